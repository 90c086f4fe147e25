package com.alleato.insights.service;

import com.alleato.insights.chunking.ChunkDraft;
import com.alleato.insights.chunking.TranscriptChunker;
import com.alleato.insights.model.Document;
import com.alleato.insights.model.NewChunk;
import com.alleato.insights.repository.DocumentChunkRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
public class ChunkIndexingServiceImpl implements ChunkIndexingService {

    private final TranscriptChunker chunker;
    private final EmbeddingService embeddingService;
    private final DocumentChunkRepository chunkRepository;
    private final int batchSize;

    public ChunkIndexingServiceImpl(
        TranscriptChunker chunker,
        EmbeddingService embeddingService,
        DocumentChunkRepository chunkRepository,
        @Value("${app.embedding.batch-size:50}") int batchSize
    ) {
        this.chunker = chunker;
        this.embeddingService = embeddingService;
        this.chunkRepository = chunkRepository;
        this.batchSize = batchSize;
    }

    @Override
    public int reindex(Document document) {
        List<ChunkDraft> drafts = chunker.chunk(document.content());
        log.debug("Doc {}: split into {} chunks", document.id(), drafts.size());

        // Every vector is computed before the store is touched
        List<float[]> vectors = new ArrayList<>(drafts.size());
        for (int from = 0; from < drafts.size(); from += batchSize) {
            List<String> texts = drafts.subList(from, Math.min(from + batchSize, drafts.size())).stream()
                .map(ChunkDraft::content)
                .toList();
            vectors.addAll(embeddingService.embedAll(texts));
        }

        List<NewChunk> chunks = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            ChunkDraft draft = drafts.get(i);
            chunks.add(new NewChunk(draft.content(), draft.speaker(), draft.startTime(), draft.endTime(), vectors.get(i)));
        }

        int stored = chunkRepository.replaceChunks(document.id(), chunks);
        log.info("Doc {}: indexed {} chunks", document.id(), stored);
        return stored;
    }
}
