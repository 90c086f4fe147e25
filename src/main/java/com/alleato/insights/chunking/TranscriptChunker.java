package com.alleato.insights.chunking;

import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.DocumentSplitter;
import dev.langchain4j.data.document.splitter.DocumentSplitters;
import dev.langchain4j.data.segment.TextSegment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits transcripts on speaker turns, packing consecutive turns up to the target size.
 * A single turn over the maximum size is split further, keeping its speaker and time.
 * Text without at least two speaker turns goes through the recursive prose splitter.
 */
@Slf4j
@Component
public class TranscriptChunker {

    // [00:01:02] John Smith: ...   |   John Smith: ...   |   **John**: ...   |   SPEAKER_1: ...
    private static final Pattern TURN = Pattern.compile(
        "^(?:\\[(?<time>(?:\\d{1,2}:)?\\d{1,2}:\\d{2})\\]\\s*)?"
            + "(?:\\*\\*(?<bold>[^*]{1,60})\\*\\*|(?<name>[A-Z][\\w .'-]{0,59}?))"
            + "\\s*(?:\\((?<ptime>(?:\\d{1,2}:)?\\d{1,2}:\\d{2})\\))?:\\s+(?<text>.*)$"
    );

    private static final int MIN_TURNS = 2;

    private final DocumentSplitter proseSplitter;
    private final DocumentSplitter turnSplitter;
    private final int targetSize;

    public TranscriptChunker(
        @Value("${app.chunking.target-size:1500}") int targetSize,
        @Value("${app.chunking.max-size:2500}") int maxSize,
        @Value("${app.chunking.overlap:300}") int overlap
    ) {
        if (targetSize <= 0 || maxSize < targetSize || overlap < 0 || overlap >= targetSize) {
            throw new IllegalArgumentException("Invalid chunking sizes: target=%d max=%d overlap=%d"
                .formatted(targetSize, maxSize, overlap));
        }
        this.targetSize = targetSize;
        this.proseSplitter = DocumentSplitters.recursive(targetSize, overlap);
        this.turnSplitter = DocumentSplitters.recursive(maxSize, overlap);
    }

    private record Turn(String speaker, Double time, StringBuilder text) {}

    public List<ChunkDraft> chunk(String content) {
        if (content == null || content.isBlank()) {
            return List.of();
        }

        List<Turn> turns = parseTurns(content);
        if (turns.size() < MIN_TURNS) {
            log.debug("No speaker turns found, splitting {} chars as prose", content.length());
            return split(proseSplitter, content).stream()
                .map(text -> new ChunkDraft(text, null, null, null))
                .toList();
        }

        return packTurns(turns);
    }

    private List<Turn> parseTurns(String content) {
        List<Turn> turns = new ArrayList<>();
        StringBuilder preamble = new StringBuilder();

        for (String line : content.split("\\R")) {
            Matcher m = TURN.matcher(line.strip());
            if (m.matches()) {
                String speaker = m.group("bold") != null ? m.group("bold").strip() : m.group("name").strip();
                String time = m.group("time") != null ? m.group("time") : m.group("ptime");
                turns.add(new Turn(speaker, parseSeconds(time), new StringBuilder(speaker + ": " + m.group("text"))));
            } else if (!turns.isEmpty()) {
                turns.get(turns.size() - 1).text().append('\n').append(line);
            } else if (!line.isBlank()) {
                preamble.append(line).append('\n');
            }
        }

        if (!turns.isEmpty() && !preamble.isEmpty()) {
            turns.add(0, new Turn(null, null, new StringBuilder(preamble.toString().strip())));
        }
        return turns;
    }

    private List<ChunkDraft> packTurns(List<Turn> turns) {
        List<ChunkDraft> chunks = new ArrayList<>();
        List<Turn> current = new ArrayList<>();
        int currentLength = 0;

        for (Turn turn : turns) {
            String text = turn.text().toString().strip();
            if (text.length() > targetSize) {
                flush(chunks, current);
                currentLength = 0;
                for (String piece : split(turnSplitter, text)) {
                    chunks.add(new ChunkDraft(piece, turn.speaker(), turn.time(), turn.time()));
                }
                continue;
            }
            if (!current.isEmpty() && currentLength + text.length() + 1 > targetSize) {
                flush(chunks, current);
                currentLength = 0;
            }
            current.add(turn);
            currentLength += text.length() + 1;
        }
        flush(chunks, current);

        return closeTimeRanges(chunks);
    }

    private static void flush(List<ChunkDraft> chunks, List<Turn> turns) {
        if (turns.isEmpty()) {
            return;
        }
        StringBuilder text = new StringBuilder();
        Set<String> speakers = new LinkedHashSet<>();
        Double start = null;
        Double lastTime = null;
        for (Turn turn : turns) {
            if (!text.isEmpty()) {
                text.append('\n');
            }
            text.append(turn.text().toString().strip());
            if (turn.speaker() != null) {
                speakers.add(turn.speaker());
            }
            if (turn.time() != null) {
                start = start == null ? turn.time() : start;
                lastTime = turn.time();
            }
        }
        chunks.add(new ChunkDraft(text.toString(), speakers.isEmpty() ? null : String.join(", ", speakers), start, lastTime));
        turns.clear();
    }

    /**
     * A chunk ends where the next timed chunk starts; the last one ends at its last turn.
     */
    private static List<ChunkDraft> closeTimeRanges(List<ChunkDraft> chunks) {
        List<ChunkDraft> result = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            ChunkDraft chunk = chunks.get(i);
            Double end = chunk.endTime();
            for (int j = i + 1; j < chunks.size(); j++) {
                Double nextStart = chunks.get(j).startTime();
                if (nextStart != null) {
                    if (chunk.startTime() != null && nextStart >= chunk.startTime()) {
                        end = nextStart;
                    }
                    break;
                }
            }
            result.add(new ChunkDraft(chunk.content(), chunk.speaker(), chunk.startTime(), end));
        }
        return result;
    }

    private static List<String> split(DocumentSplitter splitter, String text) {
        return splitter.split(Document.from(text)).stream()
            .map(TextSegment::text)
            .filter(s -> !s.isBlank())
            .toList();
    }

    static Double parseSeconds(String time) {
        if (time == null) {
            return null;
        }
        String[] parts = time.split(":");
        double seconds = 0;
        for (String part : parts) {
            seconds = seconds * 60 + Integer.parseInt(part);
        }
        return seconds;
    }
}
