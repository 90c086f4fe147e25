package com.alleato.insights.service;

import com.alleato.insights.model.Project;
import com.alleato.insights.repository.ProjectRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Exact name first, then alias, then keyword overlap. CANCELLED projects never match.
 * Keyword ties go to the most recently updated project.
 */
@Slf4j
@Service
public class ProjectResolverImpl implements ProjectResolver {

    private final ProjectRepository projectRepository;
    private final int minKeywordMatches;

    public ProjectResolverImpl(
        ProjectRepository projectRepository,
        @Value("${app.projects.min-keyword-matches:1}") int minKeywordMatches
    ) {
        this.projectRepository = projectRepository;
        this.minKeywordMatches = minKeywordMatches;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UUID> resolve(String mention) {
        if (mention == null || mention.isBlank()) {
            return Optional.empty();
        }
        String text = mention.strip();

        Optional<Project> byName = projectRepository.findByNameIgnoreCase(text);
        if (byName.isPresent()) {
            log.debug("'{}' resolved by name to project {}", text, byName.get().id());
            return byName.map(Project::id);
        }

        Optional<Project> byAlias = projectRepository.findByAliasIgnoreCase(text);
        if (byAlias.isPresent()) {
            log.debug("'{}' resolved by alias to project {}", text, byAlias.get().id());
            return byAlias.map(Project::id);
        }

        return resolveByKeywords(text);
    }

    private Optional<UUID> resolveByKeywords(String text) {
        // findResolvable is ordered by updated_at desc, so strict '>' keeps the newest on ties
        Project best = null;
        int bestScore = 0;
        for (Project project : projectRepository.findResolvable()) {
            int score = keywordMatches(project.keywords(), text);
            if (score > bestScore) {
                best = project;
                bestScore = score;
            }
        }

        if (best == null || bestScore < minKeywordMatches) {
            log.debug("No project matches '{}'", text);
            return Optional.empty();
        }

        log.debug("'{}' resolved by {} keyword(s) to project {}", text, bestScore, best.id());
        return Optional.of(best.id());
    }

    static int keywordMatches(List<String> keywords, String text) {
        if (keywords == null) {
            return 0;
        }
        int matches = 0;
        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            Pattern wholeWord = Pattern.compile(
                "(?<![\\p{L}\\p{N}])" + Pattern.quote(keyword.strip()) + "(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
            );
            if (wholeWord.matcher(text).find()) {
                matches++;
            }
        }
        return matches;
    }
}
