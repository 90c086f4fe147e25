package com.alleato.insights.classifier;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides whether a document looks like a meeting transcript. Pure: the policies see only
 * the title and the content sample they are given.
 */
@Slf4j
@Component
public class TranscriptClassifier {

    static final String UNKNOWN_TITLE = "Unknown Document";

    private final List<ClassificationPolicy> policies;

    @Autowired
    public TranscriptClassifier(@Value("${app.classifier.sample-chars:2000}") int sampleChars) {
        this(List.of(new MeetingTitlePolicy(), new SpeakerRatioPolicy(sampleChars)));
    }

    TranscriptClassifier(List<ClassificationPolicy> policies) {
        this.policies = List.copyOf(policies);
    }

    public boolean classify(String title, String contentSample) {
        String effectiveTitle = title == null || title.isBlank() ? UNKNOWN_TITLE : title;

        for (ClassificationPolicy policy : policies) {
            if (policy.matches(effectiveTitle, contentSample)) {
                log.debug("'{}' classified as transcript by {}", effectiveTitle, policy.getClass().getSimpleName());
                return true;
            }
        }

        log.debug("'{}' is not a transcript, skipping", effectiveTitle);
        return false;
    }
}
