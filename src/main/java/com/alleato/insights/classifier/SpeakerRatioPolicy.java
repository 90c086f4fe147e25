package com.alleato.insights.classifier;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Content whose lines mostly start with a speaker label, e.g. {@code "John Smith: ..."},
 * {@code "[SPEAKER_1]: ..."} or {@code "[00:01:12] Anna ..."}.
 */
public class SpeakerRatioPolicy implements ClassificationPolicy {

    static final double MIN_RATIO = 0.15;

    private static final List<Pattern> SPEAKER_PATTERNS = List.of(
        Pattern.compile("^[A-Z][a-zA-Z\\s]+:\\s"),
        Pattern.compile("^\\[?[A-Z_]+\\d*\\]?:\\s"),
        Pattern.compile("^\\[[^\\]]+\\]\\s*[A-Z]")
    );

    private final int sampleChars;

    public SpeakerRatioPolicy(int sampleChars) {
        this.sampleChars = sampleChars;
    }

    @Override
    public boolean matches(String title, String contentSample) {
        return speakerRatio(contentSample) > MIN_RATIO;
    }

    double speakerRatio(String content) {
        if (content == null || content.isEmpty()) {
            return 0.0;
        }
        String sample = content.length() > sampleChars ? content.substring(0, sampleChars) : content;

        int lines = 0;
        int speakerLines = 0;
        for (String line : sample.split("\\R")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            lines++;
            if (SPEAKER_PATTERNS.stream().anyMatch(p -> p.matcher(trimmed).find())) {
                speakerLines++;
            }
        }

        return lines == 0 ? 0.0 : (double) speakerLines / lines;
    }
}
