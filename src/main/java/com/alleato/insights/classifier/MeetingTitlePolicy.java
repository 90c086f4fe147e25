package com.alleato.insights.classifier;

import java.util.List;
import java.util.Locale;

/**
 * Titles that name a meeting-like event.
 */
public class MeetingTitlePolicy implements ClassificationPolicy {

    static final List<String> INDICATORS = List.of(
        "meeting", "call", "session", "standup", "sync", "review",
        "discussion", "conference", "huddle", "briefing", "kickoff"
    );

    @Override
    public boolean matches(String title, String contentSample) {
        if (title == null) {
            return false;
        }
        String lower = title.toLowerCase(Locale.ROOT);
        return INDICATORS.stream().anyMatch(lower::contains);
    }
}
