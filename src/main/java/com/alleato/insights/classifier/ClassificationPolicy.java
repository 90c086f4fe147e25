package com.alleato.insights.classifier;

/**
 * One stage of transcript detection. A policy only ever votes "yes"; a {@code false}
 * passes the decision on to the next policy.
 */
public interface ClassificationPolicy {
    boolean matches(String title, String contentSample);
}
