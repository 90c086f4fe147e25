package com.alleato.insights.event;

import java.util.UUID;

public record InsightsQueuedEvent(UUID documentId) {}
