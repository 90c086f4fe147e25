package com.alleato.insights.event;

import java.util.UUID;

public record DocumentIngestedEvent(UUID documentId) {}
