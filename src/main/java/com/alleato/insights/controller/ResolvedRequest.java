package com.alleato.insights.controller;

import jakarta.validation.constraints.NotNull;

public record ResolvedRequest(@NotNull Boolean resolved) {}
