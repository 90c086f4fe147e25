package com.alleato.insights.service;

import java.util.Optional;
import java.util.UUID;

public interface ProjectResolver {

    /**
     * Maps free text that names a project to that project. An empty result is a normal
     * outcome, not an error.
     */
    Optional<UUID> resolve(String mention);
}
