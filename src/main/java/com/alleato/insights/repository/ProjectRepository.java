package com.alleato.insights.repository;

import com.alleato.insights.model.Project;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Lookups used by project resolution. All finders skip CANCELLED projects and prefer the
 * most recently updated one.
 */
public interface ProjectRepository {
    Project save(Project project);
    Optional<Project> findById(UUID id);
    Optional<Project> findByNameIgnoreCase(String name);
    Optional<Project> findByAliasIgnoreCase(String alias);
    List<Project> findResolvable();
}
