package com.alleato.insights.repository;

import com.alleato.insights.model.Project;
import com.alleato.insights.model.ProjectStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcProjectRepository implements ProjectRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<Project> projectMapper = (rs, rowNum) -> new Project(
        rs.getObject("id", UUID.class),
        rs.getString("name"),
        JsonbConverter.toList(rs.getArray("aliases")),
        JsonbConverter.toList(rs.getArray("keywords")),
        ProjectStatus.valueOf(rs.getString("status")),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    @Override
    public Project save(Project project) {
        String sql = """
            INSERT INTO projects (name, aliases, keywords, status)
            VALUES (:name, :aliases, :keywords, :status)
            RETURNING *
            """;

        return jdbcClient.sql(sql)
            .param("name", project.name())
            .param("aliases", JsonbConverter.toArray(project.aliases()))
            .param("keywords", JsonbConverter.toArray(project.keywords()))
            .param("status", (project.status() != null ? project.status() : ProjectStatus.ACTIVE).name())
            .query(projectMapper)
            .single();
    }

    @Override
    public Optional<Project> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM projects WHERE id = :id")
            .param("id", id)
            .query(projectMapper)
            .optional();
    }

    @Override
    public Optional<Project> findByNameIgnoreCase(String name) {
        String sql = """
            SELECT * FROM projects
            WHERE LOWER(name) = LOWER(:name)
              AND status <> 'CANCELLED'
            ORDER BY updated_at DESC
            LIMIT 1
            """;

        return jdbcClient.sql(sql)
            .param("name", name)
            .query(projectMapper)
            .optional();
    }

    @Override
    public Optional<Project> findByAliasIgnoreCase(String alias) {
        String sql = """
            SELECT * FROM projects p
            WHERE p.status <> 'CANCELLED'
              AND EXISTS (SELECT 1 FROM unnest(p.aliases) a WHERE LOWER(a) = LOWER(:alias))
            ORDER BY p.updated_at DESC
            LIMIT 1
            """;

        return jdbcClient.sql(sql)
            .param("alias", alias)
            .query(projectMapper)
            .optional();
    }

    @Override
    public List<Project> findResolvable() {
        String sql = """
            SELECT * FROM projects
            WHERE status <> 'CANCELLED'
            ORDER BY updated_at DESC
            """;

        return jdbcClient.sql(sql)
            .query(projectMapper)
            .list();
    }
}
