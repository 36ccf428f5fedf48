package com.calypso.core.persistence;

import com.calypso.core.model.BuildConfiguration;
import com.calypso.core.model.BuildOutput;
import com.calypso.core.model.BuildStatus;
import com.calypso.core.model.Framework;
import com.calypso.core.model.GeneratedFile;
import com.calypso.core.model.StylingApproach;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed {@link BuildOutputStore}.
 * <p>
 * File sets are stored as a JSON array in a TEXT column. Status transitions are enforced
 * in SQL ({@code WHERE status = 'GENERATING'}) so two writers cannot both win.
 */
public class JdbcBuildOutputStore implements BuildOutputStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcBuildOutputStore.class);

    private static final String CONFIG_TABLE = "calypso_build_configs";
    private static final String OUTPUT_TABLE = "calypso_build_outputs";

    private static final TypeReference<List<GeneratedFile>> FILE_LIST = new TypeReference<>() {};

    private static final String CREATE_CONFIG_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id                  VARCHAR(64) PRIMARY KEY,
                project_id          VARCHAR(255) NOT NULL UNIQUE,
                framework           VARCHAR(32) NOT NULL,
                styling             VARCHAR(32) NOT NULL,
                typescript_enabled  BOOLEAN NOT NULL,
                updated_at          TIMESTAMP NOT NULL
            )
            """.formatted(CONFIG_TABLE);

    private static final String CREATE_OUTPUT_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                seq                         BIGSERIAL,
                id                          VARCHAR(64) PRIMARY KEY,
                project_id                  VARCHAR(255) NOT NULL,
                build_config_id             VARCHAR(64),
                status                      VARCHAR(16) NOT NULL,
                files                       TEXT NOT NULL,
                error                       TEXT,
                verified                    BOOLEAN,
                preview_url                 TEXT,
                preview_token               VARCHAR(128),
                preview_deployment_id       VARCHAR(255),
                preview_hosting_project_id  VARCHAR(255),
                created_at                  TIMESTAMP NOT NULL
            )
            """.formatted(OUTPUT_TABLE);

    private static final String CREATE_OUTPUT_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS idx_%1$s_project ON %1$s (project_id, created_at DESC)
            """.formatted(OUTPUT_TABLE);

    private static final String UPSERT_CONFIG_SQL = """
            INSERT INTO %s (id, project_id, framework, styling, typescript_enabled, updated_at)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (project_id)
            DO UPDATE SET framework = EXCLUDED.framework,
                          styling = EXCLUDED.styling,
                          typescript_enabled = EXCLUDED.typescript_enabled,
                          updated_at = EXCLUDED.updated_at
            """.formatted(CONFIG_TABLE);

    private static final String SELECT_CONFIG_SQL = """
            SELECT id, project_id, framework, styling, typescript_enabled, updated_at
            FROM %s WHERE project_id = ?
            """.formatted(CONFIG_TABLE);

    private static final String INSERT_OUTPUT_SQL = """
            INSERT INTO %s (id, project_id, build_config_id, status, files, error, verified,
                            preview_url, preview_token, preview_deployment_id, preview_hosting_project_id, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(OUTPUT_TABLE);

    private static final String SELECT_OUTPUT_COLUMNS = """
            SELECT id, project_id, build_config_id, status, files, error, verified,
                   preview_url, preview_token, preview_deployment_id, preview_hosting_project_id, created_at
            FROM %s
            """.formatted(OUTPUT_TABLE);

    private static final String NEWEST_FIRST = " ORDER BY created_at DESC, seq DESC LIMIT 1";

    private static final String UPDATE_FILES_SQL = """
            UPDATE %s SET files = ?
            WHERE id = ? AND (status = 'GENERATING' OR (status = 'COMPLETE' AND ? > 0))
            """.formatted(OUTPUT_TABLE);

    private static final String MARK_COMPLETE_SQL = """
            UPDATE %s SET status = 'COMPLETE', files = ?, error = NULL
            WHERE id = ? AND status = 'GENERATING'
            """.formatted(OUTPUT_TABLE);

    private static final String MARK_FAILED_SQL = """
            UPDATE %s SET status = 'FAILED', error = ?
            WHERE id = ? AND status = 'GENERATING'
            """.formatted(OUTPUT_TABLE);

    private static final String UPDATE_VERIFIED_SQL = """
            UPDATE %s SET verified = ? WHERE id = ?
            """.formatted(OUTPUT_TABLE);

    private static final String UPDATE_PREVIEW_SQL = """
            UPDATE %s SET preview_url = ?, preview_token = ?, preview_deployment_id = ?, preview_hosting_project_id = ?
            WHERE id = ?
            """.formatted(OUTPUT_TABLE);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcBuildOutputStore(DataSource dataSource, ObjectMapper objectMapper, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Creates the tables if they do not already exist. Called once during startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            for (String sql : List.of(CREATE_CONFIG_TABLE_SQL, CREATE_OUTPUT_TABLE_SQL, CREATE_OUTPUT_INDEX_SQL)) {
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.execute();
                }
            }
            log.info("Build tables '{}', '{}' ensured", CONFIG_TABLE, OUTPUT_TABLE);
        }
    }

    @Override
    public BuildConfiguration upsertConfiguration(String projectId, Framework framework, StylingApproach styling,
                                                  boolean typeScriptEnabled) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_CONFIG_SQL)) {
            stmt.setString(1, UUID.randomUUID().toString());
            stmt.setString(2, projectId);
            stmt.setString(3, framework.name());
            stmt.setString(4, styling.name());
            stmt.setBoolean(5, typeScriptEnabled);
            stmt.setTimestamp(6, Timestamp.from(clock.instant()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to save build configuration for project " + projectId, e);
        }
        return findConfiguration(projectId)
                .orElseThrow(() -> new IllegalStateException("Configuration vanished for project " + projectId));
    }

    @Override
    public Optional<BuildConfiguration> findConfiguration(String projectId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_CONFIG_SQL)) {
            stmt.setString(1, projectId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new BuildConfiguration(
                        rs.getString("id"),
                        rs.getString("project_id"),
                        Framework.valueOf(rs.getString("framework")),
                        StylingApproach.valueOf(rs.getString("styling")),
                        rs.getBoolean("typescript_enabled"),
                        rs.getTimestamp("updated_at").toInstant()));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to load build configuration for project " + projectId, e);
        }
    }

    @Override
    public BuildOutput create(BuildOutput output) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_OUTPUT_SQL)) {
            stmt.setString(1, output.id());
            stmt.setString(2, output.projectId());
            stmt.setString(3, output.buildConfigId());
            stmt.setString(4, output.status().name());
            stmt.setString(5, toJson(output.files()));
            stmt.setString(6, output.error());
            setNullableBoolean(stmt, 7, output.verified());
            stmt.setString(8, output.previewUrl());
            stmt.setString(9, output.previewToken());
            stmt.setString(10, output.previewDeploymentId());
            stmt.setString(11, output.previewHostingProjectId());
            stmt.setTimestamp(12, Timestamp.from(output.createdAt()));
            stmt.executeUpdate();
            return output;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to create build " + output.id(), e);
        }
    }

    @Override
    public Optional<BuildOutput> findById(String buildId) {
        return queryOne(SELECT_OUTPUT_COLUMNS + " WHERE id = ?", buildId);
    }

    @Override
    public Optional<BuildOutput> findLatest(String projectId) {
        return queryOne(SELECT_OUTPUT_COLUMNS + " WHERE project_id = ?" + NEWEST_FIRST, projectId);
    }

    @Override
    public Optional<BuildOutput> findLatestComplete(String projectId) {
        return queryOne(SELECT_OUTPUT_COLUMNS + " WHERE project_id = ? AND status = 'COMPLETE'" + NEWEST_FIRST,
                projectId);
    }

    @Override
    public Optional<BuildOutput> findLatestGeneratingWithFiles(String projectId) {
        return queryOne(SELECT_OUTPUT_COLUMNS
                + " WHERE project_id = ? AND status = 'GENERATING' AND files <> '[]'" + NEWEST_FIRST, projectId);
    }

    @Override
    public void updateFiles(String buildId, List<GeneratedFile> files) {
        int updated = update(UPDATE_FILES_SQL, stmt -> {
            stmt.setString(1, toJson(files));
            stmt.setString(2, buildId);
            stmt.setInt(3, files.size());
        });
        if (updated == 0) {
            throw rejected(buildId, "file update");
        }
    }

    @Override
    public void markComplete(String buildId, List<GeneratedFile> files) {
        if (files == null || files.isEmpty()) {
            throw new IllegalBuildTransitionException("Build " + buildId + " cannot complete without files");
        }
        int updated = update(MARK_COMPLETE_SQL, stmt -> {
            stmt.setString(1, toJson(files));
            stmt.setString(2, buildId);
        });
        if (updated == 0) {
            throw rejected(buildId, BuildStatus.COMPLETE.name());
        }
    }

    @Override
    public void markFailed(String buildId, String error) {
        int updated = update(MARK_FAILED_SQL, stmt -> {
            stmt.setString(1, error);
            stmt.setString(2, buildId);
        });
        if (updated == 0) {
            throw rejected(buildId, BuildStatus.FAILED.name());
        }
    }

    @Override
    public void updateVerified(String buildId, Boolean verified) {
        update(UPDATE_VERIFIED_SQL, stmt -> {
            setNullableBoolean(stmt, 1, verified);
            stmt.setString(2, buildId);
        });
    }

    @Override
    public void updatePreview(String buildId, String url, String token, String deploymentId,
                              String hostingProjectId) {
        update(UPDATE_PREVIEW_SQL, stmt -> {
            stmt.setString(1, url);
            stmt.setString(2, token);
            stmt.setString(3, deploymentId);
            stmt.setString(4, hostingProjectId);
            stmt.setString(5, buildId);
        });
    }

    private RuntimeException rejected(String buildId, String target) {
        BuildOutput current = findById(buildId).orElseThrow(() -> new BuildNotFoundException(buildId));
        return new IllegalBuildTransitionException(
                "Build " + buildId + " in status " + current.status() + " rejected " + target);
    }

    @FunctionalInterface
    private interface StatementBinder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    private int update(String sql, StatementBinder binder) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Build update failed", e);
        }
    }

    private Optional<BuildOutput> queryOne(String sql, String param) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, param);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Build query failed", e);
        }
    }

    private BuildOutput fromResultSet(ResultSet rs) throws SQLException {
        boolean verified = rs.getBoolean("verified");
        Boolean verifiedOrNull = rs.wasNull() ? null : verified;
        return new BuildOutput(
                rs.getString("id"),
                rs.getString("project_id"),
                rs.getString("build_config_id"),
                BuildStatus.valueOf(rs.getString("status")),
                fromJson(rs.getString("files")),
                rs.getString("error"),
                verifiedOrNull,
                rs.getString("preview_url"),
                rs.getString("preview_token"),
                rs.getString("preview_deployment_id"),
                rs.getString("preview_hosting_project_id"),
                rs.getTimestamp("created_at").toInstant());
    }

    private static void setNullableBoolean(PreparedStatement stmt, int index, Boolean value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.BOOLEAN);
        } else {
            stmt.setBoolean(index, value);
        }
    }

    private String toJson(List<GeneratedFile> files) {
        try {
            return objectMapper.writeValueAsString(files);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize file set", e);
        }
    }

    private List<GeneratedFile> fromJson(String json) {
        try {
            return objectMapper.readValue(json, FILE_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt file set in " + OUTPUT_TABLE, e);
        }
    }
}
