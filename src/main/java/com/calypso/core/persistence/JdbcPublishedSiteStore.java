package com.calypso.core.persistence;

import com.calypso.core.model.PublishedSite;
import com.calypso.core.model.SiteStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Objects;
import java.util.Optional;

/**
 * PostgreSQL-backed {@link PublishedSiteStore}. The unique constraints on
 * {@code project_id} and {@code slug} back the one-row-per-project and global-slug rules.
 */
public class JdbcPublishedSiteStore implements PublishedSiteStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcPublishedSiteStore.class);

    private static final String TABLE_NAME = "calypso_published_sites";

    /** PostgreSQL SQLSTATE for unique_violation. */
    private static final String UNIQUE_VIOLATION = "23505";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id                  VARCHAR(64) PRIMARY KEY,
                project_id          VARCHAR(255) NOT NULL UNIQUE,
                slug                VARCHAR(48) NOT NULL UNIQUE,
                hosting_project_id  VARCHAR(255),
                deployment_id       VARCHAR(255),
                url                 TEXT,
                build_output_id     VARCHAR(64),
                status              VARCHAR(16) NOT NULL,
                published_at        TIMESTAMP NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String UPSERT_SQL = """
            INSERT INTO %s (id, project_id, slug, hosting_project_id, deployment_id, url, build_output_id,
                            status, published_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (project_id)
            DO UPDATE SET slug = EXCLUDED.slug,
                          hosting_project_id = EXCLUDED.hosting_project_id,
                          deployment_id = EXCLUDED.deployment_id,
                          url = EXCLUDED.url,
                          build_output_id = EXCLUDED.build_output_id,
                          status = EXCLUDED.status,
                          published_at = EXCLUDED.published_at
            """.formatted(TABLE_NAME);

    private static final String SELECT_SQL = """
            SELECT id, project_id, slug, hosting_project_id, deployment_id, url, build_output_id, status, published_at
            FROM %s
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcPublishedSiteStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Published site table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Optional<PublishedSite> findByProject(String projectId) {
        return queryOne(SELECT_SQL + " WHERE project_id = ?", projectId);
    }

    @Override
    public Optional<PublishedSite> findBySlug(String slug) {
        return queryOne(SELECT_SQL + " WHERE slug = ?", slug);
    }

    @Override
    public PublishedSite save(PublishedSite site) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setString(1, site.id());
            stmt.setString(2, site.projectId());
            stmt.setString(3, site.slug());
            stmt.setString(4, site.hostingProjectId());
            stmt.setString(5, site.deploymentId());
            stmt.setString(6, site.url());
            stmt.setString(7, site.buildOutputId());
            stmt.setString(8, site.status().name());
            stmt.setTimestamp(9, Timestamp.from(site.publishedAt()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new DuplicateSlugException(site.slug());
            }
            throw new IllegalStateException("Failed to save published site for project " + site.projectId(), e);
        }
        return findByProject(site.projectId())
                .orElseThrow(() -> new IllegalStateException("Published site vanished for " + site.projectId()));
    }

    private Optional<PublishedSite> queryOne(String sql, String param) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, param);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new PublishedSite(
                        rs.getString("id"),
                        rs.getString("project_id"),
                        rs.getString("slug"),
                        rs.getString("hosting_project_id"),
                        rs.getString("deployment_id"),
                        rs.getString("url"),
                        rs.getString("build_output_id"),
                        SiteStatus.valueOf(rs.getString("status")),
                        rs.getTimestamp("published_at").toInstant()));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Published site query failed", e);
        }
    }
}
