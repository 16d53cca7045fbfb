package de.bsommerfeld.tscache.db.equivalence;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tscache.core.domain.SubjectRef;
import de.bsommerfeld.tscache.db.SqlLoader;
import de.bsommerfeld.tscache.db.SqliteDatabase;
import de.bsommerfeld.tscache.db.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * SQLite-backed {@link LinkStore} on the {@code equivalence_links} table.
 */
@Singleton
public class SqlLinkStore implements LinkStore {

    private static final Logger LOG = LoggerFactory.getLogger(SqlLinkStore.class);

    private final SqliteDatabase database;

    @Inject
    public SqlLinkStore(SqliteDatabase database) {
        this.database = database;
    }

    @Override
    public long activate(SubjectRef seed, SubjectRef target, String createdBy, String reason, Instant at) {
        try (Connection conn = database.getConnection()) {
            conn.setAutoCommit(false);
            try {
                EquivalenceLink existing = findLink(conn, seed, target);
                long id;
                if (existing == null) {
                    id = insertLink(conn, seed, target, createdBy, reason, at);
                    LOG.info("[DB] Created equivalence link {} {} -> {}", id, seed, target);
                } else if (!existing.active()) {
                    id = existing.linkId();
                    try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("reactivate-link"))) {
                        ps.setString(1, createdBy);
                        ps.setString(2, reason);
                        ps.setLong(3, at.toEpochMilli());
                        ps.setLong(4, id);
                        ps.executeUpdate();
                    }
                    LOG.info("[DB] Re-activated equivalence link {} {} -> {} ({})", id, seed, target, createdBy);
                } else {
                    id = existing.linkId();
                }
                conn.commit();
                return id;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to activate link " + seed + " -> " + target, e);
        }
    }

    private long insertLink(Connection conn, SubjectRef seed, SubjectRef target, String createdBy, String reason,
            Instant at) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-link"),
                Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, seed.subjectId());
            ps.setString(2, seed.coreHash());
            ps.setString(3, target.subjectId());
            ps.setString(4, target.coreHash());
            ps.setString(5, createdBy);
            ps.setString(6, reason);
            ps.setLong(7, at.toEpochMilli());
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next())
                    throw new SQLException("No link id generated");
                return keys.getLong(1);
            }
        }
    }

    private EquivalenceLink findLink(Connection conn, SubjectRef seed, SubjectRef target) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-link"))) {
            ps.setString(1, seed.subjectId());
            ps.setString(2, seed.coreHash());
            ps.setString(3, target.subjectId());
            ps.setString(4, target.coreHash());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? mapLink(rs) : null;
            }
        }
    }

    @Override
    public boolean deactivate(SubjectRef seed, SubjectRef target, String deactivatedBy, String reason, Instant at) {
        try (Connection conn = database.getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("deactivate-link"))) {
            ps.setString(1, deactivatedBy);
            ps.setString(2, reason);
            ps.setLong(3, at.toEpochMilli());
            ps.setString(4, seed.subjectId());
            ps.setString(5, seed.coreHash());
            ps.setString(6, target.subjectId());
            ps.setString(7, target.coreHash());
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to deactivate link " + seed + " -> " + target, e);
        }
    }

    @Override
    public List<EquivalenceLink> linksTouching(SubjectRef ref, boolean includeInactive) {
        try (Connection conn = database.getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-links-for-subject"))) {
            ps.setString(1, ref.subjectId());
            ps.setString(2, ref.coreHash());
            ps.setString(3, ref.subjectId());
            ps.setString(4, ref.coreHash());
            ps.setInt(5, includeInactive ? 1 : 0);
            return readLinks(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to list links of " + ref, e);
        }
    }

    @Override
    public List<EquivalenceLink> allLinks(boolean includeInactive) {
        try (Connection conn = database.getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-links"))) {
            ps.setInt(1, includeInactive ? 1 : 0);
            return readLinks(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to list links", e);
        }
    }

    private static List<EquivalenceLink> readLinks(PreparedStatement ps) throws SQLException {
        List<EquivalenceLink> links = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next())
                links.add(mapLink(rs));
        }
        return links;
    }

    private static EquivalenceLink mapLink(ResultSet rs) throws SQLException {
        return new EquivalenceLink(
                rs.getLong("link_id"),
                SubjectRef.of(rs.getString("seed_subject"), rs.getString("seed_hash")),
                SubjectRef.of(rs.getString("target_subject"), rs.getString("target_hash")),
                rs.getInt("active") == 1,
                rs.getString("created_by"),
                rs.getString("reason"),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                rs.getString("deactivated_by"),
                rs.getString("deactivated_reason"),
                optionalInstant(rs, "deactivated_at"),
                rs.getString("reactivated_by"),
                rs.getString("reactivated_reason"),
                optionalInstant(rs, "reactivated_at"));
    }

    private static Instant optionalInstant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }
}
