package de.bsommerfeld.tscache.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tscache.core.domain.SignatureHasher;
import de.bsommerfeld.tscache.core.domain.SliceKey;
import de.bsommerfeld.tscache.core.domain.SnapshotMetrics;
import de.bsommerfeld.tscache.core.domain.SnapshotRow;
import de.bsommerfeld.tscache.core.domain.SubjectRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * SQLite-backed {@link SnapshotStore}.
 *
 * <p>
 * All SQL lives in {@code sql/*.sql} files loaded through {@link SqlLoader}.
 * {@code retrieved_at} is persisted as epoch milliseconds and
 * {@code anchor_day} as an ISO date, so both sort correctly as stored.
 *
 * <h3>Transaction boundaries</h3>
 * {@link #appendBatch(SnapshotWrite)}, {@link #deleteSnapshots} and
 * {@link #inSubjectTransaction} run in explicit transactions with
 * rollback-on-failure. Single-row appends and reads use auto-commit.
 */
@Singleton
public class SqlSnapshotStore implements SnapshotStore {

    private static final Logger LOG = LoggerFactory.getLogger(SqlSnapshotStore.class);

    static final Comparator<SnapshotRow> RAW_ORDER = Comparator
            .comparing(SnapshotRow::anchorDay)
            .thenComparing(r -> r.sliceKey().toDsl())
            .thenComparing(SnapshotRow::retrievedAt)
            .thenComparing(SnapshotRow::subjectId)
            .thenComparing(SnapshotRow::coreHash);

    private final SqliteDatabase database;
    private final Clock clock;

    @Inject
    public SqlSnapshotStore(SqliteDatabase database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    Connection getConnection() throws SQLException {
        return database.getConnection();
    }

    Connection getExclusiveConnection() throws SQLException {
        return database.getExclusiveConnection();
    }

    // =====================================================================
    // Writes
    // =====================================================================

    @Override
    public AppendResult append(SnapshotRow row) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-snapshot"))) {
            bindRow(ps, row);
            return ps.executeUpdate() > 0 ? AppendResult.INSERTED : AppendResult.DUPLICATE;
        } catch (SQLException e) {
            throw new StoreException("Failed to append snapshot for " + row.subjectRef(), e);
        }
    }

    @Override
    public AppendSummary appendBatch(SnapshotWrite write) {
        if (write.rows().isEmpty() && write.canonicalSignature() == null)
            return AppendSummary.EMPTY;

        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                if (write.canonicalSignature() != null)
                    registerSignature(conn, write.subject(), write.canonicalSignature());
                int inserted = insertRows(conn, write.rows());
                conn.commit();
                LOG.debug("[DB] Appended {}/{} rows for {}", inserted, write.rows().size(), write.subject());
                return new AppendSummary(write.rows().size(), inserted);
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to append batch for " + write.subject(), e);
        }
    }

    private int insertRows(Connection conn, List<SnapshotRow> rows) throws SQLException {
        int inserted = 0;
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-snapshot"))) {
            for (SnapshotRow row : rows) {
                bindRow(ps, row);
                inserted += ps.executeUpdate();
            }
        }
        return inserted;
    }

    private void registerSignature(Connection conn, SubjectRef subject, String signature) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-signature"))) {
            ps.setString(1, subject.subjectId());
            ps.setString(2, subject.coreHash());
            ps.setString(3, signature.trim());
            ps.setString(4, SignatureHasher.fullHash(signature));
            ps.setString(5, SignatureHasher.ALGORITHM);
            ps.setLong(6, clock.millis());
            ps.executeUpdate();
        }
    }

    @Override
    public int deleteSnapshots(String subjectId, Set<String> coreHashes, Set<Instant> retrievedAts) {
        List<String> hashes = coreHashes == null || coreHashes.isEmpty()
                ? Collections.singletonList(null)
                : new ArrayList<>(coreHashes);
        List<Instant> batches = retrievedAts == null || retrievedAts.isEmpty()
                ? Collections.singletonList(null)
                : new ArrayList<>(retrievedAts);

        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-snapshots-for-subject"))) {
                int deleted = 0;
                for (String hash : hashes) {
                    for (Instant batch : batches) {
                        ps.setString(1, subjectId);
                        bindNullableText(ps, 2, hash);
                        bindNullableText(ps, 3, hash);
                        bindNullableMillis(ps, 4, batch);
                        bindNullableMillis(ps, 5, batch);
                        deleted += ps.executeUpdate();
                    }
                }
                conn.commit();
                LOG.info("[DB] Deleted {} snapshot rows for subject {}", deleted, subjectId);
                return deleted;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to delete snapshots for " + subjectId, e);
        }
    }

    // =====================================================================
    // Reads
    // =====================================================================

    @Override
    public List<SnapshotRow> queryRaw(SnapshotQuery query) {
        List<SnapshotRow> result = new ArrayList<>();
        String family = query.family() == null ? null : query.family().canonical();
        String from = query.anchorFrom() == null ? null : query.anchorFrom().toString();
        String to = query.anchorTo() == null ? null : query.anchorTo().toString();

        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-snapshots-for-subject"))) {
            for (SubjectRef subject : query.subjects()) {
                ps.setString(1, subject.subjectId());
                ps.setString(2, subject.coreHash());
                bindNullableText(ps, 3, family);
                bindNullableText(ps, 4, family);
                bindNullableText(ps, 5, from);
                bindNullableText(ps, 6, from);
                bindNullableText(ps, 7, to);
                bindNullableText(ps, 8, to);
                bindNullableMillis(ps, 9, query.retrievedUpTo());
                bindNullableMillis(ps, 10, query.retrievedUpTo());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next())
                        result.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to query snapshots for " + query.subjects(), e);
        }

        result.sort(RAW_ORDER);
        return result;
    }

    @Override
    public List<Instant> listRetrievals(SubjectRef subject) {
        List<Instant> result = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-retrievals-for-subject"))) {
            ps.setString(1, subject.subjectId());
            ps.setString(2, subject.coreHash());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    result.add(Instant.ofEpochMilli(rs.getLong(1)));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to list retrievals for " + subject, e);
        }
        return result;
    }

    @Override
    public List<SignatureEntry> listSignatures(String subjectId) {
        List<SignatureEntry> result = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-signatures-for-subject"))) {
            ps.setString(1, subjectId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new SignatureEntry(
                            rs.getString("subject_id"),
                            rs.getString("core_hash"),
                            rs.getString("canonical_signature"),
                            rs.getString("sig_hash_full"),
                            rs.getString("sig_algo"),
                            Instant.ofEpochMilli(rs.getLong("created_at"))));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to list signatures for " + subjectId, e);
        }
        return result;
    }

    @Override
    public List<String> subjectIds(String prefix) {
        String p = prefix == null ? "" : prefix;
        List<String> result = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-subject-ids"))) {
            ps.setString(1, p);
            ps.setString(2, p);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    result.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to list subjects with prefix '" + p + "'", e);
        }
        return result;
    }

    // =====================================================================
    // Exclusive unit of work
    // =====================================================================

    @Override
    public <T> T inSubjectTransaction(String subjectId, SubjectWork<T> work) {
        try (Connection conn = getExclusiveConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.run(new JdbcSubjectEditor(conn, subjectId));
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                LOG.warn("[DB] Rolled back unit of work for subject {}: {}", subjectId, e.getMessage());
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Unit of work failed for subject " + subjectId, e);
        }
    }

    /** Editor bound to an open IMMEDIATE transaction. */
    private static final class JdbcSubjectEditor implements SubjectEditor {

        private final Connection conn;
        private final String subjectId;

        JdbcSubjectEditor(Connection conn, String subjectId) {
            this.conn = conn;
            this.subjectId = subjectId;
        }

        @Override
        public String subjectId() {
            return subjectId;
        }

        @Override
        public List<SnapshotRow> rows() {
            List<SnapshotRow> result = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-all-snapshots-for-subject"))) {
                ps.setString(1, subjectId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next())
                        result.add(mapRow(rs));
                }
            } catch (SQLException e) {
                throw new StoreException("Failed to read rows of subject " + subjectId, e);
            }
            return result;
        }

        @Override
        public boolean delete(SnapshotRow row) {
            requireOwn(row);
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-snapshot"))) {
                bindKey(ps, 1, row);
                return ps.executeUpdate() > 0;
            } catch (SQLException e) {
                throw new StoreException("Failed to delete row " + row, e);
            }
        }

        @Override
        public void retime(SnapshotRow row, Instant newRetrievedAt) {
            requireOwn(row);
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-snapshot-retrieved-at"))) {
                ps.setLong(1, newRetrievedAt.toEpochMilli());
                bindKey(ps, 2, row);
                if (ps.executeUpdate() != 1)
                    throw new StoreException("Row to retime does not exist: " + row);
            } catch (SQLException e) {
                throw new StoreException("Failed to move row " + row + " to " + newRetrievedAt, e);
            }
        }

        private void requireOwn(SnapshotRow row) {
            if (!subjectId.equals(row.subjectId()))
                throw new IllegalArgumentException("Row of " + row.subjectId() + " edited in unit of work of "
                        + subjectId);
        }
    }

    // =====================================================================
    // Binding & mapping
    // =====================================================================

    private static void bindRow(PreparedStatement ps, SnapshotRow row) throws SQLException {
        SnapshotMetrics m = row.metrics();
        ps.setString(1, row.subjectId());
        ps.setString(2, row.coreHash());
        ps.setString(3, row.sliceKey().toDsl());
        ps.setString(4, row.family().canonical());
        ps.setString(5, row.anchorDay().toString());
        ps.setLong(6, row.retrievedAt().toEpochMilli());
        bindNullableLong(ps, 7, m.anchorEntrants());
        bindNullableLong(ps, 8, m.denominator());
        bindNullableLong(ps, 9, m.numerator());
        bindNullableDouble(ps, 10, m.medianLagDays());
        bindNullableDouble(ps, 11, m.meanLagDays());
        bindNullableDouble(ps, 12, m.anchorMedianLagDays());
        bindNullableDouble(ps, 13, m.anchorMeanLagDays());
        bindNullableDouble(ps, 14, m.onsetDeltaDays());
    }

    private static void bindKey(PreparedStatement ps, int start, SnapshotRow row) throws SQLException {
        ps.setString(start, row.subjectId());
        ps.setString(start + 1, row.coreHash());
        ps.setString(start + 2, row.sliceKey().toDsl());
        ps.setString(start + 3, row.anchorDay().toString());
        ps.setLong(start + 4, row.retrievedAt().toEpochMilli());
    }

    static SnapshotRow mapRow(ResultSet rs) throws SQLException {
        SnapshotMetrics metrics = new SnapshotMetrics(
                nullableLong(rs, "anchor_entrants"),
                nullableLong(rs, "denominator"),
                nullableLong(rs, "numerator"),
                nullableDouble(rs, "median_lag_days"),
                nullableDouble(rs, "mean_lag_days"),
                nullableDouble(rs, "anchor_median_lag_days"),
                nullableDouble(rs, "anchor_mean_lag_days"),
                nullableDouble(rs, "onset_delta_days"));
        return new SnapshotRow(
                rs.getString("subject_id"),
                rs.getString("core_hash"),
                SliceKey.parse(rs.getString("slice_key")),
                LocalDate.parse(rs.getString("anchor_day")),
                Instant.ofEpochMilli(rs.getLong("retrieved_at")),
                metrics);
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double v = rs.getDouble(column);
        return rs.wasNull() ? null : v;
    }

    private static void bindNullableLong(PreparedStatement ps, int idx, Long value) throws SQLException {
        if (value == null)
            ps.setNull(idx, Types.BIGINT);
        else
            ps.setLong(idx, value);
    }

    private static void bindNullableDouble(PreparedStatement ps, int idx, Double value) throws SQLException {
        if (value == null)
            ps.setNull(idx, Types.DOUBLE);
        else
            ps.setDouble(idx, value);
    }

    private static void bindNullableText(PreparedStatement ps, int idx, String value) throws SQLException {
        if (value == null)
            ps.setNull(idx, Types.VARCHAR);
        else
            ps.setString(idx, value);
    }

    private static void bindNullableMillis(PreparedStatement ps, int idx, Instant value) throws SQLException {
        if (value == null)
            ps.setNull(idx, Types.BIGINT);
        else
            ps.setLong(idx, value.toEpochMilli());
    }
}
