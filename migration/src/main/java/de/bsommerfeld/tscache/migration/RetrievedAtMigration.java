package de.bsommerfeld.tscache.migration;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.tscache.core.domain.SnapshotRow;
import de.bsommerfeld.tscache.db.SnapshotStore;
import de.bsommerfeld.tscache.db.SubjectEditor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonicalises {@code retrieved_at} of historical rows so that every batch
 * carries exactly one timestamp.
 *
 * <p>
 * A run plans every selected subject first. If any collision group mixes
 * different content, or if deletions are needed but not allowed, the run is
 * refused before anything is written. Only then, and only with
 * {@link MigrationOptions#commit()}, each subject is rewritten in its own
 * exclusive unit of work: deletions, then timestamp updates, then a fresh
 * analysis that rolls the subject back unless it is fully canonical.
 */
@Singleton
public class RetrievedAtMigration {

    private static final Logger LOG = LoggerFactory.getLogger(RetrievedAtMigration.class);

    private final SnapshotStore store;

    @Inject
    public RetrievedAtMigration(SnapshotStore store) {
        this.store = store;
    }

    public MigrationReport run(MigrationOptions options) throws MigrationRefusedException {
        BatchCanonicalizer canonicalizer = new BatchCanonicalizer(options.window());
        Map<String, SubjectPlan> plans = preflight(options, canonicalizer);

        List<CollisionGroup> ambiguous = new ArrayList<>();
        int deletions = 0;
        for (SubjectPlan plan : plans.values()) {
            ambiguous.addAll(plan.ambiguous());
            deletions += plan.deletions().size();
        }
        if (!ambiguous.isEmpty()) {
            LOG.error("[Migration] {} ambiguous collision group(s); no subject was modified", ambiguous.size());
            throw new AmbiguousDuplicateException(ambiguous);
        }
        if (deletions > 0 && options.commit() && !options.allowDeleteIdentical()) {
            throw new MigrationRefusedException(deletions
                    + " identical duplicate row(s) must be deleted; rerun with --allow-delete-identical");
        }

        List<SubjectReport> reports = new ArrayList<>();
        for (SubjectPlan plan : plans.values()) {
            if (!options.commit() || plan.isCanonical()) {
                reports.add(SubjectReport.planned(plan));
                continue;
            }
            reports.add(store.inSubjectTransaction(plan.subjectId(),
                    editor -> rewrite(editor, canonicalizer, options)));
        }

        MigrationReport report = new MigrationReport(options.window(), options.commit(), reports);
        LOG.info("[Migration] {} subject(s), {} row(s) to delete, {} to update, committed={}",
                reports.size(), report.totalToDelete(), report.totalToUpdate(), options.commit());
        return report;
    }

    /** Plans every selected subject without writing. */
    private Map<String, SubjectPlan> preflight(MigrationOptions options, BatchCanonicalizer canonicalizer) {
        Map<String, SubjectPlan> plans = new LinkedHashMap<>();
        for (String subjectId : scopedSubjects(options)) {
            List<SnapshotRow> rows = store.inSubjectTransaction(subjectId, SubjectEditor::rows);
            if (options.retrievedFrom() != null || options.retrievedTo() != null) {
                if (rows.stream().noneMatch(r -> options.selects(r.retrievedAt())))
                    continue;
            }
            plans.put(subjectId, canonicalizer.plan(subjectId, rows));
        }
        LOG.info("[Migration] Preflight planned {} subject(s) with a {}s window", plans.size(),
                options.window().getSeconds());
        return plans;
    }

    private List<String> scopedSubjects(MigrationOptions options) {
        if (options.subjectId() != null) {
            return store.subjectIds(options.subjectId()).stream()
                    .filter(options.subjectId()::equals)
                    .toList();
        }
        return store.subjectIds(options.subjectPrefix());
    }

    /** Runs inside the subject's unit of work; any exception rolls it back. */
    private SubjectReport rewrite(SubjectEditor editor, BatchCanonicalizer canonicalizer, MigrationOptions options) {
        SubjectPlan plan = canonicalizer.plan(editor.subjectId(), editor.rows());
        if (!plan.ambiguous().isEmpty())
            throw new IllegalStateException("Subject " + editor.subjectId() + " changed since preflight");
        if (!plan.deletions().isEmpty() && !options.allowDeleteIdentical())
            throw new IllegalStateException("Subject " + editor.subjectId() + " needs deletions that are not allowed");

        int deleted = 0;
        for (SnapshotRow row : plan.deletions()) {
            if (editor.delete(row))
                deleted++;
        }
        for (SubjectPlan.Retime retime : plan.updates())
            editor.retime(retime.row(), retime.canonicalTs());

        SubjectPlan check = canonicalizer.plan(editor.subjectId(), editor.rows());
        if (!check.isCanonical())
            throw new IllegalStateException("Subject " + editor.subjectId() + " is not canonical after rewrite ("
                    + check.deletions().size() + " deletion(s), " + check.updates().size() + " update(s) left)");

        LOG.info("[Migration] Committed {}: deleted {}, updated {}", editor.subjectId(), deleted,
                plan.updates().size());
        return new SubjectReport(plan, deleted, plan.updates().size());
    }
}
