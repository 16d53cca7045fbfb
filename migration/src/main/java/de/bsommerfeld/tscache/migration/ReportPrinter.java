package de.bsommerfeld.tscache.migration;

import java.io.PrintStream;

final class ReportPrinter {

    private static final String ROW = "%-40s %8s %8s %8s %8s %8s %8s %8s %8s%n";

    private ReportPrinter() {
    }

    static void print(MigrationReport report, PrintStream out) {
        out.printf(ROW, "subject", "rows", "groups", "ts_pre", "ts_post", "to_del", "to_upd", "deleted",
                "updated");
        for (SubjectReport s : report.subjects()) {
            SubjectPlan p = s.plan();
            out.printf(ROW, p.subjectId(), p.rowsInScope(), p.groupsTouched(), p.distinctBefore(),
                    p.distinctAfter(), p.deletions().size(), p.updates().size(), s.deleted(), s.updated());
        }
        out.printf(ROW, "TOTAL", report.totalRows(), report.totalGroupsTouched(), "", "", report.totalToDelete(),
                report.totalToUpdate(), report.totalDeleted(), report.totalUpdated());
        if (!report.committed() && (report.totalToDelete() > 0 || report.totalToUpdate() > 0))
            out.println("Dry run: rerun with --commit to apply"
                    + (report.totalToDelete() > 0 ? " (deletions need --allow-delete-identical)" : ""));
    }
}
