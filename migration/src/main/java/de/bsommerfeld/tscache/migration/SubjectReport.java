package de.bsommerfeld.tscache.migration;

/**
 * Plan of one subject plus what was actually written. Both counts are zero
 * in a dry run.
 */
public record SubjectReport(SubjectPlan plan, int deleted, int updated) {

    static SubjectReport planned(SubjectPlan plan) {
        return new SubjectReport(plan, 0, 0);
    }
}
