package de.bsommerfeld.tscache.db;

/**
 * Unit of work passed to {@link SnapshotStore#inSubjectTransaction}. Throwing
 * any runtime exception rolls the subject back.
 */
@FunctionalInterface
public interface SubjectWork<T> {

    T run(SubjectEditor editor);
}
