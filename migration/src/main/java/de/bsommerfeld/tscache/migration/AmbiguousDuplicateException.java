package de.bsommerfeld.tscache.migration;

import java.util.List;

/**
 * Raised during preflight when rows would collapse onto one key but carry
 * different values. Nothing has been modified when this is thrown.
 */
public class AmbiguousDuplicateException extends MigrationRefusedException {

    private final List<CollisionGroup> groups;

    public AmbiguousDuplicateException(List<CollisionGroup> groups) {
        super(groups.size() + " collision group(s) hold rows with different content");
        this.groups = List.copyOf(groups);
    }

    public List<CollisionGroup> getGroups() {
        return groups;
    }
}
