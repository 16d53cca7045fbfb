package de.bsommerfeld.tscache.aggregation.definition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * How a context definition treats the residual {@code other} bucket, which
 * decides both the expected value set and whether the partition can ever be
 * summed.
 */
public enum OtherPolicy {

    /** No residual bucket: the enumerated values are exhaustive. */
    NULL,

    /** The provider computes {@code other}; it is expected even if not enumerated. */
    COMPUTED,

    /** {@code other} is a declared, regular value of the enumeration. */
    EXPLICIT,

    /** Nobody knows what falls outside the enumeration; never MECE. */
    UNDEFINED;

    public static final String OTHER = "other";

    /** Values that must all be present, exactly once each, for a complete partition. */
    public Set<String> expectedValues(List<String> declared) {
        Set<String> expected = new LinkedHashSet<>(declared);
        switch (this) {
            case NULL, UNDEFINED -> expected.remove(OTHER);
            case COMPUTED -> expected.add(OTHER);
            case EXPLICIT -> {
                // declared list is authoritative
            }
        }
        return expected;
    }

    public boolean isAggregatable() {
        return this != UNDEFINED;
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OtherPolicy fromJson(String value) {
        if (value == null)
            return UNDEFINED;
        return OtherPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
