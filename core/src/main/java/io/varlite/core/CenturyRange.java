// file: core/src/main/java/io/varlite/core/CenturyRange.java
package io.varlite.core;

import io.varlite.core.error.InputException;

/** Inclusive range of centuries in which a witness is dated, e.g. (4, 4) for a fourth-century codex. */
public record CenturyRange(int earliest, int latest) {

    public CenturyRange {
        if (earliest < 1) throw new InputException("Century must be >= 1, got " + earliest);
        if (latest < earliest) {
            throw new InputException("Century range is reversed: " + earliest + ".." + latest);
        }
    }

    public static CenturyRange of(int century) {
        return new CenturyRange(century, century);
    }
}
