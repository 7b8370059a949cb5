// file: engine/src/main/java/io/varlite/engine/pack/WitnessMetadata.java
package io.varlite.engine.pack;

import io.varlite.core.CenturyRange;

/**
 * Witness attribution carried by a pack record, as the pack states it.
 * Values are not validated here; the aggregation engine rejects malformed ones.
 *
 * @param siglum          witness siglum, e.g. "WH" or "P66"
 * @param typeLabel       raw witness type label, resolved by {@link io.varlite.core.WitnessSupportResolver}
 * @param earliestCentury optional, null when the pack gives no date
 * @param latestCentury   optional, defaults to {@code earliestCentury}
 */
public record WitnessMetadata(String siglum, String typeLabel, Integer earliestCentury, Integer latestCentury) {

    public static WitnessMetadata of(String siglum, String typeLabel) {
        return new WitnessMetadata(siglum, typeLabel, null, null);
    }

    /**
     * @return the century range, or null when undated
     * @throws io.varlite.core.error.InputException if the range is invalid
     */
    public CenturyRange century() {
        if (earliestCentury == null && latestCentury == null) return null;
        if (earliestCentury == null) return CenturyRange.of(latestCentury);
        return new CenturyRange(earliestCentury, latestCentury == null ? earliestCentury : latestCentury);
    }
}
