// file: core/src/main/java/io/varlite/core/WitnessSupportResolver.java
package io.varlite.core;

import java.util.Locale;
import java.util.Map;

/**
 * Maps the free-form witness labels used by source packs onto {@link WitnessType}.
 * <p>
 * Labels are compared after trimming, lower-casing and collapsing runs of
 * '-', '_' and whitespace into one space, so "Westcott-Hort" and "westcott_hort"
 * resolve alike. Unknown labels resolve to {@link WitnessType#OTHER}; an unfamiliar
 * label never blocks ingestion.
 */
public final class WitnessSupportResolver {

    private static final Map<String, WitnessType> LABELS = Map.ofEntries(
            Map.entry("papyrus", WitnessType.MANUSCRIPT),
            Map.entry("uncial", WitnessType.MANUSCRIPT),
            Map.entry("majuscule", WitnessType.MANUSCRIPT),
            Map.entry("minuscule", WitnessType.MANUSCRIPT),
            Map.entry("manuscript", WitnessType.MANUSCRIPT),
            Map.entry("ms", WitnessType.MANUSCRIPT),
            Map.entry("codex", WitnessType.MANUSCRIPT),
            Map.entry("lectionary", WitnessType.MANUSCRIPT),

            Map.entry("edition", WitnessType.EDITION),
            Map.entry("critical edition", WitnessType.EDITION),
            Map.entry("sblgnt", WitnessType.EDITION),
            Map.entry("sbl", WitnessType.EDITION),
            Map.entry("na27", WitnessType.EDITION),
            Map.entry("na28", WitnessType.EDITION),
            Map.entry("ubs4", WitnessType.EDITION),
            Map.entry("ubs5", WitnessType.EDITION),
            Map.entry("wh", WitnessType.EDITION),
            Map.entry("westcott hort", WitnessType.EDITION),
            Map.entry("tischendorf", WitnessType.EDITION),
            Map.entry("tregelles", WitnessType.EDITION),
            Map.entry("thgnt", WitnessType.EDITION),
            Map.entry("tr", WitnessType.EDITION),
            Map.entry("textus receptus", WitnessType.EDITION),

            Map.entry("tradition", WitnessType.TRADITION),
            Map.entry("byzantine", WitnessType.TRADITION),
            Map.entry("byz", WitnessType.TRADITION),
            Map.entry("majority", WitnessType.TRADITION),
            Map.entry("majority text", WitnessType.TRADITION),
            Map.entry("rp", WitnessType.TRADITION),
            Map.entry("robinson pierpont", WitnessType.TRADITION),
            Map.entry("alexandrian", WitnessType.TRADITION),
            Map.entry("western", WitnessType.TRADITION),
            Map.entry("caesarean", WitnessType.TRADITION)
    );

    private WitnessSupportResolver() {
        // utility
    }

    public static WitnessType resolve(String rawLabel) {
        if (rawLabel == null) return WitnessType.OTHER;
        String key = rawLabel.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_-]+", " ");
        return LABELS.getOrDefault(key, WitnessType.OTHER);
    }

    /**
     * Build a support value from pack metadata.
     *
     * @param century optional century range, may be null
     */
    public static WitnessSupport support(String siglum, String rawLabel, String packId, CenturyRange century) {
        return new WitnessSupport(siglum == null ? null : siglum.trim(), resolve(rawLabel), packId, century);
    }
}
