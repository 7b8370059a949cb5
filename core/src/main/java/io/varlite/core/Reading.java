// file: core/src/main/java/io/varlite/core/Reading.java
package io.varlite.core;

import io.varlite.core.classify.Assessment;
import io.varlite.core.error.IntegrityException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One distinct textual variant within a unit.
 * <p>
 * Invariants:
 *  - index and canonicalKey never change once assigned.
 *  - supports are unique by (siglum, sourcePackId) and kept in arrival order.
 *  - the spine (index 0) carries no assessment; an alternate is assessed at most once.
 *
 * @param assessment null for the spine and for alternates not yet classified
 */
public record Reading(
        int index,
        String surfaceText,
        String canonicalKey,
        boolean spine,
        List<WitnessSupport> supports,
        Assessment assessment
) {
    private static final Pattern PAPYRUS_SIGLUM = Pattern.compile("(?:P|𝔓)\\d+");
    private static final Set<String> PRIMARY_UNCIALS = Set.of("א", "01", "B", "03", "A", "02", "C", "04", "D", "05");
    private static final int SUMMARY_SIGLA = 5;

    public Reading {
        Objects.requireNonNull(surfaceText, "surfaceText");
        Objects.requireNonNull(canonicalKey, "canonicalKey");
        supports = List.copyOf(supports);
        if (index < 0) throw new IntegrityException("Reading index must be >= 0, got " + index);
        if (spine != (index == 0)) throw new IntegrityException("Only reading 0 may be the spine, got index " + index);
        if (spine && assessment != null) throw new IntegrityException("The spine reading is never assessed");
        for (int i = 0; i < supports.size(); i++) {
            for (int j = i + 1; j < supports.size(); j++) {
                if (supports.get(i).sameAttestation(supports.get(j))) {
                    throw new IntegrityException("Duplicate support " + supports.get(j) + " on reading " + index);
                }
            }
        }
    }

    public static Reading spine(String surfaceText, String canonicalKey) {
        return new Reading(0, surfaceText, canonicalKey, true, List.of(), null);
    }

    public static Reading alternate(int index, String surfaceText, String canonicalKey) {
        return new Reading(index, surfaceText, canonicalKey, false, List.of(), null);
    }

    public boolean hasSupport(WitnessSupport candidate) {
        return supports.stream().anyMatch(s -> s.sameAttestation(candidate));
    }

    public Reading withSupport(WitnessSupport support) {
        if (hasSupport(support)) {
            throw new IntegrityException("Reading " + index + " already has support "
                    + support.siglum() + "/" + support.sourcePackId());
        }
        List<WitnessSupport> next = new ArrayList<>(supports.size() + 1);
        next.addAll(supports);
        next.add(support);
        return new Reading(index, surfaceText, canonicalKey, spine, next, assessment);
    }

    public Reading withAssessment(Assessment a) {
        Objects.requireNonNull(a, "assessment");
        if (assessment != null) throw new IntegrityException("Reading " + index + " is already assessed");
        return new Reading(index, surfaceText, canonicalKey, spine, supports, a);
    }

    // -------- descriptive evidence figures --------

    public int supportCount() {
        return supports.size();
    }

    /** Number of distinct sigla, counting a witness reported by several packs once. */
    public int witnessCount() {
        return (int) supports.stream().map(WitnessSupport::siglum).distinct().count();
    }

    public int packCount() {
        return (int) supports.stream().map(WitnessSupport::sourcePackId).distinct().count();
    }

    /** Earliest century of attestation among dated supports. */
    public OptionalInt earliestCentury() {
        return supports.stream()
                .filter(s -> s.century() != null)
                .mapToInt(s -> s.century().earliest())
                .min();
    }

    /** True if a manuscript support carries a papyrus siglum such as P66. */
    public boolean hasPapyri() {
        return supports.stream()
                .anyMatch(s -> s.type() == WitnessType.MANUSCRIPT && PAPYRUS_SIGLUM.matcher(s.siglum()).matches());
    }

    /** True if a manuscript support is one of Sinaiticus, Vaticanus, Alexandrinus, Ephraemi or Bezae. */
    public boolean hasPrimaryUncials() {
        return supports.stream()
                .anyMatch(s -> s.type() == WitnessType.MANUSCRIPT && PRIMARY_UNCIALS.contains(s.siglum()));
    }

    /** Distinct sigla in arrival order, at most five, e.g. {@code "P66, א, B, A, C (+2 more)"}. */
    public String witnessSummary() {
        List<String> sigla = supports.stream().map(WitnessSupport::siglum).distinct().toList();
        if (sigla.isEmpty()) return "No witnesses recorded";
        String shown = String.join(", ", sigla.subList(0, Math.min(SUMMARY_SIGLA, sigla.size())));
        return sigla.size() > SUMMARY_SIGLA ? shown + " (+" + (sigla.size() - SUMMARY_SIGLA) + " more)" : shown;
    }
}
