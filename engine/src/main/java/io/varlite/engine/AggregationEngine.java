// file: engine/src/main/java/io/varlite/engine/AggregationEngine.java
package io.varlite.engine;

import io.varlite.core.Location;
import io.varlite.core.Reading;
import io.varlite.core.Scope;
import io.varlite.core.TextNormalizer;
import io.varlite.core.WitnessSupport;
import io.varlite.core.WitnessSupportResolver;
import io.varlite.core.classify.SignificanceClassifier;
import io.varlite.core.error.ConflictException;
import io.varlite.core.error.InputException;
import io.varlite.core.error.IntegrityException;
import io.varlite.core.error.ProvenanceException;
import io.varlite.engine.pack.PackLoader;
import io.varlite.engine.pack.PackRecord;
import io.varlite.engine.pack.SpineSegment;
import io.varlite.engine.pack.SpineSource;
import io.varlite.storage.UnitTransaction;
import io.varlite.storage.VariantStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Merges pack readings into variant units.
 * <p>
 * A build runs in two phases:
 *  1) Plan: parse the scope, check the pack list, read the spine and every pack
 *     chapter in scope. Any input error aborts here, before anything is written.
 *  2) Merge: for each spine location, in one store transaction:
 *      - load or create the unit (reading 0 from the spine),
 *      - fold each pack record (caller's pack order, then document order) into
 *        an agreement, an existing reading or a new one, adding its support once,
 *      - assess every alternate that has no assessment yet,
 *      - commit.
 * <p>
 * Locations are independent. With {@code parallelism > 1} they are merged on a
 * worker pool; results are still reported in spine order. Rebuilding with the same
 * inputs stores nothing new.
 */
public final class AggregationEngine implements AutoCloseable {

    private final VariantStore store;
    private final PackLoader packs;
    private final SpineSource spine;
    private final SignificanceClassifier classifier;
    private final ExecutorService workers; // null when single-threaded

    public AggregationEngine(VariantStore store, PackLoader packs, SpineSource spine) {
        this(store, packs, spine, new SignificanceClassifier(), 1);
    }

    public AggregationEngine(
            VariantStore store,
            PackLoader packs,
            SpineSource spine,
            SignificanceClassifier classifier,
            int parallelism
    ) {
        if (parallelism <= 0) throw new IllegalArgumentException("parallelism must be > 0");
        this.store = Objects.requireNonNull(store, "store");
        this.packs = Objects.requireNonNull(packs, "packs");
        this.spine = Objects.requireNonNull(spine, "spine");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        if (parallelism == 1) {
            this.workers = null;
        } else {
            AtomicInteger n = new AtomicInteger();
            this.workers = Executors.newFixedThreadPool(parallelism, r -> {
                Thread t = new Thread(r, "aggregation-worker-" + n.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }
    }

    /**
     * Build (or rebuild) the units of a scope from the given packs.
     *
     * @param scopeRef book, chapter or verse reference, e.g. "John", "John.1", "John.1.18"
     * @param packIds  packs to merge, in precedence order
     * @throws InputException if the scope, the pack list or the book is invalid; nothing is written
     */
    public BuildResult build(String scopeRef, List<String> packIds) {
        long start = System.nanoTime();
        Scope scope = Scope.parse(scopeRef);
        List<String> ids = checkPacks(packIds);

        List<RankedFailure> ranked = new ArrayList<>();
        List<LocationWork> plan = plan(scope, ids, ranked);

        List<LocationOutcome> outcomes = merge(plan);

        int created = 0, updated = 0, readings = 0, supports = 0, agreements = 0;
        for (int i = 0; i < outcomes.size(); i++) {
            LocationOutcome o = outcomes.get(i);
            if (o.created()) created++;
            if (o.updated()) updated++;
            readings += o.readingsAdded();
            supports += o.supportsAdded();
            agreements += o.agreements();
            Location loc = plan.get(i).location();
            o.failures().forEach(f -> ranked.add(new RankedFailure(loc, f)));
        }
        // Stable sort: per-location order of failures is kept.
        ranked.sort(Comparator.comparing(RankedFailure::location, Comparator.nullsFirst(Comparator.<Location>naturalOrder())));

        BuildResult result = new BuildResult(
                scope.toString(), ids, created, updated, readings, supports, agreements, plan.size(),
                ranked.stream().map(RankedFailure::failure).toList());
        BuildLogger.logBuild(result, (System.nanoTime() - start) / 1_000_000);
        return result;
    }

    @Override
    public void close() {
        if (workers != null) workers.shutdownNow();
    }

    // ---------------- plan ----------------

    private record LocationWork(Location location, SpineSegment segment, List<PackRecord> records) {}

    /** Failure with its location for ordering; null when the location does not parse. */
    private record RankedFailure(Location location, BuildFailure failure) {}

    private List<String> checkPacks(List<String> packIds) {
        if (packIds == null || packIds.isEmpty()) throw new InputException("At least one pack id is required");
        List<String> ids = new ArrayList<>();
        for (String id : packIds) {
            if (id == null || id.isBlank()) throw new InputException("Pack ids must not be blank");
            if (!packs.isInstalled(id)) throw new InputException("Pack '" + id + "' is not installed");
            if (!ids.contains(id)) ids.add(id);
        }
        return ids;
    }

    private List<LocationWork> plan(Scope scope, List<String> packIds, List<RankedFailure> failures) {
        List<Integer> chapters = spine.chapters(scope.book());
        if (chapters.isEmpty()) throw new InputException("Unknown book: " + scope.book());
        if (scope.chapter() != null) {
            if (!chapters.contains(scope.chapter())) {
                throw new InputException("Unknown chapter: " + scope.book() + "." + scope.chapter());
            }
            chapters = List.of(scope.chapter());
        }

        List<LocationWork> work = new ArrayList<>();
        for (int chapter : chapters) {
            Map<Location, SpineSegment> segments = new LinkedHashMap<>();
            for (SpineSegment seg : spine.segments(scope.book(), chapter)) {
                if (scope.contains(seg.location().verse())) segments.putIfAbsent(seg.location(), seg);
            }

            Map<Location, List<PackRecord>> grouped = new LinkedHashMap<>();
            for (String packId : packIds) {
                for (PackRecord r : packs.load(packId, scope.book(), chapter)) {
                    Location loc;
                    try {
                        loc = r.location();
                    } catch (InputException e) {
                        failures.add(new RankedFailure(null, failure(r.rawLocation(), FailureKind.MALFORMED, r.packId(), e)));
                        continue;
                    }
                    if (!scope.contains(loc.verse())) continue;
                    if (!segments.containsKey(loc)) {
                        failures.add(new RankedFailure(loc, failure(loc.toString(), FailureKind.NOT_IN_SPINE, r.packId(),
                                new InputException("Location " + loc + " is not in the spine"))));
                        continue;
                    }
                    grouped.computeIfAbsent(loc, k -> new ArrayList<>()).add(r);
                }
            }

            segments.forEach((loc, seg) -> work.add(new LocationWork(loc, seg, grouped.getOrDefault(loc, List.of()))));
        }
        return work;
    }

    // ---------------- merge ----------------

    private record LocationOutcome(
            boolean created,
            boolean updated,
            int readingsAdded,
            int supportsAdded,
            int agreements,
            List<BuildFailure> failures
    ) {
        static LocationOutcome failed(List<BuildFailure> failures) {
            return new LocationOutcome(false, false, 0, 0, 0, failures);
        }
    }

    private record Accepted(PackRecord record, String canonicalKey, WitnessSupport support) {}

    private List<LocationOutcome> merge(List<LocationWork> plan) {
        if (workers == null) {
            return plan.stream().map(this::mergeLocation).toList();
        }
        List<Future<LocationOutcome>> futures = new ArrayList<>(plan.size());
        for (LocationWork w : plan) futures.add(workers.submit(() -> mergeLocation(w)));

        List<LocationOutcome> outcomes = new ArrayList<>(plan.size());
        for (Future<LocationOutcome> f : futures) {
            try {
                outcomes.add(f.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(p -> p.cancel(true));
                throw new IllegalStateException("Build interrupted", e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Merge worker failed", e.getCause());
            }
        }
        return outcomes;
    }

    private LocationOutcome mergeLocation(LocationWork w) {
        String where = w.location().toString();
        List<BuildFailure> failures = new ArrayList<>();

        // Validate everything first so a malformed record leaves the location untouched.
        List<Accepted> accepted = new ArrayList<>(w.records().size());
        for (PackRecord r : w.records()) {
            try {
                accepted.add(accept(r));
            } catch (ProvenanceException e) {
                failures.add(failure(where, FailureKind.PROVENANCE, null, e));
            } catch (InputException e) {
                failures.add(failure(where, FailureKind.MALFORMED, r.packId(), e));
                return LocationOutcome.failed(failures);
            }
        }

        try (UnitTransaction tx = store.begin(w.location())) {
            boolean created = false;
            if (!tx.exists()) {
                tx.createUnit(w.segment().text(), TextNormalizer.normalize(w.segment().text()));
                created = true;
            }
            Reading spineReading = tx.current().spine();

            int agreements = 0, readingsAdded = 0, supportsAdded = 0;
            for (Accepted a : accepted) {
                if (a.canonicalKey().equals(spineReading.canonicalKey())) {
                    agreements++;
                    continue;
                }
                OptionalInt existing = tx.findReading(a.canonicalKey());
                int index;
                if (existing.isPresent()) {
                    index = existing.getAsInt();
                } else {
                    index = tx.addReading(a.record().text(), a.canonicalKey());
                    readingsAdded++;
                }
                if (tx.addSupportIfAbsent(index, a.support())) supportsAdded++;
            }

            for (Reading alt : tx.current().alternates()) {
                if (alt.assessment() == null) {
                    tx.assessIfAbsent(alt.index(), classifier.classify(spineReading.surfaceText(), alt.surfaceText()));
                }
            }

            boolean changed = tx.hasChanges();
            tx.commit();
            return new LocationOutcome(created, changed && !created, readingsAdded, supportsAdded, agreements, failures);
        } catch (ConflictException e) {
            failures.add(failure(where, FailureKind.CONFLICT, null, e));
        } catch (IntegrityException e) {
            failures.add(failure(where, FailureKind.INTEGRITY, null, e));
        }
        return LocationOutcome.failed(failures);
    }

    /**
     * @throws ProvenanceException if the record has no pack id
     * @throws InputException      if the record is malformed
     */
    private static Accepted accept(PackRecord r) {
        if (r.packId() == null || r.packId().isBlank()) throw new ProvenanceException(r.verseId());
        if (r.text() == null) throw new InputException("Record for " + r.rawLocation() + " has no text");
        if (r.witness() == null) throw new InputException("Record for " + r.rawLocation() + " has no witness");
        WitnessSupport support = WitnessSupportResolver.support(
                r.witness().siglum(), r.witness().typeLabel(), r.packId(), r.witness().century());
        return new Accepted(r, TextNormalizer.normalize(r.text()), support);
    }

    private static BuildFailure failure(String location, FailureKind kind, String packId, RuntimeException e) {
        BuildFailure f = new BuildFailure(location, kind, packId, e.getMessage());
        BuildLogger.logFailure(f, e);
        return f;
    }
}
