// file: engine/src/main/java/io/varlite/engine/VariantEngine.java
package io.varlite.engine;

import io.varlite.core.AcknowledgementRecord;
import io.varlite.core.Location;
import io.varlite.core.Scope;
import io.varlite.core.VariantUnit;
import io.varlite.core.VerseRef;
import io.varlite.core.classify.Significance;
import io.varlite.core.classify.SignificanceClassifier;
import io.varlite.engine.config.EngineConfig;
import io.varlite.engine.gate.GateResolver;
import io.varlite.engine.gate.UnitRef;
import io.varlite.engine.pack.DirectoryPackLoader;
import io.varlite.engine.pack.DirectorySpineSource;
import io.varlite.engine.pack.PackLoader;
import io.varlite.engine.pack.SpineSource;
import io.varlite.storage.AcknowledgementStore;
import io.varlite.storage.DurableAcknowledgementStore;
import io.varlite.storage.DurableVariantStore;
import io.varlite.storage.VariantStore;

import java.util.List;
import java.util.logging.Logger;

/**
 * Entry point for callers: aggregation builds, unit queries and the acknowledgement gate
 * over one pair of durable stores.
 */
public final class VariantEngine implements AutoCloseable {
    private static final Logger log = Logger.getLogger(VariantEngine.class.getName());

    private final VariantStore units;
    private final AcknowledgementStore acks;
    private final AggregationEngine aggregation;
    private final GateResolver gate;

    public VariantEngine(
            VariantStore units,
            AcknowledgementStore acks,
            PackLoader packs,
            SpineSource spine,
            int parallelism
    ) {
        this.units = units;
        this.acks = acks;
        this.aggregation = new AggregationEngine(units, packs, spine, new SignificanceClassifier(), parallelism);
        this.gate = new GateResolver(units, acks);
    }

    /** Open the stores under {@code dataDir} and read packs and spine from directories. */
    public static VariantEngine open(EngineConfig cfg) {
        VariantStore units = DurableVariantStore.open(
                cfg.dataDir().resolve("variants"), cfg.walRotateBytes(), cfg.snapshotEvery());
        AcknowledgementStore acks = DurableAcknowledgementStore.open(
                cfg.dataDir().resolve("acks"), cfg.walRotateBytes(), cfg.snapshotEvery());
        log.info(() -> "Variant engine opened: data=" + cfg.dataDir() + " packs=" + cfg.packRoot()
                + " spine=" + cfg.spineDir() + " parallelism=" + cfg.parallelism());
        return new VariantEngine(units, acks,
                new DirectoryPackLoader(cfg.packRoot()), new DirectorySpineSource(cfg.spineDir()), cfg.parallelism());
    }

    public BuildResult build(String scope, List<String> packIds) {
        return aggregation.build(scope, packIds);
    }

    public VariantUnit getUnit(String verseId, int position) {
        return units.getUnit(verseId, position);
    }

    public VariantUnit getUnitById(long unitId) {
        return units.getUnitById(unitId);
    }

    public List<VariantUnit> getUnitsForScope(String scope) {
        return units.getUnitsForScope(Scope.parse(scope));
    }

    /** Significant and major units in scope. */
    public List<VariantUnit> getSignificantUnits(String scope) {
        return units.getSignificantUnits(Scope.parse(scope), Significance.SIGNIFICANT);
    }

    /** @param significance null counts every unit in scope */
    public int countUnits(String scope, Significance significance) {
        return units.countUnits(Scope.parse(scope), significance);
    }

    public boolean hasSignificantUnit(String verseId) {
        return units.hasSignificantUnit(VerseRef.parse(verseId));
    }

    public List<VariantUnit> pending(String scope, String sessionId) {
        return gate.pending(scope, sessionId);
    }

    public AcknowledgementRecord acknowledge(UnitRef ref, int readingIndex, String sessionId, String reason) {
        return gate.acknowledge(ref, readingIndex, sessionId, reason);
    }

    public AcknowledgementRecord acknowledgement(UnitRef ref, String sessionId) {
        return gate.acknowledgement(ref, sessionId);
    }

    public List<AcknowledgementRecord> acknowledgements(String sessionId) {
        return gate.acknowledgements(sessionId);
    }

    /** Operator reset of one unit; acknowledgements of the deleted unit id no longer match any unit. */
    public boolean resetUnit(String verseId, int position) {
        return units.resetUnit(Location.of(verseId, position));
    }

    @Override
    public void close() {
        aggregation.close();
        acks.close();
        units.close();
    }
}
