// file: engine/src/main/java/io/varlite/engine/gate/GateResolver.java
package io.varlite.engine.gate;

import io.varlite.core.AcknowledgementRecord;
import io.varlite.core.Scope;
import io.varlite.core.VariantUnit;
import io.varlite.core.error.InputException;
import io.varlite.storage.AcknowledgementStore;
import io.varlite.storage.VariantStore;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Tracks which significant units a session has explicitly reviewed.
 * <p>
 * The gate works on merged units: a unit needs acknowledgement when its
 * significance is significant or major. Acknowledgements are keyed by unit id,
 * which later builds never change, so adding evidence to a unit does not reopen it.
 */
public final class GateResolver {
    private static final Logger log = Logger.getLogger(GateResolver.class.getName());

    private final VariantStore units;
    private final AcknowledgementStore acks;
    private final Clock clock;

    public GateResolver(VariantStore units, AcknowledgementStore acks) {
        this(units, acks, Clock.systemUTC());
    }

    public GateResolver(VariantStore units, AcknowledgementStore acks, Clock clock) {
        this.units = Objects.requireNonNull(units, "units");
        this.acks = Objects.requireNonNull(acks, "acks");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Units in scope that require acknowledgement and have none for the session, in location order. */
    public List<VariantUnit> pending(String scopeRef, String sessionId) {
        Scope scope = Scope.parse(scopeRef);
        requireSession(sessionId);
        return units.getUnitsForScope(scope).stream()
                .filter(VariantUnit::requiresAcknowledgement)
                .filter(u -> acks.find(u.id(), sessionId) == null)
                .toList();
    }

    /**
     * Record that a session reviewed a unit and chose a reading. Acknowledging again
     * replaces the reading index, reason and timestamp.
     *
     * @throws InputException if the unit does not exist, the reading index is invalid
     *                        or the session id is blank; nothing is written
     */
    public AcknowledgementRecord acknowledge(UnitRef ref, int readingIndex, String sessionId, String reason) {
        requireSession(sessionId);
        VariantUnit unit = resolve(ref);
        if (!unit.hasReading(readingIndex)) {
            throw new InputException("Unit " + unit.location() + " has no reading " + readingIndex
                    + " (readings 0.." + (unit.readingCount() - 1) + ")");
        }
        AcknowledgementRecord stored = acks.upsert(
                new AcknowledgementRecord(unit.id(), sessionId, readingIndex, reason, Instant.now(clock)));
        log.fine(() -> "Session " + sessionId + " acknowledged unit " + unit.id() + " reading " + readingIndex);
        return stored;
    }

    /** Acknowledgement of a unit by a session, or null. */
    public AcknowledgementRecord acknowledgement(UnitRef ref, String sessionId) {
        requireSession(sessionId);
        return acks.find(resolve(ref).id(), sessionId);
    }

    public GateState state(UnitRef ref, String sessionId) {
        return acknowledgement(ref, sessionId) == null ? GateState.UNACKNOWLEDGED : GateState.ACKNOWLEDGED;
    }

    public List<AcknowledgementRecord> acknowledgements(String sessionId) {
        requireSession(sessionId);
        return acks.listForSession(sessionId);
    }

    private VariantUnit resolve(UnitRef ref) {
        Objects.requireNonNull(ref, "ref");
        VariantUnit unit = ref.unitId() != null ? units.getUnitById(ref.unitId()) : units.getUnit(ref.location());
        if (unit == null) throw new InputException("No variant unit " + ref);
        if (ref.location() != null && !ref.location().equals(unit.location())) {
            throw new InputException("Unit #" + unit.id() + " is at " + unit.location() + ", not " + ref.location());
        }
        return unit;
    }

    private static void requireSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) throw new InputException("Session id is required");
    }
}
