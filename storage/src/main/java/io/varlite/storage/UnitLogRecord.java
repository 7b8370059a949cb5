// file: storage/src/main/java/io/varlite/storage/UnitLogRecord.java
package io.varlite.storage;

/**
 * WAL payload of the variant store.
 * <p>
 *  - PUT:   {@code unit} is the complete after-image of a committed unit.
 *  - RESET: the unit at (verseId, position) was deleted by an operator.
 * Records carry a strictly increasing {@code seq}; replay skips records already
 * covered by the loaded snapshot.
 */
public record UnitLogRecord(long seq, Op op, String verseId, int position, UnitImage unit) {

    public enum Op { PUT, RESET }

    static UnitLogRecord put(long seq, UnitImage unit) {
        return new UnitLogRecord(seq, Op.PUT, unit.verseId(), unit.position(), unit);
    }

    static UnitLogRecord reset(long seq, String verseId, int position) {
        return new UnitLogRecord(seq, Op.RESET, verseId, position, null);
    }
}
