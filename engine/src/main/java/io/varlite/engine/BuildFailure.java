// file: engine/src/main/java/io/varlite/engine/BuildFailure.java
package io.varlite.engine;

/**
 * One failure reported by a build.
 *
 * @param location location as "verse@position"
 * @param packId   pack of the offending record, or null for location-wide failures
 */
public record BuildFailure(String location, FailureKind kind, String packId, String message) {

    @Override
    public String toString() {
        return kind + " " + location + (packId == null ? "" : " [" + packId + "]") + ": " + message;
    }
}
