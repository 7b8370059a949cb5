// file: engine/src/main/java/io/varlite/engine/BuildResult.java
package io.varlite.engine;

import java.util.List;

/**
 * Counters and failures of one aggregation build.
 * Counters only include committed work; a location that failed contributes nothing but its failures.
 */
public record BuildResult(
        String scope,
        List<String> packIds,
        int unitsCreated,
        int unitsUpdated,
        int readingsAdded,
        int supportsAdded,
        int agreements,
        int locationsProcessed,
        List<BuildFailure> failures
) {
    public BuildResult {
        packIds = List.copyOf(packIds);
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /** True when the build stored nothing new. */
    public boolean unchanged() {
        return unitsCreated == 0 && unitsUpdated == 0 && readingsAdded == 0 && supportsAdded == 0;
    }
}
