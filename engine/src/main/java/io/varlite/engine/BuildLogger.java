// file: engine/src/main/java/io/varlite/engine/BuildLogger.java
package io.varlite.engine;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place to log completed builds and merge failures.
 */
public final class BuildLogger {
    private static final Logger log = Logger.getLogger(BuildLogger.class.getName());

    private BuildLogger() {
        // utility
    }

    /**
     * Log a completed build: INFO when clean, WARNING when any failure was reported.
     *
     * @param totalMillis wall-clock latency of the whole build
     */
    public static void logBuild(BuildResult r, long totalMillis) {
        String msg = String.format(
                "BUILD %s packs=%s -> created=%d updated=%d readings=%d supports=%d agreements=%d locations=%d failures=%d (total=%dms)",
                r.scope(),
                r.packIds(),
                r.unitsCreated(),
                r.unitsUpdated(),
                r.readingsAdded(),
                r.supportsAdded(),
                r.agreements(),
                r.locationsProcessed(),
                r.failures().size(),
                totalMillis
        );

        if (r.hasFailures()) {
            log.log(Level.WARNING, msg);
        } else {
            log.log(Level.INFO, msg);
        }
    }

    /** Log a rejected record or location. Integrity violations are SEVERE. */
    public static void logFailure(BuildFailure failure, Throwable error) {
        if (failure.kind() == FailureKind.INTEGRITY) {
            log.log(Level.SEVERE, failure.toString(), error);
        } else {
            log.log(Level.FINE, failure.toString());
        }
    }
}
