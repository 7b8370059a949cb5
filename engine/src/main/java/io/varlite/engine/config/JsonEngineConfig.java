// file: engine/src/main/java/io/varlite/engine/config/JsonEngineConfig.java
package io.varlite.engine.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** JSON shape of an engine configuration file. Absent fields keep their defaults. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class JsonEngineConfig {
    public String dataDir;
    public String packRoot;
    public String spineDir;
    public Long walRotateBytes;
    public Integer snapshotEvery;
    public Integer parallelism;
}
