// file: engine/src/main/java/io/varlite/engine/pack/PackManifest.java
package io.varlite.engine.pack;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** JSON shape of {@code manifest.json} in a pack directory. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PackManifest {
    @JsonProperty("pack_id")
    @JsonAlias("id")
    public String packId;

    @JsonProperty("siglum")
    @JsonAlias("witness_siglum")
    public String siglum;

    @JsonProperty("witness_type")
    public String witnessType;

    @JsonProperty("century_range")
    @JsonAlias("date_range")
    public List<Integer> centuryRange;
}
