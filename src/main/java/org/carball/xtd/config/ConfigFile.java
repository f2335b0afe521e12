package org.carball.xtd.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Options read from a YAML configuration file. Unset entries leave the
 * corresponding option untouched.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConfigFile {

    @JsonProperty("duplicate_keys")
    private Boolean duplicateKeys;

    @JsonProperty("max_columns")
    private Integer maxColumns;

    @JsonProperty("skip_columns")
    private Boolean skipColumns;

    @JsonProperty("header")
    private String header;

    @JsonProperty("relations")
    private Boolean relations;
}
