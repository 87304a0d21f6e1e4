package com.dynop.roadnet.config;

import com.dynop.roadnet.graph.EdgeCollisionPolicy;
import com.dynop.roadnet.model.CoordinateSystem;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Settings of an offline road graph build.
 * 
 * <p>Bound from YAML (JSON works as well, being a YAML subset):
 * <pre>{@code
 * vintage: "2021"
 * crs: EPSG:4326
 * input: /data/multinet/segments.csv
 * output: /data/graph-build
 * collision_policy: reject
 * }</pre>
 */
public class RoadNetworkConfiguration {
    
    private static final ObjectMapper MAPPER = YAMLMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .build();
    
    @JsonProperty("vintage")
    private String vintage;
    
    @JsonProperty("crs")
    private String crs = CoordinateSystem.WGS84.getCode();
    
    @JsonProperty("input")
    private String input;
    
    @JsonProperty("output")
    private String output;
    
    @JsonProperty("collision_policy")
    private EdgeCollisionPolicy collisionPolicy = EdgeCollisionPolicy.OVERWRITE;
    
    /**
     * Load a configuration file.
     * 
     * @param file YAML or JSON file
     * @return Bound configuration (not yet validated)
     * @throws IOException if the file cannot be read or bound
     */
    public static RoadNetworkConfiguration load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Configuration file not found: " + file);
        }
        return MAPPER.readValue(file.toFile(), RoadNetworkConfiguration.class);
    }
    
    /**
     * @throws IllegalArgumentException if a required setting is missing or malformed
     */
    public void validate() {
        if (vintage == null || vintage.isBlank()) {
            throw new IllegalArgumentException("vintage is required");
        }
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("input is required");
        }
        if (output == null || output.isBlank()) {
            throw new IllegalArgumentException("output is required");
        }
        if (collisionPolicy == null) {
            throw new IllegalArgumentException("collision_policy must be OVERWRITE or REJECT");
        }
        getCoordinateSystem();
    }
    
    public String getVintage() {
        return vintage;
    }
    
    public void setVintage(String vintage) {
        this.vintage = vintage;
    }
    
    public String getCrs() {
        return crs;
    }
    
    public void setCrs(String crs) {
        this.crs = crs;
    }
    
    @JsonIgnore
    public CoordinateSystem getCoordinateSystem() {
        return CoordinateSystem.of(crs);
    }
    
    public String getInput() {
        return input;
    }
    
    public void setInput(String input) {
        this.input = input;
    }
    
    @JsonIgnore
    public Path getInputPath() {
        return Path.of(input);
    }
    
    public String getOutput() {
        return output;
    }
    
    public void setOutput(String output) {
        this.output = output;
    }
    
    @JsonIgnore
    public Path getOutputPath() {
        return Path.of(output);
    }
    
    public EdgeCollisionPolicy getCollisionPolicy() {
        return collisionPolicy;
    }
    
    public void setCollisionPolicy(EdgeCollisionPolicy collisionPolicy) {
        this.collisionPolicy = collisionPolicy;
    }
}
