package com.dynop.roadnet.config;

import com.dynop.roadnet.graph.EdgeCollisionPolicy;
import com.dynop.roadnet.model.CoordinateSystem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RoadNetworkConfigurationTest {

    @TempDir
    Path tempDir;

    @Test
    void bindsYaml() throws IOException {
        Path file = tempDir.resolve("build.yml");
        Files.writeString(file, String.join("\n",
            "vintage: 2017",
            "crs: epsg:3857",
            "input: /data/segments.csv",
            "output: /data/out",
            "collision_policy: reject",
            ""));
        
        RoadNetworkConfiguration config = RoadNetworkConfiguration.load(file);
        config.validate();
        
        assertEquals("2017", config.getVintage());
        assertEquals(CoordinateSystem.WEB_MERCATOR, config.getCoordinateSystem());
        assertEquals(Path.of("/data/segments.csv"), config.getInputPath());
        assertEquals(Path.of("/data/out"), config.getOutputPath());
        assertEquals(EdgeCollisionPolicy.REJECT, config.getCollisionPolicy());
    }

    @Test
    void appliesDefaults() throws IOException {
        Path file = tempDir.resolve("minimal.yml");
        Files.writeString(file, "vintage: \"2021\"\ninput: in.csv\noutput: out\n");
        
        RoadNetworkConfiguration config = RoadNetworkConfiguration.load(file);
        
        assertEquals(CoordinateSystem.WGS84, config.getCoordinateSystem());
        assertEquals(EdgeCollisionPolicy.OVERWRITE, config.getCollisionPolicy());
    }

    @Test
    void missingFileFails() {
        assertThrows(IOException.class, () -> RoadNetworkConfiguration.load(tempDir.resolve("none.yml")));
    }

    @Test
    void validateRequiresVintageInputAndOutput() {
        RoadNetworkConfiguration config = new RoadNetworkConfiguration();
        config.setInput("in.csv");
        config.setOutput("out");
        assertThrows(IllegalArgumentException.class, config::validate);
        
        config.setVintage("2021");
        config.validate();
        
        config.setCrs("4326");
        assertThrows(IllegalArgumentException.class, config::validate);
    }
}
