package com.dynop.roadnet.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class CoordinateSystemTest {

    @Test
    void parsesKnownCodesToConstants() {
        assertSame(CoordinateSystem.WGS84, CoordinateSystem.of("EPSG:4326"));
        assertSame(CoordinateSystem.WGS84, CoordinateSystem.of(" epsg:4326 "));
        assertSame(CoordinateSystem.WEB_MERCATOR, CoordinateSystem.of("EPSG:3857"));
    }

    @Test
    void keepsOtherCodes() {
        CoordinateSystem utm = CoordinateSystem.of("epsg:32618");
        assertEquals("EPSG:32618", utm.getCode());
        assertFalse(utm.isGeographic());
        assertEquals(utm, CoordinateSystem.of("EPSG:32618"));
    }

    @Test
    void onlyWgs84IsGeographic() {
        assertTrue(CoordinateSystem.WGS84.isGeographic());
        assertFalse(CoordinateSystem.WEB_MERCATOR.isGeographic());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "4326", "EPSG:", ":4326"})
    void rejectsMalformedCodes(String code) {
        assertThrows(IllegalArgumentException.class, () -> CoordinateSystem.of(code));
    }
}
