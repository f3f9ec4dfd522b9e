package com.example.astro.model;

import com.example.astro.exception.AstroErrorType;
import com.example.astro.exception.AstroException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class GeoCoordinateTest {

    @Test
    void validCoordinate() {
        GeoCoordinate coordinate = GeoCoordinate.of(40.7128, -74.0060);
        assertEquals(40.7128, coordinate.getLatitude());
        assertEquals(-74.0060, coordinate.getLongitude());
        assertEquals(coordinate, GeoCoordinate.of(40.7128, -74.0060));
    }

    @Test
    void rejectsOutOfRangeAndNonFiniteValues() {
        assertInvalid(91.0, 0.0);
        assertInvalid(-90.5, 0.0);
        assertInvalid(0.0, 181.0);
        assertInvalid(0.0, -180.01);
        assertInvalid(Double.NaN, 0.0);
        assertInvalid(0.0, Double.POSITIVE_INFINITY);
    }

    @Test
    void poleIsValidCoordinateButNotForAscendant() {
        GeoCoordinate pole = GeoCoordinate.of(90.0, 0.0);
        AstroException e = assertThrows(AstroException.class, pole::validateForAscendant);
        assertEquals(AstroErrorType.EXTREME_LATITUDE, e.getType());
        assertEquals("90.0", e.getDetail());
    }

    @Test
    void ascendantLatitudeLimitIsInclusive() {
        assertDoesNotThrow(() -> GeoCoordinate.of(85.0, 0.0).validateForAscendant());
        assertDoesNotThrow(() -> GeoCoordinate.of(-85.0, 0.0).validateForAscendant());
        assertThrows(AstroException.class, () -> GeoCoordinate.of(85.1, 0.0).validateForAscendant());
        assertThrows(AstroException.class, () -> GeoCoordinate.of(-86.0, 0.0).validateForAscendant());
    }

    private static void assertInvalid(double latitude, double longitude) {
        AstroException e = assertThrows(AstroException.class, () -> GeoCoordinate.of(latitude, longitude));
        assertEquals(AstroErrorType.INVALID_COORDINATE, e.getType());
    }
}
