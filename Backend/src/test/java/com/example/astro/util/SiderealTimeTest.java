package com.example.astro.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SiderealTimeTest {

    @Test
    void meeusExample12a() {
        // 1987-04-10 0h UT: 13h10m46.3668s
        assertEquals(197.693195, SiderealTime.gmst(2446895.5), 1e-5);
    }

    @Test
    void apparentAddsEquationOfTheEquinoxes() {
        double jd = 2446895.5;
        double gmst = SiderealTime.gmst(jd);
        double gast = SiderealTime.gast(jd, -3.788, 23.443576);
        // Δψ·cos ε ≈ -3.475"
        assertEquals(-3.788 * Math.cos(Math.toRadians(23.443576)) / 3600.0, gast - gmst, 1e-9);
        assertEquals(-3.475 / 3600.0, gast - gmst, 1e-6);
    }

    @Test
    void localTimeAddsEastLongitudeAndNormalizes() {
        double jd = JulianDay.J2000;
        double gast = SiderealTime.gast(jd, -13.9, 23.4377);
        assertEquals(AngleMath.normalize(gast + 139.65), SiderealTime.last(jd, 139.65, -13.9, 23.4377), 1e-12);
        double west = SiderealTime.last(jd, -179.9, -13.9, 23.4377);
        assertTrue(west >= 0.0 && west < 360.0);
    }
}
