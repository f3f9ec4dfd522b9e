package com.example.astro.util;

import com.example.astro.model.NutationAngles;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class NutationTest {

    // Meeus 예제 22.a: 1987-04-10 0h TD
    private static final double T_1987_04_10 = (2446895.5 - JulianDay.J2000) / 36525.0;

    @Test
    void meeusExample22a() {
        NutationAngles nutation = Nutation.compute(T_1987_04_10);
        assertEquals(-3.788, nutation.getLongitude(), 0.01);
        assertEquals(9.443, nutation.getObliquity(), 0.01);
    }

    @Test
    void amplitudeStaysWithinPhysicalBounds() {
        for (double t = -2.0; t <= 1.0; t += 0.0137) {
            NutationAngles nutation = Nutation.compute(t);
            assertEquals(0.0, nutation.getLongitude(), 20.0);
            assertEquals(0.0, nutation.getObliquity(), 11.0);
        }
    }

    @Test
    void meanObliquity() {
        assertEquals(23.4392911, Obliquity.meanObliquity(0.0), 1e-7);
        // 23°26'27.407"
        assertEquals(23.44095, Obliquity.meanObliquity(T_1987_04_10), 1e-4);
    }

    @Test
    void trueObliquityAddsNutationInObliquity() {
        double mean = Obliquity.meanObliquity(T_1987_04_10);
        assertEquals(mean + 9.443 / 3600.0, Obliquity.trueObliquity(T_1987_04_10, 9.443), 1e-12);
    }
}
