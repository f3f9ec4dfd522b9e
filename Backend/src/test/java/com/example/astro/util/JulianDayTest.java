package com.example.astro.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class JulianDayTest {

    @Test
    void meeusExample7a() {
        // 1957년 10월 4.81일
        assertEquals(2436116.31, JulianDay.julianDay(1957, 10, 4.81), 1e-6);
    }

    @Test
    void j2000Epoch() {
        assertEquals(JulianDay.J2000, JulianDay.julianDay(2000, 1, 1.5), 1e-9);
        assertEquals(JulianDay.J2000, JulianDay.julianDay(LocalDateTime.of(2000, 1, 1, 12, 0)), 1e-9);
    }

    @Test
    void januaryAndFebruaryUsePreviousYear() {
        assertEquals(2451179.5, JulianDay.julianDay(1999, 1, 1.0), 1e-9);
        assertEquals(2446895.5, JulianDay.julianDay(1987, 4, 10.0), 1e-9);
        assertEquals(2451603.5, JulianDay.julianDay(2000, 2, 29.0), 1e-9);
    }

    @Test
    void centuriesAndMillenniaAddDeltaT() {
        assertEquals(0.0, JulianDay.julianCenturiesUT(JulianDay.J2000), 1e-15);

        double jd = JulianDay.J2000 - 64.0 / 86400.0;
        assertEquals(0.0, JulianDay.julianCenturiesTT(jd, 64.0), 1e-12);
        assertEquals(0.0, JulianDay.julianMillenniaTT(jd, 64.0), 1e-12);

        double oneCentury = JulianDay.J2000 + 36525.0;
        assertEquals(1.0, JulianDay.julianCenturiesTT(oneCentury, 0.0), 1e-12);
        assertEquals(0.1, JulianDay.julianMillenniaTT(oneCentury, 0.0), 1e-12);
    }
}
