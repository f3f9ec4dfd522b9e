package com.example.astro.util;

import com.example.astro.model.ZodiacPlacement;
import com.example.astro.model.ZodiacSign;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ZodiacMapperTest {

    @Test
    void signsByLongitude() {
        assertEquals(ZodiacSign.ARIES, ZodiacMapper.sign(0.0));
        assertEquals(ZodiacSign.TAURUS, ZodiacMapper.sign(45.0));
        assertEquals(ZodiacSign.PISCES, ZodiacMapper.sign(350.0));
        assertEquals(ZodiacSign.CAPRICORN, ZodiacMapper.sign(280.369));
        assertEquals(ZodiacSign.SCORPIO, ZodiacMapper.sign(223.32));
    }

    @Test
    void intervalsAreHalfOpen() {
        assertEquals(ZodiacSign.TAURUS, ZodiacMapper.sign(30.0));
        assertEquals(ZodiacSign.ARIES, ZodiacMapper.sign(29.999));
        assertEquals(ZodiacSign.PISCES, ZodiacMapper.sign(359.999));
        assertEquals(ZodiacSign.ARIES, ZodiacMapper.sign(360.0));
    }

    @Test
    void degreeInSign() {
        assertEquals(15.5, ZodiacMapper.degreeInSign(45.5), 1e-9);
        assertEquals(0.0, ZodiacMapper.degreeInSign(30.0), 1e-12);
    }

    @Test
    void boundaryFlagWithinHalfDegreeOfCusp() {
        assertTrue(ZodiacMapper.isBoundaryCase(29.8));
        assertTrue(ZodiacMapper.isBoundaryCase(30.3));
        assertTrue(ZodiacMapper.isBoundaryCase(0.5));
        assertTrue(ZodiacMapper.isBoundaryCase(59.5));
        assertFalse(ZodiacMapper.isBoundaryCase(15.0));
        assertFalse(ZodiacMapper.isBoundaryCase(30.6));
    }

    @Test
    void classificationIsPeriodic() {
        for (double longitude = 0.0; longitude < 360.0; longitude += 7.3) {
            ZodiacPlacement base = ZodiacMapper.classify(longitude);
            assertEquals(base.getSign(), ZodiacMapper.classify(longitude + 360.0).getSign());
            assertEquals(base.getSign(), ZodiacMapper.classify(longitude - 720.0).getSign());
            assertTrue(base.getDegreeInSign() >= 0.0 && base.getDegreeInSign() < 30.0);
        }
    }

    @Test
    void rejectsNonFiniteLongitude() {
        assertThrows(IllegalArgumentException.class, () -> ZodiacMapper.classify(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> ZodiacMapper.classify(Double.POSITIVE_INFINITY));
    }

    @Test
    void signContainsUsesSameIntervals() {
        assertTrue(ZodiacSign.PISCES.contains(359.9));
        assertFalse(ZodiacSign.PISCES.contains(0.0));
        assertTrue(ZodiacSign.ARIES.contains(360.0));
        assertTrue(ZodiacSign.TAURUS.contains(30.0));
        assertFalse(ZodiacSign.ARIES.contains(30.0));
        assertEquals(330.0, ZodiacSign.PISCES.startLongitude());
        assertEquals(ZodiacSign.ARIES, ZodiacSign.fromIndex(12));
        assertEquals("Capricorn", ZodiacSign.CAPRICORN.getDisplayName());
    }
}
