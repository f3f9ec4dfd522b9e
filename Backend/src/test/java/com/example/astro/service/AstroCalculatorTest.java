package com.example.astro.service;

import com.example.astro.exception.AstroErrorType;
import com.example.astro.exception.AstroException;
import com.example.astro.model.AscendantResult;
import com.example.astro.model.CelestialBody;
import com.example.astro.model.CelestialPosition;
import com.example.astro.model.CivilMoment;
import com.example.astro.model.GeoCoordinate;
import com.example.astro.model.NatalPositions;
import com.example.astro.model.ZodiacSign;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AstroCalculatorTest {

    private static final GeoCoordinate NEW_YORK = GeoCoordinate.of(40.7128, -74.0060);
    private static final CivilMoment NEW_YORK_1990 = CivilMoment.of(1990, 8, 15, 14, 30, 0, "America/New_York");

    private final AstroCalculator calculator = new AstroCalculator();

    @Test
    void newYorkAscendant() {
        AscendantResult asc = calculator.ascendant(NEW_YORK_1990, NEW_YORK);
        assertEquals(240.9300, asc.getEclipticLongitude(), 1e-3);
        assertEquals(ZodiacSign.SAGITTARIUS, asc.getSign());
        assertEquals(0.9300, asc.getDegreeInSign(), 1e-3);
        assertFalse(asc.isBoundaryCase());
        assertEquals(167.3974, asc.getLocalSiderealTimeDegrees(), 1e-3);
        assertEquals(23.442044, asc.getTrueObliquity(), 1e-5);
        assertEquals(2448119.2708333, asc.getJulianDayUT(), 1e-6);
    }

    @Test
    void ascendantAcrossTimeZones() {
        assertAscendant(240.930, CivilMoment.of(1990, 8, 15, 14, 30, 0, "America/New_York"), 40.7128, -74.0060);
        assertAscendant(186.937, CivilMoment.of(2000, 1, 1, 0, 0, 0, "Europe/London"), 51.5074, -0.1278);
        assertAscendant(128.914, CivilMoment.of(1985, 6, 15, 8, 0, 0, "Asia/Tokyo"), 35.6762, 139.6503);
        assertAscendant(277.542, CivilMoment.of(1975, 9, 20, 15, 0, 0, "Europe/Berlin"), 52.52, 13.405);
    }

    @Test
    void fractionalOffsetAndWesternZone() {
        AscendantResult mumbai = calculator.ascendant(
                CivilMoment.of(2010, 4, 10, 6, 0, 0, "Asia/Kolkata"), GeoCoordinate.of(19.076, 72.8777));
        assertEquals(10.8925, mumbai.getEclipticLongitude(), 1e-3);
        assertEquals(ZodiacSign.ARIES, mumbai.getSign());

        AscendantResult losAngeles = calculator.ascendant(
                CivilMoment.of(2020, 1, 1, 0, 0, 0, "America/Los_Angeles"), GeoCoordinate.of(34.0522, -118.2437));
        assertEquals(190.2784, losAngeles.getEclipticLongitude(), 1e-3);
        assertEquals(ZodiacSign.LIBRA, losAngeles.getSign());
    }

    @Test
    void equatorAtJ2000() {
        CivilMoment j2000 = CivilMoment.of(2000, 1, 1, 12, 0, 0, "UTC");
        AscendantResult asc = calculator.ascendant(j2000, GeoCoordinate.of(0.0, 0.0));
        assertEquals(11.3739, asc.getEclipticLongitude(), 1e-3);
        assertEquals(ZodiacSign.ARIES, asc.getSign());

        double last = calculator.localSiderealTimeDegrees(j2000, 0.0);
        assertTrue(last > 280.0 && last < 281.0, "LAST=" + last);
        assertEquals(280.4571, last, 1e-3);
        assertEquals(2451545.0, calculator.julianDayUT(j2000), 1e-9);
    }

    @Test
    void ascendantLatitudeLimit() {
        CivilMoment j2000 = CivilMoment.of(2000, 1, 1, 12, 0, 0, "UTC");
        AscendantResult nearPole = calculator.ascendant(j2000, GeoCoordinate.of(84.9, 0.0));
        assertEquals(177.0769, nearPole.getEclipticLongitude(), 1e-2);

        AstroException e = assertThrows(AstroException.class,
                () -> calculator.ascendant(j2000, GeoCoordinate.of(85.1, 0.0)));
        assertEquals(AstroErrorType.EXTREME_LATITUDE, e.getType());
    }

    @Test
    void ascendantWithoutCoordinate() {
        AstroException e = assertThrows(AstroException.class, () -> calculator.ascendant(NEW_YORK_1990, null));
        assertEquals(AstroErrorType.MISSING_COORDINATE_FOR_ASCENDANT, e.getType());
    }

    @Test
    void sunAtJ2000() {
        CelestialPosition sun = calculator.sunPosition(CivilMoment.of(2000, 1, 1, 12, 0, 0, "UTC"));
        assertEquals(CelestialBody.SUN, sun.getBody());
        assertEquals(280.3688, sun.getLongitude(), 1e-3);
        assertEquals(ZodiacSign.CAPRICORN, sun.getSign());
        assertTrue(Math.abs(sun.getLatitude()) < 0.001);
    }

    @Test
    void j2000Positions() {
        NatalPositions natal = calculator.natalPositions(CivilMoment.of(2000, 1, 1, 12, 0, 0, "UTC"), null,
                Arrays.asList(CelestialBody.values()), false);

        assertEquals(280.3688, natal.get(CelestialBody.SUN).getLongitude(), 1e-3);
        assertEquals(223.3237, natal.get(CelestialBody.MOON).getLongitude(), 1e-3);
        assertEquals(5.1711, natal.get(CelestialBody.MOON).getLatitude(), 1e-3);
        assertEquals(ZodiacSign.SCORPIO, natal.get(CelestialBody.MOON).getSign());
        assertEquals(271.8949, natal.get(CelestialBody.MERCURY).getLongitude(), 1e-3);
        assertEquals(241.5702, natal.get(CelestialBody.VENUS).getLongitude(), 1e-3);
        assertEquals(327.9673, natal.get(CelestialBody.MARS).getLongitude(), 1e-3);
        assertEquals(25.2517, natal.get(CelestialBody.JUPITER).getLongitude(), 1e-3);
        assertEquals(40.3928, natal.get(CelestialBody.SATURN).getLongitude(), 1e-3);
        assertEquals(2451545.0, natal.getJulianDayUT(), 1e-9);
    }

    @Test
    void sunSignsAtRangeEdges() {
        assertEquals(84.041, calculator.sunPosition(CivilMoment.of(1800, 6, 15, 12, 0, "UTC")).getLongitude(), 1e-2);
        assertEquals(84.529, calculator.sunPosition(CivilMoment.of(2100, 6, 15, 12, 0, "UTC")).getLongitude(), 1e-2);
        assertEquals(ZodiacSign.GEMINI, calculator.sunPosition(CivilMoment.of(1800, 6, 15, 12, 0, "UTC")).getSign());
        assertEquals(ZodiacSign.GEMINI, calculator.sunPosition(CivilMoment.of(2100, 6, 15, 12, 0, "UTC")).getSign());
        assertEquals(ZodiacSign.CAPRICORN, calculator.sunPosition(CivilMoment.of(1950, 1, 1, 12, 0, "UTC")).getSign());
    }

    @Test
    void sunThroughPlanetPositionMatchesSunPosition() {
        CelestialPosition viaPlanet = calculator.planetPosition(CelestialBody.SUN, NEW_YORK_1990);
        CelestialPosition direct = calculator.sunPosition(NEW_YORK_1990);
        assertEquals(direct, viaPlanet);
        assertEquals(calculator.moonPosition(NEW_YORK_1990), calculator.planetPosition(CelestialBody.MOON, NEW_YORK_1990));
    }

    @Test
    void newYorkChartPositions() {
        NatalPositions natal = calculator.natalPositions(NEW_YORK_1990, NEW_YORK,
                EnumSet.range(CelestialBody.SUN, CelestialBody.SATURN), true);

        assertEquals(142.6657, natal.get(CelestialBody.SUN).getLongitude(), 1e-3);
        assertEquals(ZodiacSign.LEO, natal.get(CelestialBody.SUN).getSign());
        assertEquals(80.6815, natal.get(CelestialBody.MOON).getLongitude(), 1e-3);
        assertEquals(3.8288, natal.get(CelestialBody.MOON).getLatitude(), 1e-3);
        assertEquals(169.6090, natal.get(CelestialBody.MERCURY).getLongitude(), 1e-3);
        assertEquals(122.2650, natal.get(CelestialBody.VENUS).getLongitude(), 1e-3);
        assertEquals(51.5406, natal.get(CelestialBody.MARS).getLongitude(), 1e-3);
        assertEquals(119.4628, natal.get(CelestialBody.JUPITER).getLongitude(), 1e-3);
        assertEquals(289.8419, natal.get(CelestialBody.SATURN).getLongitude(), 1e-3);

        assertEquals(57.31, natal.getDeltaT(), 0.01);
        assertEquals(240.9300, natal.findAscendant().orElseThrow().getEclipticLongitude(), 1e-3);
    }

    @Test
    void historicalChartUsesLocalMeanTime() {
        // 1879-03-14 11:30 베를린 (LMT +0:53:28)
        CivilMoment moment = CivilMoment.of(1879, 3, 14, 11, 30, 0, "Europe/Berlin");
        NatalPositions natal = calculator.natalPositions(moment, GeoCoordinate.of(48.4, 10.0),
                Arrays.asList(CelestialBody.values()), true);

        assertEquals(7, natal.getBodies().size());
        assertEquals(353.498, natal.get(CelestialBody.SUN).getLongitude(), 1e-2);
        assertEquals(ZodiacSign.PISCES, natal.get(CelestialBody.SUN).getSign());
        assertNotNull(natal.getAscendant());
    }

    @Test
    void batchMatchesSingleCalculations() {
        NatalPositions natal = calculator.natalPositions(NEW_YORK_1990, NEW_YORK,
                Arrays.asList(CelestialBody.values()), true);

        for (CelestialBody body : CelestialBody.values()) {
            assertEquals(calculator.planetPosition(body, NEW_YORK_1990), natal.get(body), body.name());
        }
        assertEquals(calculator.ascendant(NEW_YORK_1990, NEW_YORK), natal.getAscendant());
    }

    @Test
    void duplicateBodiesAreComputedOnce() {
        List<CelestialBody> bodies = Arrays.asList(CelestialBody.MARS, CelestialBody.SUN, CelestialBody.MARS);
        NatalPositions natal = calculator.natalPositions(NEW_YORK_1990, null, bodies, false);

        assertEquals(2, natal.getBodies().size());
        assertEquals(EnumSet.of(CelestialBody.SUN, CelestialBody.MARS), natal.getBodies().keySet());
        assertNull(natal.getAscendant());
        assertFalse(natal.findAscendant().isPresent());
    }

    @Test
    void nullBodiesMeansNoBodies() {
        NatalPositions natal = calculator.natalPositions(NEW_YORK_1990, NEW_YORK, null, true);
        assertTrue(natal.getBodies().isEmpty());
        assertEquals(calculator.ascendant(NEW_YORK_1990, NEW_YORK), natal.getAscendant());

        NatalPositions empty = calculator.natalPositions(NEW_YORK_1990, null, null, false);
        assertTrue(empty.getBodies().isEmpty());
        assertNull(empty.getAscendant());
    }

    @Test
    void ascendantOnlyChart() {
        NatalPositions natal = calculator.natalPositions(NEW_YORK_1990, NEW_YORK, Collections.emptyList(), true);
        assertTrue(natal.getBodies().isEmpty());
        assertTrue(natal.findAscendant().isPresent());
    }

    @Test
    void natalAscendantRequiresCoordinate() {
        AstroException e = assertThrows(AstroException.class, () -> calculator.natalPositions(
                NEW_YORK_1990, null, EnumSet.of(CelestialBody.SUN), true));
        assertEquals(AstroErrorType.MISSING_COORDINATE_FOR_ASCENDANT, e.getType());
    }

    @Test
    void extremeLatitudeFailsWholeBatch() {
        AstroException e = assertThrows(AstroException.class, () -> calculator.natalPositions(
                NEW_YORK_1990, GeoCoordinate.of(-89.0, 0.0), EnumSet.of(CelestialBody.SUN), true));
        assertEquals(AstroErrorType.EXTREME_LATITUDE, e.getType());

        // 상승점을 요청하지 않으면 극지 좌표도 허용
        NatalPositions natal = calculator.natalPositions(
                NEW_YORK_1990, GeoCoordinate.of(-89.0, 0.0), EnumSet.of(CelestialBody.SUN), false);
        assertEquals(1, natal.getBodies().size());
    }

    private void assertAscendant(double expected, CivilMoment moment, double latitude, double longitude) {
        AscendantResult asc = calculator.ascendant(moment, GeoCoordinate.of(latitude, longitude));
        assertEquals(expected, asc.getEclipticLongitude(), 1e-2, moment.toString());
    }
}
