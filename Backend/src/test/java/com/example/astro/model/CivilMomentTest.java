package com.example.astro.model;

import com.example.astro.exception.AstroErrorType;
import com.example.astro.exception.AstroException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CivilMomentTest {

    @Test
    void validMomentKeepsCivilFields() {
        CivilMoment moment = CivilMoment.of(2000, 6, 15, 12, 30, 0, "America/New_York");
        assertEquals(2000, moment.getYear());
        assertEquals(6, moment.getMonth());
        assertEquals(15, moment.getDay());
        assertEquals("America/New_York", moment.getTimeZoneIdentifier());
    }

    @Test
    void j2000UtcHasJulianDay2451545() {
        CivilMoment moment = CivilMoment.of(2000, 1, 1, 12, 0, "UTC");
        assertEquals(2451545.0, moment.getJulianDayUT(), 1e-9);
        assertEquals(63.87, moment.getDeltaT(), 0.01);
        assertEquals(moment.getJulianCenturiesTT() / 10.0, moment.getJulianMillenniaTT(), 1e-15);
    }

    @Test
    void decimalYearUsesMidMonth() {
        CivilMoment moment = CivilMoment.of(2000, 7, 1, 0, 0, "UTC");
        assertEquals(2000.0 + 6.5 / 12.0, moment.getDecimalYear(), 1e-12);
    }

    @Test
    void convertsLocalTimeToUtc() {
        // 2000-01-01 19:00 EST = 2000-01-02 00:00 UTC
        CivilMoment moment = CivilMoment.of(2000, 1, 1, 19, 0, 0, "America/New_York");
        assertEquals(LocalDateTime.of(2000, 1, 2, 0, 0), moment.toUtcDateTime());

        CivilMoment mumbai = CivilMoment.of(2010, 4, 10, 6, 0, 0, "Asia/Kolkata");
        assertEquals(LocalDateTime.of(2010, 4, 10, 0, 30), mumbai.toUtcDateTime());
    }

    @Test
    void supportedYearBoundaries() {
        CivilMoment.of(1800, 1, 1, 0, 0, "UTC");
        CivilMoment.of(2100, 12, 31, 23, 59, 59, "UTC");
        assertError(AstroErrorType.UNSUPPORTED_YEAR_RANGE, () -> CivilMoment.of(1799, 12, 31, 0, 0, "UTC"));
        assertError(AstroErrorType.UNSUPPORTED_YEAR_RANGE, () -> CivilMoment.of(2101, 1, 1, 0, 0, "UTC"));
    }

    @Test
    void yearIsValidatedBeforeOtherFields() {
        assertError(AstroErrorType.UNSUPPORTED_YEAR_RANGE, () -> CivilMoment.of(1700, 13, 40, 25, 0, "Nowhere/Zone"));
    }

    @Test
    void leapYearRules() {
        CivilMoment.of(2000, 2, 29, 0, 0, "UTC");
        assertError(AstroErrorType.INVALID_CIVIL_MOMENT, () -> CivilMoment.of(2100, 2, 29, 0, 0, "UTC"));
        assertError(AstroErrorType.INVALID_CIVIL_MOMENT, () -> CivilMoment.of(1900, 2, 29, 0, 0, "UTC"));
    }

    @Test
    void rejectsOutOfRangeFields() {
        assertError(AstroErrorType.INVALID_CIVIL_MOMENT, () -> CivilMoment.of(2000, 0, 1, 0, 0, "UTC"));
        assertError(AstroErrorType.INVALID_CIVIL_MOMENT, () -> CivilMoment.of(2000, 4, 31, 0, 0, "UTC"));
        assertError(AstroErrorType.INVALID_CIVIL_MOMENT, () -> CivilMoment.of(2000, 1, 1, 24, 0, "UTC"));
        assertError(AstroErrorType.INVALID_CIVIL_MOMENT, () -> CivilMoment.of(2000, 1, 1, 0, 60, "UTC"));
        assertError(AstroErrorType.INVALID_CIVIL_MOMENT, () -> CivilMoment.of(2000, 1, 1, 0, 0, 60, "UTC"));
    }

    @Test
    void rejectsUnknownTimeZone() {
        assertError(AstroErrorType.INVALID_TIME_ZONE_IDENTIFIER, () -> CivilMoment.of(2000, 1, 1, 0, 0, "Invalid/Zone"));
        assertError(AstroErrorType.INVALID_TIME_ZONE_IDENTIFIER, () -> CivilMoment.of(2000, 1, 1, 0, 0, ""));
    }

    @Test
    void rejectsLocalTimeInDaylightSavingGap() {
        // 2021-03-14 02:00 → 03:00 (America/New_York)
        AstroException e = assertError(AstroErrorType.INVALID_CIVIL_MOMENT,
                () -> CivilMoment.of(2021, 3, 14, 2, 30, 0, "America/New_York"));
        assertTrue(e.getMessage().contains("America/New_York"));
    }

    @Test
    void ambiguousFallBackTimeUsesEarlierOffset() {
        // 2021-11-07 01:30 은 EDT/EST 두 번 존재, 앞선 EDT(-4) 적용
        CivilMoment moment = CivilMoment.of(2021, 11, 7, 1, 30, 0, "America/New_York");
        assertEquals(LocalDateTime.of(2021, 11, 7, 5, 30), moment.toUtcDateTime());
    }

    @Test
    void equalityUsesCivilFieldsOnly() {
        CivilMoment a = CivilMoment.of(1990, 8, 15, 14, 30, 0, "America/New_York");
        CivilMoment b = CivilMoment.of(1990, 8, 15, 14, 30, "America/New_York");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, CivilMoment.of(1990, 8, 15, 14, 30, 0, "UTC"));
    }

    @Test
    void jsonRoundTripGoesThroughValidation() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        CivilMoment moment = CivilMoment.of(1985, 6, 15, 8, 0, 0, "Asia/Tokyo");

        String json = mapper.writeValueAsString(moment);
        assertEquals("{\"year\":1985,\"month\":6,\"day\":15,\"hour\":8,\"minute\":0,\"second\":0,"
                + "\"timeZoneIdentifier\":\"Asia/Tokyo\"}", json);
        CivilMoment parsed = mapper.readValue(json, CivilMoment.class);
        assertEquals(moment, parsed);
        assertEquals(moment.getJulianDayUT(), parsed.getJulianDayUT());

        String invalid = json.replace("1985", "1799");
        JsonMappingException e = assertThrows(JsonMappingException.class,
                () -> mapper.readValue(invalid, CivilMoment.class));
        assertInstanceOf(AstroException.class, e.getCause());
    }

    private static AstroException assertError(AstroErrorType type, Executable executable) {
        AstroException e = assertThrows(AstroException.class, executable);
        assertEquals(type, e.getType());
        return e;
    }
}
