package com.example.astro.controller;

import com.example.astro.service.AstroCalculator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.closeTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AstroChartController.class)
@Import(AstroCalculator.class)
public class AstroChartControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void sunPosition() throws Exception {
        mockMvc.perform(get("/api/astro/sun")
                        .param("year", "2000").param("month", "1").param("day", "1")
                        .param("hour", "12").param("minute", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.body").value("SUN"))
                .andExpect(jsonPath("$.sign").value("CAPRICORN"))
                .andExpect(jsonPath("$.longitude", closeTo(280.3688, 1e-3)));
    }

    @Test
    void planetPathIsCaseInsensitive() throws Exception {
        mockMvc.perform(get("/api/astro/planets/mars")
                        .param("year", "1990").param("month", "8").param("day", "15")
                        .param("hour", "14").param("minute", "30")
                        .param("timeZone", "America/New_York"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.body").value("MARS"))
                .andExpect(jsonPath("$.longitude", closeTo(51.5406, 1e-3)));
    }

    @Test
    void unknownBodyIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/astro/planets/pluto")
                        .param("year", "2000").param("month", "1").param("day", "1")
                        .param("hour", "12").param("minute", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("INVALID_ARGUMENT"));
    }

    @Test
    void unsupportedYearIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/astro/moon")
                        .param("year", "1799").param("month", "1").param("day", "1")
                        .param("hour", "12").param("minute", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("UNSUPPORTED_YEAR_RANGE"));
    }

    @Test
    void ascendant() throws Exception {
        mockMvc.perform(get("/api/astro/ascendant")
                        .param("year", "1990").param("month", "8").param("day", "15")
                        .param("hour", "14").param("minute", "30")
                        .param("timeZone", "America/New_York")
                        .param("latitude", "40.7128").param("longitude", "-74.0060"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sign").value("SAGITTARIUS"))
                .andExpect(jsonPath("$.eclipticLongitude", closeTo(240.930, 1e-3)));
    }

    @Test
    void extremeLatitudeIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/astro/ascendant")
                        .param("year", "2000").param("month", "1").param("day", "1")
                        .param("hour", "12").param("minute", "0")
                        .param("latitude", "85.1").param("longitude", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("EXTREME_LATITUDE"));
    }

    @Test
    void natalDefaultsToAllBodies() throws Exception {
        mockMvc.perform(get("/api/astro/natal")
                        .param("year", "1990").param("month", "8").param("day", "15")
                        .param("hour", "14").param("minute", "30")
                        .param("timeZone", "America/New_York"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bodies.SUN.sign").value("LEO"))
                .andExpect(jsonPath("$.bodies.SATURN").exists())
                .andExpect(jsonPath("$.ascendant").doesNotExist());
    }

    @Test
    void natalAscendantWithoutCoordinateIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/astro/natal")
                        .param("year", "1990").param("month", "8").param("day", "15")
                        .param("hour", "14").param("minute", "30")
                        .param("bodies", "sun,moon")
                        .param("includeAscendant", "true"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("MISSING_COORDINATE_FOR_ASCENDANT"));
    }

    @Test
    void natalWithHalfCoordinateIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/astro/natal")
                        .param("year", "1990").param("month", "8").param("day", "15")
                        .param("hour", "14").param("minute", "30")
                        .param("latitude", "40.7128"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("INVALID_ARGUMENT"));

        mockMvc.perform(get("/api/astro/natal")
                        .param("year", "1990").param("month", "8").param("day", "15")
                        .param("hour", "14").param("minute", "30")
                        .param("longitude", "-74.0060"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("INVALID_ARGUMENT"));
    }

    @Test
    void siderealTime() throws Exception {
        mockMvc.perform(get("/api/astro/sidereal-time")
                        .param("year", "2000").param("month", "1").param("day", "1")
                        .param("hour", "12").param("minute", "0")
                        .param("longitude", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.julianDayUT", closeTo(2451545.0, 1e-9)))
                .andExpect(jsonPath("$.localSiderealTimeDegrees", closeTo(280.4571, 1e-3)));
    }
}
