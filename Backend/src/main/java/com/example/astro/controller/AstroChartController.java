package com.example.astro.controller;

import com.example.astro.exception.AstroException;
import com.example.astro.model.AscendantResult;
import com.example.astro.model.CelestialBody;
import com.example.astro.model.CelestialPosition;
import com.example.astro.model.CivilMoment;
import com.example.astro.model.GeoCoordinate;
import com.example.astro.model.NatalPositions;
import com.example.astro.service.AstroCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

@RestController
@RequestMapping("/api/astro")
public class AstroChartController {

    private static final Logger logger = LoggerFactory.getLogger(AstroChartController.class);

    private final AstroCalculator astroCalculator;

    @Value("${astro.default-time-zone:UTC}")
    private String defaultTimeZone;

    @Value("${astro.default-bodies:SUN,MOON,MERCURY,VENUS,MARS,JUPITER,SATURN}")
    private String defaultBodies;

    public AstroChartController(AstroCalculator astroCalculator) {
        this.astroCalculator = astroCalculator;
    }

    /**
     * 태양 위치 API
     */
    @GetMapping("/sun")
    public ResponseEntity<?> getSunPosition(
            @RequestParam int year, @RequestParam int month, @RequestParam int day,
            @RequestParam int hour, @RequestParam int minute,
            @RequestParam(required = false, defaultValue = "0") int second,
            @RequestParam(required = false) String timeZone) {

        return execute("태양 위치", () ->
                astroCalculator.sunPosition(moment(year, month, day, hour, minute, second, timeZone)));
    }

    /**
     * 달 위치 API
     */
    @GetMapping("/moon")
    public ResponseEntity<?> getMoonPosition(
            @RequestParam int year, @RequestParam int month, @RequestParam int day,
            @RequestParam int hour, @RequestParam int minute,
            @RequestParam(required = false, defaultValue = "0") int second,
            @RequestParam(required = false) String timeZone) {

        return execute("달 위치", () ->
                astroCalculator.moonPosition(moment(year, month, day, hour, minute, second, timeZone)));
    }

    /**
     * 천체별 위치 API (sun, moon, mercury ... saturn)
     */
    @GetMapping("/planets/{body}")
    public ResponseEntity<?> getPlanetPosition(
            @PathVariable String body,
            @RequestParam int year, @RequestParam int month, @RequestParam int day,
            @RequestParam int hour, @RequestParam int minute,
            @RequestParam(required = false, defaultValue = "0") int second,
            @RequestParam(required = false) String timeZone) {

        return execute(body + " 위치", () -> {
            CelestialBody celestialBody = parseBody(body);
            CivilMoment moment = moment(year, month, day, hour, minute, second, timeZone);
            CelestialPosition position = astroCalculator.planetPosition(celestialBody, moment);
            return position;
        });
    }

    /**
     * 상승점 API
     */
    @GetMapping("/ascendant")
    public ResponseEntity<?> getAscendant(
            @RequestParam int year, @RequestParam int month, @RequestParam int day,
            @RequestParam int hour, @RequestParam int minute,
            @RequestParam(required = false, defaultValue = "0") int second,
            @RequestParam(required = false) String timeZone,
            @RequestParam double latitude,
            @RequestParam double longitude) {

        return execute("상승점", () -> {
            CivilMoment moment = moment(year, month, day, hour, minute, second, timeZone);
            AscendantResult result = astroCalculator.ascendant(moment, GeoCoordinate.of(latitude, longitude));
            return result;
        });
    }

    /**
     * 출생 차트 일괄 계산 API
     */
    @GetMapping("/natal")
    public ResponseEntity<?> getNatalPositions(
            @RequestParam int year, @RequestParam int month, @RequestParam int day,
            @RequestParam int hour, @RequestParam int minute,
            @RequestParam(required = false, defaultValue = "0") int second,
            @RequestParam(required = false) String timeZone,
            @RequestParam(required = false) Double latitude,
            @RequestParam(required = false) Double longitude,
            @RequestParam(required = false) String bodies,
            @RequestParam(required = false, defaultValue = "false") boolean includeAscendant) {

        return execute("출생 차트", () -> {
            CivilMoment moment = moment(year, month, day, hour, minute, second, timeZone);
            if ((latitude == null) != (longitude == null)) {
                throw new IllegalArgumentException("latitude and longitude must be given together");
            }
            GeoCoordinate coordinate = latitude != null
                    ? GeoCoordinate.of(latitude, longitude)
                    : null;
            List<CelestialBody> requested = parseBodies(bodies != null ? bodies : defaultBodies);

            logger.debug("출생 차트 요청: 시각={}, 천체={}, 상승점={}", moment, requested, includeAscendant);
            NatalPositions natal = astroCalculator.natalPositions(moment, coordinate, requested, includeAscendant);
            return natal;
        });
    }

    /**
     * 율리우스 일 및 지방 시항성시 API
     */
    @GetMapping("/sidereal-time")
    public ResponseEntity<?> getSiderealTime(
            @RequestParam int year, @RequestParam int month, @RequestParam int day,
            @RequestParam int hour, @RequestParam int minute,
            @RequestParam(required = false, defaultValue = "0") int second,
            @RequestParam(required = false) String timeZone,
            @RequestParam double longitude) {

        return execute("항성시", () -> {
            CivilMoment moment = moment(year, month, day, hour, minute, second, timeZone);
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("julianDayUT", astroCalculator.julianDayUT(moment));
            response.put("localSiderealTimeDegrees", astroCalculator.localSiderealTimeDegrees(moment, longitude));
            return response;
        });
    }

    private ResponseEntity<?> execute(String description, Supplier<Object> action) {
        try {
            Object result = action.get();
            logger.info("{} 계산 응답 완료", description);
            return ResponseEntity.ok(result);
        } catch (AstroException e) {
            logger.warn("{} 요청 입력 오류: {} ({})", description, e.getMessage(), e.getType());
            return ResponseEntity.badRequest().body(errorBody("입력값이 올바르지 않습니다", e.getType().name(), e.getMessage()));
        } catch (IllegalArgumentException e) {
            logger.warn("{} 요청 파라미터 오류: {}", description, e.getMessage());
            return ResponseEntity.badRequest().body(errorBody("잘못된 요청입니다", "INVALID_ARGUMENT", e.getMessage()));
        } catch (Exception e) {
            logger.error("{} 계산 처리 오류", description, e);
            return ResponseEntity.internalServerError().body(errorBody("계산 중 오류가 발생했습니다", "INTERNAL_ERROR", e.getMessage()));
        }
    }

    private Map<String, Object> errorBody(String error, String type, String message) {
        Map<String, Object> errorResponse = new LinkedHashMap<>();
        errorResponse.put("error", error);
        errorResponse.put("type", type);
        errorResponse.put("message", message);
        return errorResponse;
    }

    private CivilMoment moment(int year, int month, int day, int hour, int minute, int second, String timeZone) {
        String zone = (timeZone == null || timeZone.isBlank()) ? defaultTimeZone : timeZone;
        return CivilMoment.of(year, month, day, hour, minute, second, zone);
    }

    private static CelestialBody parseBody(String name) {
        try {
            return CelestialBody.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown celestial body: " + name, e);
        }
    }

    private static List<CelestialBody> parseBodies(String csv) {
        List<CelestialBody> result = new ArrayList<>();
        for (String name : csv.split(",")) {
            if (!name.isBlank()) {
                result.add(parseBody(name));
            }
        }
        return result;
    }
}
