package com.example.astro.util;

import com.example.astro.model.CelestialBody;
import com.example.astro.model.CelestialPosition;
import com.example.astro.model.HeliocentricPosition;
import com.example.astro.util.vsop.Vsop87d;

/**
 * 행성 위치 계산 유틸리티 클래스
 * 일심 좌표 → 지구 중심 좌표 변환, 광시간(light-time) 보정 포함
 */
public class PlanetPositionCalculator {

    /** 빛이 1 AU를 지나는 데 걸리는 시간 (일) */
    private static final double LIGHT_TIME_DAYS_PER_AU = 0.0057755183;
    private static final double DAYS_PER_MILLENNIUM = 365250.0;
    /** 광시간 보정 반복 횟수 (고정) */
    private static final int LIGHT_TIME_ITERATIONS = 2;

    public static CelestialPosition calculate(CelestialBody body, double tau) {
        return calculate(body, tau, Vsop87d.earth(tau).toRectangular());
    }

    /**
     * 미리 계산된 지구 직교 좌표로 행성의 지구 중심 황경/황위 계산 (장동 미적용)
     *
     * @param earth 지구 일심 직교 좌표 {x, y, z}
     */
    public static CelestialPosition calculate(CelestialBody body, double tau, double[] earth) {
        if (!body.isPlanet()) {
            throw new IllegalArgumentException(body + " is not a planet");
        }

        HeliocentricPosition planet = Vsop87d.planet(body, tau);
        for (int i = 0; i < LIGHT_TIME_ITERATIONS; i++) {
            double distance = distance(planet.toRectangular(), earth);
            double lightTime = LIGHT_TIME_DAYS_PER_AU * distance / DAYS_PER_MILLENNIUM;
            planet = Vsop87d.planet(body, tau - lightTime);
        }

        double[] p = planet.toRectangular();
        double dx = p[0] - earth[0];
        double dy = p[1] - earth[1];
        double dz = p[2] - earth[2];
        double distance = Math.sqrt(dx * dx + dy * dy + dz * dz);

        double longitude = AngleMath.normalize(Math.toDegrees(Math.atan2(dy, dx)));
        double latitude = Math.toDegrees(Math.asin(dz / distance));

        return CelestialPosition.of(body, longitude, latitude, ZodiacMapper.classify(longitude));
    }

    private static double distance(double[] a, double[] b) {
        double dx = a[0] - b[0];
        double dy = a[1] - b[1];
        double dz = a[2] - b[2];
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }
}
