package com.example.astro.util;

import com.example.astro.model.CelestialBody;
import com.example.astro.model.CelestialPosition;
import com.example.astro.model.HeliocentricPosition;
import com.example.astro.util.vsop.Vsop87d;

/**
 * 태양 위치 계산 유틸리티 클래스
 * 지구 VSOP87D 일심 좌표 기반 (λ = L + 180°, β = -B)
 */
public class SunPositionCalculator {

    /** 연주 광행차 상수 (각초) */
    private static final double ABERRATION_CONSTANT = 20.4898;

    /**
     * 주어진 시각의 태양 지구 중심 황경/황위 계산 (장동 미적용)
     *
     * @param tau J2000.0 기준 TT 율리우스 천년
     * @param t   J2000.0 기준 TT 율리우스 세기
     */
    public static CelestialPosition calculate(double tau, double t) {
        return calculate(t, Vsop87d.earth(tau));
    }

    /**
     * 미리 계산된 지구 위치로 태양 위치 계산
     */
    public static CelestialPosition calculate(double t, HeliocentricPosition earth) {
        // 1. 지구 중심 기하학적 좌표
        double longitude = earth.getLongitude() + Math.PI;
        double latitude = -earth.getLatitude();

        // 2. FK5 좌표계 보정 (Meeus 25.9)
        double lp = Math.toDegrees(longitude) - 1.397 * t - 0.00031 * t * t;
        double fk5Longitude = AngleMath.arcsecondsToDegrees(-0.09033);
        double fk5Latitude = AngleMath.arcsecondsToDegrees(
                0.03916 * (AngleMath.cosDeg(lp) - AngleMath.sinDeg(lp)));
        longitude += Math.toRadians(fk5Longitude);
        latitude += Math.toRadians(fk5Latitude);

        // 3. 광행차 보정: -20.4898" / R
        double aberration = AngleMath.arcsecondsToDegrees(-ABERRATION_CONSTANT / earth.getRadius());
        longitude += Math.toRadians(aberration);

        double longitudeDegrees = AngleMath.normalize(Math.toDegrees(longitude));
        double latitudeDegrees = Math.toDegrees(latitude);

        return CelestialPosition.of(CelestialBody.SUN, longitudeDegrees, latitudeDegrees,
                ZodiacMapper.classify(longitudeDegrees));
    }
}
