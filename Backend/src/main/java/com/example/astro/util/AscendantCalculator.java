package com.example.astro.util;

/**
 * 상승점(ASC) 계산
 * λ = atan2(-cos(LAST), sin(ε)·tan(φ) + cos(ε)·sin(LAST)) + 180°
 */
public class AscendantCalculator {

    /**
     * 상승점 황경 [0, 360)
     *
     * @param lastDegrees    지방 시항성시 (도)
     * @param trueObliquity  진 황도 경사각 (도)
     * @param latitude       관측 위도 (도)
     */
    public static double ascendantLongitude(double lastDegrees, double trueObliquity, double latitude) {
        double last = Math.toRadians(lastDegrees);
        double obliquity = Math.toRadians(trueObliquity);
        double phi = Math.toRadians(latitude);

        double y = -Math.cos(last);
        double x = Math.sin(obliquity) * Math.tan(phi) + Math.cos(obliquity) * Math.sin(last);

        // atan2 결과는 하강점 쪽이므로 180°를 더해 동쪽 지평선 교점을 선택
        return AngleMath.normalize(Math.toDegrees(Math.atan2(y, x)) + 180.0);
    }
}
