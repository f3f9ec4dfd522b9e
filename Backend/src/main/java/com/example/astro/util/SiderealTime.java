package com.example.astro.util;

/**
 * 항성시 계산 (Meeus 12장)
 */
public class SiderealTime {

    /**
     * 그리니치 평균 항성시 GMST (도)
     */
    public static double gmst(double jdUT) {
        double t = JulianDay.julianCenturiesUT(jdUT);
        double theta = 280.46061837
                + 360.98564736629 * (jdUT - JulianDay.J2000)
                + 0.000387933 * t * t
                - t * t * t / 38710000.0;
        return AngleMath.normalize(theta);
    }

    /**
     * 그리니치 시항성시 GAST = GMST + 분점차 (Δψ·cos ε)
     */
    public static double gast(double jdUT, double nutationLongitudeArcsec, double trueObliquity) {
        double equationOfEquinoxes = AngleMath.arcsecondsToDegrees(nutationLongitudeArcsec)
                * AngleMath.cosDeg(trueObliquity);
        return AngleMath.normalize(gmst(jdUT) + equationOfEquinoxes);
    }

    /**
     * 지방 시항성시 LAST (도), 경도는 동경 양수
     */
    public static double last(double jdUT, double longitude,
                              double nutationLongitudeArcsec, double trueObliquity) {
        return AngleMath.normalize(gast(jdUT, nutationLongitudeArcsec, trueObliquity) + longitude);
    }
}
