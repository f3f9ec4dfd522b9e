package com.example.astro.util;

/**
 * 황도 경사각 계산 (Laskar 1986, U = T/100 의 10차 다항식)
 */
public class Obliquity {

    /** 23°26'21.448" */
    private static final double J2000_MEAN_OBLIQUITY = 23.0 + 26.0 / 60.0 + 21.448 / 3600.0;

    // 각초 단위, U^0 항은 기준값에 포함
    private static final double[] COEFFICIENTS = {
            0.0, -4680.93, -1.55, 1999.25, -51.38,
            -249.67, -39.05, 7.12, 27.87, 5.79, 2.45
    };

    /**
     * 평균 황도 경사각 ε₀ (도)
     */
    public static double meanObliquity(double t) {
        double u = t / 100.0;
        return J2000_MEAN_OBLIQUITY + AngleMath.horner(u, COEFFICIENTS) / 3600.0;
    }

    /**
     * 진 황도 경사각 ε = ε₀ + Δε (도)
     *
     * @param deltaEpsilonArcsec 경사 장동 (각초)
     */
    public static double trueObliquity(double t, double deltaEpsilonArcsec) {
        return meanObliquity(t) + AngleMath.arcsecondsToDegrees(deltaEpsilonArcsec);
    }
}
