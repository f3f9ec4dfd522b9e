package com.example.astro.util;

/**
 * ΔT = TT - UT (초) 계산
 * Espenak & Meeus (2006) 구간별 다항식, 1800~2100년
 */
public class DeltaT {

    private static final double MIN_YEAR = 1800.0;
    private static final double MAX_YEAR = 2100.0;

    private static final double[] COEFFS_1800_1860 = {
            13.72, -0.332447, 0.0068612, 0.0041116,
            -0.00037436, 0.0000121272, -0.0000001699, 0.000000000875
    };
    private static final double[] COEFFS_1860_1900 = {
            7.62, 0.5737, -0.251754, 0.01680668,
            -0.0004473624, 1.0 / 233174.0
    };
    private static final double[] COEFFS_1900_1920 = {
            -2.79, 1.494119, -0.0598939, 0.0061966, -0.000197
    };
    private static final double[] COEFFS_1920_1941 = {21.20, 0.84493, -0.076100, 0.0020936};
    private static final double[] COEFFS_1941_1961 = {29.07, 0.407, -1.0 / 233.0, 1.0 / 2547.0};
    private static final double[] COEFFS_1961_1986 = {45.45, 1.067, -1.0 / 260.0, -1.0 / 718.0};
    private static final double[] COEFFS_1986_2005 = {
            63.86, 0.3345, -0.060374, 0.0017275,
            0.000651814, 0.00002373599
    };
    private static final double[] COEFFS_2005_2050 = {62.92, 0.32217, 0.005589};

    /**
     * 소수 연도(decimal year)에 대한 ΔT(초)
     * 지원 범위를 벗어나면 가장 가까운 경계값을 사용
     */
    public static double deltaT(double decimalYear) {
        double y = decimalYear;
        if (y < MIN_YEAR) {
            y = MIN_YEAR;
        } else if (y > MAX_YEAR) {
            y = MAX_YEAR;
        }

        if (y < 1860) {
            return AngleMath.horner(y - 1800, COEFFS_1800_1860);
        }
        if (y < 1900) {
            return AngleMath.horner(y - 1860, COEFFS_1860_1900);
        }
        if (y < 1920) {
            return AngleMath.horner(y - 1900, COEFFS_1900_1920);
        }
        if (y < 1941) {
            return AngleMath.horner(y - 1920, COEFFS_1920_1941);
        }
        if (y < 1961) {
            return AngleMath.horner(y - 1950, COEFFS_1941_1961);
        }
        if (y < 1986) {
            return AngleMath.horner(y - 1975, COEFFS_1961_1986);
        }
        if (y < 2005) {
            return AngleMath.horner(y - 2000, COEFFS_1986_2005);
        }
        if (y < 2050) {
            return AngleMath.horner(y - 2000, COEFFS_2005_2050);
        }

        // 2050~2150 외삽식
        double u = (y - 1820.0) / 100.0;
        return -20.0 + 32.0 * u * u - 0.5628 * (2150.0 - y);
    }
}
