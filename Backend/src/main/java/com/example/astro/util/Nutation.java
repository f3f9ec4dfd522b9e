package com.example.astro.util;

import com.example.astro.model.NutationAngles;

/**
 * 장동(nutation) 계산, IAU 1980 이론 63항 전체 (Meeus 표 22.A)
 */
public class Nutation {

    /**
     * 열: D, M, M', F, Ω, S, S', C, C'
     * S/C 단위는 0.0001", S'/C'은 세기당 0.00001" (0.1 배율)
     */
    private static final int[][] TERMS = {
            { 0,  0,  0,  0,  1, -171996, -1742,  92025,  89},
            {-2,  0,  0,  2,  2,  -13187,   -16,   5736, -31},
            { 0,  0,  0,  2,  2,   -2274,    -2,    977,  -5},
            { 0,  0,  0,  0,  2,    2062,     2,   -895,   5},
            { 0,  1,  0,  0,  0,    1426,   -34,     54,  -1},
            { 0,  0,  1,  0,  0,     712,     1,     -7,   0},
            {-2,  1,  0,  2,  2,    -517,    12,    224,  -6},
            { 0,  0,  0,  2,  1,    -386,    -4,    200,   0},
            { 0,  0,  1,  2,  2,    -301,     0,    129,  -1},
            {-2, -1,  0,  2,  2,     217,    -5,    -95,   3},
            {-2,  0,  1,  0,  0,    -158,     0,      0,   0},
            {-2,  0,  0,  2,  1,     129,     1,    -70,   0},
            { 0,  0, -1,  2,  2,     123,     0,    -53,   0},
            { 2,  0,  0,  0,  0,      63,     0,      0,   0},
            { 0,  0,  1,  0,  1,      63,     1,    -33,   0},
            { 2,  0, -1,  2,  2,     -59,     0,     26,   0},
            { 0,  0, -1,  0,  1,     -58,    -1,     32,   0},
            { 0,  0,  1,  2,  1,     -51,     0,     27,   0},
            {-2,  0,  2,  0,  0,      48,     0,      0,   0},
            { 0,  0, -2,  2,  1,      46,     0,    -24,   0},
            { 2,  0,  0,  2,  2,     -38,     0,     16,   0},
            { 0,  0,  2,  2,  2,     -31,     0,     13,   0},
            { 0,  0,  2,  0,  0,      29,     0,      0,   0},
            {-2,  0,  1,  2,  2,      29,     0,    -12,   0},
            { 0,  0,  0,  2,  0,      26,     0,      0,   0},
            {-2,  0,  0,  2,  0,     -22,     0,      0,   0},
            { 0,  0, -1,  2,  1,      21,     0,    -10,   0},
            { 0,  2,  0,  0,  0,      17,    -1,      0,   0},
            { 2,  0, -1,  0,  1,      16,     0,     -8,   0},
            {-2,  2,  0,  2,  2,     -16,     1,      7,   0},
            { 0,  1,  0,  0,  1,     -15,     0,      9,   0},
            {-2,  0,  1,  0,  1,     -13,     0,      7,   0},
            { 0, -1,  0,  0,  1,     -12,     0,      6,   0},
            { 0,  0,  2, -2,  0,      11,     0,      0,   0},
            { 2,  0, -1,  2,  1,     -10,     0,      5,   0},
            { 2,  0,  1,  2,  2,      -8,     0,      3,   0},
            { 0,  1,  0,  2,  2,       7,     0,     -3,   0},
            {-2,  1,  1,  0,  0,      -7,     0,      0,   0},
            { 0, -1,  0,  2,  2,      -7,     0,      3,   0},
            { 2,  0,  0,  2,  1,      -7,     0,      3,   0},
            { 2,  0,  1,  0,  0,      -6,     0,      0,   0},
            {-2,  0,  2,  2,  2,      -6,     0,      3,   0},
            {-2,  0,  1,  2,  1,       6,     0,     -3,   0},
            { 2,  0, -2,  0,  1,      -6,     0,      3,   0},
            { 2,  0,  0,  0,  1,      -5,     0,      3,   0},
            { 0, -1,  1,  0,  0,      -5,     0,      0,   0},
            {-2, -1,  0,  2,  1,      -5,     0,      3,   0},
            {-2,  0,  0,  0,  1,       4,     0,      0,   0},
            { 0,  0,  2,  2,  1,       4,     0,     -2,   0},
            {-2,  0,  2,  0,  1,       4,     0,     -2,   0},
            {-2,  1,  0,  2,  1,      -4,     0,      2,   0},
            { 0,  0,  1, -2,  0,       4,     0,      0,   0},
            {-1,  0,  1,  0,  0,      -4,     0,      0,   0},
            {-2,  1,  0,  0,  0,      -3,     0,      0,   0},
            { 1,  0,  0,  0,  0,       3,     0,      0,   0},
            { 0,  0,  1,  2,  0,      -3,     0,      0,   0},
            { 0,  0, -2,  2,  2,      -3,     0,      1,   0},
            {-1, -1,  1,  0,  0,      -3,     0,      0,   0},
            { 0,  1,  1,  0,  0,      -3,     0,      0,   0},
            { 0, -1,  1,  2,  2,      -3,     0,      1,   0},
            { 2, -1, -1,  2,  2,      -3,     0,      1,   0},
            { 0,  0,  3,  2,  2,      -3,     0,      1,   0},
            { 2, -1,  0,  2,  2,      -3,     0,      1,   0},
    };

    /**
     * 황경 장동 Δψ, 경사 장동 Δε 계산 (각초)
     *
     * @param t J2000.0 기준 TT 율리우스 세기
     */
    public static NutationAngles compute(double t) {
        double t2 = t * t;
        double t3 = t2 * t;

        // 달의 평균 이각
        double d = AngleMath.normalize(297.85036 + 445267.111480 * t - 0.0019142 * t2 + t3 / 189474.0);
        // 태양 평균 근점이각
        double m = AngleMath.normalize(357.52772 + 35999.050340 * t - 0.0001603 * t2 - t3 / 300000.0);
        // 달 평균 근점이각
        double mp = AngleMath.normalize(134.96298 + 477198.867398 * t + 0.0086972 * t2 + t3 / 56250.0);
        // 달 위도 인수
        double f = AngleMath.normalize(93.27191 + 483202.017538 * t - 0.0036825 * t2 + t3 / 327270.0);
        // 달 승교점 황경
        double omega = AngleMath.normalize(125.04452 - 1934.136261 * t + 0.0020708 * t2 + t3 / 450000.0);

        double deltaPsi = 0;
        double deltaEpsilon = 0;
        for (int[] term : TERMS) {
            double argument = Math.toRadians(term[0] * d + term[1] * m + term[2] * mp
                    + term[3] * f + term[4] * omega);
            deltaPsi += (term[5] + 0.1 * term[6] * t) * Math.sin(argument);
            deltaEpsilon += (term[7] + 0.1 * term[8] * t) * Math.cos(argument);
        }

        return new NutationAngles(deltaPsi / 10000.0, deltaEpsilon / 10000.0);
    }
}
