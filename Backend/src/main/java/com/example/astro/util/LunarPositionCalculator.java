package com.example.astro.util;

import com.example.astro.model.CelestialBody;
import com.example.astro.model.CelestialPosition;

/**
 * 달 위치 계산 유틸리티 클래스
 * ELP-2000/82 절단판 (Meeus 47장, 황경 60항 + 황위 60항)
 */
public class LunarPositionCalculator {

    // 열: D, M, M', F, sin 계수 (1e-6 도)
    private static final int[][] LONGITUDE_TERMS = {
            { 0,  0,  1,  0,  6288774},
            { 2,  0, -1,  0,  1274027},
            { 2,  0,  0,  0,   658314},
            { 0,  0,  2,  0,   213618},
            { 0,  1,  0,  0,  -185116},
            { 0,  0,  0,  2,  -114332},
            { 2,  0, -2,  0,    58793},
            { 2, -1, -1,  0,    57066},
            { 2,  0,  1,  0,    53322},
            { 2, -1,  0,  0,    45758},
            { 0,  1, -1,  0,   -40923},
            { 1,  0,  0,  0,   -34720},
            { 0,  1,  1,  0,   -30383},
            { 2,  0,  0, -2,    15327},
            { 0,  0,  1,  2,   -12528},
            { 0,  0,  1, -2,    10980},
            { 4,  0, -1,  0,    10675},
            { 0,  0,  3,  0,    10034},
            { 4,  0, -2,  0,     8548},
            { 2,  1, -1,  0,    -7888},
            { 2,  1,  0,  0,    -6766},
            { 1,  0, -1,  0,    -5163},
            { 1,  1,  0,  0,     4987},
            { 2, -1,  1,  0,     4036},
            { 2,  0,  2,  0,     3994},
            { 4,  0,  0,  0,     3861},
            { 2,  0, -3,  0,     3665},
            { 0,  1, -2,  0,    -2689},
            { 2,  0, -1,  2,    -2602},
            { 2, -1, -2,  0,     2390},
            { 1,  0,  1,  0,    -2348},
            { 2, -2,  0,  0,     2236},
            { 0,  1,  2,  0,    -2120},
            { 0,  2,  0,  0,    -2069},
            { 2, -2, -1,  0,     2048},
            { 2,  0,  1, -2,    -1773},
            { 2,  0,  0,  2,    -1595},
            { 4, -1, -1,  0,     1215},
            { 0,  0,  2,  2,    -1110},
            { 3,  0, -1,  0,     -892},
            { 2,  1,  1,  0,     -810},
            { 4, -1, -2,  0,      759},
            { 0,  2, -1,  0,     -713},
            { 2,  2, -1,  0,     -700},
            { 2,  1, -2,  0,      691},
            { 2, -1,  0, -2,      596},
            { 4,  0,  1,  0,      549},
            { 0,  0,  4,  0,      537},
            { 4, -1,  0,  0,      520},
            { 1,  0, -2,  0,     -487},
            { 2,  1,  0, -2,     -399},
            { 0,  0,  2, -2,     -381},
            { 1,  1,  1,  0,      351},
            { 3,  0, -2,  0,     -340},
            { 4,  0, -3,  0,      330},
            { 2, -1,  2,  0,      327},
            { 0,  2,  1,  0,     -323},
            { 1,  1, -1,  0,      299},
            { 2,  0,  3,  0,      294},
            { 2,  0, -1, -2,        0},
    };

    private static final int[][] LATITUDE_TERMS = {
            { 0,  0,  0,  1,  5128122},
            { 0,  0,  1,  1,   280602},
            { 0,  0,  1, -1,   277693},
            { 2,  0,  0, -1,   173237},
            { 2,  0, -1,  1,    55413},
            { 2,  0, -1, -1,    46271},
            { 2,  0,  0,  1,    32573},
            { 0,  0,  2,  1,    17198},
            { 2,  0,  1, -1,     9266},
            { 0,  0,  2, -1,     8822},
            { 2, -1,  0, -1,     8216},
            { 2,  0, -2, -1,     4324},
            { 2,  0,  1,  1,     4200},
            { 2,  1,  0, -1,    -3359},
            { 2, -1, -1,  1,     2463},
            { 2, -1,  0,  1,     2211},
            { 2, -1, -1, -1,     2065},
            { 0,  1, -1, -1,    -1870},
            { 4,  0, -1, -1,     1828},
            { 0,  1,  0,  1,    -1794},
            { 0,  0,  0,  3,    -1749},
            { 0,  1, -1,  1,    -1565},
            { 1,  0,  0,  1,    -1491},
            { 0,  1,  1,  1,    -1475},
            { 0,  1,  1, -1,    -1410},
            { 0,  1,  0, -1,    -1344},
            { 1,  0,  0, -1,    -1335},
            { 0,  0,  3,  1,     1107},
            { 4,  0,  0, -1,     1021},
            { 4,  0, -1,  1,      833},
            { 0,  0,  1, -3,      777},
            { 4,  0, -2,  1,      671},
            { 2,  0,  0, -3,      607},
            { 2,  0,  2, -1,      596},
            { 2, -1,  1, -1,      491},
            { 2,  0, -2,  1,     -451},
            { 0,  0,  3, -1,      439},
            { 2,  0,  2,  1,      422},
            { 2,  0, -3, -1,      421},
            { 2,  1, -1,  1,     -366},
            { 2,  1,  0,  1,     -351},
            { 4,  0,  0,  1,      331},
            { 2, -1,  1,  1,      315},
            { 2, -2,  0, -1,      302},
            { 0,  0,  1,  3,     -283},
            { 2,  1,  1, -1,     -229},
            { 1,  1,  0, -1,      223},
            { 1,  1,  0,  1,      223},
            { 0,  1, -2, -1,     -220},
            { 2,  1, -1, -1,     -220},
            { 1,  0,  1,  1,     -185},
            { 2, -1, -2, -1,      181},
            { 0,  1,  2,  1,     -177},
            { 4,  0, -2, -1,      176},
            { 4, -1, -1, -1,      166},
            { 1,  0,  1, -1,     -164},
            { 4,  0,  1, -1,      132},
            { 1,  0, -1, -1,     -119},
            { 4, -1,  0, -1,      115},
            { 2, -2,  0,  1,      107},
    };

    /**
     * 달의 지구 중심 평균 황경/황위 (장동 미적용, 광행차 보정 없음)
     *
     * @param t J2000.0 기준 TT 율리우스 세기
     */
    public static CelestialPosition calculate(double t) {
        double t2 = t * t;
        double t3 = t2 * t;
        double t4 = t3 * t;

        // 1. 달의 평균 황경 L'
        double meanLongitude = AngleMath.normalize(218.3164477 + 481267.88123421 * t
                - 0.0015786 * t2 + t3 / 538841.0 - t4 / 65194000.0);
        // 2. 평균 이각 D
        double d = AngleMath.normalize(297.8501921 + 445267.1114034 * t
                - 0.0018819 * t2 + t3 / 545868.0 - t4 / 113065000.0);
        // 3. 태양 평균 근점이각 M
        double m = AngleMath.normalize(357.5291092 + 35999.0502909 * t
                - 0.0001536 * t2 + t3 / 24490000.0);
        // 4. 달 평균 근점이각 M'
        double mp = AngleMath.normalize(134.9633964 + 477198.8675055 * t
                + 0.0087414 * t2 + t3 / 69699.0 - t4 / 14712000.0);
        // 5. 달 위도 인수 F
        double f = AngleMath.normalize(93.2720950 + 483202.0175233 * t
                - 0.0036539 * t2 - t3 / 3526000.0 + t4 / 863310000.0);

        // 지구 궤도 이심률 변화 보정
        double e = 1.0 - 0.002516 * t - 0.0000074 * t2;

        double sumL = sumTerms(LONGITUDE_TERMS, d, m, mp, f, e);
        double sumB = sumTerms(LATITUDE_TERMS, d, m, mp, f, e);

        // 금성, 목성 섭동 및 지구 편평도 보정 (A1, A2, A3)
        double a1 = AngleMath.normalize(119.75 + 131.849 * t);
        double a2 = AngleMath.normalize(53.09 + 479264.290 * t);
        double a3 = AngleMath.normalize(313.45 + 481266.484 * t);

        sumL += 3958.0 * AngleMath.sinDeg(a1)
                + 1962.0 * AngleMath.sinDeg(meanLongitude - f)
                + 318.0 * AngleMath.sinDeg(a2);

        sumB += -2235.0 * AngleMath.sinDeg(meanLongitude)
                + 382.0 * AngleMath.sinDeg(a3)
                + 175.0 * AngleMath.sinDeg(a1 - f)
                + 175.0 * AngleMath.sinDeg(a1 + f)
                + 127.0 * AngleMath.sinDeg(meanLongitude - mp)
                - 115.0 * AngleMath.sinDeg(meanLongitude + mp);

        double longitude = AngleMath.normalize(meanLongitude + sumL / 1_000_000.0);
        double latitude = sumB / 1_000_000.0;

        return CelestialPosition.of(CelestialBody.MOON, longitude, latitude,
                ZodiacMapper.classify(longitude));
    }

    private static double sumTerms(int[][] terms, double d, double m, double mp, double f, double e) {
        double e2 = e * e;
        double sum = 0.0;
        for (int[] term : terms) {
            double coefficient = term[4];
            int absM = Math.abs(term[1]);
            if (absM == 1) {
                coefficient *= e;
            } else if (absM == 2) {
                coefficient *= e2;
            }
            double argument = term[0] * d + term[1] * m + term[2] * mp + term[3] * f;
            sum += coefficient * AngleMath.sinDeg(argument);
        }
        return sum;
    }
}
