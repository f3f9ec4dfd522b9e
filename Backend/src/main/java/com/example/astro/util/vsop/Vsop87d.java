package com.example.astro.util.vsop;

import com.example.astro.model.CelestialBody;
import com.example.astro.model.HeliocentricPosition;

/**
 * VSOP87D 급수 평가기
 * 결과는 J2000.0 황도/분점 기준 일심 구면 좌표 (L, B rad / R AU)
 */
public class Vsop87d {

    private static final double AMPLITUDE_SCALE = 1.0e-8;

    /**
     * Σ_k τ^k · Σ A·cos(B + C·τ) 를 Horner 방식으로 평가
     *
     * @param series 차수별 항 그룹 (series[k] = τ^k 계수 항들)
     * @param tau    J2000.0 기준 TT 율리우스 천년
     */
    public static double evaluate(double[][][] series, double tau) {
        double result = 0.0;
        for (int k = series.length - 1; k >= 0; k--) {
            double sum = 0.0;
            for (double[] term : series[k]) {
                sum += term[0] * Math.cos(term[1] + term[2] * tau);
            }
            result = result * tau + sum;
        }
        return result * AMPLITUDE_SCALE;
    }

    public static HeliocentricPosition earth(double tau) {
        return position(EarthSeries.LONGITUDE, EarthSeries.LATITUDE, EarthSeries.RADIUS, tau);
    }

    /**
     * 행성의 일심 좌표, 태양과 달은 VSOP87D 급수가 없으므로 호출 오류
     */
    public static HeliocentricPosition planet(CelestialBody body, double tau) {
        switch (body) {
            case MERCURY:
                return position(MercurySeries.LONGITUDE, MercurySeries.LATITUDE, MercurySeries.RADIUS, tau);
            case VENUS:
                return position(VenusSeries.LONGITUDE, VenusSeries.LATITUDE, VenusSeries.RADIUS, tau);
            case MARS:
                return position(MarsSeries.LONGITUDE, MarsSeries.LATITUDE, MarsSeries.RADIUS, tau);
            case JUPITER:
                return position(JupiterSeries.LONGITUDE, JupiterSeries.LATITUDE, JupiterSeries.RADIUS, tau);
            case SATURN:
                return position(SaturnSeries.LONGITUDE, SaturnSeries.LATITUDE, SaturnSeries.RADIUS, tau);
            default:
                throw new IllegalArgumentException("No VSOP87D series for " + body);
        }
    }

    private static HeliocentricPosition position(double[][][] longitude, double[][][] latitude,
                                                 double[][][] radius, double tau) {
        return new HeliocentricPosition(
                evaluate(longitude, tau),
                evaluate(latitude, tau),
                evaluate(radius, tau));
    }
}
