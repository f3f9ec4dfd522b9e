package com.example.astro.util;

/**
 * 각도 정규화 및 도(degree) 단위 삼각함수 유틸리티
 */
public class AngleMath {

    /**
     * 각도를 [0, 360) 범위로 정규화
     */
    public static double normalize(double degrees) {
        double result = degrees % 360.0;
        if (result < 0) {
            result += 360.0;
        }
        // -1e-15 + 360 처럼 반올림으로 360이 되는 경우
        if (result >= 360.0) {
            result -= 360.0;
        }
        // -360 % 360 = -0.0
        if (result == 0.0) {
            return 0.0;
        }
        return result;
    }

    public static double sinDeg(double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }

    public static double cosDeg(double degrees) {
        return Math.cos(Math.toRadians(degrees));
    }

    public static double tanDeg(double degrees) {
        return Math.tan(Math.toRadians(degrees));
    }

    /**
     * 각초(arcsecond)를 도 단위로 변환
     */
    public static double arcsecondsToDegrees(double arcseconds) {
        return arcseconds / 3600.0;
    }

    /**
     * Horner 방식 다항식 평가. coefficients[i]는 x^i의 계수
     */
    static double horner(double x, double[] coefficients) {
        double result = coefficients[coefficients.length - 1];
        for (int i = coefficients.length - 2; i >= 0; i--) {
            result = result * x + coefficients[i];
        }
        return result;
    }
}
