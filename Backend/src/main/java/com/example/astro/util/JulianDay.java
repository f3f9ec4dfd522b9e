package com.example.astro.util;

import java.time.LocalDateTime;

/**
 * 율리우스 일(Julian Day) 계산 (Meeus 7장, 그레고리력 전용)
 */
public class JulianDay {

    /** J2000.0 기준 시각: 2000-01-01 12:00 TT */
    public static final double J2000 = 2451545.0;

    private static final double DAYS_PER_CENTURY = 36525.0;
    private static final double DAYS_PER_MILLENNIUM = 365250.0;
    private static final double SECONDS_PER_DAY = 86400.0;

    /**
     * 연, 월, 소수 일(day fraction)로부터 율리우스 일 계산
     */
    public static double julianDay(int year, int month, double dayFraction) {
        double y = year;
        double m = month;
        if (m <= 2) {
            y -= 1;
            m += 12;
        }

        double a = Math.floor(y / 100.0);
        double b = 2.0 - a + Math.floor(a / 4.0);

        return Math.floor(365.25 * (y + 4716.0))
                + Math.floor(30.6001 * (m + 1.0))
                + dayFraction + b - 1524.5;
    }

    /**
     * UTC 시각으로부터 율리우스 일(UT) 계산
     */
    public static double julianDay(LocalDateTime utc) {
        double dayFraction = utc.getDayOfMonth()
                + utc.getHour() / 24.0
                + utc.getMinute() / 1440.0
                + utc.getSecond() / SECONDS_PER_DAY;
        return julianDay(utc.getYear(), utc.getMonthValue(), dayFraction);
    }

    public static double julianCenturiesUT(double jd) {
        return (jd - J2000) / DAYS_PER_CENTURY;
    }

    /**
     * TT 기준 J2000.0 이후 율리우스 세기 (T)
     */
    public static double julianCenturiesTT(double jdUT, double deltaTSeconds) {
        double jdTT = jdUT + deltaTSeconds / SECONDS_PER_DAY;
        return (jdTT - J2000) / DAYS_PER_CENTURY;
    }

    /**
     * TT 기준 J2000.0 이후 율리우스 천년 (τ, VSOP87 입력)
     */
    public static double julianMillenniaTT(double jdUT, double deltaTSeconds) {
        double jdTT = jdUT + deltaTSeconds / SECONDS_PER_DAY;
        return (jdTT - J2000) / DAYS_PER_MILLENNIUM;
    }
}
