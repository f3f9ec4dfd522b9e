package com.example.astro.model;

import com.example.astro.util.AngleMath;

/**
 * 황도 12궁, 황경 0°부터 30°씩
 */
public enum ZodiacSign {
    ARIES("Aries"),
    TAURUS("Taurus"),
    GEMINI("Gemini"),
    CANCER("Cancer"),
    LEO("Leo"),
    VIRGO("Virgo"),
    LIBRA("Libra"),
    SCORPIO("Scorpio"),
    SAGITTARIUS("Sagittarius"),
    CAPRICORN("Capricorn"),
    AQUARIUS("Aquarius"),
    PISCES("Pisces");

    public static final double SPAN_DEGREES = 30.0;

    private static final ZodiacSign[] VALUES = values();

    private final String displayName;

    ZodiacSign(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public double startLongitude() {
        return ordinal() * SPAN_DEGREES;
    }

    /**
     * 황경이 이 궁의 [시작, 시작+30) 구간에 속하는지 여부
     */
    public boolean contains(double longitude) {
        double normalized = AngleMath.normalize(longitude);
        double start = startLongitude();
        return normalized >= start && normalized < start + SPAN_DEGREES;
    }

    public static ZodiacSign fromIndex(int index) {
        return VALUES[Math.floorMod(index, VALUES.length)];
    }
}
