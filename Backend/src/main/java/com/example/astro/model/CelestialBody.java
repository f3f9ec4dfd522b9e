package com.example.astro.model;

/**
 * 계산 대상 천체
 */
public enum CelestialBody {
    SUN("Sun"),
    MOON("Moon"),
    MERCURY("Mercury"),
    VENUS("Venus"),
    MARS("Mars"),
    JUPITER("Jupiter"),
    SATURN("Saturn");

    private final String displayName;

    CelestialBody(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * VSOP87D 일심 좌표를 지구 중심으로 변환해 구하는 행성 여부
     */
    public boolean isPlanet() {
        return this != SUN && this != MOON;
    }
}
