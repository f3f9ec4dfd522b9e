package com.example.astro.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * 천체의 지구 중심 시황경/황위와 궁 정보
 */
@Value
public class CelestialPosition {

    @JsonProperty("body")
    CelestialBody body;

    @JsonProperty("longitude")
    double longitude; // 황경 [0, 360)

    @JsonProperty("latitude")
    double latitude; // 황위

    @JsonProperty("sign")
    ZodiacSign sign;

    @JsonProperty("degreeInSign")
    double degreeInSign;

    @JsonProperty("boundaryCase")
    boolean boundaryCase;

    public static CelestialPosition of(CelestialBody body, double longitude, double latitude,
                                       ZodiacPlacement placement) {
        return new CelestialPosition(body, longitude, latitude,
                placement.getSign(), placement.getDegreeInSign(), placement.isBoundaryCase());
    }
}
