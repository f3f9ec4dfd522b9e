package com.example.astro.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * 상승점(ASC) 계산 결과
 */
@Value
public class AscendantResult {

    @JsonProperty("eclipticLongitude")
    double eclipticLongitude;

    @JsonProperty("sign")
    ZodiacSign sign;

    @JsonProperty("degreeInSign")
    double degreeInSign;

    @JsonProperty("localSiderealTimeDegrees")
    double localSiderealTimeDegrees; // 지방 시항성시 (도)

    @JsonProperty("julianDayUT")
    double julianDayUT;

    @JsonProperty("trueObliquity")
    double trueObliquity; // 진 황도 경사각 (도)

    @JsonProperty("boundaryCase")
    boolean boundaryCase;
}
