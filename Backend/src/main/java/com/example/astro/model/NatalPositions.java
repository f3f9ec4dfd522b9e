package com.example.astro.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 출생 차트 일괄 계산 결과
 * 요청된 천체마다 하나의 위치, 선택적으로 상승점
 */
@Getter
public class NatalPositions {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("ascendant")
    private final AscendantResult ascendant;

    @JsonProperty("bodies")
    private final Map<CelestialBody, CelestialPosition> bodies;

    @JsonProperty("julianDayUT")
    private final double julianDayUT;

    @JsonProperty("deltaT")
    private final double deltaT; // 초

    public NatalPositions(AscendantResult ascendant, Map<CelestialBody, CelestialPosition> bodies,
                          double julianDayUT, double deltaT) {
        this.ascendant = ascendant;
        this.bodies = bodies.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(bodies));
        this.julianDayUT = julianDayUT;
        this.deltaT = deltaT;
    }

    public Optional<AscendantResult> findAscendant() {
        return Optional.ofNullable(ascendant);
    }

    public CelestialPosition get(CelestialBody body) {
        return bodies.get(body);
    }
}
