package com.example.astro.model;

import lombok.Value;

/**
 * 황경의 궁 분류 결과
 */
@Value
public class ZodiacPlacement {
    ZodiacSign sign;
    double degreeInSign; // 궁 내 각도 [0, 30)
    boolean boundaryCase; // 궁 경계 0.5° 이내 여부
}
