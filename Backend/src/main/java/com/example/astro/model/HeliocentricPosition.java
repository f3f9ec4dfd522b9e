package com.example.astro.model;

import lombok.Value;

/**
 * VSOP87D 일심 황도 구면 좌표
 */
@Value
public class HeliocentricPosition {
    double longitude; // L (rad)
    double latitude;  // B (rad)
    double radius;    // R (AU)

    /**
     * 일심 황도 직교 좌표 {x, y, z} (AU)
     */
    public double[] toRectangular() {
        double cosLat = Math.cos(latitude);
        return new double[]{
                radius * cosLat * Math.cos(longitude),
                radius * cosLat * Math.sin(longitude),
                radius * Math.sin(latitude)
        };
    }
}
