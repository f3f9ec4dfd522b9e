package com.example.astro.model;

import com.example.astro.exception.AstroException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 지리 좌표 (위도 -90~90, 경도 -180~180, 동경 양수)
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GeoCoordinate {

    /** 상승점 계산이 허용되는 최대 위도 */
    public static final double MAX_ASCENDANT_LATITUDE = 85.0;

    double latitude;
    double longitude;

    public static GeoCoordinate of(double latitude, double longitude) {
        if (!Double.isFinite(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw AstroException.invalidCoordinate(
                    "Latitude " + latitude + " out of range -90...90", latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw AstroException.invalidCoordinate(
                    "Longitude " + longitude + " out of range -180...180", longitude);
        }
        return new GeoCoordinate(latitude, longitude);
    }

    /**
     * 극지방에서는 상승점 공식이 불안정하므로 |위도| > 85° 거부
     */
    public void validateForAscendant() {
        if (Math.abs(latitude) > MAX_ASCENDANT_LATITUDE) {
            throw AstroException.extremeLatitude(latitude);
        }
    }
}
