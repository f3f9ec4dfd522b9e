package com.example.astro.exception;

/**
 * 천문 계산 오류 분류
 */
public enum AstroErrorType {
    INVALID_COORDINATE,
    EXTREME_LATITUDE,
    INVALID_CIVIL_MOMENT,
    INVALID_TIME_ZONE_IDENTIFIER,
    DATE_CONVERSION_FAILED,
    UNSUPPORTED_YEAR_RANGE,
    MISSING_COORDINATE_FOR_ASCENDANT
}
