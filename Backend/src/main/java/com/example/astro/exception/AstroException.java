package com.example.astro.exception;

import lombok.Getter;

/**
 * 입력 검증 단계에서 발생하는 천문 계산 예외
 * 오류 종류와 문제가 된 값(detail)을 함께 전달한다
 */
@Getter
public class AstroException extends RuntimeException {

    private final AstroErrorType type;
    private final String detail;

    public AstroException(AstroErrorType type, String message) {
        this(type, message, null, null);
    }

    public AstroException(AstroErrorType type, String message, String detail) {
        this(type, message, detail, null);
    }

    public AstroException(AstroErrorType type, String message, String detail, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.detail = detail;
    }

    public static AstroException invalidCoordinate(String message, double value) {
        return new AstroException(AstroErrorType.INVALID_COORDINATE, message, String.valueOf(value));
    }

    public static AstroException extremeLatitude(double latitude) {
        return new AstroException(AstroErrorType.EXTREME_LATITUDE,
                "Latitude " + latitude + " exceeds ±85° limit for ascendant calculation",
                String.valueOf(latitude));
    }

    public static AstroException invalidCivilMoment(String message) {
        return new AstroException(AstroErrorType.INVALID_CIVIL_MOMENT, message);
    }

    public static AstroException invalidTimeZone(String identifier, Throwable cause) {
        return new AstroException(AstroErrorType.INVALID_TIME_ZONE_IDENTIFIER,
                "Unknown time zone identifier: " + identifier, identifier, cause);
    }

    public static AstroException dateConversionFailed(Throwable cause) {
        return new AstroException(AstroErrorType.DATE_CONVERSION_FAILED,
                "Calendar conversion to UTC failed", null, cause);
    }

    public static AstroException unsupportedYear(int year) {
        return new AstroException(AstroErrorType.UNSUPPORTED_YEAR_RANGE,
                "Year " + year + " is outside supported range 1800...2100", String.valueOf(year));
    }

    public static AstroException missingCoordinateForAscendant() {
        return new AstroException(AstroErrorType.MISSING_COORDINATE_FOR_ASCENDANT,
                "Ascendant requested but no coordinate provided");
    }
}
