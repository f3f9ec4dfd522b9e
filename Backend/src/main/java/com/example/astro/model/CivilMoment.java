package com.example.astro.model;

import com.example.astro.exception.AstroException;
import com.example.astro.util.DeltaT;
import com.example.astro.util.JulianDay;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * 특정 시간대의 지역 시각(연월일시분초)
 * 생성 시 UTC 변환과 율리우스 일, ΔT, TT 세기/천년을 한 번만 계산해 보관한다
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@JsonPropertyOrder({"year", "month", "day", "hour", "minute", "second", "timeZoneIdentifier"})
public final class CivilMoment {

    public static final int MIN_YEAR = 1800;
    public static final int MAX_YEAR = 2100;

    @EqualsAndHashCode.Include
    private final int year;
    @EqualsAndHashCode.Include
    private final int month;
    @EqualsAndHashCode.Include
    private final int day;
    @EqualsAndHashCode.Include
    private final int hour;
    @EqualsAndHashCode.Include
    private final int minute;
    @EqualsAndHashCode.Include
    private final int second;
    @EqualsAndHashCode.Include
    private final String timeZoneIdentifier;

    @Getter(onMethod_ = @JsonIgnore)
    private final double decimalYear;
    @Getter(onMethod_ = @JsonIgnore)
    private final double julianDayUT;
    @Getter(onMethod_ = @JsonIgnore)
    private final double deltaT;
    @Getter(onMethod_ = @JsonIgnore)
    private final double julianCenturiesTT;
    @Getter(onMethod_ = @JsonIgnore)
    private final double julianMillenniaTT;

    @Getter(AccessLevel.NONE)
    private final LocalDateTime utcDateTime;

    private CivilMoment(int year, int month, int day, int hour, int minute, int second,
                        String timeZoneIdentifier, LocalDateTime utcDateTime) {
        this.year = year;
        this.month = month;
        this.day = day;
        this.hour = hour;
        this.minute = minute;
        this.second = second;
        this.timeZoneIdentifier = timeZoneIdentifier;
        this.utcDateTime = utcDateTime;

        // Espenak & Meeus: y = year + (month - 0.5) / 12
        this.decimalYear = year + (month - 0.5) / 12.0;
        this.julianDayUT = JulianDay.julianDay(utcDateTime);
        this.deltaT = DeltaT.deltaT(decimalYear);
        this.julianCenturiesTT = JulianDay.julianCenturiesTT(julianDayUT, deltaT);
        this.julianMillenniaTT = JulianDay.julianMillenniaTT(julianDayUT, deltaT);
    }

    public static CivilMoment of(int year, int month, int day, int hour, int minute,
                                 String timeZoneIdentifier) {
        return of(year, month, day, hour, minute, 0, timeZoneIdentifier);
    }

    /**
     * 입력값 검증 후 CivilMoment 생성
     * 검증 순서: 연도 범위, 월, 일, 시, 분, 초, 시간대, 서머타임 공백 구간
     */
    @JsonCreator
    public static CivilMoment of(@JsonProperty("year") int year,
                                 @JsonProperty("month") int month,
                                 @JsonProperty("day") int day,
                                 @JsonProperty("hour") int hour,
                                 @JsonProperty("minute") int minute,
                                 @JsonProperty("second") int second,
                                 @JsonProperty("timeZoneIdentifier") String timeZoneIdentifier) {
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw AstroException.unsupportedYear(year);
        }
        if (month < 1 || month > 12) {
            throw AstroException.invalidCivilMoment("Month " + month + " out of range 1...12");
        }
        int maxDay = YearMonth.of(year, month).lengthOfMonth();
        if (day < 1 || day > maxDay) {
            throw AstroException.invalidCivilMoment(
                    "Day " + day + " out of range 1..." + maxDay + " for " + year + "-" + month);
        }
        if (hour < 0 || hour > 23) {
            throw AstroException.invalidCivilMoment("Hour " + hour + " out of range 0...23");
        }
        if (minute < 0 || minute > 59) {
            throw AstroException.invalidCivilMoment("Minute " + minute + " out of range 0...59");
        }
        if (second < 0 || second > 59) {
            throw AstroException.invalidCivilMoment("Second " + second + " out of range 0...59");
        }

        ZoneId zone = resolveZone(timeZoneIdentifier);
        LocalDateTime local = LocalDateTime.of(year, month, day, hour, minute, second);

        // 서머타임 시작 시 건너뛰는 지역 시각은 거부
        if (zone.getRules().getValidOffsets(local).isEmpty()) {
            throw AstroException.invalidCivilMoment(
                    "Local time " + local + " is not representable in " + timeZoneIdentifier);
        }

        LocalDateTime utc;
        try {
            utc = ZonedDateTime.of(local, zone)
                    .withZoneSameInstant(ZoneOffset.UTC)
                    .toLocalDateTime();
        } catch (DateTimeException e) {
            throw AstroException.dateConversionFailed(e);
        }

        return new CivilMoment(year, month, day, hour, minute, second, timeZoneIdentifier, utc);
    }

    private static ZoneId resolveZone(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw AstroException.invalidTimeZone(String.valueOf(identifier), null);
        }
        try {
            return ZoneId.of(identifier);
        } catch (DateTimeException e) {
            throw AstroException.invalidTimeZone(identifier, e);
        }
    }

    /**
     * UTC 기준 시각
     */
    @JsonIgnore
    public LocalDateTime toUtcDateTime() {
        return utcDateTime;
    }

    @Override
    public String toString() {
        return String.format("%04d-%02d-%02dT%02d:%02d:%02d[%s]",
                year, month, day, hour, minute, second, timeZoneIdentifier);
    }
}
