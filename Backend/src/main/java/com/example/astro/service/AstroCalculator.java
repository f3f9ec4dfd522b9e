package com.example.astro.service;

import com.example.astro.exception.AstroException;
import com.example.astro.model.AscendantResult;
import com.example.astro.model.CelestialBody;
import com.example.astro.model.CelestialPosition;
import com.example.astro.model.CivilMoment;
import com.example.astro.model.GeoCoordinate;
import com.example.astro.model.HeliocentricPosition;
import com.example.astro.model.NatalPositions;
import com.example.astro.model.NutationAngles;
import com.example.astro.model.ZodiacPlacement;
import com.example.astro.util.AngleMath;
import com.example.astro.util.AscendantCalculator;
import com.example.astro.util.LunarPositionCalculator;
import com.example.astro.util.Nutation;
import com.example.astro.util.Obliquity;
import com.example.astro.util.PlanetPositionCalculator;
import com.example.astro.util.SiderealTime;
import com.example.astro.util.SunPositionCalculator;
import com.example.astro.util.ZodiacMapper;
import com.example.astro.util.vsop.Vsop87d;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 천문 계산 진입점
 * 공통 시간 값(율리우스 일, ΔT, T, τ, 장동)을 한 번 계산해 천체별 계산기에 전달한다
 */
@Service
public class AstroCalculator {

    private static final Logger logger = LoggerFactory.getLogger(AstroCalculator.class);

    public double julianDayUT(CivilMoment moment) {
        return moment.getJulianDayUT();
    }

    /**
     * 지방 시항성시 (도)
     *
     * @param longitude 관측 경도 (동경 양수)
     */
    public double localSiderealTimeDegrees(CivilMoment moment, double longitude) {
        return TimeContext.of(moment).localApparentSiderealTime(longitude);
    }

    /**
     * 주어진 시각과 위치의 상승점 계산
     */
    public AscendantResult ascendant(CivilMoment moment, GeoCoordinate coordinate) {
        if (coordinate == null) {
            throw AstroException.missingCoordinateForAscendant();
        }
        AscendantResult result = ascendant(TimeContext.of(moment), coordinate);
        logger.debug("상승점 계산: 시각={}, 위치=({}, {}), ASC={}",
                moment, coordinate.getLatitude(), coordinate.getLongitude(), result.getEclipticLongitude());
        return result;
    }

    /**
     * 태양의 시황경/황위
     */
    public CelestialPosition sunPosition(CivilMoment moment) {
        TimeContext context = TimeContext.of(moment);
        CelestialPosition mean = SunPositionCalculator.calculate(context.t, Vsop87d.earth(context.tau));
        return logged(moment, applyNutation(mean, context.nutation));
    }

    /**
     * 달의 시황경/황위
     */
    public CelestialPosition moonPosition(CivilMoment moment) {
        TimeContext context = TimeContext.of(moment);
        CelestialPosition mean = LunarPositionCalculator.calculate(context.t);
        return logged(moment, applyNutation(mean, context.nutation));
    }

    /**
     * 천체의 시황경/황위, 태양과 달은 전용 계산으로 위임
     */
    public CelestialPosition planetPosition(CelestialBody body, CivilMoment moment) {
        switch (body) {
            case SUN:
                return sunPosition(moment);
            case MOON:
                return moonPosition(moment);
            default:
                TimeContext context = TimeContext.of(moment);
                double[] earth = Vsop87d.earth(context.tau).toRectangular();
                CelestialPosition mean = PlanetPositionCalculator.calculate(body, context.tau, earth);
                return logged(moment, applyNutation(mean, context.nutation));
        }
    }

    /**
     * 출생 차트 일괄 계산
     * 시간 값과 장동, 지구 위치는 한 번만 계산해 모든 천체와 상승점에 재사용한다
     *
     * @param coordinate       상승점을 요청하지 않으면 null 허용
     * @param bodies           계산할 천체 목록 (중복은 하나로 처리, null이면 천체 없음)
     * @param includeAscendant 상승점 포함 여부
     */
    public NatalPositions natalPositions(CivilMoment moment, GeoCoordinate coordinate,
                                         Collection<CelestialBody> bodies, boolean includeAscendant) {
        if (includeAscendant && coordinate == null) {
            throw AstroException.missingCoordinateForAscendant();
        }

        TimeContext context = TimeContext.of(moment);
        Set<CelestialBody> requested = (bodies == null || bodies.isEmpty())
                ? EnumSet.noneOf(CelestialBody.class)
                : EnumSet.copyOf(bodies);

        AscendantResult ascendant = includeAscendant ? ascendant(context, coordinate) : null;

        // 달 외의 천체가 있으면 지구 위치를 한 번만 계산
        boolean needsEarth = requested.stream().anyMatch(body -> body != CelestialBody.MOON);
        HeliocentricPosition earth = needsEarth ? Vsop87d.earth(context.tau) : null;
        double[] earthRect = earth != null ? earth.toRectangular() : null;

        Map<CelestialBody, CelestialPosition> positions = new EnumMap<>(CelestialBody.class);
        for (CelestialBody body : requested) {
            CelestialPosition mean;
            switch (body) {
                case SUN:
                    mean = SunPositionCalculator.calculate(context.t, earth);
                    break;
                case MOON:
                    mean = LunarPositionCalculator.calculate(context.t);
                    break;
                default:
                    mean = PlanetPositionCalculator.calculate(body, context.tau, earthRect);
                    break;
            }
            positions.put(body, applyNutation(mean, context.nutation));
        }

        logger.info("출생 차트 계산 완료: 시각={}, JD={}, 천체 {}개, 상승점 포함={}",
                moment, context.julianDayUT, positions.size(), ascendant != null);

        return new NatalPositions(ascendant, positions, context.julianDayUT, context.deltaT);
    }

    private AscendantResult ascendant(TimeContext context, GeoCoordinate coordinate) {
        coordinate.validateForAscendant();

        double last = context.localApparentSiderealTime(coordinate.getLongitude());
        double longitude = AscendantCalculator.ascendantLongitude(
                last, context.trueObliquity, coordinate.getLatitude());
        ZodiacPlacement placement = ZodiacMapper.classify(longitude);

        return new AscendantResult(longitude, placement.getSign(), placement.getDegreeInSign(),
                last, context.julianDayUT, context.trueObliquity, placement.isBoundaryCase());
    }

    /**
     * 평균 황경에 황경 장동(Δψ)을 더해 시황경으로 변환
     */
    private static CelestialPosition applyNutation(CelestialPosition mean, NutationAngles nutation) {
        double longitude = AngleMath.normalize(
                mean.getLongitude() + AngleMath.arcsecondsToDegrees(nutation.getLongitude()));
        return CelestialPosition.of(mean.getBody(), longitude, mean.getLatitude(),
                ZodiacMapper.classify(longitude));
    }

    private static CelestialPosition logged(CivilMoment moment, CelestialPosition position) {
        logger.debug("{} 위치 계산: 시각={}, 황경={}, 황위={}, 궁={}",
                position.getBody().getDisplayName(), moment,
                position.getLongitude(), position.getLatitude(), position.getSign());
        return position;
    }

    /**
     * 한 번의 계산에서 공유하는 시간 관련 값
     */
    private static final class TimeContext {
        private final double julianDayUT;
        private final double deltaT;
        private final double t;
        private final double tau;
        private final NutationAngles nutation;
        private final double trueObliquity;

        private TimeContext(CivilMoment moment) {
            this.julianDayUT = moment.getJulianDayUT();
            this.deltaT = moment.getDeltaT();
            this.t = moment.getJulianCenturiesTT();
            this.tau = moment.getJulianMillenniaTT();
            this.nutation = Nutation.compute(t);
            this.trueObliquity = Obliquity.trueObliquity(t, nutation.getObliquity());
        }

        static TimeContext of(CivilMoment moment) {
            return new TimeContext(moment);
        }

        double localApparentSiderealTime(double longitude) {
            return SiderealTime.last(julianDayUT, longitude, nutation.getLongitude(), trueObliquity);
        }
    }
}
