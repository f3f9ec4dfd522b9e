package com.example.astro.util;

import com.example.astro.model.ZodiacPlacement;
import com.example.astro.model.ZodiacSign;

/**
 * 황경 → 궁, 궁 내 각도, 경계 여부 분류
 */
public class ZodiacMapper {

    /** 궁 경계로부터 이 각도 이내면 경계 사례로 표시 */
    public static final double BOUNDARY_MARGIN_DEGREES = 0.5;

    public static ZodiacPlacement classify(double longitude) {
        if (!Double.isFinite(longitude)) {
            throw new IllegalArgumentException("Longitude must be finite: " + longitude);
        }
        double normalized = AngleMath.normalize(longitude);
        int index = (int) Math.floor(normalized / ZodiacSign.SPAN_DEGREES);
        ZodiacSign sign = ZodiacSign.fromIndex(index);
        double degreeInSign = normalized - ZodiacSign.SPAN_DEGREES * index;
        boolean boundary = degreeInSign <= BOUNDARY_MARGIN_DEGREES
                || degreeInSign >= ZodiacSign.SPAN_DEGREES - BOUNDARY_MARGIN_DEGREES;
        return new ZodiacPlacement(sign, degreeInSign, boundary);
    }

    public static ZodiacSign sign(double longitude) {
        return classify(longitude).getSign();
    }

    public static double degreeInSign(double longitude) {
        return classify(longitude).getDegreeInSign();
    }

    public static boolean isBoundaryCase(double longitude) {
        return classify(longitude).isBoundaryCase();
    }
}
