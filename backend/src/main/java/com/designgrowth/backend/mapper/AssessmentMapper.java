package com.designgrowth.backend.mapper;

import com.designgrowth.backend.dto.request.CreateAssessmentRequest;
import com.designgrowth.backend.model.SkillAssessment;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class AssessmentMapper {

    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 4;

    public SkillAssessment toDocument(CreateAssessmentRequest request) {
        Map<String, Integer> ratings = new LinkedHashMap<>();
        request.getRatings().forEach((competency, value) -> ratings.put(competency, normalizeRating(value)));

        return SkillAssessment.builder()
                .designerId(request.getDesignerId())
                .cycle(request.getCycle())
                .ratings(ratings)
                .notes(request.getNotes())
                .build();
    }

    /**
     * Coerces a raw JSON rating to an integer (anything that is not an integer becomes 1) and clamps it to 1..4.
     * Clamping happens before narrowing, so out-of-range longs and big integers land on the nearest bound.
     */
    public static int normalizeRating(Object value) {
        BigInteger rating = toInteger(value);
        if (rating.compareTo(BigInteger.valueOf(MIN_RATING)) < 0) {
            return MIN_RATING;
        }
        if (rating.compareTo(BigInteger.valueOf(MAX_RATING)) > 0) {
            return MAX_RATING;
        }
        return rating.intValue();
    }

    private static BigInteger toInteger(Object value) {
        try {
            if (value instanceof BigInteger) {
                return (BigInteger) value;
            }
            if (value instanceof BigDecimal) {
                return ((BigDecimal) value).toBigInteger();
            }
            if (value instanceof Double || value instanceof Float) {
                // toBigInteger truncates toward zero; NaN and infinities throw
                return BigDecimal.valueOf(((Number) value).doubleValue()).toBigInteger();
            }
            if (value instanceof Number) {
                return BigInteger.valueOf(((Number) value).longValue());
            }
            if (value instanceof String) {
                return new BigInteger(((String) value).trim());
            }
        } catch (NumberFormatException e) {
            return BigInteger.valueOf(MIN_RATING);
        }
        return BigInteger.valueOf(MIN_RATING);
    }
}
