package com.foodrec.service.scoring;

import com.foodrec.model.Place;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 기준별 신호 점수 (모두 0~1)
 * 데이터가 없을 때의 기본값은 모두 여기서 결정함
 */
public final class SignalScorers {

    static final double UNKNOWN_PRICE_SCORE = 0.5;
    static final double UNKNOWN_OPEN_SCORE = 0.6;
    static final double UNKNOWN_DISTANCE_SCORE = 0.6;

    static final double NEAR_PLATEAU_KM = 0.25;
    static final double DISTANCE_FLOOR = 0.1;
    private static final double DISTANCE_DECAY = 0.9;

    // 리뷰 1000개 근처에서 신뢰도 1
    private static final double REVIEW_CONFIDENCE_LOG_SCALE = 3.0;

    private SignalScorers() {
    }

    /**
     * 키워드 매칭 비율 (부분 점수)
     * name + types + summary + primaryType 을 소문자로 합친 문자열에 포함되면 hit
     */
    public static double keywordScore(Place place, List<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            return 0;
        }
        String bag = keywordBag(place);

        int hits = 0;
        for (String keyword : keywords) {
            String k = keyword != null ? keyword.trim().toLowerCase(Locale.ROOT) : "";
            if (k.isEmpty()) {
                continue;
            }
            if (bag.contains(k)) {
                hits++;
            }
        }
        return (double) hits / keywords.size();
    }

    /**
     * 가격 적합도
     * 선호 레벨과 예산 레벨의 교집합(유효 집합)에 들어가면 1, 아니면 0, 가격 정보가 없으면 0.5
     * 유효 집합이 없거나 비어 있으면 1
     */
    public static double priceScore(Place place, List<Integer> priceLevels, Set<Integer> budgetLevels) {
        Set<Integer> allowed = effectivePriceLevels(priceLevels, budgetLevels);
        if (allowed == null || allowed.isEmpty()) {
            return 1;
        }
        Integer level = PriceClassifier.levelOf(place.getPriceLevel());
        if (level == null) {
            return UNKNOWN_PRICE_SCORE;
        }
        return allowed.contains(level) ? 1 : 0;
    }

    /**
     * @return 제약이 없으면 null
     */
    static Set<Integer> effectivePriceLevels(Collection<Integer> priceLevels, Set<Integer> budgetLevels) {
        boolean hasPreference = priceLevels != null && !priceLevels.isEmpty();
        if (!hasPreference && budgetLevels == null) {
            return null;
        }
        Set<Integer> allowed = new LinkedHashSet<>(hasPreference ? priceLevels : budgetLevels);
        if (hasPreference && budgetLevels != null) {
            allowed.retainAll(budgetLevels);
        }
        return allowed;
    }

    /**
     * 평점 × 리뷰 수 기반 신뢰도
     * 리뷰 1개짜리 5점이 리뷰 수천 개의 4.5점보다 앞서지 않도록 함
     */
    public static double qualityScore(Double rating, Long reviewCount) {
        if (rating == null || rating == 0 || rating.isNaN()) {
            return 0;
        }
        double r = Math.min(Math.max(rating, 0), 5);
        long reviews = reviewCount != null ? Math.max(reviewCount, 0) : 0;
        double confidence = Math.log10(reviews + 1) / REVIEW_CONFIDENCE_LOG_SCALE;
        return (r / 5) * Math.min(confidence, 1);
    }

    public static double openScore(Boolean openNow, boolean requireOpen) {
        if (!requireOpen) {
            return 1;
        }
        if (openNow == null) {
            return UNKNOWN_OPEN_SCORE;
        }
        return openNow ? 1 : 0;
    }

    /**
     * 250m 이내는 1, maxKm 이상은 0.1 (0으로 떨어지지 않음), 그 사이는 선형 감소
     */
    public static double distanceScore(Double km, double maxKm) {
        if (km == null) {
            return UNKNOWN_DISTANCE_SCORE;
        }
        if (km <= NEAR_PLATEAU_KM) {
            return 1;
        }
        if (km >= maxKm) {
            return DISTANCE_FLOOR;
        }
        return 1 - (km / maxKm) * DISTANCE_DECAY;
    }

    private static String keywordBag(Place place) {
        StringBuilder bag = new StringBuilder();
        append(bag, place.getName());
        if (place.getTypes() != null) {
            for (String type : place.getTypes()) {
                append(bag, type);
            }
        }
        append(bag, place.getSummary());
        append(bag, place.getPrimaryType());
        return bag.toString().toLowerCase(Locale.ROOT);
    }

    private static void append(StringBuilder bag, String value) {
        if (bag.length() > 0) {
            bag.append(' ');
        }
        if (value != null) {
            bag.append(value);
        }
    }
}
