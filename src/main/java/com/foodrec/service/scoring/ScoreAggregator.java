package com.foodrec.service.scoring;

import com.foodrec.model.GeoPoint;
import com.foodrec.model.Place;
import com.foodrec.model.Profile;
import com.foodrec.model.SignalBreakdown;

/**
 * 다섯 개 신호를 고정 가중치로 합산
 * minRating 미달(평점이 있을 때만)은 제외하지 않고 0.6 배로 감점
 */
public final class ScoreAggregator {

    static final double WEIGHT_KEYWORD = 0.30;
    static final double WEIGHT_PRICE = 0.15;
    static final double WEIGHT_QUALITY = 0.30;
    static final double WEIGHT_DISTANCE = 0.15;
    static final double WEIGHT_OPEN = 0.10;

    static final double RATING_PENALTY = 0.6;

    private ScoreAggregator() {
    }

    public static SignalBreakdown aggregate(Place place, Profile profile, GeoPoint origin) {
        Double km = GeoDistance.distanceKm(origin, place.getLocation());

        double keyword = SignalScorers.keywordScore(place, profile.getKeywords());
        double price = SignalScorers.priceScore(place, profile.getPriceLevels(),
                PriceClassifier.budgetToLevels(profile.getMaxBudget()));
        double quality = SignalScorers.qualityScore(place.getRating(), place.getUserRatingCount());
        double distance = SignalScorers.distanceScore(km, profile.getMaxDistanceKm());
        double open = SignalScorers.openScore(place.getOpenNow(), profile.isRequireOpen());

        double ratingPenalty = place.getRating() != null && place.getRating() < profile.getMinRating()
                ? RATING_PENALTY
                : 1.0;

        double weighted = WEIGHT_KEYWORD * keyword
                + WEIGHT_PRICE * price
                + WEIGHT_QUALITY * quality
                + WEIGHT_DISTANCE * distance
                + WEIGHT_OPEN * open;

        return SignalBreakdown.builder()
                .distanceKm(km)
                .keyword(keyword)
                .price(price)
                .quality(quality)
                .distance(distance)
                .open(open)
                .ratingPenalty(ratingPenalty)
                .score(weighted * ratingPenalty)
                .build();
    }
}
