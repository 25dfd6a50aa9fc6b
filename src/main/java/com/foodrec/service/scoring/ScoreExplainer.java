package com.foodrec.service.scoring;

import com.foodrec.model.Place;
import com.foodrec.model.Profile;
import com.foodrec.model.SignalBreakdown;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 추천 이유 한 줄 생성
 * 예: "$$ · 4.6★ (1200 reviews) · 350 m away · matches 100% of tastes (tacos) · open now"
 * 신호 값은 다시 계산하지 않고 ScoreAggregator 결과를 그대로 사용
 */
public final class ScoreExplainer {

    static final String DELIMITER = " · ";
    private static final int KEYWORD_MATCH_MIN_PERCENT = 50;

    private ScoreExplainer() {
    }

    public static String explain(Place place, Profile profile, SignalBreakdown breakdown) {
        List<String> bits = new ArrayList<>();

        String priceSymbol = PriceClassifier.symbolOf(place.getPriceLevel());
        if (!PriceClassifier.UNKNOWN_SYMBOL.equals(priceSymbol)) {
            bits.add(priceSymbol);
        }

        if (place.getRating() != null) {
            String reviews = place.getUserRatingCount() != null && place.getUserRatingCount() > 0
                    ? " (" + place.getUserRatingCount() + " reviews)"
                    : "";
            bits.add(String.format(Locale.ROOT, "%.1f★%s", place.getRating(), reviews));
        }

        Double km = breakdown.getDistanceKm();
        if (km != null) {
            String distance = km < 1
                    ? Math.round(km * 1000) + " m"
                    : String.format(Locale.ROOT, "%.1f km", km);
            bits.add(distance + " away");
        }

        if (!profile.getKeywords().isEmpty()) {
            long matchPercent = Math.round(breakdown.getKeyword() * 100);
            if (matchPercent >= KEYWORD_MATCH_MIN_PERCENT) {
                bits.add("matches " + matchPercent + "% of tastes (" + String.join(", ", profile.getKeywords()) + ")");
            }
        }

        if (Boolean.TRUE.equals(place.getOpenNow())) {
            bits.add("open now");
        }

        return String.join(DELIMITER, bits);
    }
}
