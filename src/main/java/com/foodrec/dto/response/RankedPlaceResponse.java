package com.foodrec.dto.response;

import com.foodrec.model.GeoPoint;
import com.foodrec.model.Place;
import com.foodrec.model.PriceCategory;
import com.foodrec.model.ScoredCandidate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * 랭킹 결과 항목 DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankedPlaceResponse {

    private static final int SCORE_SCALE = 4;

    private String placeId;
    private String name;
    private Double rating;
    private Long userRatingCount;
    private PriceCategory priceLevel; // "PRICE_LEVEL_MODERATE"
    private GeoPoint location;
    private Boolean openNow;
    private double score; // 소수점 4자리 반올림 (정렬은 반올림 전 값 기준)
    private String why;
    private String website;
    private String phone;
    private List<String> types;
    private String primaryType;

    public static RankedPlaceResponse from(ScoredCandidate candidate) {
        Place place = candidate.getPlace();
        return RankedPlaceResponse.builder()
                .placeId(place.getPlaceId())
                .name(place.getName())
                .rating(place.getRating())
                .userRatingCount(place.getUserRatingCount())
                .priceLevel(place.getPriceLevel())
                .location(place.getLocation())
                .openNow(place.getOpenNow())
                .score(roundScore(candidate.getScore()))
                .why(candidate.getWhy())
                .website(place.getWebsite())
                .phone(place.getPhone())
                .types(place.getTypes() != null ? place.getTypes() : List.of())
                .primaryType(place.getPrimaryType())
                .build();
    }

    static double roundScore(double score) {
        return BigDecimal.valueOf(score).setScale(SCORE_SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
