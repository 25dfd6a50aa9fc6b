package com.foodrec.dto.response;

import com.foodrec.model.ScoredCandidate;
import com.foodrec.model.SignalBreakdown;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 단일 장소의 신호별 점수 상세 DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreBreakdownResponse {
    private String placeId;
    private double score;
    private String why;
    private Double distanceKm;
    private double ratingPenalty;
    private Signals signals;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Signals {
        private double keyword;
        private double price;
        private double quality;
        private double distance;
        private double open;
    }

    public static ScoreBreakdownResponse from(ScoredCandidate candidate) {
        SignalBreakdown breakdown = candidate.getBreakdown();
        return ScoreBreakdownResponse.builder()
                .placeId(candidate.getPlace().getPlaceId())
                .score(RankedPlaceResponse.roundScore(breakdown.getScore()))
                .why(candidate.getWhy())
                .distanceKm(breakdown.getDistanceKm())
                .ratingPenalty(breakdown.getRatingPenalty())
                .signals(new Signals(
                        breakdown.getKeyword(),
                        breakdown.getPrice(),
                        breakdown.getQuality(),
                        breakdown.getDistance(),
                        breakdown.getOpen()))
                .build();
    }
}
