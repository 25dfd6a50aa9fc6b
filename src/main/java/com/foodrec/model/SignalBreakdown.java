package com.foodrec.model;

import lombok.Builder;
import lombok.Value;

/**
 * 한 후보에 대한 신호별 점수와 최종 점수
 * 점수 계산과 설명 문구 생성이 같은 값을 공유함
 */
@Value
@Builder
public class SignalBreakdown {
    Double distanceKm; // origin 또는 location이 없으면 null
    double keyword;
    double price;
    double quality;
    double distance;
    double open;
    double ratingPenalty;
    double score;
}
