package com.foodrec.model;

import lombok.Builder;
import lombok.Value;

/**
 * 점수와 설명이 붙은 후보. 원본 Place는 변경하지 않음
 */
@Value
@Builder
public class ScoredCandidate {
    Place place;
    SignalBreakdown breakdown;
    String why;

    public double getScore() {
        return breakdown.getScore();
    }
}
