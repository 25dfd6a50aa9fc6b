package com.foodrec.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RankingResult {
    int total;
    int returned;
    List<ScoredCandidate> items;
}
