package com.foodrec.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 정규화된 사용자 선호 프로필
 * 요청 DTO는 ProfileNormalizer를 거쳐 이 형태가 됨
 */
@Value
@Builder
public class Profile {

    public static final double DEFAULT_MAX_DISTANCE_KM = 3.0;

    @Builder.Default
    List<String> keywords = List.of();

    /** 허용 가격 레벨 (0-4). 비어 있으면 선호 없음 */
    @Builder.Default
    List<Integer> priceLevels = List.of();

    @Builder.Default
    double minRating = 0.0;

    @Builder.Default
    boolean requireOpen = false;

    @Builder.Default
    double maxDistanceKm = DEFAULT_MAX_DISTANCE_KM;

    Budget maxBudget;

    public static Profile defaults() {
        return Profile.builder().build();
    }

    /**
     * 랭킹에 영향을 주는 선호가 하나라도 있는지
     */
    public boolean hasPreferences() {
        return !keywords.isEmpty()
                || !priceLevels.isEmpty()
                || minRating > 0
                || (maxBudget != null && maxBudget.getAmount() != null && maxBudget.getAmount() > 0);
    }
}
