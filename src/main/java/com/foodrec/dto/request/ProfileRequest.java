package com.foodrec.dto.request;

import com.foodrec.model.Budget;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 사용자 선호 프로필 요청 DTO (정규화 전)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProfileRequest {
    private List<String> keywords; // ["vegan", "ramen"]
    private List<Object> priceLevels; // [1, 2] 또는 ["PRICE_LEVEL_MODERATE"], JSON 값 그대로 받음
    private Double minRating;
    private Boolean requireOpen;
    private Double maxDistanceKm;
    private Budget maxBudget;
}
