package com.foodrec.dto.request;

import com.foodrec.model.GeoPoint;
import com.foodrec.model.Place;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 랭킹 요청 DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RankRequest {
    private List<Place> candidates;
    private ProfileRequest profile;
    private GeoPoint origin; // 없으면 거리 신호는 중립값
    private Integer topK; // 미지정 시 ranking.default-top-k
}
