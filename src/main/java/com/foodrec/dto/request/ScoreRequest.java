package com.foodrec.dto.request;

import com.foodrec.model.GeoPoint;
import com.foodrec.model.Place;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 단일 장소 점수 상세 요청 DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoreRequest {
    private Place place;
    private ProfileRequest profile;
    private GeoPoint origin;
}
