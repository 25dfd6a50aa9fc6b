package com.foodrec.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 정규화된 장소 (랭킹 후보)
 * placeId 외의 모든 필드는 null일 수 있음
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Place {
    String placeId;
    String name;
    Double rating; // 0-5
    Long userRatingCount;
    PriceCategory priceLevel;
    GeoPoint location;
    Boolean openNow; // true / false / null(알 수 없음)
    String primaryType;
    List<String> types;
    String phone;
    String website;
    String summary; // editorialSummary
}
