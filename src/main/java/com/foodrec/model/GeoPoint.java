package com.foodrec.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 위경도 좌표
 */
@Value
@Builder
@Jacksonized
public class GeoPoint {
    Double lat;
    Double lng;

    public static GeoPoint of(double lat, double lng) {
        return new GeoPoint(lat, lng);
    }

    /**
     * lat/lng 둘 다 있고 유한한 값인지
     */
    @JsonIgnore
    public boolean isComplete() {
        return lat != null && lng != null && Double.isFinite(lat) && Double.isFinite(lng);
    }
}
