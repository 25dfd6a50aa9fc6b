package com.foodrec.service.scoring;

import com.foodrec.model.GeoPoint;

/**
 * 두 좌표 간 대원 거리 (Haversine 공식)
 */
public final class GeoDistance {

    private static final double EARTH_RADIUS_KM = 6371.0;

    private GeoDistance() {
    }

    /**
     * @return km 단위 거리. 어느 한쪽이라도 없으면 null
     */
    public static Double distanceKm(GeoPoint a, GeoPoint b) {
        if (a == null || b == null || !a.isComplete() || !b.isComplete()) {
            return null;
        }
        return distanceKm(a.getLat(), a.getLng(), b.getLat(), b.getLng());
    }

    public static double distanceKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);

        double sinDLat = Math.sin(dLat / 2);
        double sinDLon = Math.sin(dLon / 2);

        double h = sinDLat * sinDLat +
                Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2)) * sinDLon * sinDLon;

        double c = 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
        return EARTH_RADIUS_KM * c;
    }
}
