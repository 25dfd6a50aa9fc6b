package com.foodrec.service.normalize;

import com.foodrec.dto.request.PlacesPayload;
import com.foodrec.model.GeoPoint;
import com.foodrec.model.Place;
import com.foodrec.model.PriceCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Google Places API v1 장소 → 정규화된 Place
 * 모든 필드를 채우되 값이 없으면 null(또는 기본값)으로 둠
 */
@Component
@Slf4j
public class PlaceNormalizer {

    public List<Place> normalizeAll(PlacesPayload payload) {
        if (payload == null || payload.getPlaces() == null) {
            return List.of();
        }
        return payload.getPlaces().stream()
                .filter(Objects::nonNull)
                .map(this::normalize)
                .collect(Collectors.toList());
    }

    public Place normalize(PlacesPayload.RawPlace raw) {
        if (raw.getId() == null) {
            log.debug("[PlaceNormalizer] place without id - name: {}",
                    raw.getDisplayName() != null ? raw.getDisplayName().getText() : null);
        }

        GeoPoint location = null;
        if (raw.getLocation() != null
                && raw.getLocation().getLatitude() != null
                && raw.getLocation().getLongitude() != null) {
            location = GeoPoint.of(raw.getLocation().getLatitude(), raw.getLocation().getLongitude());
        }

        return Place.builder()
                .placeId(raw.getId())
                .name(raw.getDisplayName() != null ? raw.getDisplayName().getText() : null)
                .rating(raw.getRating())
                .userRatingCount(raw.getUserRatingCount() != null ? raw.getUserRatingCount() : 0L)
                .priceLevel(PriceCategory.fromValue(raw.getPriceLevel()))
                .location(location)
                .openNow(raw.getCurrentOpeningHours() != null ? raw.getCurrentOpeningHours().getOpenNow() : null)
                .primaryType(raw.getPrimaryType())
                .types(raw.getTypes() != null ? Collections.unmodifiableList(new ArrayList<>(raw.getTypes())) : List.of())
                .phone(raw.getNationalPhoneNumber())
                .website(raw.getWebsiteUri())
                .summary(raw.getEditorialSummary() != null ? raw.getEditorialSummary().getText() : null)
                .build();
    }
}
