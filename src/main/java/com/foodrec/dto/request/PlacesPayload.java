package com.foodrec.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Google Places API v1 searchNearby / searchText / place details 응답 형태
 * 정규화에 필요한 필드만 매핑하고 나머지는 무시
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlacesPayload {
    private List<RawPlace> places;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RawPlace {
        private String id;
        private DisplayName displayName;
        private Location location;
        private List<String> types;
        private String primaryType;
        private String priceLevel; // "PRICE_LEVEL_MODERATE"
        private Double rating;
        private Long userRatingCount;
        private String nationalPhoneNumber;
        private String websiteUri;
        private EditorialSummary editorialSummary;
        private CurrentOpeningHours currentOpeningHours;

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class DisplayName {
            private String text;
            private String languageCode;
        }

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class Location {
            private Double latitude;
            private Double longitude;
        }

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class EditorialSummary {
            private String text;
            private String languageCode;
        }

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class CurrentOpeningHours {
            private Boolean openNow;
            private List<String> weekdayDescriptions;
        }
    }
}
