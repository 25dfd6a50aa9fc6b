package com.foodrec.service.normalize;

import com.foodrec.dto.request.ProfileRequest;
import com.foodrec.model.PriceCategory;
import com.foodrec.model.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 요청 프로필 → 정규화된 Profile
 * 누락 필드는 기본값으로 채우고, 가격 레벨은 숫자/카테고리명 모두 허용
 */
@Component
public class ProfileNormalizer {

    private static final Pattern NUMERIC = Pattern.compile("-?\\d{1,9}");

    public Profile normalize(ProfileRequest request) {
        if (request == null) {
            return Profile.defaults();
        }

        List<String> keywords = request.getKeywords() == null
                ? List.of()
                : request.getKeywords().stream()
                        .map(keyword -> Objects.toString(keyword, ""))
                        .collect(Collectors.toUnmodifiableList());

        Double maxDistanceKm = request.getMaxDistanceKm();

        return Profile.builder()
                .keywords(keywords)
                .priceLevels(normalizePriceLevels(request.getPriceLevels()))
                .minRating(request.getMinRating() != null ? request.getMinRating() : 0.0)
                .requireOpen(Boolean.TRUE.equals(request.getRequireOpen()))
                .maxDistanceKm(maxDistanceKm != null && maxDistanceKm > 0 ? maxDistanceKm : Profile.DEFAULT_MAX_DISTANCE_KM)
                .maxBudget(request.getMaxBudget())
                .build();
    }

    /**
     * 2, 2.0, "2", "MODERATE", "PRICE_LEVEL_MODERATE" → 2
     * 정수가 아닌 숫자(2.5), boolean, 객체 등 해석할 수 없는 값은 버림
     */
    List<Integer> normalizePriceLevels(List<?> priceLevels) {
        if (priceLevels == null) {
            return List.of();
        }
        List<Integer> levels = new ArrayList<>();
        for (Object raw : priceLevels) {
            Integer level = null;
            if (raw instanceof Number) {
                level = ordinalOf((Number) raw);
            } else if (raw instanceof String) {
                level = levelOf((String) raw);
            }
            if (level != null) {
                levels.add(level);
            }
        }
        return List.copyOf(levels);
    }

    private static Integer ordinalOf(Number number) {
        double value = number.doubleValue();
        if (!Double.isFinite(value) || value != Math.rint(value) || Math.abs(value) > Integer.MAX_VALUE) {
            return null;
        }
        return (int) value;
    }

    private static Integer levelOf(String raw) {
        if (raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        if (NUMERIC.matcher(value).matches()) {
            return Integer.parseInt(value);
        }
        PriceCategory category = PriceCategory.fromValue(value);
        return category != null ? category.getLevel() : null;
    }
}
