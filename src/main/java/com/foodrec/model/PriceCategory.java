package com.foodrec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Google Places API v1 priceLevel 카테고리
 * 각 카테고리는 서수 레벨(0-4)과 표시용 심볼을 가짐
 */
public enum PriceCategory {
    FREE(0, "$"),
    INEXPENSIVE(1, "$"),
    MODERATE(2, "$$"),
    EXPENSIVE(3, "$$$"),
    VERY_EXPENSIVE(4, "$$$$");

    private static final String PROVIDER_PREFIX = "PRICE_LEVEL_";

    private final int level;
    private final String symbol;

    PriceCategory(int level, String symbol) {
        this.level = level;
        this.symbol = symbol;
    }

    public int getLevel() {
        return level;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * API 응답 형식 ("PRICE_LEVEL_MODERATE")
     */
    @JsonValue
    public String getProviderName() {
        return PROVIDER_PREFIX + name();
    }

    /**
     * "MODERATE", "PRICE_LEVEL_MODERATE", "2" 모두 허용
     * 알 수 없는 값(PRICE_LEVEL_UNSPECIFIED 등)은 null
     */
    @JsonCreator
    public static PriceCategory fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith(PROVIDER_PREFIX)) {
            normalized = normalized.substring(PROVIDER_PREFIX.length());
        }
        for (PriceCategory category : values()) {
            if (category.name().equals(normalized)) {
                return category;
            }
        }
        try {
            return fromLevel(Integer.parseInt(normalized));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static PriceCategory fromLevel(int level) {
        for (PriceCategory category : values()) {
            if (category.level == level) {
                return category;
            }
        }
        return null;
    }
}
