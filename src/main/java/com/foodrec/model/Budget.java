package com.foodrec.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 1인 최대 예산. currency는 기록용이며 환산하지 않음
 */
@Value
@Builder
@Jacksonized
public class Budget {
    Double amount;
    String currency;
}
