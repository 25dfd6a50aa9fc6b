package com.foodrec.service.scoring;

import com.foodrec.model.Budget;
import com.foodrec.model.PriceCategory;

import java.util.Set;

/**
 * 가격 카테고리 ↔ 레벨/심볼 변환, 예산 → 허용 가격 레벨 추정
 */
public final class PriceClassifier {

    public static final String UNKNOWN_SYMBOL = "–";

    private PriceClassifier() {
    }

    public static Integer levelOf(PriceCategory category) {
        return category != null ? category.getLevel() : null;
    }

    public static String symbolOf(PriceCategory category) {
        return category != null ? category.getSymbol() : UNKNOWN_SYMBOL;
    }

    /**
     * 1인 예산 금액 → 허용 가격 레벨 (휴리스틱 구간)
     * 통화 환산은 하지 않음: 한 기준 통화 구간표를 모든 통화에 그대로 사용
     *
     * @return 예산이 없거나 0 이하이면 null (제약 없음)
     */
    public static Set<Integer> budgetToLevels(Budget budget) {
        if (budget == null || budget.getAmount() == null || budget.getAmount() <= 0) {
            return null;
        }
        double amount = budget.getAmount();
        if (amount <= 50) {
            return Set.of(0, 1);
        } else if (amount <= 100) {
            return Set.of(1, 2);
        } else if (amount <= 200) {
            return Set.of(2, 3);
        } else {
            return Set.of(3, 4);
        }
    }
}
