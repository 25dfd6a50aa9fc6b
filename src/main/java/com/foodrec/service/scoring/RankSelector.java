package com.foodrec.service.scoring;

import com.foodrec.exception.ValidationException;
import com.foodrec.model.GeoPoint;
import com.foodrec.model.Place;
import com.foodrec.model.Profile;
import com.foodrec.model.RankingResult;
import com.foodrec.model.ScoredCandidate;
import com.foodrec.model.SignalBreakdown;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 후보 전체를 점수화한 뒤 점수 내림차순으로 정렬하고 상위 topK개만 반환
 *
 * 후보별 점수 계산은 서로 독립적이라 executor로 병렬 실행할 수 있음.
 * 결과는 입력 순서대로 모은 뒤 한 번에 안정 정렬하므로 동점이면 입력 순서가 유지됨
 */
public class RankSelector {

    public static final int DEFAULT_TOP_K = 10;

    private static final Comparator<ScoredCandidate> BY_SCORE_DESC =
            Comparator.comparingDouble(ScoredCandidate::getScore).reversed();

    private final Executor executor;

    /**
     * 호출 스레드에서 순차 실행
     */
    public RankSelector() {
        this(Runnable::run);
    }

    public RankSelector(Executor executor) {
        this.executor = executor;
    }

    public RankingResult rank(List<Place> candidates, Profile profile, GeoPoint origin) {
        return rank(candidates, profile, origin, DEFAULT_TOP_K);
    }

    public RankingResult rank(List<Place> candidates, Profile profile, GeoPoint origin, int topK) {
        validate(candidates, origin, topK);
        Profile effectiveProfile = profile != null ? profile : Profile.defaults();

        List<CompletableFuture<ScoredCandidate>> futures = new ArrayList<>(candidates.size());
        for (Place place : candidates) {
            futures.add(CompletableFuture.supplyAsync(() -> score(place, effectiveProfile, origin), executor));
        }

        List<ScoredCandidate> scored = new ArrayList<>(futures.size());
        for (CompletableFuture<ScoredCandidate> future : futures) {
            scored.add(future.join());
        }

        // List.sort는 안정 정렬
        scored.sort(BY_SCORE_DESC);
        List<ScoredCandidate> items = List.copyOf(scored.subList(0, Math.min(topK, scored.size())));

        return RankingResult.builder()
                .total(candidates.size())
                .returned(items.size())
                .items(items)
                .build();
    }

    /**
     * 후보 하나의 점수와 설명
     */
    public static ScoredCandidate score(Place place, Profile profile, GeoPoint origin) {
        SignalBreakdown breakdown = ScoreAggregator.aggregate(place, profile, origin);
        return ScoredCandidate.builder()
                .place(place)
                .breakdown(breakdown)
                .why(ScoreExplainer.explain(place, profile, breakdown))
                .build();
    }

    static void validate(List<Place> candidates, GeoPoint origin, int topK) {
        if (candidates == null) {
            throw new ValidationException("\"candidates\" must be an array of normalized places");
        }
        for (int i = 0; i < candidates.size(); i++) {
            if (candidates.get(i) == null) {
                throw new ValidationException("\"candidates\" must not contain null entries", Map.of("index", i));
            }
        }
        validateOrigin(origin);
        if (topK <= 0) {
            throw new ValidationException("\"topK\" must be a positive number", Map.of("topK", topK));
        }
    }

    public static void validateOrigin(GeoPoint origin) {
        if (origin != null && !origin.isComplete()) {
            throw new ValidationException("\"origin\" must have { lat:number, lng:number }");
        }
    }
}
