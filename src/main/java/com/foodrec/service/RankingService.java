package com.foodrec.service;

import com.foodrec.dto.request.RankRequest;
import com.foodrec.dto.request.ScoreRequest;
import com.foodrec.exception.ValidationException;
import com.foodrec.model.Profile;
import com.foodrec.model.RankingResult;
import com.foodrec.model.ScoredCandidate;
import com.foodrec.service.normalize.ProfileNormalizer;
import com.foodrec.service.scoring.RankSelector;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 후보 랭킹 메인 서비스
 * 후보별 점수 계산은 고정 크기 스레드 풀로 병렬 처리
 */
@Service
@Slf4j
public class RankingService {

    private final ProfileNormalizer profileNormalizer;
    private final int defaultTopK;

    // worker-threads가 1 이하이면 null (호출 스레드에서 순차 처리)
    private final ExecutorService executorService;
    private final RankSelector rankSelector;

    public RankingService(ProfileNormalizer profileNormalizer,
                          @Value("${ranking.default-top-k:10}") int defaultTopK,
                          @Value("${ranking.worker-threads:4}") int workerThreads) {
        this.profileNormalizer = profileNormalizer;
        this.defaultTopK = defaultTopK;
        if (workerThreads > 1) {
            this.executorService = Executors.newFixedThreadPool(workerThreads);
            this.rankSelector = new RankSelector(executorService);
        } else {
            this.executorService = null;
            this.rankSelector = new RankSelector();
        }
    }

    public RankingResult rank(RankRequest request) {
        final long t0 = System.nanoTime();
        Profile profile = profileNormalizer.normalize(request.getProfile());
        int topK = request.getTopK() != null ? request.getTopK() : defaultTopK;

        log.info("[RankingService] rank start - totalCandidates: {}, topK: {}, profile: {}, hasOrigin: {}",
                request.getCandidates() != null ? request.getCandidates().size() : null,
                topK, profile, request.getOrigin() != null);
        if (!profile.hasPreferences()) {
            log.warn("[RankingService] profile has no preferences, ranking by quality/distance/open only");
        }

        RankingResult result = rankSelector.rank(request.getCandidates(), profile, request.getOrigin(), topK);

        log.info("[RankingService] rank ok - returned: {}, elapsedMs: {}",
                result.getReturned(), (System.nanoTime() - t0) / 1_000_000L);
        return result;
    }

    /**
     * 단일 장소의 신호별 점수 (랭킹 디버깅용)
     */
    public ScoredCandidate score(ScoreRequest request) {
        if (request.getPlace() == null) {
            throw new ValidationException("\"place\" is required");
        }
        RankSelector.validateOrigin(request.getOrigin());
        Profile profile = profileNormalizer.normalize(request.getProfile());

        ScoredCandidate scored = RankSelector.score(request.getPlace(), profile, request.getOrigin());
        log.debug("[RankingService] score - placeId: {}, score: {}, breakdown: {}",
                request.getPlace().getPlaceId(), scored.getScore(), scored.getBreakdown());
        return scored;
    }

    @PreDestroy
    public void shutdown() {
        if (executorService != null) {
            executorService.shutdown();
        }
    }
}
