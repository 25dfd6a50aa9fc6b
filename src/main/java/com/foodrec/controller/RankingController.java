package com.foodrec.controller;

import com.foodrec.dto.request.RankRequest;
import com.foodrec.dto.request.ScoreRequest;
import com.foodrec.dto.response.RankResponse;
import com.foodrec.dto.response.ScoreBreakdownResponse;
import com.foodrec.service.RankingService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 후보 랭킹 REST API 컨트롤러
 */
@RestController
@RequestMapping("/api/ranking")
@CrossOrigin(origins = {"http://localhost:3000"})
public class RankingController {

    @Autowired
    private RankingService rankingService;

    /**
     * 후보 랭킹 API
     * POST /api/ranking/rank
     * 후보 + 프로필 + 출발지를 받아 점수 내림차순 상위 topK개와 추천 이유를 반환
     */
    @PostMapping("/rank")
    public ResponseEntity<RankResponse> rank(@RequestBody RankRequest request) {
        return ResponseEntity.ok(RankResponse.from(rankingService.rank(request)));
    }

    /**
     * 단일 장소 점수 상세 API
     * POST /api/ranking/score
     */
    @PostMapping("/score")
    public ResponseEntity<ScoreBreakdownResponse> score(@RequestBody ScoreRequest request) {
        return ResponseEntity.ok(ScoreBreakdownResponse.from(rankingService.score(request)));
    }
}
