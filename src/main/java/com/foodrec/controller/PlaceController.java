package com.foodrec.controller;

import com.foodrec.dto.request.PlacesPayload;
import com.foodrec.dto.response.CandidatesResponse;
import com.foodrec.model.Place;
import com.foodrec.service.normalize.PlaceNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 장소 데이터 정규화 REST API 컨트롤러
 */
@RestController
@RequestMapping("/api/places")
@CrossOrigin(origins = {"http://localhost:3000"})
@Slf4j
public class PlaceController {

    @Autowired
    private PlaceNormalizer placeNormalizer;

    /**
     * Google Places API v1 응답 정규화 API
     * POST /api/places/normalize
     * 결과의 candidates는 /api/ranking/rank 요청에 그대로 넣을 수 있음
     */
    @PostMapping("/normalize")
    public ResponseEntity<CandidatesResponse> normalize(@RequestBody PlacesPayload payload) {
        List<Place> candidates = placeNormalizer.normalizeAll(payload);
        log.info("[PlaceController] normalized places - count: {}", candidates.size());
        return ResponseEntity.ok(new CandidatesResponse(candidates));
    }
}
