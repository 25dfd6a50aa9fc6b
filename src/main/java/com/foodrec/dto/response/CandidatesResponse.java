package com.foodrec.dto.response;

import com.foodrec.model.Place;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 정규화된 후보 목록 DTO. 그대로 랭킹 요청의 candidates로 사용 가능
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CandidatesResponse {
    private List<Place> candidates;
}
