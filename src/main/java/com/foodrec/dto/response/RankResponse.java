package com.foodrec.dto.response;

import com.foodrec.model.RankingResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 랭킹 응답 DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RankResponse {
    private Integer total;
    private Integer returned;
    private List<RankedPlaceResponse> items;

    public static RankResponse from(RankingResult result) {
        List<RankedPlaceResponse> items = result.getItems().stream()
                .map(RankedPlaceResponse::from)
                .collect(Collectors.toList());
        return new RankResponse(result.getTotal(), result.getReturned(), items);
    }
}
