package com.goormthonuniv.credibility.controller;

import com.goormthonuniv.credibility.dto.SortBy;
import com.goormthonuniv.credibility.dto.SortOrder;
import com.goormthonuniv.credibility.dto.SourceStats;
import com.goormthonuniv.credibility.dto.SourceStatsPage;
import com.goormthonuniv.credibility.dto.SourceStatsQuery;
import com.goormthonuniv.credibility.dto.TimeRange;
import com.goormthonuniv.credibility.service.SourceStatisticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/api/v1/sources")
@RequiredArgsConstructor
public class SourceStatsController {

    private final SourceStatisticsService service;

    @Operation(summary = "매체 신뢰도 목록", description = "기간/기사 유형/최소 기사 수로 거른 매체별 등급을 정렬·페이지네이션해 반환합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "400", description = "파라미터 오류")
    })
    @GetMapping
    public ResponseEntity<SourceStatsPage> list(
            @RequestParam(required = false) @Min(1) Integer minArticles,
            @RequestParam(required = false) String timeRange,
            @RequestParam(required = false) String articleType,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String sortOrder,
            @RequestParam(required = false) @Min(0) Integer limit,
            @RequestParam(required = false) @Min(0) Integer offset) {

        SourceStatsQuery query = new SourceStatsQuery(
                minArticles,
                TimeRange.fromParam(timeRange),
                articleType,
                SortBy.fromParam(sortBy),
                SortOrder.fromParam(sortOrder),
                limit,
                offset
        );
        return ResponseEntity.ok(service.getSourceStats(query));
    }

    @Operation(summary = "매체 신뢰도 상세")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "분석 이력이 없는 매체")
    })
    @GetMapping("/{publication}")
    public ResponseEntity<SourceStats> get(@PathVariable String publication) {
        return service.getSourceStatsById(publication)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
