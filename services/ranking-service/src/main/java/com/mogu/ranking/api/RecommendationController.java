package com.mogu.ranking.api;

import com.mogu.ranking.api.dto.ErrorResponse;
import com.mogu.ranking.api.dto.RecommendationResponse;
import com.mogu.ranking.ranking.ScoredListing;
import com.mogu.ranking.ranking.SortMode;
import com.mogu.ranking.service.RecommendationRequest;
import com.mogu.ranking.service.RecommendationResult;
import com.mogu.ranking.service.RecommendationService;
import jakarta.servlet.http.HttpServletRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RecommendationController {
    private final RecommendationService recommendationService;

    public RecommendationController(RecommendationService recommendationService) {
        this.recommendationService = recommendationService;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @GetMapping("/v1/posts/recommended")
    public ResponseEntity<?> recommended(
        @RequestParam(value = "latitude", required = false) Double latitude,
        @RequestParam(value = "longitude", required = false) Double longitude,
        @RequestParam(value = "radius", required = false) Double radius,
        @RequestParam(value = "category", required = false) String category,
        @RequestParam(value = "mogu_market", required = false) String market,
        @RequestParam(value = "sort", required = false) String sort,
        @RequestParam(value = "page", defaultValue = "1") int page,
        @RequestParam(value = "size", required = false) Integer size,
        @RequestParam(value = "debug", defaultValue = "false") boolean debug,
        @RequestHeader(value = "x-user-id", required = false) String userHeader,
        HttpServletRequest httpRequest
    ) {
        long started = System.nanoTime();
        String traceId = RequestIdUtil.resolveOrGenerate(httpRequest, RequestLoggingFilter.TRACE_ID);
        String requestId = RequestIdUtil.resolveOrGenerate(httpRequest, RequestLoggingFilter.REQUEST_ID);

        if (latitude == null || !Double.isFinite(latitude) || latitude < -90.0 || latitude > 90.0) {
            return badRequest("latitude is required and must be within [-90, 90]", traceId, requestId);
        }
        if (longitude == null || !Double.isFinite(longitude) || longitude < -180.0 || longitude > 180.0) {
            return badRequest("longitude is required and must be within [-180, 180]", traceId, requestId);
        }
        if (radius != null && !(radius > 0.0 && Double.isFinite(radius))) {
            return badRequest("radius must be a positive number", traceId, requestId);
        }
        if (page < 1) {
            return badRequest("page must be >= 1", traceId, requestId);
        }
        if (size != null && size < 1) {
            return badRequest("size must be >= 1", traceId, requestId);
        }
        SortMode sortMode = SortMode.fromParam(sort);
        if (sortMode == null) {
            return badRequest("sort must be one of ai_recommended, recent, distance", traceId, requestId);
        }
        UUID userId = null;
        if (userHeader != null && !userHeader.isBlank()) {
            try {
                userId = UUID.fromString(userHeader.trim());
            } catch (IllegalArgumentException ex) {
                return badRequest("x-user-id must be a UUID", traceId, requestId);
            }
        }

        RecommendationResult result = recommendationService.recommend(new RecommendationRequest(
            latitude,
            longitude,
            radius,
            category,
            market,
            sortMode,
            page,
            size,
            userId
        ));

        RecommendationResponse response = toResponse(result, debug);
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        response.setTookMs((System.nanoTime() - started) / 1_000_000L);
        return ResponseEntity.ok(response);
    }

    private RecommendationResponse toResponse(RecommendationResult result, boolean debug) {
        RecommendationResponse response = new RecommendationResponse();
        response.setPage(result.page().page());
        response.setSize(result.page().size());
        response.setTotal(result.page().total());
        response.setSort(result.sort().param());

        List<String> postIds = new ArrayList<>(result.page().items().size());
        List<RecommendationResponse.Hit> hits = new ArrayList<>(result.page().items().size());
        int rank = (result.page().page() - 1) * result.page().size();
        for (ScoredListing entry : result.page().items()) {
            postIds.add(entry.id());
            RecommendationResponse.Hit hit = new RecommendationResponse.Hit();
            hit.setPostId(entry.id());
            hit.setRank(++rank);
            hit.setFinalScore(entry.finalScore());
            hit.setV0(entry.v0());
            hit.setV1(entry.v1());
            hit.setDistanceKm(entry.listing().distanceKm());
            hit.setReputation(entry.listing().reputation());
            hits.add(hit);
        }
        response.setPostIds(postIds);

        if (debug) {
            response.setHits(hits);
            RecommendationResponse.DebugInfo info = new RecommendationResponse.DebugInfo();
            info.setHistoryStrength(result.historyStrength());
            info.setW0(result.weights() == null ? null : result.weights().w0());
            info.setW1(result.weights() == null ? null : result.weights().w1());
            info.setCfCoverage(result.cfCoverage());
            info.setCandidates(result.candidates());
            info.setReasonCodes(result.reasonCodes());
            response.setDebug(info);
        }
        return response;
    }

    private ResponseEntity<ErrorResponse> badRequest(String message, String traceId, String requestId) {
        return ResponseEntity.badRequest().body(new ErrorResponse("bad_request", message, traceId, requestId));
    }
}
