package com.smartfix.request.controller;

import com.smartfix.request.model.ScoredRequest;
import com.smartfix.request.service.MatchingEngine;
import com.smartfix.shared.dto.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/providers")
@RequiredArgsConstructor
public class ProviderRecommendationController {

    private final MatchingEngine matchingEngine;

    @GetMapping("/{providerId}/recommendations")
    public ResponseEntity<ApiResponse<List<ScoredRequest>>> recommendations(
            @PathVariable("providerId") String providerId,
            @RequestParam(value = "limit", required = false) Integer limit) {

        return ResponseEntity.ok(ApiResponse.ok(matchingEngine.getRecommendationsForProvider(providerId, limit)));
    }
}
