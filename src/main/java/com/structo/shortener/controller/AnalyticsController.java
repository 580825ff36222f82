package com.structo.shortener.controller;

import com.structo.shortener.dto.LinkAnalyticsResponse;
import com.structo.shortener.exception.UnauthorizedException;
import com.structo.shortener.service.AnalyticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/urls")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AnalyticsService analyticsService;

    @GetMapping("/{code}/analytics")
    public ResponseEntity<LinkAnalyticsResponse> getAnalytics(
            @RequestAttribute(value = "userId", required = false) Long userId,
            @PathVariable String code) {

        if (userId == null) {
            throw new UnauthorizedException();
        }
        return ResponseEntity.ok(analyticsService.summarizeOwned(code, userId));
    }
}
