package com.structo.shortener.controller;

import com.structo.shortener.dto.DailyCount;
import com.structo.shortener.dto.LinkAnalyticsResponse;
import com.structo.shortener.dto.NamedCount;
import com.structo.shortener.exception.ShortLinkNotFoundException;
import com.structo.shortener.service.AnalyticsService;
import com.structo.shortener.service.JwtService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AnalyticsController.class)
class AnalyticsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AnalyticsService analyticsService;

    @MockitoBean
    private JwtService jwtService;

    @BeforeEach
    void setUp() {
        when(jwtService.extractUserId("good-token")).thenReturn(7L);
    }

    @Test
    void analytics_requiresToken() throws Exception {
        mockMvc.perform(get("/api/v1/urls/abc2345/analytics"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(analyticsService);
    }

    @Test
    void analytics_rendersSummary() throws Exception {
        LinkAnalyticsResponse summary = LinkAnalyticsResponse.builder()
                .shortCode("abc2345")
                .originalUrl("https://example.com")
                .totalClicks(3)
                .uniqueVisitors(2)
                .clicksByDay(List.of(new DailyCount(LocalDate.of(2026, 4, 1), 3L)))
                .topCountries(List.of(new NamedCount("US", 2L)))
                .topBrowsers(List.of())
                .topOs(List.of())
                .topDevices(List.of(new NamedCount("unknown", 3L)))
                .topReferrers(List.of())
                .build();
        when(analyticsService.summarizeOwned("abc2345", 7L)).thenReturn(summary);

        mockMvc.perform(get("/api/v1/urls/abc2345/analytics").header("Authorization", "Bearer good-token"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_clicks").value(3))
                .andExpect(jsonPath("$.unique_visitors").value(2))
                .andExpect(jsonPath("$.clicks_by_day[0].date").value("2026-04-01"))
                .andExpect(jsonPath("$.top_countries[0].name").value("US"))
                .andExpect(jsonPath("$.top_devices[0].name").value("unknown"));
    }

    @Test
    void analytics_foreignLinkIsNotFound() throws Exception {
        when(analyticsService.summarizeOwned("theirs1", 7L)).thenThrow(new ShortLinkNotFoundException());

        mockMvc.perform(get("/api/v1/urls/theirs1/analytics").header("Authorization", "Bearer good-token"))
                .andExpect(status().isNotFound());
    }
}
