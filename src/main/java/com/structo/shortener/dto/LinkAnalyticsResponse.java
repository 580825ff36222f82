package com.structo.shortener.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class LinkAnalyticsResponse {
    @JsonProperty("short_code")
    private String shortCode;
    @JsonProperty("original_url")
    private String originalUrl;
    @JsonProperty("total_clicks")
    private long totalClicks;
    @JsonProperty("unique_visitors")
    private long uniqueVisitors;
    @JsonProperty("clicks_by_day")
    private List<DailyCount> clicksByDay;
    @JsonProperty("top_countries")
    private List<NamedCount> topCountries;
    @JsonProperty("top_browsers")
    private List<NamedCount> topBrowsers;
    @JsonProperty("top_os")
    private List<NamedCount> topOs;
    @JsonProperty("top_devices")
    private List<NamedCount> topDevices;
    @JsonProperty("top_referrers")
    private List<NamedCount> topReferrers;
}
