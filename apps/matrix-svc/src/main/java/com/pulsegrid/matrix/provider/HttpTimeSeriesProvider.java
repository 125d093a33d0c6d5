package com.pulsegrid.matrix.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulsegrid.matrix.config.PulsegridProperties;
import com.pulsegrid.matrix.model.DayRecord;
import com.pulsegrid.matrix.model.Metric;
import com.pulsegrid.matrix.model.SegmentFilter;
import com.pulsegrid.matrix.model.SegmentPairSeries;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Forecast API client. Blocking by design: the matrix run awaits each segment pair's response.
 */
@Component
public class HttpTimeSeriesProvider implements TimeSeriesProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpTimeSeriesProvider.class);
    private static final String SERIES_PATH = "/forecast/series";

    private final PulsegridProperties.Provider properties;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public record SeriesRequest(
            @JsonProperty("report_suite") String reportSuite,
            @JsonProperty("segments") List<String> segments,
            @JsonProperty("metrics") List<String> metrics,
            @JsonProperty("start") String start,
            @JsonProperty("end") String end,
            @JsonProperty("granularity") String granularity,
            @JsonProperty("lookback_days") int lookbackDays
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SeriesResponse(
            @JsonProperty("series") Map<String, List<DayPoint>> series,
            @JsonProperty("request_id") String requestId
    ) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record DayPoint(
                @JsonProperty("date") String date,
                @JsonProperty("actual") Double actual,
                @JsonProperty("forecast") Double forecast,
                @JsonProperty("upper") Double upper,
                @JsonProperty("lower") Double lower
        ) {}
    }

    @Autowired
    public HttpTimeSeriesProvider(PulsegridProperties properties, ObjectMapper objectMapper) {
        this(properties.provider(), objectMapper);
    }

    HttpTimeSeriesProvider(PulsegridProperties.Provider properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMsOrDefault()));
        requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMsOrDefault()));

        RestClient.Builder builder = RestClient.builder()
                .requestFactory(requestFactory)
                .baseUrl(properties.baseUrl())
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE);
        if (properties.hasApiKey()) {
            builder.defaultHeader("Authorization", "Bearer " + properties.apiKey());
        }
        this.restClient = builder.build();
        log.info("Forecast provider client configured: baseUrl='{}', readTimeoutMs={}, apiKeyPresent={}",
                properties.baseUrl(), properties.readTimeoutMsOrDefault(), properties.hasApiKey());
    }

    @Override
    public SegmentPairSeries fetch(
            SegmentFilter filter,
            List<Metric> metrics,
            LocalDate windowStart,
            LocalDate windowEnd,
            Granularity granularity
    ) {
        String pair = filter.describe();
        SeriesRequest request = new SeriesRequest(
                properties.reportSuite(),
                filter.segmentIds(),
                metrics.stream().map(Metric::id).toList(),
                windowStart.toString(),
                windowEnd.toString(),
                granularity.name().toLowerCase(),
                properties.lookbackDaysOrDefault()
        );
        String body;
        try {
            body = restClient.post()
                    .uri(SERIES_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException ex) {
            log.error("Forecast provider responded {} for {}", ex.getStatusCode().value(), pair);
            throw new ProviderException(pair,
                    "Forecast provider responded " + ex.getStatusCode().value() + " for " + pair, ex);
        } catch (RestClientException ex) {
            log.error("Forecast provider call failed for {}", pair, ex);
            throw new ProviderException(pair, "Forecast provider call failed for " + pair + ": " + ex.getMessage(), ex);
        }
        if (body == null || body.isBlank()) {
            throw new ProviderException(pair, "Forecast provider returned an empty body for " + pair, null);
        }
        return toSeries(pair, body);
    }

    private SegmentPairSeries toSeries(String pair, String body) {
        SeriesResponse response;
        try {
            response = objectMapper.readValue(body, SeriesResponse.class);
        } catch (JsonProcessingException ex) {
            throw new ProviderException(pair, "Unreadable forecast provider response for " + pair, ex);
        }
        if (response.series() == null) {
            return new SegmentPairSeries(Map.of());
        }
        Map<String, List<DayRecord>> series = new LinkedHashMap<>();
        response.series().forEach((metricId, points) -> {
            List<DayRecord> days = new ArrayList<>();
            if (points != null) {
                for (SeriesResponse.DayPoint point : points) {
                    days.add(toDayRecord(pair, metricId, point));
                }
            }
            series.put(metricId, List.copyOf(days));
        });
        log.debug("Forecast provider returned {} series for {} (requestId={})", series.size(), pair, response.requestId());
        return new SegmentPairSeries(series);
    }

    private DayRecord toDayRecord(String pair, String metricId, SeriesResponse.DayPoint point) {
        if (point == null || point.date() == null) {
            throw new ProviderException(pair, metricId, "Undated point in series for metric '" + metricId + "'", null);
        }
        try {
            return new DayRecord(LocalDate.parse(point.date()), point.actual(), point.forecast(), point.upper(), point.lower());
        } catch (DateTimeParseException ex) {
            throw new ProviderException(pair, metricId,
                    "Invalid date '" + point.date() + "' in series for metric '" + metricId + "'", ex);
        }
    }
}
