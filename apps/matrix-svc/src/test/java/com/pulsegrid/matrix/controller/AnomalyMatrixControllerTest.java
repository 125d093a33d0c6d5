package com.pulsegrid.matrix.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.pulsegrid.matrix.model.DayRecord;
import com.pulsegrid.matrix.model.SegmentPairSeries;
import com.pulsegrid.matrix.provider.ProviderException;
import com.pulsegrid.matrix.provider.TimeSeriesProvider;
import com.pulsegrid.matrix.security.TraceIdFilter;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class AnomalyMatrixControllerTest {

    private static final LocalDate MONDAY = LocalDate.of(2024, 3, 4);

    @Autowired
    MockMvc mockMvc;

    @MockBean
    TimeSeriesProvider provider;

    @Test
    void returnsMatrixInDeclaredOrder() throws Exception {
        stubWeek();

        mockMvc.perform(get("/anomaly-matrix").param("refresh", "true").header(TraceIdFilter.TRACE_HEADER, "trace-123"))
                .andExpect(status().isOk())
                .andExpect(header().string(TraceIdFilter.TRACE_HEADER, "trace-123"))
                .andExpect(jsonPath("$.windowStart").value("2024-03-04"))
                .andExpect(jsonPath("$.rows[0].id").value("seg-a1"))
                .andExpect(jsonPath("$.rows[1].id").value("seg-a2"))
                .andExpect(jsonPath("$.columns[0].name").value("SegB1"))
                .andExpect(jsonPath("$.metrics[1].polarity").value("HIGHER_IS_BAD"))
                .andExpect(jsonPath("$.metrics[1].decimals").value(1))
                .andExpect(jsonPath("$.cells.length()").value(4))
                .andExpect(jsonPath("$.cells[0].segmentA").value("seg-a1"))
                .andExpect(jsonPath("$.cells[0].metric").value("revenue"))
                .andExpect(jsonPath("$.cells[0].good").value(1))
                .andExpect(jsonPath("$.cells[0].bad").value(1))
                .andExpect(jsonPath("$.cells[0].net").value(0))
                .andExpect(jsonPath("$.traceId").value("trace-123"));
    }

    @Test
    void returnsSingleCellOrNotFound() throws Exception {
        stubWeek();

        mockMvc.perform(get("/anomaly-matrix/cells/seg-a2/seg-b1/bounce-rate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.good").value(1))
                .andExpect(jsonPath("$.bad").value(1));
        mockMvc.perform(get("/anomaly-matrix/cells/seg-a2/seg-b1/sessions"))
                .andExpect(status().isNotFound());
    }

    @Test
    void rejectsOversizedCellIdentifiers() throws Exception {
        mockMvc.perform(get("/anomaly-matrix/cells/{a}/seg-b1/revenue", "x".repeat(200)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void rebuildReturnsCreated() throws Exception {
        stubWeek();

        mockMvc.perform(post("/anomaly-matrix/runs"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.cells.length()").value(4));
    }

    @Test
    void providerFailureIsReportedWithSegmentPair() throws Exception {
        when(provider.fetch(any(), anyList(), any(), any(), any()))
                .thenThrow(new ProviderException("seg-a1 x seg-b1", "Forecast provider responded 503 for seg-a1 x seg-b1", null));

        mockMvc.perform(get("/anomaly-matrix").param("refresh", "true"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("PROVIDER_ERROR"))
                .andExpect(jsonPath("$.details.segmentPair").value("seg-a1 x seg-b1"))
                .andExpect(jsonPath("$.traceId").exists());
    }

    private void stubWeek() {
        List<DayRecord> week = List.of(
                new DayRecord(MONDAY, 100.0, 100.0, 110.0, 90.0),
                new DayRecord(MONDAY.plusDays(1), 200.0, 100.0, 150.0, 50.0),
                new DayRecord(MONDAY.plusDays(2), 10.0, 100.0, 150.0, 50.0),
                new DayRecord(MONDAY.plusDays(3), 100.0, 100.0, 110.0, 90.0),
                new DayRecord(MONDAY.plusDays(4), 105.0, 100.0, 110.0, 90.0)
        );
        when(provider.fetch(any(), anyList(), any(), any(), any()))
                .thenReturn(new SegmentPairSeries(Map.of("revenue", week, "bounce-rate", week)));
    }
}
