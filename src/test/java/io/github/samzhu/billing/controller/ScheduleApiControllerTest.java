package io.github.samzhu.billing.controller;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class ScheduleApiControllerTest {

    private static final String QUARTERLY_REQUEST = """
        {
          "start": "2025-02-15",
          "cycleAnchorDay": 2,
          "end": "2025-12-31",
          "cycleLength": "quarterly",
          "pricePerMonth": 10,
          "quantityPerMonth": 5,
          "maxQuantity": 5000000
        }
        """;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void shouldReturnScheduleWithTotals() throws Exception {
        mockMvc.perform(post("/api/v1/schedules")
                .contentType(MediaType.APPLICATION_JSON)
                .content(QUARTERLY_REQUEST))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.period_count").value(5))
            .andExpect(jsonPath("$.periods", hasSize(5)))
            .andExpect(jsonPath("$.periods[0].billing_start").value("2025-02-15"))
            .andExpect(jsonPath("$.periods[0].billing_end").value("2025-03-01"))
            .andExpect(jsonPath("$.periods[0].prorated").value(true))
            .andExpect(jsonPath("$.periods[0].breakdown", hasSize(2)))
            .andExpect(jsonPath("$.periods[0].breakdown[0].month").value("Feb 2025"))
            .andExpect(jsonPath("$.periods[0].breakdown[0].active_days").value(14))
            .andExpect(jsonPath("$.periods[0].breakdown[0].total_days").value(28))
            .andExpect(jsonPath("$.periods[2].billing_start").value("2025-06-02"))
            .andExpect(jsonPath("$.periods[2].prorated").value(false))
            .andExpect(jsonPath("$.periods[4].billing_end").value("2025-12-31"));
    }

    @Test
    void shouldReturnBarePeriodList() throws Exception {
        mockMvc.perform(post("/api/v1/schedules/periods")
                .contentType(MediaType.APPLICATION_JSON)
                .content(QUARTERLY_REQUEST))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(5)))
            .andExpect(jsonPath("$[1].billing_start").value("2025-03-02"))
            .andExpect(jsonPath("$[1].billing_end").value("2025-06-01"));
    }

    @Test
    void shouldRejectStartAfterEnd() throws Exception {
        String body = QUARTERLY_REQUEST
            .replace("\"start\": \"2025-02-15\"", "\"start\": \"2026-01-01\"");

        mockMvc.perform(post("/api/v1/schedules")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.title").value("Invalid date range"))
            .andExpect(jsonPath("$.detail", containsString("2026-01-01")));
    }

    @Test
    void shouldRejectAnchorDayOutsideRange() throws Exception {
        String body = QUARTERLY_REQUEST.replace("\"cycleAnchorDay\": 2", "\"cycleAnchorDay\": 29");

        mockMvc.perform(post("/api/v1/schedules")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.title").value("Validation failed"))
            .andExpect(jsonPath("$.detail", containsString("cycleAnchorDay")));
    }

    @Test
    void shouldRejectUnknownCycleLength() throws Exception {
        String body = QUARTERLY_REQUEST.replace("\"quarterly\"", "\"yearly\"");

        mockMvc.perform(post("/api/v1/schedules")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.title").value("Invalid parameter"))
            .andExpect(jsonPath("$.parameter").value("cycleLength"));
    }

    @Test
    void shouldRejectMalformedDate() throws Exception {
        String body = QUARTERLY_REQUEST.replace("\"2025-12-31\"", "\"31/12/2025\"");

        mockMvc.perform(post("/api/v1/schedules")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.title").value("Malformed request"));
    }
}
