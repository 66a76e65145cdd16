package io.github.samzhu.billing.controller;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.billing.dto.api.BillingPeriodResponse;
import io.github.samzhu.billing.dto.api.ScheduleRequest;
import io.github.samzhu.billing.dto.api.ScheduleResponse;
import io.github.samzhu.billing.service.BillingScheduleService;

/**
 * 計費排程 REST API 控制器。
 *
 * <p>提供以下端點：
 * <ul>
 *   <li>{@code POST /api/v1/schedules} - 產生排程 (含合計)</li>
 *   <li>{@code POST /api/v1/schedules/periods} - 產生排程，只回傳期間列表</li>
 * </ul>
 *
 * <p>日期參數使用 ISO 格式：{@code YYYY-MM-DD}
 */
@RestController
@RequestMapping("/api/v1/schedules")
public class ScheduleApiController {

    private static final Logger log = LoggerFactory.getLogger(ScheduleApiController.class);

    private final BillingScheduleService scheduleService;

    public ScheduleApiController(BillingScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    /**
     * 產生計費排程。
     *
     * @param request 排程請求
     * @return 各期明細與合計
     */
    @PostMapping
    public ResponseEntity<ScheduleResponse> createSchedule(@RequestBody @Validated ScheduleRequest request) {
        log.debug("Generating schedule: start={}, end={}, cycle={}, anchorDay={}",
            request.start(), request.end(), request.cycleLength(), request.cycleAnchorDay());

        return ResponseEntity.ok(scheduleService.generateSchedule(request));
    }

    /**
     * 產生計費排程，只回傳依序排列的期間。
     *
     * @param request 排程請求
     * @return 計費期間列表
     */
    @PostMapping("/periods")
    public ResponseEntity<List<BillingPeriodResponse>> createSchedulePeriods(
            @RequestBody @Validated ScheduleRequest request) {
        log.debug("Generating schedule periods: start={}, end={}, cycle={}, anchorDay={}",
            request.start(), request.end(), request.cycleLength(), request.cycleAnchorDay());

        return ResponseEntity.ok(scheduleService.generateSchedule(request).periods());
    }
}
