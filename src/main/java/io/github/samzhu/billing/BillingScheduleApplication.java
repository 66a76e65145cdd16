package io.github.samzhu.billing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Billing Schedule Service - 訂閱計費排程與按日比例計算服務。
 *
 * <p>此服務依訂閱的起訖日期、計費週期與錨定日，計算出完整的計費排程：
 * <ul>
 *   <li>將任意日期區間切分為以日曆月為單位的片段</li>
 *   <li>依實際使用天數計算每月使用比例 (按日比例)</li>
 *   <li>以錨定日對齊每個計費週期的邊界</li>
 *   <li>以總量上限截斷最後一個計費週期</li>
 *   <li>提供 REST API 產生排程</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * ScheduleRequest → PeriodBuilder (週期邊界)
 *                        ↓
 *                  MonthFractionator (月份比例與明細)
 *                        ↓
 *                  CapEnforcer (上限截斷)
 *                        ↓
 *                  List&lt;BillingPeriod&gt; → ScheduleSummaryLogger / API 回應
 * </pre>
 */
@SpringBootApplication
public class BillingScheduleApplication {

    private static final Logger log = LoggerFactory.getLogger(BillingScheduleApplication.class);

    public static void main(String[] args) {
        log.info("Starting Billing Schedule Service - Prorated Billing Calculation");
        SpringApplication.run(BillingScheduleApplication.class, args);
    }
}
