package io.github.samzhu.billing.dto;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import io.github.samzhu.billing.exception.InvalidParameterException;

/**
 * 計費週期，每個週期涵蓋固定的月數。
 */
public enum BillingCycle {

    MONTHLY("monthly", 1),
    QUARTERLY("quarterly", 3),
    HALF_YEARLY("half-yearly", 6);

    private final String code;
    private final int months;

    BillingCycle(String code, int months) {
        this.code = code;
        this.months = months;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public int months() {
        return months;
    }

    /**
     * 由代碼解析週期，不分大小寫，亦接受列舉常數名稱 (如 {@code HALF_YEARLY})。
     *
     * @param value 週期代碼，如 monthly、quarterly、half-yearly
     * @return 對應的週期
     * @throws InvalidParameterException 若代碼為 null 或無法辨識
     */
    @JsonCreator
    public static BillingCycle fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidParameterException("cycleLength", "must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (BillingCycle cycle : values()) {
            if (cycle.code.equals(normalized) || cycle.name().equalsIgnoreCase(normalized)) {
                return cycle;
            }
        }
        throw new InvalidParameterException("cycleLength",
            "unknown billing cycle '" + value + "', expected monthly, quarterly or half-yearly");
    }
}
