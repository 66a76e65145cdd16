package io.github.samzhu.billing.exception;

import java.time.LocalDate;

/**
 * 日期區間無效異常。
 *
 * <p>以下情況拋出此異常：
 * <ul>
 *   <li>計費起始日晚於結束日 (輸入錯誤)</li>
 *   <li>計算過程中切出的子區間反轉，或月份比例超出 (0, 1] (日期運算缺陷，正確輸入下不應出現)</li>
 * </ul>
 */
public class InvalidRangeException extends RuntimeException {

    private final LocalDate start;
    private final LocalDate end;

    public InvalidRangeException(LocalDate start, LocalDate end) {
        this(start, end, String.format("Invalid date range: start=%s is after end=%s", start, end));
    }

    public InvalidRangeException(LocalDate start, LocalDate end, String message) {
        super(message);
        this.start = start;
        this.end = end;
    }

    public LocalDate getStart() {
        return start;
    }

    public LocalDate getEnd() {
        return end;
    }
}
