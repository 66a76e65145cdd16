package io.github.samzhu.billing.exception;

/**
 * 計費參數無效異常。
 *
 * <p>錨定日超出 1-28、單價/月用量/總量上限非正數、必要欄位缺漏、
 * 或未知的計費週期代碼時拋出。整個排程請求失敗，不回傳部分結果。
 */
public class InvalidParameterException extends RuntimeException {

    private final String parameterName;

    public InvalidParameterException(String parameterName, String message) {
        super(String.format("Invalid parameter '%s': %s", parameterName, message));
        this.parameterName = parameterName;
    }

    public String getParameterName() {
        return parameterName;
    }
}
