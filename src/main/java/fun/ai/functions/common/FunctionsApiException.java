package fun.ai.functions.common;

/**
 * 调用 functions 平台失败：携带平台返回的 HTTP 状态码与原因。
 * status 为空表示请求未拿到响应（连接失败、超时等）。
 */
public class FunctionsApiException extends RuntimeException {
    private final Integer status;
    private final String reason;

    public FunctionsApiException(Integer status, String reason) {
        super(reason);
        this.status = status;
        this.reason = reason;
    }

    public FunctionsApiException(String reason, Throwable cause) {
        super(reason, cause);
        this.status = null;
        this.reason = reason;
    }

    public Integer getStatus() {
        return status;
    }

    public String getReason() {
        return reason;
    }

    /**
     * 映射到对外的 HTTP 状态码：没有平台状态时按 500。
     */
    public int statusOrDefault() {
        return status == null ? 500 : status;
    }

    /**
     * 对外错误信息：优先平台原因，其次底层异常。
     */
    public String reasonOrDefault() {
        if (reason != null && !reason.isBlank()) {
            return reason;
        }
        return getCause() != null ? getCause().toString() : "functions error";
    }
}
