package fun.ai.functions.common;

import com.fasterxml.jackson.annotation.JsonAnyGetter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 统一响应体。
 *
 * <pre>
 * 成功：{"app": {...}, "message": "..."} / {"apps": [...], "message": "..."} / {"message": "..."}
 * 失败：{"error": {"message": "..."}}
 * </pre>
 */
public class Result {

    private final Map<String, Object> body = new LinkedHashMap<>();

    private Result() {
    }

    public static Result success(String key, Object data, String message) {
        Result r = new Result();
        r.body.put(key, data);
        r.body.put("message", message);
        return r;
    }

    public static Result success(String message) {
        Result r = new Result();
        r.body.put("message", message);
        return r;
    }

    public static Result error(String message) {
        Result r = new Result();
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("message", message);
        r.body.put("error", error);
        return r;
    }

    @JsonAnyGetter
    public Map<String, Object> body() {
        return Collections.unmodifiableMap(body);
    }
}
