package fun.ai.functions.functions;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import fun.ai.functions.common.FunctionsApiException;
import fun.ai.functions.config.FunctionsProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * API 服务侧轻量客户端：调用 functions 平台（Fn/IronFunctions 兼容）的 /{version}/apps 接口。
 *
 * 平台非 2xx 响应统一抛 {@link FunctionsApiException}，携带平台状态码与 error.message。
 */
@Component
public class FunctionsClient {

    private static final TypeReference<List<FnRoute>> ROUTE_LIST = new TypeReference<>() {};

    private final FunctionsProperties props;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public FunctionsClient(FunctionsProperties props, ObjectMapper objectMapper) {
        this.props = props;
        this.objectMapper = objectMapper;
        long connectTimeoutMs = props.getConnectTimeoutMs() > 0 ? props.getConnectTimeoutMs() : 2000;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();
    }

    public FnPlatformApp showApp(String name) {
        JsonNode root = requestJson("GET", "/apps/" + urlPath(name), null);
        return readField(root, "app", FnPlatformApp.class);
    }

    public FnPlatformApp createApp(String name) {
        Map<String, Object> body = Map.of("app", Map.of("name", name));
        JsonNode root = requestJson("POST", "/apps", body);
        return readField(root, "app", FnPlatformApp.class);
    }

    /**
     * 更新远端应用：fields 原样作为 app 字段提交（如 config）。
     */
    public FnPlatformApp updateApp(String name, Map<String, Object> fields) {
        Map<String, Object> body = Map.of("app", fields == null ? Collections.emptyMap() : fields);
        JsonNode root = requestJson("PATCH", "/apps/" + urlPath(name), body);
        return readField(root, "app", FnPlatformApp.class);
    }

    public void deleteApp(String name) {
        requestJson("DELETE", "/apps/" + urlPath(name), null);
    }

    public List<FnRoute> listRoutes(String appName) {
        JsonNode root = requestJson("GET", "/apps/" + urlPath(appName) + "/routes", null);
        JsonNode routes = root.path("routes");
        if (routes.isMissingNode() || routes.isNull()) {
            return Collections.emptyList();
        }
        try {
            return objectMapper.convertValue(routes, ROUTE_LIST);
        } catch (IllegalArgumentException e) {
            throw new FunctionsApiException("functions decode failed: routes of " + appName, e);
        }
    }

    private <T> T readField(JsonNode root, String field, Class<T> type) {
        JsonNode node = root.path(field);
        if (node.isMissingNode() || node.isNull()) {
            throw new FunctionsApiException("functions response missing '" + field + "'", null);
        }
        try {
            return objectMapper.convertValue(node, type);
        } catch (IllegalArgumentException e) {
            throw new FunctionsApiException("functions decode failed: " + field, e);
        }
    }

    private JsonNode requestJson(String method, String path, Object bodyObj) {
        String m = (method == null ? "GET" : method).toUpperCase(Locale.ROOT);
        String url = joinUrl(props.getBaseUrl(), "/" + props.getApiVersion() + path);
        byte[] bodyBytes = new byte[0];
        if (bodyObj != null) {
            try {
                bodyBytes = objectMapper.writeValueAsBytes(bodyObj);
            } catch (Exception e) {
                throw new FunctionsApiException("functions request encode failed: " + e.getMessage(), e);
            }
        }

        HttpRequest.Builder b = HttpRequest.newBuilder().uri(URI.create(url));
        if (props.getReadTimeoutMs() > 0) {
            b.timeout(Duration.ofMillis(props.getReadTimeoutMs()));
        }
        if ("GET".equals(m) || "DELETE".equals(m)) {
            b.method(m, HttpRequest.BodyPublishers.noBody());
        } else {
            b.method(m, HttpRequest.BodyPublishers.ofByteArray(bodyBytes));
        }
        b.header("Accept", "application/json");
        if (bodyObj != null) {
            b.header("Content-Type", "application/json");
        }
        if (StringUtils.hasText(props.getToken())) {
            b.header("Authorization", "Bearer " + props.getToken());
        }

        HttpResponse<byte[]> resp;
        try {
            resp = httpClient.send(b.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FunctionsApiException("functions request interrupted", e);
        } catch (Exception e) {
            throw new FunctionsApiException("functions request failed: " + e.getMessage(), e);
        }

        byte[] raw = resp.body() == null ? new byte[0] : resp.body();
        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            throw new FunctionsApiException(status, errorReason(raw, status));
        }
        if (raw.length == 0) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(raw);
        } catch (Exception e) {
            throw new FunctionsApiException("functions decode failed: http=" + status + ", body="
                    + new String(raw, StandardCharsets.UTF_8), e);
        }
    }

    /**
     * 平台错误体：{"error": {"message": "..."}}；解析不了时退回原始 body。
     */
    private String errorReason(byte[] raw, int status) {
        String text = new String(raw, StandardCharsets.UTF_8);
        String fallback = StringUtils.hasText(text) ? text : "functions error: http=" + status;
        JsonNode message;
        try {
            message = objectMapper.readTree(raw).path("error").path("message");
        } catch (Exception notJson) {
            return fallback;
        }
        return message.isTextual() && StringUtils.hasText(message.asText()) ? message.asText() : fallback;
    }

    private String joinUrl(String baseUrl, String pathAndQuery) {
        String b = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String p = (pathAndQuery == null) ? "" : pathAndQuery;
        if (!p.startsWith("/")) p = "/" + p;
        return b + p;
    }

    private String urlPath(String s) {
        return s == null ? "" : URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
