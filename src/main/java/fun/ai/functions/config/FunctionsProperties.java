package fun.ai.functions.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * API 服务 -> functions 平台（Fn/IronFunctions 兼容 /v1/apps 接口）调用配置。
 *
 * <pre>
 * functions.base-url=http://127.0.0.1:8080
 * functions.api-version=v1
 * functions.token=xxxx   # 可选：平台开启鉴权时以 Authorization: Bearer 透传
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "functions")
public class FunctionsProperties {
    private String baseUrl = "http://127.0.0.1:8080";
    private String apiVersion = "v1";
    private String token = "";

    private long connectTimeoutMs = 2000;

    /**
     * 请求总超时（包含读取）。0 表示不设置。
     */
    private long readTimeoutMs = 8000;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public void setApiVersion(String apiVersion) {
        this.apiVersion = apiVersion;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public long getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(long readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }
}
