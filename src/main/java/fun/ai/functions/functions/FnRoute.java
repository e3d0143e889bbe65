package fun.ai.functions.functions;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * functions 平台上挂在应用下的路由。存在路由的应用不允许删除。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FnRoute {

    @JsonProperty("app_name")
    private String appName;

    private String path;

    private String image;

    private String type;

    private String format;

    private Long memory;

    private Integer timeout;

    @JsonProperty("idle_timeout")
    private Integer idleTimeout;

    private Map<String, String> config;

    private Map<String, List<String>> headers;
}
