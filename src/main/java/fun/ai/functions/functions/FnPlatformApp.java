package fun.ai.functions.functions;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.Map;

/**
 * functions 平台上的应用资源
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "functions 平台应用")
public class FnPlatformApp {

    @Schema(description = "应用名称", example = "billing-p1")
    private String name;

    @Schema(description = "应用级配置（注入到该应用下所有函数的环境变量）")
    private Map<String, String> config;
}
