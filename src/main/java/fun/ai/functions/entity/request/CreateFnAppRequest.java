package fun.ai.functions.entity.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 创建函数应用请求：{"app": {"name": "...", "description": "..."}}
 */
@Data
@Schema(description = "创建函数应用请求")
public class CreateFnAppRequest {

    @Valid
    @NotNull(message = "app is required")
    @Schema(description = "应用信息", requiredMode = Schema.RequiredMode.REQUIRED)
    private AppSpec app;

    @Data
    @Schema(description = "应用信息")
    public static class AppSpec {

        @NotBlank(message = "app.name is required")
        @Schema(description = "应用名称（实际名称为 {name}-{projectId}，最长 30 个字符）",
                requiredMode = Schema.RequiredMode.REQUIRED, example = "billing")
        private String name;

        @Schema(description = "应用描述，缺省为 App for project {projectId}", example = "Billing functions")
        private String description;
    }
}
