package fun.ai.functions.entity.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fun.ai.functions.entity.FnApp;
import fun.ai.functions.functions.FnPlatformApp;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 函数应用视图：本地登记字段 + 远端平台字段
 */
@Data
@Schema(description = "函数应用")
public class FnAppView {

    @Schema(description = "应用ID", example = "1")
    private Long id;

    @JsonProperty("project_id")
    @Schema(description = "项目ID", example = "p1")
    private String projectId;

    @Schema(description = "应用名称", example = "billing-p1")
    private String name;

    @Schema(description = "应用描述", example = "App for project p1")
    private String description;

    @JsonProperty("created_at")
    @Schema(description = "创建时间")
    private LocalDateTime createdAt;

    @JsonProperty("updated_at")
    @Schema(description = "更新时间")
    private LocalDateTime updatedAt;

    @Schema(description = "远端应用配置")
    private Map<String, String> config;

    /**
     * 仅列表接口使用：远端查询失败时的错误信息
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @Schema(description = "远端查询失败原因（仅列表接口，正常时不返回）")
    private String error;

    public static FnAppView of(FnApp app, FnPlatformApp fnApp) {
        FnAppView view = local(app);
        if (fnApp != null) {
            view.setConfig(fnApp.getConfig());
        }
        return view;
    }

    public static FnAppView withError(FnApp app, String error) {
        FnAppView view = local(app);
        view.setError(error);
        return view;
    }

    private static FnAppView local(FnApp app) {
        FnAppView view = new FnAppView();
        view.setId(app.getId());
        view.setProjectId(app.getProjectId());
        view.setName(app.getName());
        view.setDescription(app.getDescription());
        view.setCreatedAt(app.getCreateTime());
        view.setUpdatedAt(app.getUpdateTime());
        return view;
    }
}
