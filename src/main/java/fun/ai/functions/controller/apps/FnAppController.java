package fun.ai.functions.controller.apps;


import fun.ai.functions.common.Result;
import fun.ai.functions.entity.request.CreateFnAppRequest;
import fun.ai.functions.entity.response.FnAppView;
import fun.ai.functions.service.AppLifecycleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * 项目级函数应用控制器
 */
@RestController
@RequestMapping("/v1/{projectId}/apps")
@Tag(name = "Apps", description = "项目级函数应用的增删改查接口")
public class FnAppController {

    private final AppLifecycleService appLifecycleService;

    public FnAppController(AppLifecycleService appLifecycleService) {
        this.appLifecycleService = appLifecycleService;
    }

    @GetMapping
    @Operation(summary = "获取项目下的所有应用", description = "远端查询失败的应用仍会返回，并带 error 字段")
    public Result list(@Parameter(description = "项目ID", required = true) @PathVariable("projectId") String projectId) {
        List<FnAppView> apps = appLifecycleService.list(projectId);
        return Result.success("apps", apps, "Successfully listed applications");
    }

    /**
     * 创建应用
     * @param projectId 项目ID
     * @param request {"app": {"name": "...", "description": "..."}}
     * @return 创建后的应用
     */
    @PostMapping
    @Operation(summary = "创建应用", description = "实际应用名为 {name}-{projectId}，截断到 30 个字符")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Successful operation"),
            @ApiResponse(responseCode = "409", description = "App exists")
    })
    public Result create(@Parameter(description = "项目ID", required = true) @PathVariable("projectId") String projectId,
                         @Valid @RequestBody CreateFnAppRequest request) {
        FnAppView app = appLifecycleService.create(projectId,
                request.getApp().getName(), request.getApp().getDescription());
        return Result.success("app", app, "App successfully created");
    }

    @GetMapping("/{app}")
    @Operation(summary = "获取应用详情")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Successful operation"),
            @ApiResponse(responseCode = "404", description = "App not found")
    })
    public Result get(@Parameter(description = "项目ID", required = true) @PathVariable("projectId") String projectId,
                      @Parameter(description = "应用名称", required = true) @PathVariable("app") String app) {
        return Result.success("app", appLifecycleService.get(projectId, app), "Successfully loaded app");
    }

    /**
     * 更新应用：body 原样转发给 functions 平台，本地登记信息不变
     */
    @PutMapping("/{app}")
    @Operation(summary = "更新应用", description = "请求体作为远端应用字段转发（如 {\"config\": {...}}）")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Successful operation"),
            @ApiResponse(responseCode = "404", description = "App not found")
    })
    public Result update(@Parameter(description = "项目ID", required = true) @PathVariable("projectId") String projectId,
                         @Parameter(description = "应用名称", required = true) @PathVariable("app") String app,
                         @RequestBody Map<String, Object> body) {
        return Result.success("app", appLifecycleService.update(projectId, app, body), "App successfully updated");
    }

    @DeleteMapping("/{app}")
    @Operation(summary = "删除应用", description = "远端应用仍有路由时不允许删除")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Successful operation"),
            @ApiResponse(responseCode = "403", description = "App has routes"),
            @ApiResponse(responseCode = "404", description = "App not found")
    })
    public Result delete(@Parameter(description = "项目ID", required = true) @PathVariable("projectId") String projectId,
                         @Parameter(description = "应用名称", required = true) @PathVariable("app") String app) {
        appLifecycleService.delete(projectId, app);
        return Result.success("App successfully deleted");
    }
}
