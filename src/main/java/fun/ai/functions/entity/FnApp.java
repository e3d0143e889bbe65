package fun.ai.functions.entity;

import com.baomidou.mybatisplus.annotation.*;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 项目下的函数应用（本地登记记录）
 *
 * 同名的远端函数应用由 functions 平台持有；(project_id, name) 唯一。
 */
@Data
@TableName("fn_app")
public class FnApp {
    /**
     * 主键
     */
    @TableId(value = "id", type = IdType.AUTO)
    @Schema(description = "应用ID")
    private Long id;

    /**
     * 项目ID（租户隔离标识，调用方传入，不做格式校验）
     */
    @TableField("project_id")
    @Schema(description = "项目ID")
    private String projectId;

    /**
     * 应用名称：{请求名称}-{projectId}，截断到 30 个字符
     */
    @TableField("name")
    @Schema(description = "应用名称", example = "billing-p1")
    private String name;

    @TableField("description")
    @Schema(description = "应用描述")
    private String description;

    @Schema(description = "创建时间")
    @TableField(value = "create_time", fill = FieldFill.INSERT)
    private LocalDateTime createTime;

    @Schema(description = "更新时间")
    @TableField(value = "update_time", fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updateTime;

}
