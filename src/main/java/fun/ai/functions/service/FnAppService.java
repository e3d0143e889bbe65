package fun.ai.functions.service;


import com.baomidou.mybatisplus.extension.service.IService;
import fun.ai.functions.common.AppConflictException;
import fun.ai.functions.entity.FnApp;

import java.util.List;

/**
 * 函数应用本地登记服务（fn_app 表）
 */
public interface FnAppService extends IService<FnApp> {
    /**
     * 查询项目下的全部应用，按登记顺序（id 升序）返回
     * @param projectId 项目ID
     * @return 应用列表，没有时为空列表
     */
    List<FnApp> findByProject(String projectId);

    /**
     * 按项目ID + 应用名称查询
     * @param projectId 项目ID
     * @param name 应用名称（已派生的完整名称）
     * @return 匹配的记录
     */
    List<FnApp> findByProjectAndName(String projectId, String name);

    /**
     * 应用是否已登记
     */
    boolean exists(String name, String projectId);

    /**
     * 登记应用。依赖 (project_id, name) 唯一约束做原子判重。
     * @param app 应用信息
     * @return 写入后的应用（含 id 与时间字段）
     * @throws AppConflictException 唯一约束冲突（并发创建已抢先写入）
     */
    FnApp register(FnApp app) throws AppConflictException;

    /**
     * 删除应用登记
     * @return 是否删除了记录
     */
    boolean deleteByProjectAndName(String projectId, String name);
}
