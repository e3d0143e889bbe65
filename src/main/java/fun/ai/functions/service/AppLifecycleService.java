package fun.ai.functions.service;

import fun.ai.functions.common.AppConflictException;
import fun.ai.functions.common.AppHasRoutesException;
import fun.ai.functions.common.AppNotFoundException;
import fun.ai.functions.common.AppProvisioningException;
import fun.ai.functions.common.FunctionsApiException;
import fun.ai.functions.entity.response.FnAppView;

import java.util.List;
import java.util.Map;

/**
 * 函数应用生命周期：本地登记（fn_app）与 functions 平台之间的对账编排。
 *
 * 本地前置校验（存在性）总是先于任何远端调用。
 */
public interface AppLifecycleService {

    /**
     * 名称最大长度（与平台应用名限制一致）
     */
    int MAX_APP_NAME_LENGTH = 30;

    /**
     * 列出项目下的应用。单个应用远端查询失败时不中断，该条目带 error 返回。
     * @param projectId 项目ID
     * @return 应用视图，按登记顺序
     */
    List<FnAppView> list(String projectId);

    /**
     * 创建应用：先远端开通，再本地登记。
     * @param projectId 项目ID
     * @param name 请求名称（实际名称为 {name}-{projectId}，截断到 30 个字符）
     * @param description 描述，为空时使用默认描述
     * @return 新应用视图
     * @throws AppConflictException 同名应用已存在
     * @throws AppProvisioningException 远端开通或本地登记失败
     */
    FnAppView create(String projectId, String name, String description);

    /**
     * @throws AppNotFoundException 本地未登记
     * @throws FunctionsApiException 远端查询失败
     */
    FnAppView get(String projectId, String appName);

    /**
     * 仅更新远端应用，本地记录只做重新读取。
     * @param fields 原样转发给平台的应用字段
     * @throws AppNotFoundException 本地未登记
     * @throws FunctionsApiException 远端更新失败
     */
    FnAppView update(String projectId, String appName, Map<String, Object> fields);

    /**
     * 删除应用：先删本地登记，再删远端应用；远端删除失败时恢复本地登记。
     * @throws AppNotFoundException 本地未登记
     * @throws AppHasRoutesException 远端应用仍有路由
     * @throws FunctionsApiException 远端查询/删除失败
     */
    void delete(String projectId, String appName);

    /**
     * 派生应用名称：{name}-{projectId}，超过 30 个字符（按码点计）时截断
     */
    static String deriveAppName(String name, String projectId) {
        String full = name + "-" + projectId;
        if (full.codePointCount(0, full.length()) <= MAX_APP_NAME_LENGTH) {
            return full;
        }
        return full.substring(0, full.offsetByCodePoints(0, MAX_APP_NAME_LENGTH));
    }
}
