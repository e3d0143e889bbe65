package fun.ai.functions.service.impl;

import fun.ai.functions.common.AppConflictException;
import fun.ai.functions.common.AppHasRoutesException;
import fun.ai.functions.common.AppNotFoundException;
import fun.ai.functions.common.AppProvisioningException;
import fun.ai.functions.common.FunctionsApiException;
import fun.ai.functions.entity.FnApp;
import fun.ai.functions.entity.response.FnAppView;
import fun.ai.functions.functions.FnPlatformApp;
import fun.ai.functions.functions.FnRoute;
import fun.ai.functions.functions.FunctionsClient;
import fun.ai.functions.service.AppLifecycleService;
import fun.ai.functions.service.FnAppService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 函数应用生命周期实现：本地登记 + functions 平台。
 *
 * 两侧没有分布式事务，靠补偿动作收敛：
 * - create：远端已开通但本地登记失败（非唯一键冲突）时，删除远端应用
 * - delete：本地删除在事务内进行，远端删除失败则回滚本地删除
 */
@Service
public class AppLifecycleServiceImpl implements AppLifecycleService {

    private static final Logger logger = LoggerFactory.getLogger(AppLifecycleServiceImpl.class);

    private final FnAppService fnAppService;
    private final FunctionsClient functionsClient;

    public AppLifecycleServiceImpl(FnAppService fnAppService, FunctionsClient functionsClient) {
        this.fnAppService = fnAppService;
        this.functionsClient = functionsClient;
    }

    @Override
    public List<FnAppView> list(String projectId) {
        logger.info("[{}] - Listing apps", projectId);
        List<FnApp> stored = fnAppService.findByProject(projectId);
        List<FnAppView> views = new ArrayList<>(stored.size());
        for (FnApp app : stored) {
            try {
                FnPlatformApp fnApp = functionsClient.showApp(app.getName());
                views.add(FnAppView.of(app, fnApp));
            } catch (FunctionsApiException e) {
                logger.warn("[{}] - Fn app '{}' lookup failed: status={}, reason={}",
                        projectId, app.getName(), e.getStatus(), e.reasonOrDefault());
                views.add(FnAppView.withError(app, e.reasonOrDefault()));
            }
        }
        logger.info("[{}] - Apps found: {}", projectId, views.size());
        return views;
    }

    @Override
    public FnAppView create(String projectId, String name, String description) {
        String appName = AppLifecycleService.deriveAppName(name, projectId);
        logger.info("[{}] - Creating app {}", projectId, appName);

        if (fnAppService.exists(appName, projectId)) {
            logger.info("[{}] - Similar app was found, aborting", projectId);
            throw new AppConflictException(appName);
        }

        FnPlatformApp fnApp;
        try {
            fnApp = functionsClient.createApp(appName);
        } catch (FunctionsApiException e) {
            logger.error("[{}] - Fn app '{}' creation failed: status={}, reason={}",
                    projectId, appName, e.getStatus(), e.reasonOrDefault());
            throw new AppProvisioningException("Unable to create app " + appName + ": " + e.reasonOrDefault(), e);
        }
        logger.debug("[{}] - Fn app created", projectId);

        FnApp app = new FnApp();
        app.setProjectId(projectId);
        app.setName(appName);
        app.setDescription(description != null ? description : "App for project " + projectId);
        FnApp stored;
        try {
            stored = fnAppService.register(app);
        } catch (AppConflictException e) {
            // 并发创建的另一方已登记成功，远端同名应用归它所有，不做补偿
            throw e;
        } catch (RuntimeException e) {
            logger.error("[{}] - App '{}' registration failed, removing fn app: {}", projectId, appName, e.getMessage(), e);
            compensateRemoteCreate(projectId, appName, e);
            throw new AppProvisioningException("Unable to register app " + appName + ": " + e.getMessage(), e);
        }
        logger.debug("[{}] - App created", projectId);
        return FnAppView.of(stored, fnApp);
    }

    @Override
    public FnAppView get(String projectId, String appName) {
        logger.info("[{}] - Searching for app with name {}", projectId, appName);
        FnApp stored = requireRegistered(projectId, appName);
        FnPlatformApp fnApp;
        try {
            fnApp = functionsClient.showApp(appName);
        } catch (FunctionsApiException e) {
            logger.error("[{}] - Fn app '{}' was not found. Reason: {}", projectId, appName, e.reasonOrDefault());
            throw e;
        }
        logger.debug("[{}] - App '{}' found", projectId, appName);
        return FnAppView.of(stored, fnApp);
    }

    @Override
    public FnAppView update(String projectId, String appName, Map<String, Object> fields) {
        logger.info("[{}] - Setting up update procedure with data '{}'", projectId, fields);
        requireRegistered(projectId, appName);
        FnPlatformApp fnApp;
        try {
            fnApp = functionsClient.updateApp(appName, fields);
        } catch (FunctionsApiException e) {
            logger.info("[{}] - Unable to update app, aborting. Reason: {}", projectId, e.reasonOrDefault());
            throw e;
        }
        // 本地记录不随 body 变化，仅重新读取
        FnApp stored = requireRegistered(projectId, appName);
        logger.info("[{}] - Updated app {} with data {}", projectId, appName, fields);
        return FnAppView.of(stored, fnApp);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void delete(String projectId, String appName) {
        logger.info("[{}] - Deleting app {}", projectId, appName);
        requireRegistered(projectId, appName);

        List<FnRoute> routes;
        try {
            functionsClient.showApp(appName);
            routes = functionsClient.listRoutes(appName);
        } catch (FunctionsApiException e) {
            logger.info("[{}] - Unable to get app, aborting. Reason: {}", projectId, e.reasonOrDefault());
            throw e;
        }

        if (routes != null && !routes.isEmpty()) {
            logger.info("[{}] - App has routes, unable to delete it, aborting", projectId);
            throw new AppHasRoutesException(appName, routes.size());
        }

        fnAppService.deleteByProjectAndName(projectId, appName);
        logger.debug("[{}] - App model entry gone", projectId);
        try {
            functionsClient.deleteApp(appName);
        } catch (FunctionsApiException e) {
            // 抛出后事务回滚，本地登记恢复
            logger.error("[{}] - Fn app '{}' deletion failed, keeping app model entry. Reason: {}",
                    projectId, appName, e.reasonOrDefault());
            throw e;
        }
        logger.debug("[{}] - Fn app deleted", projectId);
    }

    private FnApp requireRegistered(String projectId, String appName) {
        if (!fnAppService.exists(appName, projectId)) {
            logger.info("[{}] - App not found, aborting", projectId);
            throw new AppNotFoundException(appName);
        }
        List<FnApp> found = fnAppService.findByProjectAndName(projectId, appName);
        if (found.isEmpty()) {
            // 校验与读取之间被并发删除
            throw new AppNotFoundException(appName);
        }
        return found.get(0);
    }

    private void compensateRemoteCreate(String projectId, String appName, RuntimeException cause) {
        try {
            functionsClient.deleteApp(appName);
            logger.info("[{}] - Fn app '{}' removed after failed registration", projectId, appName);
        } catch (FunctionsApiException e) {
            logger.error("[{}] - Fn app '{}' left orphaned: {}", projectId, appName, e.reasonOrDefault());
            cause.addSuppressed(e);
        }
    }
}
