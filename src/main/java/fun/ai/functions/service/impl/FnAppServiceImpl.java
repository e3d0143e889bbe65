package fun.ai.functions.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import fun.ai.functions.common.AppConflictException;
import fun.ai.functions.entity.FnApp;
import fun.ai.functions.mapper.FnAppMapper;
import fun.ai.functions.service.FnAppService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 函数应用本地登记服务实现类
 */
@Service
public class FnAppServiceImpl extends ServiceImpl<FnAppMapper, FnApp> implements FnAppService {

    private static final Logger logger = LoggerFactory.getLogger(FnAppServiceImpl.class);

    @Override
    public List<FnApp> findByProject(String projectId) {
        QueryWrapper<FnApp> queryWrapper = new QueryWrapper<>();
        queryWrapper.eq("project_id", projectId)
                .orderByAsc("id");
        return baseMapper.selectList(queryWrapper);
    }

    @Override
    public List<FnApp> findByProjectAndName(String projectId, String name) {
        QueryWrapper<FnApp> queryWrapper = new QueryWrapper<>();
        queryWrapper.eq("project_id", projectId)
                .eq("name", name)
                .orderByAsc("id");
        return baseMapper.selectList(queryWrapper);
    }

    @Override
    public boolean exists(String name, String projectId) {
        QueryWrapper<FnApp> queryWrapper = new QueryWrapper<>();
        queryWrapper.eq("project_id", projectId)
                .eq("name", name);
        Long count = baseMapper.selectCount(queryWrapper);
        return count != null && count > 0;
    }

    @Override
    public FnApp register(FnApp app) throws AppConflictException {
        try {
            if (!save(app)) {
                throw new IllegalStateException("App " + app.getName() + " was not registered");
            }
            return app;
        } catch (DuplicateKeyException e) {
            // 并发创建：另一个请求已先写入同名记录
            logger.info("[{}] - App {} registered concurrently, unique key rejected insert",
                    app.getProjectId(), app.getName());
            throw new AppConflictException(app.getName(), e);
        }
    }

    @Override
    public boolean deleteByProjectAndName(String projectId, String name) {
        QueryWrapper<FnApp> queryWrapper = new QueryWrapper<>();
        queryWrapper.eq("project_id", projectId)
                .eq("name", name);
        return baseMapper.delete(queryWrapper) > 0;
    }
}
