package fun.ai.functions.mapper;


import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import fun.ai.functions.entity.FnApp;
import org.apache.ibatis.annotations.Mapper;

/**
 * 函数应用 Mapper 接口
 */
@Mapper
public interface FnAppMapper extends BaseMapper<FnApp> {
}
