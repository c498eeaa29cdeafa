package world.willfrog.angelmarket.valuationservice.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Configuration;

/**
 * Mapper 扫描放在独立配置类上，Web 切片测试不会加载它
 */
@Configuration
@MapperScan("world.willfrog.angelmarket.valuationservice.mapper")
public class MybatisConfig {
}
