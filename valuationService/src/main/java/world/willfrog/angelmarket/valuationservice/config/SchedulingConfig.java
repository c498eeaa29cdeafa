package world.willfrog.angelmarket.valuationservice.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 各定时任务自身按 valuation.accrual.enabled / valuation.snapshot.enabled 开关注册
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {
}
