package world.willfrog.angelmarket.valuationservice.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties(ValuationProperties.class)
public class ValuationConfig {

    @Bean
    public Clock clock(ValuationProperties properties) {
        return Clock.system(ZoneId.of(properties.getZoneId()));
    }
}
