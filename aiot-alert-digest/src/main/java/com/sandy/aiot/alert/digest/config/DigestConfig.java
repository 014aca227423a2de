package com.sandy.aiot.alert.digest.config;

import com.sandy.aiot.alert.digest.vo.AlertThresholds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
@Slf4j
public class DigestConfig {

    @Bean
    public Clock digestClock() {
        return Clock.systemUTC();
    }

    /**
     * Runs transport calls so the coordinator can bound them with a timeout.
     */
    @Bean(name = "digestSendExecutor")
    public ThreadPoolTaskExecutor digestSendExecutor(@Value("${digest.send.pool-size:4}") int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("digest-send-");
        executor.initialize();
        return executor;
    }

    @Bean
    public AlertThresholds alertThresholds(
            @Value("${digest.thresholds.ph.warning-min:6.0}") double phMin,
            @Value("${digest.thresholds.ph.warning-max:8.5}") double phMax,
            @Value("${digest.thresholds.tds.warning-min:0}") double tdsMin,
            @Value("${digest.thresholds.tds.warning-max:500}") double tdsMax,
            @Value("${digest.thresholds.turbidity.warning-min:0}") double turbidityMin,
            @Value("${digest.thresholds.turbidity.warning-max:5}") double turbidityMax) {
        AlertThresholds thresholds = new AlertThresholds()
                .with("ph", phMin, phMax)
                .with("tds", tdsMin, tdsMax)
                .with("turbidity", turbidityMin, turbidityMax);
        log.info("Digest category thresholds: {}", thresholds.getBands());
        return thresholds;
    }
}
