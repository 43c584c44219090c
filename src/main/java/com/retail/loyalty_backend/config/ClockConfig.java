package com.retail.loyalty_backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * 业务时区时钟：自然日计算（连续天数、历史筛选、统计窗口）与定时任务均以此时区为准。
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock loyaltyClock(@Value("${app.loyalty.time-zone:Asia/Tashkent}") String timeZone) {
        return Clock.system(ZoneId.of(timeZone));
    }
}
