package com.retail.loyalty_backend.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 启用 Spring 的定时任务功能（积分过期扫描、连续天数重置）
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {
}
