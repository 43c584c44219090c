package com.retail.loyalty_backend.modules.streak.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "app.loyalty.streak")
@Data
public class StreakProperties {

    /**
     * 连续天数里程碑。按天数值匹配，不记录是否领取过。
     */
    private List<Milestone> milestones = new ArrayList<>(List.of(
            new Milestone(3, 10L, "3 days in a row!"),
            new Milestone(5, 20L, "5 days in a row!"),
            new Milestone(7, 30L, "A whole week!"),
            new Milestone(14, 50L, "Two weeks in a row!"),
            new Milestone(30, 100L, "A month of activity!")
    ));

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Milestone {
        private int days;
        private long bonus;
        private String message;
    }
}
