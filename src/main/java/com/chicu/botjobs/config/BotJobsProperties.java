package com.chicu.botjobs.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "botjobs")
public class BotJobsProperties {

    private Scheduler scheduler = new Scheduler();
    private Watch watch = new Watch();

    @Data
    public static class Scheduler {

        /**
         * Потоки таймеров (и тиков @Scheduled).
         */
        private int poolSize = 4;

        /**
         * Через сколько отдать просроченное одноразовое напоминание.
         */
        private Duration overdueGrace = Duration.ofSeconds(1);

        /**
         * Пояс по умолчанию, если ни у задачи, ни у владельца его нет.
         */
        private String defaultZone = "UTC";

        /**
         * Поднимать таймеры напоминаний при старте.
         */
        private boolean loadOnStartup = true;
    }

    @Data
    public static class Watch {

        /**
         * Фоновый diff-опрос WATCH-задач.
         */
        private boolean enabled = true;

        /**
         * Тик опроса (Spring cron, с секундами).
         */
        private String pollCron = "0 */1 * * * *";

        /**
         * Период повторного заполнения пустых displayName.
         */
        private Duration backfillInterval = Duration.ofHours(1);

        /**
         * Потоки для параллельного опроса записей.
         */
        private int workerThreads = 4;
    }
}
