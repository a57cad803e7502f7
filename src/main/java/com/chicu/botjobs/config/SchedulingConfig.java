package com.chicu.botjobs.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Configuration
@EnableScheduling
@EnableConfigurationProperties(BotJobsProperties.class)
public class SchedulingConfig {

    /**
     * Свой ThreadFactory с счётчиком. Имена вида: watch-exec-1, watch-exec-2, ...
     */
    private static final class NamedDaemonFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicLong ctr = new AtomicLong(1);

        private NamedDaemonFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName(prefix + ctr.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Таймеры напоминаний и тики @Scheduled.
     */
    @Bean(name = "jobTaskScheduler")
    public ThreadPoolTaskScheduler jobTaskScheduler(BotJobsProperties props) {
        int size = Math.max(2, props.getScheduler().getPoolSize());

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(size);
        scheduler.setThreadNamePrefix("job-timer-");
        scheduler.setDaemon(true);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);

        log.info("⏱ Job scheduler: {} поток(а/ов)", size);
        return scheduler;
    }

    /**
     * Пул для параллельного опроса WATCH и разбора очереди.
     */
    @Bean(name = "watchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService watchExecutor(BotJobsProperties props) {
        int threads = Math.max(1, props.getWatch().getWorkerThreads());
        return Executors.newFixedThreadPool(threads, new NamedDaemonFactory("watch-exec-"));
    }
}
