package com.securepower.antitheft.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableScheduling
public class CoreConfig {

    private static final Logger log = LoggerFactory.getLogger(CoreConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs channel sends. Sized so one slow provider cannot starve the others. A plain
     * {@link ExecutorService} because timed-out sends are cancelled through their futures.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService alertDispatchExecutor(AppProperties props) {
        int threads = props.getAlerts().getDispatchThreads();
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("alert-dispatch-");
        threadFactory.setDaemon(true);

        log.info("Alert dispatch pool initialized - threads: {}", threads);
        return Executors.newFixedThreadPool(threads, threadFactory);
    }

    /**
     * Processes raised events and background enrichment off the caller's thread.
     */
    @Bean
    public ThreadPoolTaskExecutor securityEventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.setThreadNamePrefix("security-event-");
        executor.setDaemon(true);

        // Let queued events finish on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);

        executor.initialize();
        log.info("Security event pool initialized - threads: {}", executor.getCorePoolSize());
        return executor;
    }
}
