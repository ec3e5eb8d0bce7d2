package com.securepower.antitheft.config;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class CoreConfigTest {

    private final CoreConfig config = new CoreConfig();

    @Test
    void shouldRunChannelSendsOnNamedDaemonThreads() throws Exception {
        ExecutorService executor = config.alertDispatchExecutor(new AppProperties());
        try {
            Thread worker = executor.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);

            assertThat(worker.getName()).startsWith("alert-dispatch-");
            assertThat(worker.isDaemon()).isTrue();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldProcessEventsOnNamedThreads() throws Exception {
        ThreadPoolTaskExecutor executor = config.securityEventExecutor();
        try {
            CompletableFuture<String> name = new CompletableFuture<>();
            executor.execute(() -> name.complete(Thread.currentThread().getName()));

            assertThat(name.get(5, TimeUnit.SECONDS)).startsWith("security-event-");
            assertThat(executor.getMaxPoolSize()).isEqualTo(4);
        } finally {
            executor.shutdown();
        }
    }
}
