package com.wordsonphone.backend.config;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.Map;

@Configuration
public class AsyncExecutorConfig {

    /**
     * 批次生成用的 pool：每次 orchestration 最多 3 條並行 + 1 條補抓，
     * pool 開大一點讓兩個使用者同時生成也不會互卡。
     */
    @Bean("batchGenerationExecutor")
    public ThreadPoolTaskExecutor batchGenerationExecutor(
            @Value("${app.executor.batch.core-size:6}") int coreSize,
            @Value("${app.executor.batch.max-size:12}") int maxSize,
            @Value("${app.executor.batch.queue-capacity:100}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(coreSize);
        ex.setMaxPoolSize(maxSize);
        ex.setQueueCapacity(queueCapacity);
        ex.setThreadNamePrefix("gen-batch-");
        ex.setWaitForTasksToCompleteOnShutdown(false);
        // worker thread 沿用呼叫端的 MDC（rid）
        ex.setTaskDecorator(task -> {
            Map<String, String> ctx = MDC.getCopyOfContextMap();
            return () -> {
                if (ctx != null) MDC.setContextMap(ctx);
                try {
                    task.run();
                } finally {
                    MDC.clear();
                }
            };
        });
        ex.initialize();
        return ex;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
