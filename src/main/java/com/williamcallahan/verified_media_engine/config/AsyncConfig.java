package com.williamcallahan.verified_media_engine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for the selection pipeline and for async MVC responses
 *
 * Features:
 * - Bounded pool for source fetches, sized for I/O-bound fan-out
 * - Bounded pool for oracle retries and scoring callbacks
 * - Caller-runs back-pressure on every pool instead of rejecting work
 */
@Configuration
public class AsyncConfig implements WebMvcConfigurer {

    /**
     * Selections can take up to the fan-out plus scoring deadlines, so async requests get a generous timeout
     */
    @Override
    public void configureAsyncSupport(@NonNull AsyncSupportConfigurer configurer) {
        configurer.setDefaultTimeout(150000);
        configurer.setTaskExecutor(mvcTaskExecutor());
    }

    @Bean("mvcTaskExecutor")
    public AsyncTaskExecutor mvcTaskExecutor() {
        return boundedExecutor(10, 40, 200, "mvc-async-");
    }

    /**
     * Source fetches: one task per source per selection
     */
    @Bean("sourceFetchExecutor")
    public AsyncTaskExecutor sourceFetchExecutor() {
        return boundedExecutor(6, 24, 100, "source-fetch-");
    }

    /**
     * Oracle retry scheduling and scoring continuations
     */
    @Bean("oracleExecutor")
    public AsyncTaskExecutor oracleExecutor() {
        return boundedExecutor(4, 16, 100, "oracle-");
    }

    private static ThreadPoolTaskExecutor boundedExecutor(int core, int max, int queue, String prefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
