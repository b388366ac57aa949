package org.tokbench.runner.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableAsync
public class ExecutorConfig {

    /**
     * Shard workers are never interrupted: shutdown waits for them, and they stop at
     * their next check once the active run is cancelled.
     */
    @Bean(name = "shardExecutor")
    @DependsOn({"aggregatorExecutor", "hitRecordStore"})
    public ThreadPoolTaskExecutor shardExecutor(BenchmarkProperties properties) {
        int workers = Math.max(1, properties.getWorkers());
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(workers);
        ex.setMaxPoolSize(workers);
        ex.setThreadNamePrefix("shard-worker-");
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.setAwaitTerminationSeconds(30);
        ex.initialize();
        return ex;
    }

    /** Single thread, so shard results of a run are handled one at a time and in order. */
    @Bean(name = "aggregatorExecutor")
    @DependsOn("hitRecordStore")
    public ThreadPoolTaskExecutor aggregatorExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(1);
        ex.setMaxPoolSize(1);
        ex.setThreadNamePrefix("aggregator-");
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.setAwaitTerminationSeconds(30);
        ex.initialize();
        return ex;
    }
}
