package com.searchnexus.config;

import com.searchnexus.util.KeyedLocks;
import com.searchnexus.util.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableScheduling
public class AsyncConfig {

    @Bean(name = "reconcileExecutor")
    public ThreadPoolTaskExecutor reconcileExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("reconcile-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "validationExecutor")
    public ThreadPoolTaskExecutor validationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("validate-");
        executor.initialize();
        return executor;
    }

    @Bean
    public KeyedLocks nodeLocks() {
        return new KeyedLocks();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.system();
    }
}
