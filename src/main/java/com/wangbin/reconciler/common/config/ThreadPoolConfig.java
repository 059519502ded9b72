package com.wangbin.reconciler.common.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.wangbin.reconciler.core.config.ReconcilerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class ThreadPoolConfig {

    private ThreadFactory buildNamedThreadFactory(String prefix, boolean daemon) {
        return new ThreadFactoryBuilder()
                .setNameFormat(prefix + "-%d")
                .setDaemon(daemon)
                .setPriority(Thread.NORM_PRIORITY)
                .build();
    }

    /**
     * 缺陷判定线程池（CPU密集型），每条判定一个任务
     */
    @Bean(name = "ruleEvaluationExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor ruleEvaluationExecutor(ReconcilerProperties properties) {
        int threads = Math.max(1, properties.getRules().getThreads());
        return new ThreadPoolExecutor(
                threads,
                threads,
                30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                buildNamedThreadFactory("rule-evaluator", true)
        );
    }
}
