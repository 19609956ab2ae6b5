package com.agentic.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置类。
 * <p>
 * 消息总线投递线程池：每个邮箱同一时刻最多占用一个线程，线程数决定可并行投递的接收方数量。
 * </p>
 *
 * @author agentic
 * @since 2026-10-17
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ThreadPoolConfigProperties.class)
public class ThreadPoolConfig {

    @Bean(name = "messageDeliveryExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "messageDeliveryExecutor")
    public ThreadPoolExecutor messageDeliveryExecutor(ThreadPoolConfigProperties properties) {
        int coreSize = Math.max(properties.getCorePoolSize(), 1);
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(properties.getThreadNamePrefix() + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(
                coreSize,
                Math.max(properties.getMaxPoolSize(), coreSize),
                Math.max(properties.getKeepAliveTime(), 0L),
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(properties.getBlockQueueSize(), 1)),
                threadFactory,
                buildRejectedExecutionHandler(properties.getPolicy()));
    }

    /**
     * 投递必须在总线线程上执行：调用方线程可能正持有调度锁，因此只接受 AbortPolicy。
     */
    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if (policy != null && !"AbortPolicy".equals(policy)) {
            log.warn("Unsupported rejection policy '{}' for message delivery, fallback to AbortPolicy", policy);
        }
        return new ThreadPoolExecutor.AbortPolicy();
    }

}
