package com.agentic.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 消息投递线程池配置属性，前缀 thread.pool.delivery.config。
 *
 * @author agentic
 * @since 2026-10-17
 */
@Data
@ConfigurationProperties(prefix = "thread.pool.delivery.config", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数，默认4 */
    private Integer corePoolSize = 4;

    /** 最大线程数，默认16 */
    private Integer maxPoolSize = 16;

    /** 空闲线程最大存活时间（秒），默认60L */
    private Long keepAliveTime = 60L;

    /** 阻塞队列最大容量，默认10000 */
    private Integer blockQueueSize = 10000;

    /** 线程名前缀 */
    private String threadNamePrefix = "message-delivery-";

    /**
     * 拒绝策略，仅支持 AbortPolicy，其它取值回退为 AbortPolicy。
     * 投递被拒绝时，总线丢弃该邮箱内的消息并计入 dropped。
     */
    private String policy = "AbortPolicy";

}
