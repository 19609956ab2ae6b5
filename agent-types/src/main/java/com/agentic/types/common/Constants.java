package com.agentic.types.common;

/**
 * 全局常量定义类。
 * <p>
 * 定义协调核心使用的通用常量，如广播地址、默认编排器标识等。
 * </p>
 *
 * @author agentic
 * @since 2026-10-17
 */
public class Constants {

    /** 逗号分隔符，用于字符串分割操作 */
    public final static String SPLIT = ",";

    /** 广播收件人标记 */
    public final static String BROADCAST_RECIPIENT = "*";

    /** 默认编排器在消息总线上的地址 */
    public final static String DEFAULT_ORCHESTRATOR_ID = "orchestrator";

}
