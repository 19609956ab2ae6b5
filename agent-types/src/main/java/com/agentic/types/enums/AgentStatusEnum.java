package com.agentic.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Agent 状态枚举
 *
 * @author agentic
 * @since 2026-10-17
 */
public enum AgentStatusEnum {

    /**
     * 空闲 - 已启动且没有在途任务
     */
    IDLE("idle"),

    /**
     * 忙碌 - 至少有一个在途任务
     */
    BUSY("busy"),

    /**
     * 已停止 - 不接收新任务
     */
    STOPPED("stopped");

    private final String code;

    AgentStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
