package com.agentic.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 消息类型枚举
 *
 * @author agentic
 * @since 2026-10-17
 */
public enum MessageTypeEnum {

    /**
     * 任务分配通知（编排器 -> Agent）
     */
    TASK_ASSIGNMENT("task_assignment"),

    /**
     * 任务执行成功（Agent -> 编排器）
     */
    TASK_RESULT("task_result"),

    /**
     * 任务执行失败或被取消（Agent -> 编排器）
     */
    TASK_FAILURE("task_failure"),

    /**
     * Agent 之间的协作消息
     */
    COORDINATION("coordination"),

    /**
     * 状态通知
     */
    STATUS("status"),

    /**
     * 广播
     */
    BROADCAST("broadcast");

    private final String code;

    MessageTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTaskOutcome() {
        return this == TASK_RESULT || this == TASK_FAILURE;
    }
}
