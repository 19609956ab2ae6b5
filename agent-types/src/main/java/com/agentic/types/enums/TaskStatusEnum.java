package com.agentic.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 任务状态枚举
 *
 * @author agentic
 * @since 2026-10-17
 */
public enum TaskStatusEnum {

    /**
     * 待处理 - 任务已提交，等待依赖完成或可用 Agent
     */
    PENDING("pending", false),

    /**
     * 已分配 - 调度器已选定 Agent，等待 Agent 接收
     */
    ASSIGNED("assigned", false),

    /**
     * 运行中 - Agent 正在执行
     */
    RUNNING("running", false),

    /**
     * 已完成 - 执行成功，结果已写回
     */
    COMPLETED("completed", true),

    /**
     * 失败 - 执行失败且重试预算耗尽
     */
    FAILED("failed", true),

    /**
     * 已过期 - 截止时间前未能开始执行
     */
    EXPIRED("expired", true),

    /**
     * 已取消 - 显式取消、依赖失败或系统停止
     */
    CANCELLED("cancelled", true);

    private final String code;
    private final boolean terminal;

    TaskStatusEnum(String code, boolean terminal) {
        this.code = code;
        this.terminal = terminal;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * 终态中除 COMPLETED 以外的状态，会阻断下游依赖。
     */
    public boolean isBlocking() {
        return this == FAILED || this == EXPIRED || this == CANCELLED;
    }

    public static TaskStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TaskStatusEnum status : TaskStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status code: " + code);
    }
}
