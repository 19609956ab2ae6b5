package com.agentic.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义协调核心对外抛出的错误码和对应描述信息。
 * </p>
 *
 * @author agentic
 * @since 2026-10-17
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 依赖任务不存在 */
    UNKNOWN_DEPENDENCY("0101", "依赖任务不存在"),

    /** 依赖成环 */
    DEPENDENCY_CYCLE("0102", "任务依赖成环"),

    /** 任务 ID 重复 */
    DUPLICATE_TASK("0103", "任务已存在"),

    /** 任务不存在 */
    TASK_NOT_FOUND("0104", "任务不存在"),

    /** 任务不可清除 */
    TASK_EVICTION_REJECTED("0105", "任务不可清除"),

    /** 非法状态迁移 */

    /** Agent 名称重复 */
    DUPLICATE_AGENT("0201", "Agent 已注册"),

    /** Agent 不存在 */
    AGENT_NOT_FOUND("0202", "Agent 不存在");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
