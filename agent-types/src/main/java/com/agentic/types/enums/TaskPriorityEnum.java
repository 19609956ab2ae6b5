package com.agentic.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 任务优先级枚举，level 越大越优先。
 *
 * @author agentic
 * @since 2026-10-17
 */
public enum TaskPriorityEnum {

    LOW("low", 1),

    MEDIUM("medium", 2),

    HIGH("high", 3),

    CRITICAL("critical", 4);

    private final String code;
    private final int level;

    TaskPriorityEnum(String code, int level) {
        this.code = code;
        this.level = level;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getLevel() {
        return level;
    }

    public static TaskPriorityEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TaskPriorityEnum priority : TaskPriorityEnum.values()) {
            if (priority.code.equalsIgnoreCase(code)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown task priority code: " + code);
    }
}
