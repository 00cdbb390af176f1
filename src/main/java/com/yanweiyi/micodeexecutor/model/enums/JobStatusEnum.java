package com.yanweiyi.micodeexecutor.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.EnumSet;
import java.util.Set;

/**
 * 任务状态枚举
 * <p>
 * pending -> assigned -> compiling -> running -> completed，
 * assigned / compiling / running 可能因基础设施故障回到 pending（重试）或进入 failed。
 */
@Getter
public enum JobStatusEnum {

    PENDING("等待调度", "pending"),
    ASSIGNED("已分配", "assigned"),
    COMPILING("编译中", "compiling"),
    RUNNING("运行中", "running"),
    COMPLETED("已完成", "completed"),
    FAILED("执行失败", "failed");

    private final String message;

    @JsonValue
    private final String value;

    JobStatusEnum(String message, String value) {
        this.message = message;
        this.value = value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * 判断是否允许从当前状态迁移到目标状态
     */
    public boolean canTransitionTo(JobStatusEnum target) {
        return allowedTargets().contains(target);
    }

    private Set<JobStatusEnum> allowedTargets() {
        switch (this) {
            case PENDING:
                return EnumSet.of(ASSIGNED, FAILED);
            case ASSIGNED:
                return EnumSet.of(COMPILING, RUNNING, COMPLETED, PENDING, FAILED);
            case COMPILING:
                return EnumSet.of(RUNNING, COMPLETED, PENDING, FAILED);
            case RUNNING:
                return EnumSet.of(COMPLETED, PENDING, FAILED);
            default:
                return EnumSet.noneOf(JobStatusEnum.class);
        }
    }

    /**
     * 根据 value 获取枚举
     *
     * @param value 枚举值
     * @return 对应的枚举值，如果没有找到返回 null
     */
    @JsonCreator
    public static JobStatusEnum getEnumByValue(String value) {
        if (value == null) {
            return null;
        }
        for (JobStatusEnum statusEnum : JobStatusEnum.values()) {
            if (statusEnum.value.equals(value)) {
                return statusEnum;
            }
        }
        return null;
    }
}
