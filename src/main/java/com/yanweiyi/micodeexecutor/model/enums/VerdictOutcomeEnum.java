package com.yanweiyi.micodeexecutor.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 单个测试用例的判定结果
 *
 * @author yanweiyi
 */
@Getter
public enum VerdictOutcomeEnum {

    ACCEPTED("答案正确", "accepted"),
    WRONG_ANSWER("答案错误", "wrong_answer"),
    COMPILE_ERROR("编译失败", "compile_error"),
    RUNTIME_ERROR("运行错误", "runtime_error"),
    TIME_LIMIT_EXCEEDED("执行超时", "time_limit_exceeded"),
    MEMORY_LIMIT_EXCEEDED("内存溢出", "memory_limit_exceeded"),
    INTERNAL_ERROR("系统错误", "internal_error");

    private final String message;

    @JsonValue
    private final String value;

    VerdictOutcomeEnum(String message, String value) {
        this.message = message;
        this.value = value;
    }

    /**
     * 获取值列表
     *
     * @return 值列表
     */
    public static List<String> getValues() {
        return Arrays.stream(values()).map(outcome -> outcome.value).collect(Collectors.toList());
    }

    /**
     * 根据 value 获取枚举
     *
     * @param value 枚举值
     * @return 对应的枚举值，如果没有找到返回 null
     */
    @JsonCreator
    public static VerdictOutcomeEnum getEnumByValue(String value) {
        if (value == null) {
            return null;
        }
        for (VerdictOutcomeEnum outcomeEnum : VerdictOutcomeEnum.values()) {
            if (outcomeEnum.value.equals(value)) {
                return outcomeEnum;
            }
        }
        return null;
    }
}
