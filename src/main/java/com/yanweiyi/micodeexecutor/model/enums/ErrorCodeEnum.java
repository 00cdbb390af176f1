package com.yanweiyi.micodeexecutor.model.enums;

import lombok.Getter;

/**
 * 接口错误码
 */
@Getter
public enum ErrorCodeEnum {

    INVALID_REQUEST("请求参数错误", "invalid_request", 400),
    UNKNOWN_LANGUAGE("不支持的编程语言", "unknown_language", 400),
    FORBIDDEN("无权限", "forbidden", 403),
    JOB_NOT_FOUND("任务不存在", "job_not_found", 404),
    UNKNOWN_WORKER("工作节点未注册", "unknown_worker", 404),
    SYSTEM_ERROR("系统错误", "system_error", 500);

    private final String message;

    private final String value;

    private final int httpStatus;

    ErrorCodeEnum(String message, String value, int httpStatus) {
        this.message = message;
        this.value = value;
        this.httpStatus = httpStatus;
    }
}
