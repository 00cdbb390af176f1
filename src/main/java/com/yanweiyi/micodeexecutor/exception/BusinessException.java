package com.yanweiyi.micodeexecutor.exception;

import com.yanweiyi.micodeexecutor.model.enums.ErrorCodeEnum;
import lombok.Getter;

/**
 * 业务异常，由全局异常处理器转换为 {error, message} 响应
 *
 * @author yanweiyi
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCodeEnum errorCode;

    public BusinessException(ErrorCodeEnum errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCodeEnum errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
