package com.otpguard.exception;

import lombok.Getter;

/**
 * 防护校验失败时的异常形式。
 * <p>
 * 服务方法默认返回结果对象（{@code OtpResult} / {@code ResetDecision}），调用方需要异常语义时
 * 通过各自的 {@code orElseThrow()} 转换为本异常；{@code EmailNormalizer} 遇到空邮箱也直接抛出，
 * 错误码为 {@link ErrorCode#BAD_REQUEST}。
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    /**
     * 使用错误码的默认文案。
     */
    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    /**
     * 携带带有具体数值的提示，例如剩余锁定分钟数或每小时上限。
     */
    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
