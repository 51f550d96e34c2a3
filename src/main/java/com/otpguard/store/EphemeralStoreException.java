package com.otpguard.store;

import com.otpguard.exception.ErrorCode;
import lombok.Getter;

/**
 * 短期存储不可用或数据无法按计数器解释。
 * <p>
 * 保护逻辑遇到该异常时必须向上抛出（fail closed），不能视为“未锁定”。
 */
@Getter
public class EphemeralStoreException extends RuntimeException {

    private final ErrorCode errorCode = ErrorCode.STORE_UNAVAILABLE;

    public EphemeralStoreException(String message) {
        super(message);
    }

    public EphemeralStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
