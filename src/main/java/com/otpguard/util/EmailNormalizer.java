package com.otpguard.util;

import com.otpguard.exception.BusinessException;
import com.otpguard.exception.ErrorCode;
import org.springframework.util.StringUtils;

import java.util.Locale;

public final class EmailNormalizer {

    private EmailNormalizer() {
    }

    /**
     * 规范化邮箱：去除首尾空白并转小写。所有以邮箱派生键名的位置都必须经过此方法。
     *
     * @throws BusinessException 邮箱为空时抛出，空值不能当作通配键使用。
     */
    public static String normalize(String email) {
        if (!StringUtils.hasText(email)) {
            throw new BusinessException(ErrorCode.BAD_REQUEST, "Email must not be empty");
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * 日志脱敏：保留首字符与域名，例如 {@code j***@example.com}。
     */
    public static String mask(String email) {
        if (email == null) {
            return null;
        }
        int at = email.indexOf('@');
        if (at <= 0) {
            return "***";
        }
        return email.charAt(0) + "***" + email.substring(at);
    }
}
