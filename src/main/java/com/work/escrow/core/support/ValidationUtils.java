package com.work.escrow.core.support;

import java.math.BigInteger;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * 参数校验工具类，统一参数校验逻辑，减少代码重复
 */
public final class ValidationUtils {

    /**
     * itemId / 账户地址的合法字符集与长度限制：
     * 仅允许大小写字母、数字以及少量分隔符，长度 1~128。
     */
    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[a-zA-Z0-9:_.-]{1,128}$");

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 校验字符串参数不为空
     */
    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    /**
     * 校验对象不为null
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " 不能为null");
        }
        return value;
    }

    /**
     * 校验字节数组不为空
     */
    public static byte[] requireNonEmpty(byte[] value, String paramName) {
        if (value == null || value.length == 0) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    /**
     * 校验Duration必须大于0
     */
    public static Duration requirePositive(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return duration;
    }

    /**
     * 校验金额必须大于0
     */
    public static BigInteger requirePositive(BigInteger amount, String paramName) {
        requireNonNull(amount, paramName);
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return amount;
    }

    /**
     * 校验 itemId / 地址的格式与长度，作为 requireNonEmpty 之上的“加强版”校验。
     * <p>约束：长度 1~128，仅允许 [a-zA-Z0-9:_.-]。</p>
     */
    public static String requireValidIdentifier(String value, String paramName) {
        requireNonEmpty(value, paramName);
        if (!IDENTIFIER_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(paramName + " 非法，只允许 1~128 位的字母、数字、':'、'_'、'.'、'-'");
        }
        return value;
    }
}
