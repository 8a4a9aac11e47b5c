package com.wangbin.hostkeeper.common.utils;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 验证工具类
 */
public class ValidatorUtil {

    private static final Pattern HOST_ID_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]*$");

    private static final String UNIT_NAME_EXTRA_CHARS = "-_.@\\";

    private ValidatorUtil() {
    }

    public static boolean isEmpty(String str) {
        return str == null || str.trim().isEmpty();
    }

    public static boolean isNotEmpty(String str) {
        return !isEmpty(str);
    }

    public static boolean isHostId(String hostId) {
        return isNotEmpty(hostId) && HOST_ID_PATTERN.matcher(hostId).matches();
    }

    /**
     * systemd 单元名校验：字母数字及 "-_.@\"，不能以 "-" 开头
     */
    public static boolean isValidUnitName(String name) {
        if (isEmpty(name) || name.startsWith("-")) {
            return false;
        }
        for (char c : name.toCharArray()) {
            if (!Character.isLetterOrDigit(c) && UNIT_NAME_EXTRA_CHARS.indexOf(c) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * 检查正则表达式是否合法
     */
    public static boolean isValidRegex(String regex) {
        if (regex == null) {
            return false;
        }
        try {
            Pattern.compile(regex);
            return true;
        } catch (PatternSyntaxException e) {
            return false;
        }
    }
}
