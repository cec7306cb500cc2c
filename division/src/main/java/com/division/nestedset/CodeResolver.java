package com.division.nestedset;

import com.division.nestedset.exception.DivisionDataException;

import java.util.Objects;

/**
 * 编码解析：按位截取上级编码并右补 0 至 6 位
 * <p>
 * 编码前 2 位为省，前 4 位为市，前 6 位为区县，其后为街道自由后缀。
 *
 * @author ZhangBoyuan
 * @since 2026-10-18
 */
public final class CodeResolver {

    /**
     * 标准编码宽度
     */
    public static final int STANDARD_WIDTH = 6;

    private static final int PROVINCE_DIGITS = 2;

    private static final int CITY_DIGITS = 4;

    private static final int AREA_DIGITS = 6;

    private static final String PADDING = "000000";

    private CodeResolver() {
    }

    /**
     * 所属省编码，例如 1101010001 → 110000
     */
    public static String provinceOf(String code) {
        return prefixOf(code, PROVINCE_DIGITS);
    }

    /**
     * 所属市编码，例如 1101010001 → 110100
     */
    public static String cityOf(String code) {
        return prefixOf(code, CITY_DIGITS);
    }

    /**
     * 所属区县编码，例如 1101010001 → 110101
     */
    public static String areaOf(String code) {
        return prefixOf(code, AREA_DIGITS);
    }

    /**
     * 右补 0 至 6 位，已满 6 位的编码原样返回
     */
    public static String padded(String code) {
        return code.length() >= STANDARD_WIDTH ? code : code + PADDING.substring(code.length());
    }

    /**
     * 是否为非空的纯数字编码
     */
    public static boolean isNumeric(String code) {
        if (Objects.isNull(code) || code.isEmpty()) {
            return false;
        }
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static String prefixOf(String code, int digits) {
        if (Objects.isNull(code) || code.length() < digits) {
            throw new DivisionDataException("编码 [%s] 长度不足 %d 位，无法解析上级编码".formatted(code, digits));
        }
        return code.substring(0, digits) + PADDING.substring(digits);
    }

}
