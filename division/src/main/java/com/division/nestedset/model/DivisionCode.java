package com.division.nestedset.model;

import com.division.nestedset.CodeResolver;
import com.division.nestedset.exception.DivisionDataException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * 结构化的区划编码，入库前解析一次，之后直接取字段而不再反复截取字符串
 * <p>
 * 低于自身层级的字段为 null，例如市级编码没有 areaCode 和 streetSuffix。
 *
 * @author ZhangBoyuan
 * @since 2026-10-18
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DivisionCode {

    /**
     * 原始编码
     */
    private final String code;

    private final DivisionLevel level;

    /**
     * 省编码，补齐 6 位
     */
    private final String provinceCode;

    /**
     * 市编码，补齐 6 位
     */
    private final String cityCode;

    /**
     * 区县编码
     */
    private final String areaCode;

    /**
     * 街道后缀（区县编码之后的部分）
     */
    private final String streetSuffix;

    private DivisionCode(String code, DivisionLevel level) {
        this.code = code;
        this.level = level;
        this.provinceCode = CodeResolver.provinceOf(code);
        this.cityCode = level.getDepth() >= DivisionLevel.CITY.getDepth() ? CodeResolver.cityOf(code) : null;
        this.areaCode = level.getDepth() >= DivisionLevel.AREA.getDepth() ? CodeResolver.areaOf(code) : null;
        this.streetSuffix = level == DivisionLevel.STREET ? code.substring(CodeResolver.STANDARD_WIDTH) : null;
    }

    /**
     * 解析指定层级的编码
     *
     * @throws DivisionDataException 编码为空、含非数字字符或长度不足
     */
    public static DivisionCode parse(String code, DivisionLevel level) {
        if (Objects.isNull(code) || code.isBlank()) {
            throw new DivisionDataException("%s级记录缺少编码".formatted(level.getLabel()));
        }
        String trimmed = code.trim();
        if (!CodeResolver.isNumeric(trimmed)) {
            throw new DivisionDataException("%s级编码 [%s] 含非数字字符".formatted(level.getLabel(), trimmed));
        }
        if (trimmed.length() < level.getPrefixLength()) {
            throw new DivisionDataException("%s级编码 [%s] 长度不足 %d 位"
                    .formatted(level.getLabel(), trimmed, level.getPrefixLength()));
        }
        return new DivisionCode(trimmed, level);
    }

    /**
     * 本级在查找表中的键，即补齐后的本级编码
     */
    public String key() {
        return switch (level) {
            case PROVINCE -> provinceCode;
            case CITY -> cityCode;
            case AREA -> areaCode;
            case STREET -> code;
        };
    }

    /**
     * 直接上级在查找表中的键，省级返回 null
     */
    public String parentKey() {
        return switch (level) {
            case PROVINCE -> null;
            case CITY -> provinceCode;
            case AREA -> cityCode;
            case STREET -> areaCode;
        };
    }

}
