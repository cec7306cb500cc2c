package com.division.nestedset.sink;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 输出端类型，对应配置项 division.output.sink
 *
 * @author ZhangBoyuan
 * @since 2026-10-18
 */
public enum SinkType {

    /**
     * SQL 脚本文件
     */
    SQL,

    /**
     * 直接写入数据库
     */
    JDBC,

    /**
     * Excel 文件
     */
    EXCEL;

    public static SinkType fromValue(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (SinkType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        String supported = Arrays.stream(values()).map(t -> t.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining(", "));
        throw new IllegalArgumentException("不支持的输出类型: %s，可选值: %s".formatted(value, supported));
    }

}
