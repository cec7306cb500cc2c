package com.division.mybatisplus.utils;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.core.toolkit.StringUtils;
import lombok.Getter;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 根据 MyBatis-Plus 注解解析实体对应的表名和列名
 * 未指定名称时按下划线命名转换，与生成器的 underline_to_camel 策略一致
 *
 * @author ZhangBoyuan
 * @since 2026-10-18
 */
@Getter
public final class TableMetadata {

    private static final String PLACEHOLDER = "?";

    private static final String SEPARATOR = ", ";

    /**
     * 表名
     */
    private final String tableName;

    /**
     * 按插入顺序排列的列名
     */
    private final List<String> columns;

    private TableMetadata(String tableName, List<String> columns) {
        this.tableName = tableName;
        this.columns = Collections.unmodifiableList(columns);
    }

    /**
     * 解析实体元数据
     *
     * @param entityClass 实体类
     * @param fieldNames  参与插入的字段（类字段名），决定列顺序
     * @return 表元数据
     */
    public static TableMetadata of(Class<?> entityClass, List<String> fieldNames) {
        TableName tableName = entityClass.getAnnotation(TableName.class);
        String table = Objects.nonNull(tableName) && !tableName.value().isEmpty()
                ? tableName.value()
                : StringUtils.camelToUnderline(entityClass.getSimpleName());

        List<String> columns = new ArrayList<>(fieldNames.size());
        for (String fieldName : fieldNames) {
            columns.add(resolveColumn(entityClass, fieldName));
        }
        return new TableMetadata(table, columns);
    }

    /**
     * 替换表名，列保持不变；传入空值时返回自身
     */
    public TableMetadata withTableName(String table) {
        if (Objects.isNull(table) || table.isBlank()) {
            return this;
        }
        return new TableMetadata(table.trim(), columns);
    }

    /**
     * 插入语句前缀，例如 {@code INSERT INTO nested(id, node) VALUES(}
     */
    public String insertPrefix() {
        return "INSERT INTO " + tableName + "(" + String.join(SEPARATOR, columns) + ") VALUES(";
    }

    /**
     * 带占位符的插入语句，供 JDBC 预编译使用
     */
    public String parameterizedInsert() {
        return insertPrefix() + columns.stream().map(c -> PLACEHOLDER).collect(Collectors.joining(SEPARATOR)) + ")";
    }

    private static String resolveColumn(Class<?> entityClass, String fieldName) {
        Field field;
        try {
            field = entityClass.getDeclaredField(fieldName);
        } catch (NoSuchFieldException e) {
            throw new IllegalArgumentException("实体 %s 不存在字段 %s".formatted(entityClass.getSimpleName(), fieldName), e);
        }
        TableId tableId = field.getAnnotation(TableId.class);
        if (Objects.nonNull(tableId) && !tableId.value().isEmpty()) {
            return tableId.value();
        }
        TableField tableField = field.getAnnotation(TableField.class);
        if (Objects.nonNull(tableField)) {
            if (!tableField.exist()) {
                throw new IllegalArgumentException("字段 %s 未映射到数据库列".formatted(fieldName));
            }
            if (!tableField.value().isEmpty()) {
                return tableField.value();
            }
        }
        return StringUtils.camelToUnderline(fieldName);
    }

}
