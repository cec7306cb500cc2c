package com.division.properties;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;

/**
 * properties 工具类
 *
 * @author ZhangBoyuan
 * @since 2026-10-18
 */
@Slf4j
public class PropertiesUtil {

    /**
     * 数据库配置文件
     */
    private static final String DB_PROPERTIES = "db.properties";

    /**
     * 行政区划生成配置文件
     */
    public static final String DIVISION_PROPERTIES = "division.properties";

    private PropertiesUtil() {
    }

    /**
     * 加载数据库配置文件
     */
    public static Properties loadDbProperties() {
        return load(PropertiesUtil.class, DB_PROPERTIES);
    }

    /**
     * 加载配置文件（通过指定类的ClassLoader）
     */
    public static Properties load(Class<?> clazz, String fileName) {
        return loadWithClass(clazz, fileName);
    }

    /**
     * 读取必填配置项，缺失或为空时直接失败
     *
     * @param properties 配置
     * @param key        配置键
     * @return 去除首尾空白后的配置值
     */
    public static String getRequired(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (Objects.isNull(value) || value.isBlank()) {
            String errorMsg = "缺少必填配置项: %s".formatted(key);
            log.error(errorMsg);
            throw new RuntimeException(errorMsg);
        }
        return value.trim();
    }

    /**
     * 核心加载逻辑
     */
    private static Properties loadWithClass(Class<?> clazz, String fileName) {
        log.info("开始加载 {} 配置文件", fileName);
        Properties properties = new Properties();
        try (InputStream input = clazz.getClassLoader().getResourceAsStream(fileName)) {
            if (Objects.isNull(input)) {
                String errorMsg = "无法找到配置文件: %s (通过类 %s 加载)".formatted(fileName, clazz.getSimpleName());
                log.error(errorMsg);
                throw new RuntimeException(errorMsg);
            }
            properties.load(input);
            log.info("成功加载配置文件: {}", fileName);
        } catch (IOException e) {
            String errorMsg = "读取配置文件失败: %s (通过类 %s 加载)".formatted(fileName, clazz.getSimpleName());
            log.error(errorMsg, e);
            throw new RuntimeException(errorMsg, e);
        }
        return properties;
    }

}
