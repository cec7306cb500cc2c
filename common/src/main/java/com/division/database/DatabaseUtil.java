package com.division.database;

import com.division.properties.PropertiesUtil;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Properties;

/**
 * 数据库相关工具类
 *
 * @author ZhangBoyuan
 * @since 2026-10-18
 */
@Slf4j
public class DatabaseUtil {

    /**
     * 单例数据源实例
     */
    private static volatile HikariDataSource DATA_SOURCE;

    private DatabaseUtil() {
    }

    /**
     * 双重检查锁定获取数据源，配置取自 db.properties
     */
    public static HikariDataSource getDataSource() {
        if (Objects.isNull(DATA_SOURCE)) {
            synchronized (DatabaseUtil.class) {
                if (Objects.isNull(DATA_SOURCE)) {
                    DATA_SOURCE = createDataSource(PropertiesUtil.loadDbProperties());
                }
            }
        }
        return DATA_SOURCE;
    }

    /**
     * 根据配置创建连接池
     *
     * @param props 包含 db.url、db.username、db.password、db.driver 的配置
     * @return 新的数据源，调用方负责关闭
     */
    public static HikariDataSource createDataSource(Properties props) {
        try {
            HikariDataSource dataSource = new HikariDataSource();
            dataSource.setJdbcUrl(props.getProperty("db.url"));
            dataSource.setUsername(props.getProperty("db.username"));
            dataSource.setPassword(props.getProperty("db.password"));
            String driver = props.getProperty("db.driver");
            if (Objects.nonNull(driver) && !driver.isBlank()) {
                dataSource.setDriverClassName(driver);
            }
            // 单线程批量写入，连接数无需太多
            dataSource.setMaximumPoolSize(2);
            dataSource.setMinimumIdle(1);
            // 获取连接的超时时间（单位毫秒）
            dataSource.setConnectionTimeout(30000);
            log.info("数据库连接池初始化成功: {}", props.getProperty("db.url"));
            return dataSource;
        } catch (Exception e) {
            log.error("数据库连接池初始化失败", e);
            throw new RuntimeException("数据库连接池初始化失败", e);
        }
    }

    /**
     * 打印连接池状态信息
     */
    public static void logPoolStatus() {
        if (Objects.isNull(DATA_SOURCE) || Objects.isNull(DATA_SOURCE.getHikariPoolMXBean())) {
            log.info("连接池未初始化");
            return;
        }

        log.info("数据库连接池状态：活跃连接数-{}, 空闲连接数-{}, 总连接数-{}",
                DATA_SOURCE.getHikariPoolMXBean().getActiveConnections(),
                DATA_SOURCE.getHikariPoolMXBean().getIdleConnections(),
                DATA_SOURCE.getHikariPoolMXBean().getTotalConnections()
        );
    }

    /**
     * 关闭数据源
     */
    public static void closeDataSource() {
        if (Objects.nonNull(DATA_SOURCE) && !DATA_SOURCE.isClosed()) {
            try {
                DATA_SOURCE.close();
                log.info("数据库连接池已关闭");
            } finally {
                DATA_SOURCE = null;
            }
        }
    }

}
