package com.division.nestedset.sink;

import com.division.mybatisplus.entity.NestedArea;
import com.division.mybatisplus.utils.TableMetadata;
import com.division.nestedset.exception.EmissionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * 直接写入数据库，所有行在同一事务中批量插入，提交前失败则整体回滚
 *
 * @author ZhangBoyuan
 * @since 2026-10-18
 */
@Slf4j
public class JdbcRowSink implements RowSink {

    /**
     * 默认批量大小
     */
    public static final int DEFAULT_BATCH_SIZE = 1000;

    private final Connection connection;

    private final JdbcTemplate jdbcTemplate;

    private final String insertSql;

    private final String tableName;

    private final int batchSize;

    private final List<Object[]> batch;

    private long written;

    private boolean finished;

    private JdbcRowSink(Connection connection, TableMetadata metadata, int batchSize) {
        this.connection = connection;
        this.jdbcTemplate = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
        this.insertSql = metadata.parameterizedInsert();
        this.tableName = metadata.getTableName();
        this.batchSize = batchSize;
        this.batch = new ArrayList<>(batchSize);
    }

    /**
     * 从数据源取一个连接并开启事务
     *
     * @param dataSource 数据源
     * @param metadata   目标表元数据
     * @param batchSize  每批插入的行数
     */
    public static JdbcRowSink open(DataSource dataSource, TableMetadata metadata, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("批量大小必须为正数: " + batchSize);
        }
        try {
            Connection connection = dataSource.getConnection();
            connection.setAutoCommit(false);
            return new JdbcRowSink(connection, metadata, batchSize);
        } catch (SQLException e) {
            throw new EmissionException("获取数据库连接失败", e);
        }
    }

    @Override
    public void write(NestedArea row) {
        batch.add(new Object[]{row.getId(), row.getNode(), row.getPid(), row.getDepth(), row.getLft(), row.getRgt()});
        if (batch.size() >= batchSize) {
            flush();
        }
    }

    @Override
    public void finish() {
        flush();
        try {
            connection.commit();
            finished = true;
            log.info("已提交 {} 行到表 {}", written, tableName);
        } catch (SQLException e) {
            throw new EmissionException("提交事务失败", e);
        }
    }

    @Override
    public void close() {
        try {
            if (!finished) {
                connection.rollback();
                log.warn("输出未完成，已回滚表 {} 的写入", tableName);
            }
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            log.warn("回滚事务失败", e);
        } finally {
            try {
                connection.close();
            } catch (SQLException e) {
                log.warn("关闭数据库连接失败", e);
            }
        }
    }

    @Override
    public String describe() {
        return "table " + tableName;
    }

    private void flush() {
        if (batch.isEmpty()) {
            return;
        }
        try {
            jdbcTemplate.batchUpdate(insertSql, batch);
            written += batch.size();
            batch.clear();
        } catch (DataAccessException e) {
            Object firstId = batch.get(0)[0];
            throw new EmissionException("批量写入失败，批次起始区划 [%s]".formatted(firstId), e);
        }
    }

}
