package com.division.nestedset.sink;

import com.division.mybatisplus.entity.NestedArea;
import com.division.mybatisplus.utils.TableMetadata;
import com.division.nestedset.exception.EmissionException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * 输出 INSERT 语句文件，每个节点一行：
 * <pre>
 * INSERT INTO nested(id, node, pid, depth, lft, rgt) VALUES(110000, '北京市', 0, 1, 1, 8);
 * </pre>
 * 先写临时文件，提交时再替换目标文件。
 *
 * @author ZhangBoyuan
 * @since 2026-10-18
 */
@Slf4j
public class SqlFileSink implements RowSink {

    private static final String TEMP_SUFFIX = ".tmp";

    private final Path target;

    private final Path tempFile;

    private final String insertPrefix;

    private final BufferedWriter writer;

    private boolean finished;

    private SqlFileSink(Path target, Path tempFile, String insertPrefix, BufferedWriter writer) {
        this.target = target;
        this.tempFile = tempFile;
        this.insertPrefix = insertPrefix;
        this.writer = writer;
    }

    /**
     * 打开输出文件
     *
     * @param target   目标 SQL 文件
     * @param metadata 目标表元数据
     */
    public static SqlFileSink open(Path target, TableMetadata metadata) {
        Path absolute = target.toAbsolutePath();
        Path tempFile = absolute.resolveSibling(absolute.getFileName() + TEMP_SUFFIX);
        try {
            if (Objects.nonNull(absolute.getParent())) {
                Files.createDirectories(absolute.getParent());
            }
            BufferedWriter writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8);
            return new SqlFileSink(absolute, tempFile, metadata.insertPrefix(), writer);
        } catch (IOException e) {
            throw new EmissionException("无法创建 SQL 文件: " + tempFile, e);
        }
    }

    /**
     * 生成单条插入语句（不含换行）
     */
    public static String toStatement(String insertPrefix, NestedArea row) {
        return insertPrefix + row.getId() +
                ", '" + escape(row.getNode()) + "', " +
                row.getPid() + ", " +
                row.getDepth() + ", " +
                row.getLft() + ", " +
                row.getRgt() + ");";
    }

    @Override
    public void write(NestedArea row) {
        try {
            writer.write(toStatement(insertPrefix, row));
            writer.newLine();
        } catch (IOException e) {
            throw new EmissionException("写入区划 [%s] 失败".formatted(row.getId()), e);
        }
    }

    @Override
    public void finish() {
        try {
            writer.close();
            Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
            finished = true;
        } catch (IOException e) {
            throw new EmissionException("提交 SQL 文件失败: " + target, e);
        }
    }

    @Override
    public void close() {
        if (finished) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("关闭临时文件失败: {}", tempFile, e);
        }
        try {
            Files.deleteIfExists(tempFile);
            log.warn("输出未完成，已删除临时文件: {}", tempFile);
        } catch (IOException e) {
            log.warn("删除临时文件失败: {}", tempFile, e);
        }
    }

    @Override
    public String describe() {
        return target.toString();
    }

    /**
     * 单引号转义为两个单引号
     */
    static String escape(String value) {
        return Objects.isNull(value) ? "" : value.replace("'", "''");
    }

}
