package com.division.nestedset;

import com.division.database.DatabaseUtil;
import com.division.mybatisplus.entity.NestedArea;
import com.division.mybatisplus.utils.TableMetadata;
import com.division.nestedset.model.Area;
import com.division.nestedset.model.DivisionRecords;
import com.division.nestedset.sink.ExcelRowSink;
import com.division.nestedset.sink.JdbcRowSink;
import com.division.nestedset.sink.RowSink;
import com.division.nestedset.sink.SinkType;
import com.division.nestedset.sink.SqlFileSink;
import com.division.properties.PropertiesUtil;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/**
 * 行政区划嵌套集合生成
 * 读取省、市、区县、街道四级数据，构建区划树并按先序遍历编号，
 * 输出 nested 表的初始化数据
 * <p>
 * 实现方案：
 * 1. 按编码前缀（前 2 位省、前 4 位市、前 6 位区县）逐级挂载子节点
 * 2. 先序遍历整片森林，进入节点时取左值，离开时取右值，编号全局连续
 * 3. 再按同样顺序逐行输出 (id, node, pid, depth, lft, rgt)
 * 4. 查询某区划的全部下级：lft &gt; 父.lft AND rgt &lt; 父.rgt
 * <p>
 * 任一步骤出错即终止，不输出部分结果。
 *
 * @author ZhangBoyuan
 * @since 2026-10-18
 */
@Slf4j
public class NestedSetGenerator {

    // 配置项
    public static final String PROVINCES_FILE = "division.data.provinces";
    public static final String CITIES_FILE = "division.data.cities";
    public static final String AREAS_FILE = "division.data.areas";
    public static final String STREETS_FILE = "division.data.streets";
    public static final String OUTPUT_SINK = "division.output.sink";
    public static final String OUTPUT_SQL_FILE = "division.output.sql-file";
    public static final String OUTPUT_EXCEL_FILE = "division.output.excel-file";
    public static final String OUTPUT_TABLE = "division.output.table";
    public static final String OUTPUT_BATCH_SIZE = "division.output.batch-size";

    private static final String DEFAULT_SQL_FILE = "./division.sql";
    private static final String DEFAULT_EXCEL_FILE = "./division.xlsx";

    private final DivisionRecordLoader loader;

    private final AreaTreeBuilder treeBuilder;

    private final NestedSetIndexer indexer;

    private final StatementEmitter emitter;

    public NestedSetGenerator() {
        this(new DivisionRecordLoader(), new AreaTreeBuilder(), new NestedSetIndexer(), new StatementEmitter());
    }

    public NestedSetGenerator(DivisionRecordLoader loader, AreaTreeBuilder treeBuilder,
                              NestedSetIndexer indexer, StatementEmitter emitter) {
        this.loader = loader;
        this.treeBuilder = treeBuilder;
        this.indexer = indexer;
        this.emitter = emitter;
    }

    /**
     * 主方法，第一个参数可指定类路径下的其他配置文件
     */
    public static void main(String[] args) {
        String configFile = args.length > 0 ? args[0] : PropertiesUtil.DIVISION_PROPERTIES;
        try {
            Properties props = PropertiesUtil.load(NestedSetGenerator.class, configFile);
            long rows = new NestedSetGenerator().generate(props);
            log.info("生成完成！共 {} 个区划节点", rows);
        } catch (RuntimeException e) {
            log.error("生成失败", e);
            System.exit(1);
        }
    }

    /**
     * 按配置执行完整流程
     *
     * @param props 生成配置
     * @return 输出行数
     */
    public long generate(Properties props) {
        DivisionRecords records = loader.load(
                Paths.get(PropertiesUtil.getRequired(props, PROVINCES_FILE)),
                optionalPath(props, CITIES_FILE),
                optionalPath(props, AREAS_FILE),
                optionalPath(props, STREETS_FILE));

        TableMetadata metadata = TableMetadata.of(NestedArea.class, NestedArea.INSERT_FIELDS)
                .withTableName(props.getProperty(OUTPUT_TABLE));
        SinkType sinkType = SinkType.fromValue(props.getProperty(OUTPUT_SINK, SinkType.SQL.name()));

        if (sinkType == SinkType.JDBC) {
            try {
                return generate(records, openSink(sinkType, props, metadata));
            } finally {
                DatabaseUtil.logPoolStatus();
                DatabaseUtil.closeDataSource();
            }
        }
        return generate(records, openSink(sinkType, props, metadata));
    }

    /**
     * 构建、编号并输出，结束后关闭输出端
     *
     * @param records 四级记录
     * @param sink    输出端
     * @return 输出行数
     */
    public long generate(DivisionRecords records, RowSink sink) {
        try (RowSink out = sink) {
            List<Area> forest = treeBuilder.build(records);
            indexer.index(forest);
            return emitter.emit(forest, out);
        }
    }

    private static RowSink openSink(SinkType sinkType, Properties props, TableMetadata metadata) {
        return switch (sinkType) {
            case SQL -> SqlFileSink.open(Paths.get(props.getProperty(OUTPUT_SQL_FILE, DEFAULT_SQL_FILE).trim()), metadata);
            case EXCEL -> ExcelRowSink.open(Paths.get(props.getProperty(OUTPUT_EXCEL_FILE, DEFAULT_EXCEL_FILE).trim()), metadata);
            case JDBC -> JdbcRowSink.open(DatabaseUtil.getDataSource(), metadata, batchSize(props));
        };
    }

    private static int batchSize(Properties props) {
        String value = props.getProperty(OUTPUT_BATCH_SIZE);
        if (Objects.isNull(value) || value.isBlank()) {
            return JdbcRowSink.DEFAULT_BATCH_SIZE;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("配置项 %s 不是整数: %s".formatted(OUTPUT_BATCH_SIZE, value), e);
        }
    }

    private static Path optionalPath(Properties props, String key) {
        String value = props.getProperty(key);
        return Objects.isNull(value) || value.isBlank() ? null : Paths.get(value.trim());
    }

}
