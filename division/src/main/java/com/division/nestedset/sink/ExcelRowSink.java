package com.division.nestedset.sink;

import com.division.mybatisplus.entity.NestedArea;
import com.division.mybatisplus.utils.TableMetadata;
import com.division.nestedset.exception.EmissionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.xssf.streaming.SXSSFSheet;
import org.apache.poi.xssf.streaming.SXSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;

/**
 * 输出 Excel 文件，表头为列名，之后每个节点一行
 * 使用流式工作簿，内存中只保留最近的若干行；提交时先写临时文件再替换目标文件
 *
 * @author ZhangBoyuan
 * @since 2026-10-18
 */
@Slf4j
public class ExcelRowSink implements RowSink {

    /**
     * 内存中保留的行数
     */
    private static final int ROW_ACCESS_WINDOW = 500;

    private static final String TEMP_SUFFIX = ".tmp";

    private static final int HEADER_ROW_INDEX = 0;

    private static final int COLUMN_WIDTH = 5000;

    // 列索引常量
    private static final int ID_COL = 0;
    private static final int NODE_COL = 1;
    private static final int PID_COL = 2;
    private static final int DEPTH_COL = 3;
    private static final int LFT_COL = 4;
    private static final int RGT_COL = 5;

    private final Path target;

    private final Path tempFile;

    private final SXSSFWorkbook workbook;

    private final SXSSFSheet sheet;

    private int nextRow = HEADER_ROW_INDEX + 1;

    private boolean finished;

    private ExcelRowSink(Path target, SXSSFWorkbook workbook, SXSSFSheet sheet) {
        this.target = target;
        this.tempFile = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        this.workbook = workbook;
        this.sheet = sheet;
    }

    /**
     * 创建工作簿并写入表头，工作表以表名命名
     */
    public static ExcelRowSink open(Path target, TableMetadata metadata) {
        SXSSFWorkbook workbook = new SXSSFWorkbook(ROW_ACCESS_WINDOW);
        SXSSFSheet sheet = workbook.createSheet(metadata.getTableName());

        CellStyle headerStyle = workbook.createCellStyle();
        Font headerFont = workbook.createFont();
        headerFont.setBold(true);
        headerStyle.setFont(headerFont);
        headerStyle.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
        headerStyle.setFillPattern(FillPatternType.SOLID_FOREGROUND);

        Row header = sheet.createRow(HEADER_ROW_INDEX);
        List<String> columns = metadata.getColumns();
        for (int i = 0; i < columns.size(); i++) {
            Cell cell = header.createCell(i);
            cell.setCellValue(columns.get(i));
            cell.setCellStyle(headerStyle);
            sheet.setColumnWidth(i, COLUMN_WIDTH);
        }
        // 冻结表头
        sheet.createFreezePane(0, HEADER_ROW_INDEX + 1);
        return new ExcelRowSink(target.toAbsolutePath(), workbook, sheet);
    }

    @Override
    public void write(NestedArea row) {
        Row excelRow = sheet.createRow(nextRow++);
        excelRow.createCell(ID_COL).setCellValue(row.getId());
        excelRow.createCell(NODE_COL).setCellValue(row.getNode());
        excelRow.createCell(PID_COL).setCellValue(row.getPid());
        excelRow.createCell(DEPTH_COL).setCellValue(row.getDepth());
        excelRow.createCell(LFT_COL).setCellValue(row.getLft());
        excelRow.createCell(RGT_COL).setCellValue(row.getRgt());
    }

    @Override
    public void finish() {
        try {
            if (Objects.nonNull(target.getParent())) {
                Files.createDirectories(target.getParent());
            }
            try (OutputStream out = Files.newOutputStream(tempFile)) {
                workbook.write(out);
            }
            Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
            finished = true;
        } catch (IOException e) {
            throw new EmissionException("写入 Excel 文件失败: " + target, e);
        }
    }

    @Override
    public void close() {
        try {
            workbook.close();
        } catch (IOException e) {
            log.warn("关闭工作簿失败", e);
        } finally {
            // 清理流式工作簿的临时文件
            workbook.dispose();
        }
        if (finished) {
            return;
        }
        try {
            Files.deleteIfExists(tempFile);
            log.warn("输出未完成，未生成 Excel 文件: {}", target);
        } catch (IOException e) {
            log.warn("删除临时文件失败: {}", tempFile, e);
        }
    }

    @Override
    public String describe() {
        return target.toString();
    }

}
