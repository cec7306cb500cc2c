package com.division.nestedset;

import com.division.nestedset.exception.DivisionDataException;
import com.division.nestedset.model.DivisionLevel;
import com.division.nestedset.model.DivisionRecords;
import com.division.nestedset.model.FlatRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * 读取四级区划 JSON 文件，每个文件为 {@code [{"code", "name", "parent_code"}]} 数组
 *
 * @author ZhangBoyuan
 * @since 2026-10-18
 */
@Slf4j
public class DivisionRecordLoader {

    private static final TypeReference<List<FlatRecord>> RECORD_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public DivisionRecordLoader() {
        this(new ObjectMapper());
    }

    public DivisionRecordLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 读取四级数据；路径为 null 表示该级没有数据
     */
    public DivisionRecords load(Path provinces, Path cities, Path areas, Path streets) {
        return new DivisionRecords(
                read(provinces, DivisionLevel.PROVINCE),
                read(cities, DivisionLevel.CITY),
                read(areas, DivisionLevel.AREA),
                read(streets, DivisionLevel.STREET));
    }

    /**
     * 读取单级数据
     *
     * @throws DivisionDataException 文件不存在、无法解析或包含空记录
     */
    public List<FlatRecord> read(Path file, DivisionLevel level) {
        if (Objects.isNull(file)) {
            log.info("未配置{}级数据文件，跳过", level.getLabel());
            return List.of();
        }
        if (!Files.isRegularFile(file)) {
            throw new DivisionDataException("%s级数据文件不存在: %s".formatted(level.getLabel(), file));
        }
        List<FlatRecord> records;
        try {
            records = objectMapper.readValue(file.toFile(), RECORD_LIST);
        } catch (IOException e) {
            throw new DivisionDataException("%s级数据文件解析失败: %s".formatted(level.getLabel(), file), e);
        }
        if (Objects.isNull(records)) {
            records = List.of();
        }
        for (int i = 0; i < records.size(); i++) {
            if (Objects.isNull(records.get(i))) {
                throw new DivisionDataException("%s级数据文件 %s 第 %d 条记录为空".formatted(level.getLabel(), file, i + 1));
            }
        }
        log.info("读取到 {} 条{}级数据", records.size(), level.getLabel());
        return records;
    }

}
