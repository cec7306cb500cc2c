package com.division.nestedset;

import com.division.nestedset.exception.DivisionDataException;
import com.division.nestedset.model.Area;
import com.division.nestedset.model.DivisionCode;
import com.division.nestedset.model.DivisionLevel;
import com.division.nestedset.model.DivisionRecords;
import com.division.nestedset.model.FlatRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 由四级扁平记录构建区划森林，每个省一棵树
 * <p>
 * 按省、市、区县、街道的顺序逐级处理，上一级的查找表建完后才处理下一级；
 * 同级兄弟节点保持数据文件中的相对顺序。某一级整体缺失时得到较浅的树，
 * 但单条记录找不到上级属于数据错误。
 *
 * @author ZhangBoyuan
 * @since 2026-10-18
 */
@Slf4j
public class AreaTreeBuilder {

    /**
     * 省级节点的父级编码
     */
    public static final String ROOT_PARENT_CODE = "0";

    /**
     * 构建区划森林
     *
     * @param records 四级记录
     * @return 按省份顺序排列的根节点
     * @throws DivisionDataException 编码非法、重复或找不到上级
     */
    public List<Area> build(DivisionRecords records) {
        List<Area> forest = new ArrayList<>(records.getProvinces().size());

        // 省
        Map<String, Area> provinces = new HashMap<>();
        for (FlatRecord record : records.getProvinces()) {
            DivisionCode code = DivisionCode.parse(record.getCode(), DivisionLevel.PROVINCE);
            Area province = new Area(code, record.getName(), ROOT_PARENT_CODE);
            register(provinces, code, province);
            forest.add(province);
        }

        // 市、区县：挂到上一级的查找表上，并建立本级查找表
        Map<String, Area> cities = attachLevel(records.getCities(), DivisionLevel.CITY, provinces);
        Map<String, Area> areas = attachLevel(records.getAreas(), DivisionLevel.AREA, cities);

        // 街道为叶子节点，无需查找表
        int streets = 0;
        for (FlatRecord record : records.getStreets()) {
            DivisionCode code = DivisionCode.parse(record.getCode(), DivisionLevel.STREET);
            Area area = lookupParent(areas, code);
            area.addChild(new Area(code, record.getName(), parentCodeOf(record, code, area)));
            streets++;
        }

        log.info("区划树构建完成：{} 个根节点，{} 个市，{} 个区县，{} 个街道",
                forest.size(), cities.size(), areas.size(), streets);
        return forest;
    }

    private Map<String, Area> attachLevel(List<FlatRecord> records, DivisionLevel level, Map<String, Area> parents) {
        Map<String, Area> index = new HashMap<>();
        for (FlatRecord record : records) {
            DivisionCode code = DivisionCode.parse(record.getCode(), level);
            Area parent = lookupParent(parents, code);
            Area node = new Area(code, record.getName(), parentCodeOf(record, code, parent));
            parent.addChild(node);
            register(index, code, node);
        }
        return index;
    }

    private static void register(Map<String, Area> index, DivisionCode code, Area node) {
        Area existing = index.putIfAbsent(code.key(), node);
        if (Objects.nonNull(existing)) {
            throw new DivisionDataException("%s级编码 [%s] 与 [%s] 重复"
                    .formatted(code.getLevel().getLabel(), code.getCode(), existing.getCode()));
        }
    }

    private static Area lookupParent(Map<String, Area> parents, DivisionCode code) {
        Area parent = parents.get(code.parentKey());
        if (Objects.isNull(parent)) {
            throw new DivisionDataException("%s级编码 [%s] 找不到上级 [%s]"
                    .formatted(code.getLevel().getLabel(), code.getCode(), code.parentKey()));
        }
        return parent;
    }

    /**
     * 记录自带父级编码时须与所挂上级一致（补齐 6 位后相等），一致则原样保留；
     * 未提供时取所挂上级的编码
     *
     * @throws DivisionDataException 父级编码含非数字字符或与所挂上级不符
     */
    private static String parentCodeOf(FlatRecord record, DivisionCode code, Area parent) {
        String parentCode = record.getParentCode();
        if (Objects.isNull(parentCode) || parentCode.isBlank()) {
            return parent.getCode();
        }
        String trimmed = parentCode.trim();
        if (!CodeResolver.isNumeric(trimmed)) {
            throw new DivisionDataException("%s级编码 [%s] 的父级编码 [%s] 含非数字字符"
                    .formatted(code.getLevel().getLabel(), code.getCode(), trimmed));
        }
        if (!CodeResolver.padded(trimmed).equals(parent.getDivisionCode().key())) {
            throw new DivisionDataException("%s级编码 [%s] 的父级编码 [%s] 与上级 [%s] 不符"
                    .formatted(code.getLevel().getLabel(), code.getCode(), trimmed, parent.getCode()));
        }
        return trimmed;
    }

}
