package com.division.nestedset.model;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * 按文件原始顺序保存的四级区划记录
 *
 * @author ZhangBoyuan
 * @since 2026-10-18
 */
@Getter
public class DivisionRecords {

    private final List<FlatRecord> provinces;

    private final List<FlatRecord> cities;

    private final List<FlatRecord> areas;

    private final List<FlatRecord> streets;

    public DivisionRecords(List<FlatRecord> provinces, List<FlatRecord> cities,
                           List<FlatRecord> areas, List<FlatRecord> streets) {
        this.provinces = copyOf(provinces);
        this.cities = copyOf(cities);
        this.areas = copyOf(areas);
        this.streets = copyOf(streets);
    }

    public List<FlatRecord> get(DivisionLevel level) {
        return switch (level) {
            case PROVINCE -> provinces;
            case CITY -> cities;
            case AREA -> areas;
            case STREET -> streets;
        };
    }

    public int size() {
        return provinces.size() + cities.size() + areas.size() + streets.size();
    }

    private static List<FlatRecord> copyOf(List<FlatRecord> records) {
        return Objects.isNull(records) ? List.of() : List.copyOf(records);
    }

}
