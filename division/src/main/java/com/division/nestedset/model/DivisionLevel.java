package com.division.nestedset.model;

import lombok.Getter;

/**
 * 区划层级，prefixLength 为本级编码至少包含的位数；
 * 街道编码在 6 位区县编码之后至少还有 1 位后缀，否则会与所属区县同号
 *
 * @author ZhangBoyuan
 * @since 2026-10-18
 */
@Getter
public enum DivisionLevel {

    PROVINCE(1, 2, "省"),
    CITY(2, 4, "市"),
    AREA(3, 6, "区县"),
    STREET(4, 7, "街道");

    private final int depth;

    private final int prefixLength;

    private final String label;

    DivisionLevel(int depth, int prefixLength, String label) {
        this.depth = depth;
        this.prefixLength = prefixLength;
        this.label = label;
    }

}
