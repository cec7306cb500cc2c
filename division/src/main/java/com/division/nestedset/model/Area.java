package com.division.nestedset.model;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 区划树节点，省、市、区县、街道共用
 * <p>
 * 节点独占其子节点，子节点只追加不迁移；left/right/depth 由
 * {@link com.division.nestedset.NestedSetIndexer} 赋值，未编号时为 0。
 *
 * @author ZhangBoyuan
 * @since 2026-10-18
 */
@Getter
@ToString(exclude = "children")
public class Area {

    private final DivisionCode divisionCode;

    private final String name;

    private final String parentCode;

    @Setter
    private int left;

    @Setter
    private int right;

    @Setter
    private int depth;

    private final List<Area> children = new ArrayList<>();

    public Area(DivisionCode divisionCode, String name, String parentCode) {
        this.divisionCode = divisionCode;
        this.name = name;
        this.parentCode = parentCode;
    }

    public String getCode() {
        return divisionCode.getCode();
    }

    public DivisionLevel getLevel() {
        return divisionCode.getLevel();
    }

    public List<Area> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public void addChild(Area child) {
        children.add(child);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean isIndexed() {
        return left > 0;
    }

    /**
     * 子树节点数（含自身）
     */
    public int size() {
        int size = 1;
        for (Area child : children) {
            size += child.size();
        }
        return size;
    }

    /**
     * 按左右值判断是否为 other 的祖先
     */
    public boolean isAncestorOf(Area other) {
        return left < other.left && other.right < right;
    }

}
