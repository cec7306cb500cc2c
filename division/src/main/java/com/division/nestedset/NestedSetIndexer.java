package com.division.nestedset;

import com.division.nestedset.model.Area;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 嵌套集合编号：先序深度优先遍历，进入节点时取下一个编号作为左值，
 * 遍历完所有子节点后再取下一个编号作为右值。
 * <p>
 * 编号计数在整片森林中连续递增，不按树重置。计数值作为参数传入递归并由返回值带回，
 * 不使用共享的可变状态，单线程使用。
 *
 * @author ZhangBoyuan
 * @since 2026-10-18
 */
@Slf4j
public class NestedSetIndexer {

    /**
     * 省级节点层级
     */
    public static final int ROOT_DEPTH = 1;

    /**
     * 为整片森林编号
     *
     * @param forest 按省份顺序排列的根节点
     * @return 最后分配的编号，等于节点总数的两倍
     */
    public int index(List<Area> forest) {
        int counter = 0;
        for (Area root : forest) {
            counter = index(root, counter, ROOT_DEPTH);
        }
        if (forest.isEmpty()) {
            log.info("没有省级节点，未分配编号");
        } else {
            log.info("编号范围 {} 至 {}", forest.get(0).getLeft(), forest.get(forest.size() - 1).getRight());
        }
        return counter;
    }

    /**
     * 为一棵子树编号
     *
     * @param node    子树根节点
     * @param counter 进入前已分配的最后一个编号
     * @param depth   子树根节点的层级
     * @return 离开子树后已分配的最后一个编号
     */
    public int index(Area node, int counter, int depth) {
        if (counter < 0) {
            throw new IllegalStateException("编号不能为负数: " + counter);
        }
        if (node.isIndexed()) {
            throw new IllegalStateException("节点 [%s] 已编号".formatted(node.getCode()));
        }
        counter = next(counter);
        node.setLeft(counter);
        node.setDepth(depth);
        for (Area child : node.getChildren()) {
            counter = index(child, counter, depth + 1);
        }
        counter = next(counter);
        node.setRight(counter);
        return counter;
    }

    /**
     * 每个根节点进入前的编号，即前面各棵树节点数之和的两倍；
     * 按这些偏移各自编号的结果与顺序编号一致
     */
    public static int[] rootOffsets(List<Area> forest) {
        int[] offsets = new int[forest.size()];
        int offset = 0;
        for (int i = 0; i < forest.size(); i++) {
            offsets[i] = offset;
            try {
                offset = Math.addExact(offset, Math.multiplyExact(2, forest.get(i).size()));
            } catch (ArithmeticException e) {
                throw new IllegalStateException("嵌套集合编号溢出", e);
            }
        }
        return offsets;
    }

    private static int next(int counter) {
        try {
            return Math.addExact(counter, 1);
        } catch (ArithmeticException e) {
            throw new IllegalStateException("嵌套集合编号溢出", e);
        }
    }

}
