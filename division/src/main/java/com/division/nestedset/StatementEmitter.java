package com.division.nestedset;

import com.division.mybatisplus.entity.NestedArea;
import com.division.nestedset.exception.EmissionException;
import com.division.nestedset.model.Area;
import com.division.nestedset.sink.RowSink;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 按先序遍历已编号的森林，每个节点输出一行，顺序与编号时一致：
 * 父节点之后紧跟其整棵子树
 *
 * @author ZhangBoyuan
 * @since 2026-10-18
 */
@Slf4j
public class StatementEmitter {

    /**
     * 输出整片森林并提交
     *
     * @param forest 已编号的森林
     * @param sink   输出端，由调用方负责关闭
     * @return 输出行数
     * @throws EmissionException 任一行写入失败或提交失败
     */
    public long emit(List<Area> forest, RowSink sink) {
        long rows = 0;
        for (Area root : forest) {
            rows = emit(root, sink, rows);
        }
        sink.finish();
        log.info("共输出 {} 行到 {}", rows, sink.describe());
        return rows;
    }

    private long emit(Area node, RowSink sink, long rows) {
        sink.write(toRow(node));
        rows++;
        for (Area child : node.getChildren()) {
            rows = emit(child, sink, rows);
        }
        return rows;
    }

    /**
     * 节点转为表行
     *
     * @throws IllegalStateException 节点尚未编号
     */
    public static NestedArea toRow(Area node) {
        if (!node.isIndexed()) {
            throw new IllegalStateException("节点 [%s] 尚未编号".formatted(node.getCode()));
        }
        return new NestedArea(node.getCode(), node.getName(), node.getParentCode(),
                node.getDepth(), node.getLeft(), node.getRight());
    }

}
