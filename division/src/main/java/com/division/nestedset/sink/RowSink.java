package com.division.nestedset.sink;

import com.division.mybatisplus.entity.NestedArea;
import com.division.nestedset.exception.EmissionException;

/**
 * 嵌套集合行的输出端
 * <p>
 * 按先序逐行写入，全部写完后调用 {@link #finish()} 提交；
 * 未提交就关闭时丢弃已写内容，不留下部分结果。
 *
 * @author ZhangBoyuan
 * @since 2026-10-18
 */
public interface RowSink extends AutoCloseable {

    /**
     * 写入一行
     *
     * @throws EmissionException 写入失败
     */
    void write(NestedArea row);

    /**
     * 提交全部已写入的行
     *
     * @throws EmissionException 提交失败
     */
    void finish();

    /**
     * 释放资源，未提交时丢弃已写内容
     */
    @Override
    void close();

    /**
     * 输出位置描述，用于日志
     */
    String describe();

}
