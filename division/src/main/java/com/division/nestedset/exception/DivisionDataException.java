package com.division.nestedset.exception;

/**
 * 区划数据格式错误：编码长度不足、非数字、重复，或找不到上级节点
 * 出现即终止整个生成过程，不产出任何部分结果
 *
 * @author ZhangBoyuan
 * @since 2026-10-18
 */
public class DivisionDataException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DivisionDataException(String message) {
        super(message);
    }

    public DivisionDataException(String message, Throwable cause) {
        super(message, cause);
    }

}
