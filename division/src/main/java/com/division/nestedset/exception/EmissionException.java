package com.division.nestedset.exception;

/**
 * 输出端写入失败，整次输出作废
 *
 * @author ZhangBoyuan
 * @since 2026-10-18
 */
public class EmissionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EmissionException(String message) {
        super(message);
    }

    public EmissionException(String message, Throwable cause) {
        super(message, cause);
    }

}
