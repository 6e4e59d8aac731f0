package com.hlsflow.ir.interp;

/**
 * IR 求值错误（实参缺失或类型不符、非法节点等）。
 */
public class IrEvaluationException extends RuntimeException {

    public IrEvaluationException(String message) {
        super(message);
    }

    public IrEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
