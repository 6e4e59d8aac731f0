package com.hlsflow.translator.gen;

import com.hlsflow.ir.IrFunction;
import com.hlsflow.translator.types.CType;

import java.util.List;

/**
 * 非内联被调函数：以 INVOKE 调用，结果元组依次为
 * 返回值（非 void 时）、更新后的 this（非 const 方法与构造函数）、各输出参数。
 */
final class CalleeFunction {
    private final IrFunction function;
    private final CType returnType;
    private final boolean takesThis;
    private final boolean returnsThis;
    /** 非 const 引用与数组参数的源参数下标 */
    private final List<Integer> outParameters;

    CalleeFunction(IrFunction function, CType returnType, boolean takesThis, boolean returnsThis,
                   List<Integer> outParameters) {
        this.function = function;
        this.returnType = returnType;
        this.takesThis = takesThis;
        this.returnsThis = returnsThis;
        this.outParameters = outParameters;
    }

    IrFunction getFunction() { return function; }
    CType getReturnType() { return returnType; }
    boolean takesThis() { return takesThis; }
    boolean returnsThis() { return returnsThis; }
    List<Integer> getOutParameters() { return outParameters; }

    boolean hasReturn() {
        return !returnType.isVoid();
    }
}
