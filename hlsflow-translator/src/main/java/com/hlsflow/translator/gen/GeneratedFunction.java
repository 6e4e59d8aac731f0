package com.hlsflow.translator.gen;

import com.hlsflow.ir.IrFunction;
import com.hlsflow.translator.io.IoOp;

import java.util.Collections;
import java.util.List;

/**
 * 顶层函数的生成结果：IR 函数与其输出的组成
 */
public final class GeneratedFunction {

    private final IrFunction function;
    private final boolean hasReturnValue;
    private final List<String> outParameters;
    private final List<String> staticLocals;
    private final List<IoOp> ioOps;

    GeneratedFunction(IrFunction function, boolean hasReturnValue, List<String> outParameters,
                      List<String> staticLocals, List<IoOp> ioOps) {
        this.function = function;
        this.hasReturnValue = hasReturnValue;
        this.outParameters = Collections.unmodifiableList(outParameters);
        this.staticLocals = Collections.unmodifiableList(staticLocals);
        this.ioOps = Collections.unmodifiableList(ioOps);
    }

    public IrFunction getFunction() {
        return function;
    }

    public boolean hasReturnValue() {
        return hasReturnValue;
    }

    /** 作为输出返回的非 const 引用形参 */
    public List<String> getOutParameters() {
        return outParameters;
    }

    public List<String> getStaticLocals() {
        return staticLocals;
    }

    /** 程序顺序的 IO 操作，每个在输出中占一个 {值, fired} 对 */
    public List<IoOp> getIoOps() {
        return ioOps;
    }

    public int getOutputCount() {
        return (hasReturnValue ? 1 : 0) + outParameters.size() + staticLocals.size() + ioOps.size();
    }

    /** 单个输出且没有 IO 时直接返回该值，不包成元组 */
    public boolean isBareResult() {
        return ioOps.isEmpty() && getOutputCount() == 1;
    }
}
