package com.hlsflow.ir.pass;

import com.hlsflow.ir.IrPackage;

/**
 * IR pass 接口。
 */
public interface IrPass {

    /**
     * Pass 名称。
     */
    String getName();

    /**
     * 对 IR 包执行变换，返回结果包（可以是同一对象）。
     */
    IrPackage run(IrPackage pkg);
}
