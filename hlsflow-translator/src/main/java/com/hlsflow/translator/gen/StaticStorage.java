package com.hlsflow.translator.gen;

import com.hlsflow.ir.node.IrNode;
import com.hlsflow.ir.value.IrValue;
import com.hlsflow.translator.types.CType;

/**
 * 顶层函数静态局部变量的存放方式：函数模式下是参数加输出，proc 模式下是状态元素
 */
public interface StaticStorage {

    /** 声明静态变量，返回其初始读取节点 */
    IrNode declare(String name, CType type, IrValue initialValue);
}
