package com.hlsflow.translator.gen;

import com.hlsflow.ir.IrBuilder;
import com.hlsflow.ir.node.IrNode;
import com.hlsflow.ir.value.IrValue;
import com.hlsflow.translator.types.CType;
import com.hlsflow.translator.types.StructLayout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 结构体打包 / 拆包、整数转换与左值路径更新
 */
final class ValueOps {

    private ValueOps() {
    }

    static IrNode zero(IrBuilder b, CType type) {
        return b.literal(IrValue.zero(type.toIrType()));
    }

    static IrNode one(IrBuilder b, CType type) {
        return b.literal(type.getWidth(), 1);
    }

    // ========== 结构体 ==========

    static IrNode field(IrBuilder b, StructLayout layout, IrNode value, int index) {
        if (layout.isNoTuple()) {
            return value;
        }
        return b.tupleIndex(value, index);
    }

    static List<IrNode> unpack(IrBuilder b, StructLayout layout, IrNode value) {
        int n = layout.getFieldCount();
        if (layout.isNoTuple()) {
            return Collections.singletonList(value);
        }
        List<IrNode> fields = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            fields.add(b.tupleIndex(value, i));
        }
        return fields;
    }

    static IrNode pack(IrBuilder b, StructLayout layout, List<IrNode> fields) {
        if (layout.isNoTuple()) {
            return fields.get(0);
        }
        return b.tuple(fields);
    }

    static IrNode withField(IrBuilder b, StructLayout layout, IrNode value, int index, IrNode newField) {
        List<IrNode> fields = new ArrayList<>(unpack(b, layout, value));
        fields.set(index, newField);
        return pack(b, layout, fields);
    }

    /** 派生类值中的基类部分 */
    static IrNode baseSlice(IrBuilder b, StructLayout derived, StructLayout base, IrNode value) {
        List<IrNode> fields = unpack(b, derived, value);
        return pack(b, base, new ArrayList<>(fields.subList(0, base.getFieldCount())));
    }

    static IrNode withBase(IrBuilder b, StructLayout derived, StructLayout base, IrNode value, IrNode newBase) {
        List<IrNode> fields = new ArrayList<>(unpack(b, derived, value));
        List<IrNode> baseFields = unpack(b, base, newBase);
        for (int i = 0; i < baseFields.size(); i++) {
            fields.set(i, baseFields.get(i));
        }
        return pack(b, derived, fields);
    }

    // ========== 整数 ==========

    /** 整数 / 布尔之间的转换：截断、符号扩展或零扩展；转 bool 为 != 0 */
    static IrNode convertIntegral(IrBuilder b, CValue v, CType target) {
        CType from = v.getType();
        if (from.equals(target)) {
            return v.getNode();
        }
        if (target.isBool()) {
            return toBool(b, v);
        }
        return b.resize(v.getNode(), target.getWidth(), from.isInt() && from.isSigned());
    }

    static IrNode toBool(IrBuilder b, CValue v) {
        if (v.getType().isBool()) {
            return v.getNode();
        }
        return b.ne(v.getNode(), zero(b, v.getType()));
    }

    // ========== 左值 ==========

    static IrNode read(IrBuilder b, LValue lv) {
        IrNode value = lv.getRoot().getValue();
        for (LValue.Step step : lv.getSteps()) {
            value = readStep(b, step, value);
        }
        return value;
    }

    private static IrNode readStep(IrBuilder b, LValue.Step step, IrNode value) {
        switch (step.getKind()) {
            case FIELD:
                return field(b, step.getContainer(), value, step.getField());
            case INDEX:
                return b.arrayIndex(value, step.getIndex());
            case BASE:
                return baseSlice(b, step.getContainer(), step.getType().getStruct(), value);
            default:
                throw new IllegalStateException("Unknown step " + step.getKind());
        }
    }

    /** 把 newValue 写入路径末端后得到的根变量新值 */
    static IrNode update(IrBuilder b, LValue lv, IrNode newValue) {
        return update(b, lv.getSteps(), 0, lv.getRoot().getValue(), newValue);
    }

    private static IrNode update(IrBuilder b, List<LValue.Step> steps, int k, IrNode current, IrNode newValue) {
        if (k == steps.size()) {
            return newValue;
        }
        LValue.Step step = steps.get(k);
        IrNode inner = readStep(b, step, current);
        IrNode updated = update(b, steps, k + 1, inner, newValue);
        switch (step.getKind()) {
            case FIELD:
                return withField(b, step.getContainer(), current, step.getField(), updated);
            case INDEX:
                return b.arrayUpdate(current, step.getIndex(), updated);
            case BASE:
                return withBase(b, step.getContainer(), step.getType().getStruct(), current, updated);
            default:
                throw new IllegalStateException("Unknown step " + step.getKind());
        }
    }
}
