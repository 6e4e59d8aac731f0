package com.hlsflow.translator.gen;

import com.hlsflow.ir.node.IrNode;
import com.hlsflow.translator.types.CType;
import com.hlsflow.translator.types.StructLayout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 可赋值位置：根变量加访问路径（字段、数组下标、基类切片）。
 * 写入时沿路径做函数式更新并重新绑定根变量。
 */
public final class LValue {

    public static final class Step {
        public enum Kind {
            FIELD, INDEX, BASE
        }

        private final Kind kind;
        /** FIELD / BASE 作用的结构体 */
        private final StructLayout container;
        private final int field;
        private final IrNode index;
        /** 本步之后的类型 */
        private final CType type;

        private Step(Kind kind, StructLayout container, int field, IrNode index, CType type) {
            this.kind = kind;
            this.container = container;
            this.field = field;
            this.index = index;
            this.type = type;
        }

        public Kind getKind() { return kind; }
        public StructLayout getContainer() { return container; }
        public int getField() { return field; }
        public IrNode getIndex() { return index; }
        public CType getType() { return type; }
    }

    private final Variable root;
    private final List<Step> steps;
    private final CType type;

    private LValue(Variable root, List<Step> steps, CType type) {
        this.root = root;
        this.steps = steps;
        this.type = type;
    }

    /** 变量本身；引用变量展开为其目标 */
    public static LValue of(Variable variable) {
        if (variable.getKind() == Variable.Kind.REFERENCE) {
            return variable.getTarget();
        }
        return new LValue(variable, Collections.<Step>emptyList(), variable.getType());
    }

    public LValue field(StructLayout container, int fieldIndex) {
        CType fieldType = container.getAllFields().get(fieldIndex).getType();
        return append(new Step(Step.Kind.FIELD, container, fieldIndex, null, fieldType));
    }

    public LValue index(IrNode indexNode) {
        return append(new Step(Step.Kind.INDEX, null, 0, indexNode, type.getElement()));
    }

    /** 把派生类对象视为基类 base */
    public LValue base(StructLayout base) {
        return append(new Step(Step.Kind.BASE, type.getStruct(), 0, null, CType.struct(base)));
    }

    private LValue append(Step step) {
        List<Step> extended = new ArrayList<>(steps);
        extended.add(step);
        return new LValue(root, extended, step.getType());
    }

    public Variable getRoot() {
        return root;
    }

    public List<Step> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public CType getType() {
        return type;
    }

    @Override
    public String toString() {
        return root.getName() + (steps.isEmpty() ? "" : "[" + steps.size() + " steps]");
    }
}
