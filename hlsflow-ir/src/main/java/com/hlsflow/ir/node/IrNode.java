package com.hlsflow.ir.node;

import com.hlsflow.ir.IrFunction;
import com.hlsflow.ir.type.IrType;
import com.hlsflow.ir.value.IrValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * IR 数据流节点。
 *
 * <p>操作数布局：</p>
 * <ul>
 *   <li>SEL: (cond, onTrue, onFalse)</li>
 *   <li>PRIORITY_SEL: (selector, case0 .. caseN-1, default)，取最低置位对应的 case</li>
 *   <li>ARRAY_UPDATE: (array, index, value)</li>
 *   <li>RECEIVE: (predicate?)；SEND: (data, predicate?)</li>
 *   <li>CONCAT: 首个操作数为最高位</li>
 * </ul>
 */
public final class IrNode {

    private final int id;
    private final IrOp op;
    private final IrType type;
    private final List<IrNode> operands;
    private String name;

    /** LITERAL 的值 */
    private IrValue literal;
    /** TUPLE_INDEX 的下标、BIT_SLICE 的起始位 */
    private int index;
    /** PARAM / STATE_READ / RECEIVE / SEND 引用的参数、状态或通道名 */
    private String reference;
    /** INVOKE 的被调函数 */
    private IrFunction callee;

    public IrNode(int id, IrOp op, IrType type, List<IrNode> operands) {
        this.id = id;
        this.op = op;
        this.type = type;
        this.operands = new ArrayList<>(operands);
    }

    public int getId() { return id; }
    public IrOp getOp() { return op; }
    public IrType getType() { return type; }

    public List<IrNode> getOperands() {
        return Collections.unmodifiableList(operands);
    }

    public IrNode getOperand(int i) {
        return operands.get(i);
    }

    public int getOperandCount() {
        return operands.size();
    }

    /** 把对 oldNode 的引用替换为 newNode，返回是否有替换 */
    public boolean replaceOperand(IrNode oldNode, IrNode newNode) {
        boolean changed = false;
        for (int i = 0; i < operands.size(); i++) {
            if (operands.get(i) == oldNode) {
                operands.set(i, newNode);
                changed = true;
            }
        }
        return changed;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public IrValue getLiteral() { return literal; }
    public void setLiteral(IrValue literal) { this.literal = literal; }

    public int getIndex() { return index; }
    public void setIndex(int index) { this.index = index; }

    public String getReference() { return reference; }
    public void setReference(String reference) { this.reference = reference; }

    public IrFunction getCallee() { return callee; }
    public void setCallee(IrFunction callee) { this.callee = callee; }

    public boolean isLiteral() {
        return op == IrOp.LITERAL;
    }

    /** RECEIVE/SEND 是否带谓词 */
    public boolean hasPredicate() {
        if (op == IrOp.RECEIVE) return operands.size() == 1;
        if (op == IrOp.SEND) return operands.size() == 2;
        return false;
    }

    public IrNode getPredicate() {
        if (!hasPredicate()) {
            return null;
        }
        return operands.get(operands.size() - 1);
    }

    /** 文本中引用此节点的名字 */
    public String getDisplayName() {
        if (name != null) {
            return name;
        }
        return op.getMnemonic() + "." + id;
    }

    @Override
    public String toString() {
        return getDisplayName() + ": " + type;
    }
}
