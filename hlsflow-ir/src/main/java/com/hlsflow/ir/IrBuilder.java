package com.hlsflow.ir;

import com.hlsflow.ir.interp.IrInterpreter;
import com.hlsflow.ir.interp.NodeEvaluator;
import com.hlsflow.ir.node.IrNode;
import com.hlsflow.ir.node.IrOp;
import com.hlsflow.ir.type.IrType;
import com.hlsflow.ir.value.Bits;
import com.hlsflow.ir.value.IrValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * IR 构建辅助类。
 * 封装创建节点的便捷方法，操作数全为字面量时在构建期折叠。
 */
public class IrBuilder {

    private final IrFunctionBase target;
    /** 非 null 时新节点插入到该节点之前 */
    private IrNode insertionPoint;
    private boolean folding = true;

    public IrBuilder(IrFunctionBase target) {
        this.target = target;
    }

    public IrFunctionBase getTarget() { return target; }

    public void setInsertionPoint(IrNode anchor) {
        this.insertionPoint = anchor;
    }

    public void clearInsertionPoint() {
        this.insertionPoint = null;
    }

    public void setFolding(boolean folding) {
        this.folding = folding;
    }

    // ========== 节点发射 ==========

    private IrNode place(IrNode node) {
        if (insertionPoint != null) {
            return target.insertNodeBefore(insertionPoint, node);
        }
        return target.addNode(node);
    }

    private IrNode create(IrOp op, IrType type, List<IrNode> operands) {
        return new IrNode(target.nextNodeId(), op, type, operands);
    }

    private IrNode emit(IrOp op, IrType type, IrNode... operands) {
        return emit(op, type, Arrays.asList(operands), 0);
    }

    private IrNode emit(IrOp op, IrType type, List<IrNode> operands, int index) {
        IrNode node = create(op, type, operands);
        node.setIndex(index);
        if (folding && op.isFoldable() && allLiterals(operands)) {
            List<IrValue> values = new ArrayList<>(operands.size());
            for (IrNode operand : operands) {
                values.add(operand.getLiteral());
            }
            return literal(NodeEvaluator.evaluate(node, values));
        }
        return place(node);
    }

    private static boolean allLiterals(List<IrNode> nodes) {
        for (IrNode n : nodes) {
            if (!n.isLiteral()) {
                return false;
            }
        }
        return true;
    }

    // ========== 源节点 ==========

    public IrNode param(String name, IrType type) {
        if (!(target instanceof IrFunction)) {
            throw new IllegalStateException("Params can only be added to functions");
        }
        IrNode node = create(IrOp.PARAM, type, Collections.<IrNode>emptyList());
        node.setName(name);
        return ((IrFunction) target).addParam(node);
    }

    public IrNode literal(IrValue value) {
        IrNode node = create(IrOp.LITERAL, value.getType(), Collections.<IrNode>emptyList());
        node.setLiteral(value);
        return place(node);
    }

    public IrNode literal(int width, long value) {
        return literal(IrValue.ofBits(width, value));
    }

    public IrNode literalBool(boolean value) {
        return literal(IrValue.ofBool(value));
    }

    /** proc 状态元素，返回其 STATE_READ 节点 */
    public IrNode state(String name, IrValue initialValue) {
        if (!(target instanceof IrProc)) {
            throw new IllegalStateException("State can only be added to procs");
        }
        return ((IrProc) target).addStateElement(name, initialValue).getRead();
    }

    // ========== 算术 ==========

    public IrNode add(IrNode a, IrNode b) { return binary(IrOp.ADD, a, b); }
    public IrNode sub(IrNode a, IrNode b) { return binary(IrOp.SUB, a, b); }
    public IrNode mul(IrNode a, IrNode b) { return binary(IrOp.MUL, a, b); }
    public IrNode udiv(IrNode a, IrNode b) { return binary(IrOp.UDIV, a, b); }
    public IrNode sdiv(IrNode a, IrNode b) { return binary(IrOp.SDIV, a, b); }
    public IrNode umod(IrNode a, IrNode b) { return binary(IrOp.UMOD, a, b); }
    public IrNode smod(IrNode a, IrNode b) { return binary(IrOp.SMOD, a, b); }
    public IrNode xor(IrNode a, IrNode b) { return binary(IrOp.XOR, a, b); }

    public IrNode neg(IrNode a) {
        return emit(IrOp.NEG, requireBits(a), a);
    }

    private IrNode binary(IrOp op, IrNode a, IrNode b) {
        requireSameBits(op, a, b);
        return emit(op, a.getType(), a, b);
    }

    // ========== 位运算（带化简） ==========

    public IrNode and(IrNode a, IrNode b) {
        requireSameBits(IrOp.AND, a, b);
        if (folding) {
            if (isAllOnes(a)) return b;
            if (isAllOnes(b)) return a;
            if (isZero(a)) return a;
            if (isZero(b)) return b;
            if (a == b) return a;
        }
        return emit(IrOp.AND, a.getType(), a, b);
    }

    public IrNode or(IrNode a, IrNode b) {
        requireSameBits(IrOp.OR, a, b);
        if (folding) {
            if (isZero(a)) return b;
            if (isZero(b)) return a;
            if (isAllOnes(a)) return a;
            if (isAllOnes(b)) return b;
            if (a == b) return a;
        }
        return emit(IrOp.OR, a.getType(), a, b);
    }

    public IrNode not(IrNode a) {
        requireBits(a);
        if (folding && a.getOp() == IrOp.NOT) {
            return a.getOperand(0);
        }
        return emit(IrOp.NOT, a.getType(), a);
    }

    private static boolean isZero(IrNode n) {
        return n.isLiteral() && n.getLiteral().getBits().isZero();
    }

    private static boolean isAllOnes(IrNode n) {
        return n.isLiteral() && n.getLiteral().getBits().isAllOnes();
    }

    // ========== 移位 ==========

    public IrNode shll(IrNode a, IrNode amount) { return shift(IrOp.SHLL, a, amount); }
    public IrNode shrl(IrNode a, IrNode amount) { return shift(IrOp.SHRL, a, amount); }
    public IrNode shra(IrNode a, IrNode amount) { return shift(IrOp.SHRA, a, amount); }

    private IrNode shift(IrOp op, IrNode a, IrNode amount) {
        requireBits(a);
        requireBits(amount);
        return emit(op, a.getType(), a, amount);
    }

    // ========== 比较 ==========

    public IrNode eq(IrNode a, IrNode b) { return compare(IrOp.EQ, a, b); }
    public IrNode ne(IrNode a, IrNode b) { return compare(IrOp.NE, a, b); }
    public IrNode ult(IrNode a, IrNode b) { return compare(IrOp.ULT, a, b); }
    public IrNode ule(IrNode a, IrNode b) { return compare(IrOp.ULE, a, b); }
    public IrNode ugt(IrNode a, IrNode b) { return compare(IrOp.UGT, a, b); }
    public IrNode uge(IrNode a, IrNode b) { return compare(IrOp.UGE, a, b); }
    public IrNode slt(IrNode a, IrNode b) { return compare(IrOp.SLT, a, b); }
    public IrNode sle(IrNode a, IrNode b) { return compare(IrOp.SLE, a, b); }
    public IrNode sgt(IrNode a, IrNode b) { return compare(IrOp.SGT, a, b); }
    public IrNode sge(IrNode a, IrNode b) { return compare(IrOp.SGE, a, b); }

    private IrNode compare(IrOp op, IrNode a, IrNode b) {
        if (!a.getType().equals(b.getType())) {
            throw new IllegalArgumentException(op.getMnemonic() + " operands differ: "
                    + a.getType() + " vs " + b.getType());
        }
        if (op != IrOp.EQ && op != IrOp.NE) {
            requireBits(a);
        }
        return emit(op, IrType.bool(), a, b);
    }

    // ========== 选择 ==========

    /** cond ? onTrue : onFalse */
    public IrNode select(IrNode cond, IrNode onTrue, IrNode onFalse) {
        requireWidth(cond, 1);
        if (!onTrue.getType().equals(onFalse.getType())) {
            throw new IllegalArgumentException("Select arms differ: " + onTrue.getType() + " vs " + onFalse.getType());
        }
        if (folding) {
            if (cond.isLiteral()) {
                return cond.getLiteral().isTrue() ? onTrue : onFalse;
            }
            if (onTrue == onFalse) {
                return onTrue;
            }
            if (onTrue.isLiteral() && onFalse.isLiteral() && onTrue.getLiteral().equals(onFalse.getLiteral())) {
                return onTrue;
            }
            if (onTrue.getType().equals(IrType.bool()) && onTrue.isLiteral() && onFalse.isLiteral()) {
                return onTrue.getLiteral().isTrue() ? cond : not(cond);
            }
        }
        return emit(IrOp.SEL, onTrue.getType(), cond, onTrue, onFalse);
    }

    /**
     * 优先选择：selector 的最低置位 i 选 cases[i]，全零选 defaultValue
     */
    public IrNode prioritySelect(IrNode selector, List<IrNode> cases, IrNode defaultValue) {
        requireWidth(selector, cases.size());
        List<IrNode> operands = new ArrayList<>();
        operands.add(selector);
        for (IrNode c : cases) {
            if (!c.getType().equals(defaultValue.getType())) {
                throw new IllegalArgumentException("Priority select case type " + c.getType()
                        + " differs from " + defaultValue.getType());
            }
            operands.add(c);
        }
        operands.add(defaultValue);
        return emit(IrOp.PRIORITY_SEL, defaultValue.getType(), operands, 0);
    }

    // ========== 宽度 ==========

    public IrNode zeroExtend(IrNode a, int width) {
        requireBits(a);
        if (a.getType().getWidth() == width) return a;
        return emit(IrOp.ZERO_EXT, IrType.bits(width), a);
    }

    public IrNode signExtend(IrNode a, int width) {
        requireBits(a);
        if (a.getType().getWidth() == width) return a;
        return emit(IrOp.SIGN_EXT, IrType.bits(width), a);
    }

    public IrNode bitSlice(IrNode a, int start, int width) {
        requireBits(a);
        if (start == 0 && a.getType().getWidth() == width) return a;
        if (start + width > a.getType().getWidth()) {
            throw new IllegalArgumentException("Slice [" + start + ", " + (start + width)
                    + ") out of range for " + a.getType());
        }
        return emit(IrOp.BIT_SLICE, IrType.bits(width), Collections.singletonList(a), start);
    }

    /** 扩展或截断到目标宽度 */
    public IrNode resize(IrNode a, int width, boolean signed) {
        int from = requireBits(a).getWidth();
        if (from == width) return a;
        if (from > width) return bitSlice(a, 0, width);
        return signed ? signExtend(a, width) : zeroExtend(a, width);
    }

    /** 首个操作数为最高位 */
    public IrNode concat(List<IrNode> parts) {
        int width = 0;
        for (IrNode p : parts) {
            width += requireBits(p).getWidth();
        }
        return emit(IrOp.CONCAT, IrType.bits(width), parts, 0);
    }

    // ========== 聚合 ==========

    public IrNode tuple(List<IrNode> elements) {
        List<IrType> types = new ArrayList<>();
        for (IrNode e : elements) {
            types.add(e.getType());
        }
        return emit(IrOp.TUPLE, IrType.tuple(types), elements, 0);
    }

    public IrNode tuple(IrNode... elements) {
        return tuple(Arrays.asList(elements));
    }

    public IrNode tupleIndex(IrNode tuple, int index) {
        if (!tuple.getType().isTuple()) {
            throw new IllegalArgumentException("tuple_index on non-tuple " + tuple.getType());
        }
        if (folding && tuple.getOp() == IrOp.TUPLE) {
            return tuple.getOperand(index);
        }
        return emit(IrOp.TUPLE_INDEX, tuple.getType().getElementType(index),
                Collections.singletonList(tuple), index);
    }

    public IrNode array(List<IrNode> elements) {
        if (elements.isEmpty()) {
            throw new IllegalArgumentException("Array needs at least one element");
        }
        return emit(IrOp.ARRAY, IrType.array(elements.get(0).getType(), elements.size()), elements, 0);
    }

    public IrNode arrayIndex(IrNode array, IrNode index) {
        if (!array.getType().isArray()) {
            throw new IllegalArgumentException("array_index on non-array " + array.getType());
        }
        requireBits(index);
        return emit(IrOp.ARRAY_INDEX, array.getType().getElementType(), array, index);
    }

    public IrNode arrayUpdate(IrNode array, IrNode index, IrNode value) {
        if (!array.getType().isArray()) {
            throw new IllegalArgumentException("array_update on non-array " + array.getType());
        }
        requireBits(index);
        if (!array.getType().getElementType().equals(value.getType())) {
            throw new IllegalArgumentException("array_update value " + value.getType()
                    + " does not match element type " + array.getType().getElementType());
        }
        return emit(IrOp.ARRAY_UPDATE, array.getType(), array, index, value);
    }

    // ========== 调用与通道 ==========

    /** 调用纯函数；实参全为字面量时直接求值 */
    public IrNode invoke(IrFunction callee, List<IrNode> args) {
        List<IrType> paramTypes = callee.getParamTypes();
        if (paramTypes.size() != args.size()) {
            throw new IllegalArgumentException("Invoke of " + callee.getName() + " passes " + args.size()
                    + " arguments, expected " + paramTypes.size());
        }
        for (int i = 0; i < args.size(); i++) {
            if (!paramTypes.get(i).equals(args.get(i).getType())) {
                throw new IllegalArgumentException("Argument " + i + " of " + callee.getName() + " has type "
                        + args.get(i).getType() + ", expected " + paramTypes.get(i));
            }
        }
        if (folding && allLiterals(args)) {
            List<IrValue> values = new ArrayList<>();
            for (IrNode a : args) {
                values.add(a.getLiteral());
            }
            return literal(new IrInterpreter().run(callee, values));
        }
        IrNode node = create(IrOp.INVOKE, callee.getReturnType(), args);
        node.setCallee(callee);
        return place(node);
    }

    public IrNode receive(String channel, IrType type, IrNode predicate) {
        List<IrNode> operands = predicate == null
                ? Collections.<IrNode>emptyList() : Collections.singletonList(predicate);
        IrNode node = create(IrOp.RECEIVE, type, operands);
        node.setReference(channel);
        return place(node);
    }

    public IrNode send(String channel, IrNode data, IrNode predicate) {
        List<IrNode> operands = new ArrayList<>();
        operands.add(data);
        if (predicate != null) {
            operands.add(predicate);
        }
        IrNode node = create(IrOp.SEND, IrType.emptyTuple(), operands);
        node.setReference(channel);
        return place(node);
    }

    // ========== 校验 ==========

    private static IrType requireBits(IrNode n) {
        if (!n.getType().isBits()) {
            throw new IllegalArgumentException("Expected bits operand, got " + n.getType());
        }
        return n.getType();
    }

    private static void requireWidth(IrNode n, int width) {
        if (!n.getType().equals(IrType.bits(width))) {
            throw new IllegalArgumentException("Expected bits[" + width + "] operand, got " + n.getType());
        }
    }

    private static void requireSameBits(IrOp op, IrNode a, IrNode b) {
        requireBits(a);
        if (!a.getType().equals(b.getType())) {
            throw new IllegalArgumentException(op.getMnemonic() + " operands differ: "
                    + a.getType() + " vs " + b.getType());
        }
    }

    /** 布尔常量的便捷判断 */
    public static boolean isLiteralTrue(IrNode n) {
        return n.isLiteral() && n.getLiteral().isBits() && n.getLiteral().getBits().isTrue();
    }

    public static boolean isLiteralFalse(IrNode n) {
        return n.isLiteral() && n.getLiteral().isBits() && n.getLiteral().getBits().isZero();
    }

    /** 整数常量值（按宽度符号扩展或零扩展） */
    public static long literalValue(IrNode n, boolean signed) {
        Bits bits = n.getLiteral().getBits();
        return signed ? bits.toSignedLong() : bits.toUnsignedLong();
    }
}
