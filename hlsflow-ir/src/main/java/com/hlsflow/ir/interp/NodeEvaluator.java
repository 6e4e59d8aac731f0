package com.hlsflow.ir.interp;

import com.hlsflow.ir.node.IrNode;
import com.hlsflow.ir.type.IrType;
import com.hlsflow.ir.value.Bits;
import com.hlsflow.ir.value.IrValue;

import java.util.ArrayList;
import java.util.List;

/**
 * 纯节点的求值规则，解释器与构建期常量折叠共用。
 *
 * <p>除零：无符号商为全 1，有符号商为同号极值；模零为 0。
 * 数组下标越界：读取钳制到末元素，更新忽略。</p>
 */
public final class NodeEvaluator {

    private NodeEvaluator() {
    }

    public static IrValue evaluate(IrNode node, List<IrValue> operands) {
        IrType type = node.getType();
        switch (node.getOp()) {
            case LITERAL:
                return node.getLiteral();
            case ADD:
                return bits(type, u(operands, 0) + u(operands, 1));
            case SUB:
                return bits(type, u(operands, 0) - u(operands, 1));
            case MUL:
                return bits(type, u(operands, 0) * u(operands, 1));
            case UDIV: {
                long divisor = u(operands, 1);
                if (divisor == 0) {
                    return IrValue.ofBits(Bits.allOnes(type.getWidth()));
                }
                return bits(type, Long.divideUnsigned(u(operands, 0), divisor));
            }
            case SDIV: {
                long dividend = s(operands, 0);
                long divisor = s(operands, 1);
                int width = type.getWidth();
                if (divisor == 0) {
                    if (width == 0) {
                        return bits(type, 0);
                    }
                    long max = Bits.mask(width - 1);
                    return bits(type, dividend < 0 ? ~max : max);
                }
                return bits(type, dividend / divisor);
            }
            case UMOD: {
                long divisor = u(operands, 1);
                return bits(type, divisor == 0 ? 0 : Long.remainderUnsigned(u(operands, 0), divisor));
            }
            case SMOD: {
                long divisor = s(operands, 1);
                return bits(type, divisor == 0 ? 0 : s(operands, 0) % divisor);
            }
            case NEG:
                return bits(type, -u(operands, 0));
            case AND:
                return bits(type, u(operands, 0) & u(operands, 1));
            case OR:
                return bits(type, u(operands, 0) | u(operands, 1));
            case XOR:
                return bits(type, u(operands, 0) ^ u(operands, 1));
            case NOT:
                return bits(type, ~u(operands, 0));
            case SHLL: {
                long amount = u(operands, 1);
                return bits(type, outOfRange(amount, type) ? 0 : u(operands, 0) << amount);
            }
            case SHRL: {
                long amount = u(operands, 1);
                return bits(type, outOfRange(amount, type) ? 0 : u(operands, 0) >>> amount);
            }
            case SHRA: {
                long amount = u(operands, 1);
                long value = s(operands, 0);
                if (outOfRange(amount, type)) {
                    return bits(type, value < 0 ? -1L : 0);
                }
                return bits(type, value >> amount);
            }
            case EQ:
                return IrValue.ofBool(operands.get(0).equals(operands.get(1)));
            case NE:
                return IrValue.ofBool(!operands.get(0).equals(operands.get(1)));
            case ULT:
                return IrValue.ofBool(Long.compareUnsigned(u(operands, 0), u(operands, 1)) < 0);
            case ULE:
                return IrValue.ofBool(Long.compareUnsigned(u(operands, 0), u(operands, 1)) <= 0);
            case UGT:
                return IrValue.ofBool(Long.compareUnsigned(u(operands, 0), u(operands, 1)) > 0);
            case UGE:
                return IrValue.ofBool(Long.compareUnsigned(u(operands, 0), u(operands, 1)) >= 0);
            case SLT:
                return IrValue.ofBool(s(operands, 0) < s(operands, 1));
            case SLE:
                return IrValue.ofBool(s(operands, 0) <= s(operands, 1));
            case SGT:
                return IrValue.ofBool(s(operands, 0) > s(operands, 1));
            case SGE:
                return IrValue.ofBool(s(operands, 0) >= s(operands, 1));
            case SEL:
                return operands.get(0).isTrue() ? operands.get(1) : operands.get(2);
            case PRIORITY_SEL: {
                Bits selector = operands.get(0).getBits();
                int cases = operands.size() - 2;
                for (int i = 0; i < cases; i++) {
                    if (selector.getBit(i)) {
                        return operands.get(i + 1);
                    }
                }
                return operands.get(operands.size() - 1);
            }
            case ZERO_EXT:
                return bits(type, u(operands, 0));
            case SIGN_EXT:
                return bits(type, s(operands, 0));
            case BIT_SLICE:
                return bits(type, u(operands, 0) >>> node.getIndex());
            case CONCAT: {
                long acc = 0;
                for (IrValue v : operands) {
                    int width = v.getType().getWidth();
                    acc = (width >= 64 ? 0 : acc << width) | v.toUnsignedLong();
                }
                return bits(type, acc);
            }
            case TUPLE:
                return IrValue.tuple(operands);
            case TUPLE_INDEX:
                return operands.get(0).getElement(node.getIndex());
            case ARRAY:
                return IrValue.array(operands);
            case ARRAY_INDEX: {
                List<IrValue> elements = operands.get(0).getElements();
                return elements.get(clampIndex(u(operands, 1), elements.size()));
            }
            case ARRAY_UPDATE: {
                List<IrValue> elements = operands.get(0).getElements();
                long index = u(operands, 1);
                if (Long.compareUnsigned(index, elements.size()) >= 0) {
                    return operands.get(0);
                }
                List<IrValue> updated = new ArrayList<>(elements);
                updated.set((int) index, operands.get(2));
                return IrValue.array(updated);
            }
            default:
                throw new IrEvaluationException("Node " + node.getDisplayName() + " ("
                        + node.getOp().getMnemonic() + ") cannot be evaluated in isolation");
        }
    }

    private static int clampIndex(long index, int size) {
        if (Long.compareUnsigned(index, size) >= 0) {
            return size - 1;
        }
        return (int) index;
    }

    private static boolean outOfRange(long amount, IrType type) {
        return Long.compareUnsigned(amount, type.getWidth()) >= 0;
    }

    private static IrValue bits(IrType type, long value) {
        return IrValue.ofBits(type.getWidth(), value);
    }

    private static long u(List<IrValue> operands, int i) {
        return operands.get(i).toUnsignedLong();
    }

    private static long s(List<IrValue> operands, int i) {
        return operands.get(i).toSignedLong();
    }
}
