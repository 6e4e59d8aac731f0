package com.hlsflow.ir;

import com.hlsflow.ir.node.IrNode;
import com.hlsflow.ir.node.IrOp;

/**
 * 把 IR 包渲染为文本。
 */
public final class IrPrinter {

    private IrPrinter() {
    }

    public static String print(IrPackage pkg) {
        StringBuilder sb = new StringBuilder();
        sb.append("package ").append(pkg.getName()).append('\n');
        if (pkg.getTopName() != null) {
            sb.append("top ").append(pkg.getTopName()).append('\n');
        }
        for (IrChannel channel : pkg.getChannels()) {
            sb.append('\n').append(channel);
        }
        if (!pkg.getChannels().isEmpty()) {
            sb.append('\n');
        }
        for (IrFunction function : pkg.getFunctions()) {
            sb.append('\n').append(print(function));
        }
        for (IrProc proc : pkg.getProcs()) {
            sb.append('\n').append(print(proc));
        }
        return sb.toString();
    }

    public static String print(IrFunction function) {
        StringBuilder sb = new StringBuilder();
        sb.append("fn ").append(function.getName()).append('(');
        boolean first = true;
        for (IrNode p : function.getParams()) {
            if (!first) sb.append(", ");
            sb.append(p.getName()).append(": ").append(p.getType());
            first = false;
        }
        sb.append(") -> ").append(function.getReturnType()).append(" {\n");
        for (IrNode node : function.getNodes()) {
            if (node.getOp() != IrOp.PARAM) {
                sb.append("  ").append(printNode(node)).append('\n');
            }
        }
        if (function.getReturnValue() != null) {
            sb.append("  ret ").append(function.getReturnValue().getDisplayName()).append('\n');
        }
        return sb.append("}\n").toString();
    }

    public static String print(IrProc proc) {
        StringBuilder sb = new StringBuilder();
        sb.append("proc ").append(proc.getName()).append('(');
        boolean first = true;
        for (IrProc.StateElement e : proc.getStateElements()) {
            if (!first) sb.append(", ");
            sb.append(e.getName()).append(": ").append(e.getType())
                    .append(" init=").append(e.getInitialValue());
            first = false;
        }
        sb.append(") {\n");
        for (IrNode node : proc.getNodes()) {
            if (node.getOp() != IrOp.STATE_READ) {
                sb.append("  ").append(printNode(node)).append('\n');
            }
        }
        for (IrProc.StateElement e : proc.getStateElements()) {
            sb.append("  next ").append(e.getName()).append(" = ")
                    .append(e.getNext().getDisplayName()).append('\n');
        }
        return sb.append("}\n").toString();
    }

    static String printNode(IrNode node) {
        StringBuilder sb = new StringBuilder();
        sb.append(node.getDisplayName()).append(": ").append(node.getType())
                .append(" = ").append(node.getOp().getMnemonic()).append('(');
        boolean first = true;
        for (IrNode operand : node.getOperands()) {
            if (!first) sb.append(", ");
            sb.append(operand.getDisplayName());
            first = false;
        }
        String attribute = attribute(node);
        if (attribute != null) {
            if (!first) sb.append(", ");
            sb.append(attribute);
        }
        return sb.append(')').toString();
    }

    private static String attribute(IrNode node) {
        switch (node.getOp()) {
            case LITERAL: return "value=" + node.getLiteral();
            case TUPLE_INDEX: return "index=" + node.getIndex();
            case BIT_SLICE: return "start=" + node.getIndex() + ", width=" + node.getType().getWidth();
            case ZERO_EXT:
            case SIGN_EXT: return "new_bit_count=" + node.getType().getWidth();
            case INVOKE: return "to_apply=" + node.getCallee().getName();
            case RECEIVE:
            case SEND: return "channel=" + node.getReference();
            case STATE_READ: return "state_element=" + node.getReference();
            default: return null;
        }
    }
}
