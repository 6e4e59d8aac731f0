package com.hlsflow.ir.pass;

import com.hlsflow.ir.IrFunction;
import com.hlsflow.ir.IrFunctionBase;
import com.hlsflow.ir.IrPackage;
import com.hlsflow.ir.node.IrNode;
import com.hlsflow.ir.node.IrOp;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把 INVOKE 节点替换为被调函数体的副本，直到不再有调用。
 */
public class InlineInvokesPass implements IrPass {

    @Override
    public String getName() {
        return "inline";
    }

    @Override
    public IrPackage run(IrPackage pkg) {
        for (IrFunctionBase fb : pkg.getFunctionBases()) {
            inlineAll(fb);
        }
        return pkg;
    }

    /** 内联 fb 中的全部调用（被调函数中的调用随副本一起展开） */
    public void inlineAll(IrFunctionBase fb) {
        List<IrNode> invokes = fb.getNodesWithOp(IrOp.INVOKE);
        while (!invokes.isEmpty()) {
            for (IrNode invoke : invokes) {
                inline(fb, invoke);
            }
            invokes = fb.getNodesWithOp(IrOp.INVOKE);
        }
    }

    private void inline(IrFunctionBase caller, IrNode invoke) {
        IrFunction callee = invoke.getCallee();
        Map<IrNode, IrNode> mapping = new IdentityHashMap<>();
        List<IrNode> params = callee.getParams();
        for (int i = 0; i < params.size(); i++) {
            mapping.put(params.get(i), invoke.getOperand(i));
        }
        List<IrNode> cloned = new ArrayList<>();
        for (IrNode node : callee.getNodes()) {
            if (node.getOp() == IrOp.PARAM) {
                continue;
            }
            List<IrNode> operands = new ArrayList<>(node.getOperandCount());
            for (IrNode operand : node.getOperands()) {
                operands.add(mapping.get(operand));
            }
            IrNode copy = new IrNode(caller.nextNodeId(), node.getOp(), node.getType(), operands);
            copy.setLiteral(node.getLiteral());
            copy.setIndex(node.getIndex());
            copy.setReference(node.getReference());
            copy.setCallee(node.getCallee());
            mapping.put(node, copy);
            cloned.add(copy);
        }
        caller.insertNodesBefore(invoke, cloned);
        caller.replaceAllUses(invoke, mapping.get(callee.getReturnValue()));
        caller.removeNode(invoke);
    }
}
