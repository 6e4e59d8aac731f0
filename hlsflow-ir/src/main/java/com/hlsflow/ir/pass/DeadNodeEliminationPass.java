package com.hlsflow.ir.pass;

import com.hlsflow.ir.IrFunctionBase;
import com.hlsflow.ir.IrPackage;
import com.hlsflow.ir.node.IrNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 删除从根（返回值、参数、状态、通道操作）不可达的节点。
 */
public class DeadNodeEliminationPass implements IrPass {

    @Override
    public String getName() {
        return "dce";
    }

    @Override
    public IrPackage run(IrPackage pkg) {
        for (IrFunctionBase fb : pkg.getFunctionBases()) {
            removeDeadNodes(fb);
        }
        return pkg;
    }

    /** 返回删除的节点数 */
    public int removeDeadNodes(IrFunctionBase fb) {
        Set<IrNode> live = Collections.newSetFromMap(new IdentityHashMap<IrNode, Boolean>());
        Deque<IrNode> worklist = new ArrayDeque<>(fb.getRoots());
        while (!worklist.isEmpty()) {
            IrNode node = worklist.pop();
            if (live.add(node)) {
                worklist.addAll(node.getOperands());
            }
        }
        List<IrNode> dead = new ArrayList<>();
        for (IrNode node : fb.getNodes()) {
            if (!live.contains(node)) {
                dead.add(node);
            }
        }
        for (IrNode node : dead) {
            fb.removeNode(node);
        }
        return dead.size();
    }
}
