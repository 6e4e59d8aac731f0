package com.hlsflow.ir.pass;

import com.hlsflow.ir.IrFunctionBase;
import com.hlsflow.ir.IrPackage;
import com.hlsflow.ir.IrProc;
import com.hlsflow.ir.node.IrNode;
import com.hlsflow.ir.node.IrOp;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 检查 proc 是否可以直接生成组合逻辑：
 * 没有残留 INVOKE，且每个通道在每个 proc 中最多一个端口操作。
 */
public final class CombinationalReadinessCheck {

    private CombinationalReadinessCheck() {
    }

    /** 返回全部问题描述，空列表表示就绪 */
    public static List<String> findProblems(IrPackage pkg) {
        List<String> problems = new ArrayList<>();
        for (IrFunctionBase fb : pkg.getFunctionBases()) {
            for (IrNode invoke : fb.getNodesWithOp(IrOp.INVOKE)) {
                problems.add(fb.getName() + ": unresolved invoke " + invoke.getDisplayName()
                        + " of " + invoke.getCallee().getName());
            }
        }
        for (IrProc proc : pkg.getProcs()) {
            Map<String, Integer> portOps = new HashMap<>();
            for (IrNode node : proc.getNodes()) {
                if (node.getOp() == IrOp.RECEIVE || node.getOp() == IrOp.SEND) {
                    portOps.merge(node.getReference(), 1, Integer::sum);
                }
            }
            for (Map.Entry<String, Integer> e : portOps.entrySet()) {
                if (e.getValue() > 1) {
                    problems.add(proc.getName() + ": channel " + e.getKey() + " has "
                            + e.getValue() + " port operations");
                }
            }
        }
        return problems;
    }

    public static boolean isReady(IrPackage pkg) {
        return findProblems(pkg).isEmpty();
    }
}
