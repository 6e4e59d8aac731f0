package com.hlsflow.ir;

import com.hlsflow.ir.node.IrNode;
import com.hlsflow.ir.node.IrOp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数与 proc 的公共部分：按拓扑序排列的节点列表。
 */
public abstract class IrFunctionBase {

    protected final String name;
    protected final List<IrNode> nodes = new ArrayList<>();
    private int nextId = 1;

    protected IrFunctionBase(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public List<IrNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int nextNodeId() {
        return nextId++;
    }

    /** 追加节点（操作数必须已在列表中） */
    public IrNode addNode(IrNode node) {
        nodes.add(node);
        return node;
    }

    /** 在 anchor 之前插入节点 */
    public IrNode insertNodeBefore(IrNode anchor, IrNode node) {
        insertNodesBefore(anchor, Collections.singletonList(node));
        return node;
    }

    /** 在指定位置插入节点 */
    public IrNode insertNodeAt(int position, IrNode node) {
        nodes.add(position, node);
        return node;
    }

    /** 在 anchor 之前插入一组节点，保持拓扑序 */
    public void insertNodesBefore(IrNode anchor, List<IrNode> newNodes) {
        int position = nodes.indexOf(anchor);
        if (position < 0) {
            throw new IllegalArgumentException("Node " + anchor.getDisplayName() + " is not in " + name);
        }
        nodes.addAll(position, newNodes);
    }

    public void removeNode(IrNode node) {
        nodes.remove(node);
    }

    public boolean containsNode(IrNode node) {
        return nodes.contains(node);
    }

    /**
     * 把所有对 oldNode 的使用改为 newNode（包括返回值、状态更新等根引用）。
     * 调用方保证 newNode 位于所有使用者之前。
     */
    public void replaceAllUses(IrNode oldNode, IrNode newNode) {
        for (IrNode node : nodes) {
            if (node != newNode) {
                node.replaceOperand(oldNode, newNode);
            }
        }
        replaceRootUses(oldNode, newNode);
    }

    /** 根引用（返回值、状态 next）的替换 */
    protected abstract void replaceRootUses(IrNode oldNode, IrNode newNode);

    /** 根节点：DCE 从这里出发标记存活 */
    public abstract List<IrNode> getRoots();

    /** 某节点的所有使用者 */
    public List<IrNode> getUsers(IrNode node) {
        List<IrNode> users = new ArrayList<>();
        for (IrNode n : nodes) {
            if (n.getOperands().contains(node)) {
                users.add(n);
            }
        }
        return users;
    }

    public List<IrNode> getNodesWithOp(IrOp op) {
        List<IrNode> result = new ArrayList<>();
        for (IrNode n : nodes) {
            if (n.getOp() == op) {
                result.add(n);
            }
        }
        return result;
    }
}
