package com.hlsflow.ir;

import com.hlsflow.ir.node.IrNode;
import com.hlsflow.ir.node.IrOp;
import com.hlsflow.ir.type.IrType;
import com.hlsflow.ir.value.IrValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * IR proc：每次迭代执行一遍节点列表，状态元素跨迭代保持。
 */
public class IrProc extends IrFunctionBase {

    /**
     * 状态元素：初值、读取节点与下一次迭代的值
     */
    public static final class StateElement {
        private final String name;
        private final IrType type;
        private final IrValue initialValue;
        private IrNode read;
        private IrNode next;

        StateElement(String name, IrType type, IrValue initialValue) {
            this.name = name;
            this.type = type;
            this.initialValue = initialValue;
        }

        public String getName() { return name; }
        public IrType getType() { return type; }
        public IrValue getInitialValue() { return initialValue; }
        public IrNode getRead() { return read; }
        public IrNode getNext() { return next; }

        void setRead(IrNode read) { this.read = read; }
        public void setNext(IrNode next) { this.next = next; }
    }

    private final List<StateElement> stateElements = new ArrayList<>();

    public IrProc(String name) {
        super(name);
    }

    /**
     * 声明状态元素并创建其 STATE_READ 节点（next 默认为读取值本身）
     */
    public StateElement addStateElement(String stateName, IrValue initialValue) {
        if (getStateElement(stateName) != null) {
            throw new IllegalArgumentException("Duplicate state element: " + stateName);
        }
        StateElement element = new StateElement(stateName, initialValue.getType(), initialValue);
        IrNode read = new IrNode(nextNodeId(), IrOp.STATE_READ, initialValue.getType(),
                Collections.<IrNode>emptyList());
        read.setReference(stateName);
        read.setName(stateName);
        insertNodeAt(stateElements.size(), read);
        element.setRead(read);
        element.setNext(read);
        stateElements.add(element);
        return element;
    }

    public List<StateElement> getStateElements() {
        return Collections.unmodifiableList(stateElements);
    }

    public StateElement getStateElement(String stateName) {
        for (StateElement e : stateElements) {
            if (e.getName().equals(stateName)) {
                return e;
            }
        }
        return null;
    }

    /** 引用到的通道名（按首次出现顺序） */
    public List<String> getChannelNames() {
        List<String> names = new ArrayList<>();
        for (IrNode n : nodes) {
            if ((n.getOp() == IrOp.RECEIVE || n.getOp() == IrOp.SEND) && !names.contains(n.getReference())) {
                names.add(n.getReference());
            }
        }
        return names;
    }

    @Override
    protected void replaceRootUses(IrNode oldNode, IrNode newNode) {
        for (StateElement e : stateElements) {
            if (e.next == oldNode) {
                e.next = newNode;
            }
        }
    }

    @Override
    public List<IrNode> getRoots() {
        List<IrNode> roots = new ArrayList<>();
        for (StateElement e : stateElements) {
            roots.add(e.getRead());
            roots.add(e.getNext());
        }
        for (IrNode n : nodes) {
            if (n.getOp().isSideEffecting()) {
                roots.add(n);
            }
        }
        return roots;
    }

    @Override
    public String toString() {
        return "proc " + name;
    }
}
