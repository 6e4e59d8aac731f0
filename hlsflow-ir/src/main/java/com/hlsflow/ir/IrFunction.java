package com.hlsflow.ir;

import com.hlsflow.ir.node.IrNode;
import com.hlsflow.ir.node.IrOp;
import com.hlsflow.ir.type.IrType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * IR 纯函数：参数节点、节点列表与返回值。
 */
public class IrFunction extends IrFunctionBase {

    private final List<IrNode> params = new ArrayList<>();
    private IrNode returnValue;

    public IrFunction(String name) {
        super(name);
    }

    public List<IrNode> getParams() {
        return Collections.unmodifiableList(params);
    }

    public IrNode getParam(String paramName) {
        for (IrNode p : params) {
            if (paramName.equals(p.getName())) {
                return p;
            }
        }
        return null;
    }

    /** 参数节点始终排在所有非参数节点之前 */
    public IrNode addParam(IrNode param) {
        if (param.getOp() != IrOp.PARAM) {
            throw new IllegalArgumentException("Not a param node: " + param);
        }
        insertNodeAt(params.size(), param);
        params.add(param);
        return param;
    }

    @Override
    public void removeNode(IrNode node) {
        super.removeNode(node);
        params.remove(node);
    }

    public IrNode getReturnValue() {
        return returnValue;
    }

    public void setReturnValue(IrNode returnValue) {
        this.returnValue = returnValue;
    }

    public IrType getReturnType() {
        return returnValue != null ? returnValue.getType() : IrType.emptyTuple();
    }

    public List<IrType> getParamTypes() {
        List<IrType> types = new ArrayList<>();
        for (IrNode p : params) {
            types.add(p.getType());
        }
        return types;
    }

    @Override
    protected void replaceRootUses(IrNode oldNode, IrNode newNode) {
        if (returnValue == oldNode) {
            returnValue = newNode;
        }
    }

    @Override
    public List<IrNode> getRoots() {
        List<IrNode> roots = new ArrayList<>(params);
        if (returnValue != null) {
            roots.add(returnValue);
        }
        return roots;
    }

    @Override
    public String toString() {
        return "fn " + name + getParamTypes() + " -> " + getReturnType();
    }
}
