package com.hlsflow.ir.interp;

import com.hlsflow.ir.IrFunction;
import com.hlsflow.ir.node.IrNode;
import com.hlsflow.ir.value.IrValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * IR 纯函数解释器：按节点顺序逐个求值。
 */
public class IrInterpreter {

    /** 递归深度上限（INVOKE 嵌套） */
    private static final int MAX_CALL_DEPTH = 256;

    private int depth;

    /**
     * 以位置实参运行函数
     */
    public IrValue run(IrFunction function, List<IrValue> args) {
        List<IrNode> params = function.getParams();
        if (args.size() != params.size()) {
            throw new IrEvaluationException("Function '" + function.getName() + "' expects "
                    + params.size() + " arguments, got " + args.size());
        }
        Map<String, IrValue> kwargs = new HashMap<>();
        for (int i = 0; i < params.size(); i++) {
            kwargs.put(params.get(i).getName(), args.get(i));
        }
        return runKwargs(function, kwargs);
    }

    /**
     * 以参数名到值的映射运行函数
     */
    public IrValue runKwargs(IrFunction function, Map<String, IrValue> args) {
        if (++depth > MAX_CALL_DEPTH) {
            depth = 0;
            throw new IrEvaluationException("Maximum call depth exceeded in '" + function.getName() + "'");
        }
        try {
            Map<IrNode, IrValue> values = new IdentityHashMap<>();
            for (IrNode node : function.getNodes()) {
                values.put(node, evaluate(function, node, values, args));
            }
            if (function.getReturnValue() == null) {
                return IrValue.tuple(new ArrayList<IrValue>());
            }
            return values.get(function.getReturnValue());
        } finally {
            depth--;
        }
    }

    private IrValue evaluate(IrFunction function, IrNode node, Map<IrNode, IrValue> values,
                             Map<String, IrValue> args) {
        switch (node.getOp()) {
            case PARAM: {
                IrValue value = args.get(node.getName());
                if (value == null) {
                    throw new IrEvaluationException("Missing argument '" + node.getName()
                            + "' for function '" + function.getName() + "'");
                }
                if (!value.getType().equals(node.getType())) {
                    throw new IrEvaluationException("Argument '" + node.getName() + "' has type "
                            + value.getType() + ", expected " + node.getType());
                }
                return value;
            }
            case INVOKE:
                return runKwargs(node.getCallee(), bindArguments(node, operandValues(node, values)));
            case STATE_READ:
            case RECEIVE:
            case SEND:
                throw new IrEvaluationException("Function '" + function.getName()
                        + "' contains proc-only node " + node.getDisplayName());
            default:
                return NodeEvaluator.evaluate(node, operandValues(node, values));
        }
    }

    static List<IrValue> operandValues(IrNode node, Map<IrNode, IrValue> values) {
        List<IrValue> operands = new ArrayList<>(node.getOperandCount());
        for (IrNode operand : node.getOperands()) {
            IrValue v = values.get(operand);
            if (v == null) {
                throw new IrEvaluationException("Operand " + operand.getDisplayName() + " of "
                        + node.getDisplayName() + " is not evaluated before use");
            }
            operands.add(v);
        }
        return operands;
    }

    static Map<String, IrValue> bindArguments(IrNode invoke, List<IrValue> args) {
        List<IrNode> params = invoke.getCallee().getParams();
        if (params.size() != args.size()) {
            throw new IrEvaluationException("Invoke of '" + invoke.getCallee().getName() + "' passes "
                    + args.size() + " arguments, expected " + params.size());
        }
        Map<String, IrValue> kwargs = new HashMap<>();
        for (int i = 0; i < params.size(); i++) {
            kwargs.put(params.get(i).getName(), args.get(i));
        }
        return kwargs;
    }
}
