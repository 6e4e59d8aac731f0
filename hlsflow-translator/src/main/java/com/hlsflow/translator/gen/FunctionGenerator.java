package com.hlsflow.translator.gen;

import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.decl.FunctionDecl;
import com.hlsflow.compiler.ast.decl.ParamDecl;
import com.hlsflow.ir.IrBuilder;
import com.hlsflow.ir.IrFunction;
import com.hlsflow.ir.node.IrNode;
import com.hlsflow.ir.node.IrOp;
import com.hlsflow.ir.type.IrType;
import com.hlsflow.translator.TranslationException;
import com.hlsflow.translator.io.FunctionIoBackend;
import com.hlsflow.translator.io.IoOp;
import com.hlsflow.translator.io.IoScheduler;
import com.hlsflow.translator.types.CType;
import com.hlsflow.translator.types.TypeScope;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 函数模式：顶层函数生成一个纯 IR 函数。
 *
 * <p>参数依次为值 / 引用形参、每个被读取的通道（一次读取为裸值，多次为元组）、每个静态局部变量；
 * 输出依次为返回值、非 const 引用形参、静态局部变量、每个 IO 操作的 {值, fired} 对。</p>
 */
public final class FunctionGenerator {

    private static final Logger LOG = Logger.getLogger(FunctionGenerator.class.getName());

    private static final String STATIC_PLACEHOLDER_PREFIX = "__static";

    private final GenerationSession session;

    public FunctionGenerator(GenerationSession session) {
        this.session = session;
    }

    public GeneratedFunction generate(FunctionDecl top) {
        SourceLocation loc = top.getLocation();
        requireTranslatable(top);
        IrFunction function = new IrFunction(session.uniqueName(top.getName()));
        IrBuilder b = new IrBuilder(function);
        IoScheduler io = new IoScheduler(new FunctionIoBackend(b));
        TypeScope scope = TypeScope.inNamespace(session.getIndex().namespaceOf(top));
        FunctionContext ctx = new FunctionContext(session, b, io, scope, null, top);
        CType ret = session.getTypes().resolve(top.getReturnType(), scope);
        ctx.setReturnType(ret);

        final List<IrNode> staticPlaceholders = new ArrayList<>();
        final List<CType> staticTypes = new ArrayList<>();
        ctx.setStaticStorage((name, type, initialValue) -> {
            IrNode placeholder = b.param(STATIC_PLACEHOLDER_PREFIX + staticPlaceholders.size(), type.toIrType());
            staticPlaceholders.add(placeholder);
            staticTypes.add(type);
            return placeholder;
        });

        session.enter(top, loc);
        List<Variable> outs = new ArrayList<>();
        List<String> outNames = new ArrayList<>();
        try {
            List<ParamDecl> params = top.getParameters();
            for (int i = 0; i < params.size(); i++) {
                ParamDecl p = params.get(i);
                String name = p.getName() != null ? p.getName() : "__unnamed" + i;
                CType type = session.getTypes().resolve(p.getType(), p.getArrayDimensions(), scope);
                if (type.isChannel()) {
                    ctx.declareChannel(name, type, name, false, p.getLocation());
                    continue;
                }
                Variable v = ctx.declareValue(name, type, b.param(name, type.toIrType()), p.getLocation());
                if (CallTranslator.isOutParameter(p)) {
                    outs.add(v);
                    outNames.add(name);
                }
            }
            session.statements().translateBody(top.getBody(), ctx);
            io.finish();
        } finally {
            session.exit(top);
        }

        List<IrNode> outputs = new ArrayList<>();
        if (!ret.isVoid()) {
            outputs.add(ctx.getReturnValue());
        }
        for (Variable v : outs) {
            outputs.add(v.getValue());
        }
        List<String> staticNames = new ArrayList<>();
        for (Variable v : ctx.getStaticLocals()) {
            outputs.add(v.getValue());
            staticNames.add(v.getName());
        }
        for (IoOp op : io.getOps()) {
            IrNode data = op.isReceive() ? op.getValue() : op.getPayload();
            outputs.add(b.tuple(data, op.getCondition()));
        }
        boolean bare = io.getOps().isEmpty() && outputs.size() == 1;
        function.setReturnValue(bare ? outputs.get(0) : b.tuple(outputs));

        // 先确定返回值，再把占位参数换成最终参数，返回值中的引用随之更新
        finalizeReceives(function, b, io);
        finalizeStatics(function, b, staticPlaceholders, staticTypes, staticNames);

        session.addFunction(function);
        LOG.fine("Generated top function " + function.getName() + " with " + function.getParams().size()
                + " params, " + outputs.size() + " outputs and " + io.getOps().size() + " IO ops");
        return new GeneratedFunction(function, !ret.isVoid(), outNames, staticNames, io.getOps());
    }

    static void requireTranslatable(FunctionDecl top) {
        if (top.isTemplate()) {
            throw TranslationException.unsupported("Top function '" + top.getName() + "' cannot be a template",
                    top.getLocation());
        }
        if (!top.hasBody()) {
            throw TranslationException.unsupported("Top function '" + top.getName() + "' has no body",
                    top.getLocation());
        }
    }

    /** 每个被读取的通道一个参数：一次读取为裸值，多次读取为按程序顺序的元组 */
    private static void finalizeReceives(IrFunction function, IrBuilder b, IoScheduler io) {
        for (Map.Entry<String, List<IoOp>> entry : io.opsByChannel(IoOp.Kind.RECEIVE).entrySet()) {
            List<IoOp> ops = entry.getValue();
            if (ops.size() == 1) {
                IoOp op = ops.get(0);
                IrNode param = b.param(entry.getKey(), op.getPayloadType().toIrType());
                replacePlaceholder(function, op.getValue(), param);
                op.setValue(param);
                continue;
            }
            List<IrType> types = new ArrayList<>();
            for (IoOp op : ops) {
                types.add(op.getPayloadType().toIrType());
            }
            IrNode param = b.param(entry.getKey(), IrType.tuple(types));
            IrNode anchor = firstNonParam(function);
            if (anchor != null) {
                b.setInsertionPoint(anchor);
            }
            try {
                for (int k = 0; k < ops.size(); k++) {
                    IoOp op = ops.get(k);
                    IrNode element = b.tupleIndex(param, k);
                    replacePlaceholder(function, op.getValue(), element);
                    op.setValue(element);
                }
            } finally {
                b.clearInsertionPoint();
            }
        }
    }

    private static void finalizeStatics(IrFunction function, IrBuilder b, List<IrNode> placeholders,
                                        List<CType> types, List<String> names) {
        for (int i = 0; i < placeholders.size(); i++) {
            String name = names.get(i);
            if (function.getParam(name) != null) {
                name = name + STATIC_PLACEHOLDER_PREFIX;
            }
            IrNode param = b.param(name, types.get(i).toIrType());
            replacePlaceholder(function, placeholders.get(i), param);
        }
    }

    private static void replacePlaceholder(IrFunction function, IrNode placeholder, IrNode replacement) {
        function.replaceAllUses(placeholder, replacement);
        function.removeNode(placeholder);
    }

    private static IrNode firstNonParam(IrFunction function) {
        for (IrNode n : function.getNodes()) {
            if (n.getOp() != IrOp.PARAM) {
                return n;
            }
        }
        return null;
    }
}
