package com.hlsflow.translator.gen;

import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.decl.FunctionDecl;
import com.hlsflow.compiler.ast.decl.ParamDecl;
import com.hlsflow.ir.IrBuilder;
import com.hlsflow.ir.IrChannel;
import com.hlsflow.ir.IrProc;
import com.hlsflow.ir.node.IrNode;
import com.hlsflow.translator.TranslationException;
import com.hlsflow.translator.block.ChannelMode;
import com.hlsflow.translator.block.HlsBlock;
import com.hlsflow.translator.block.HlsChannel;
import com.hlsflow.translator.block.HlsChannelType;
import com.hlsflow.translator.io.IoBackend;
import com.hlsflow.translator.io.IoScheduler;
import com.hlsflow.translator.io.SingleValueIoBackend;
import com.hlsflow.translator.io.StreamingIoBackend;
import com.hlsflow.translator.types.CType;
import com.hlsflow.translator.types.TypeScope;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * proc 模式：按块描述把顶层函数生成为一个 proc。
 *
 * <p>通道形参对应 FIFO 端口，值形参对应 DIRECT_IN 端口（每次迭代开头读取一次），
 * 静态局部变量成为状态元素。</p>
 */
public final class ProcGenerator {

    private static final Logger LOG = Logger.getLogger(ProcGenerator.class.getName());

    private final GenerationSession session;

    public ProcGenerator(GenerationSession session) {
        this.session = session;
    }

    public IrProc generate(FunctionDecl top, HlsBlock block, ChannelMode mode) {
        SourceLocation loc = top.getLocation();
        FunctionGenerator.requireTranslatable(top);
        TypeScope scope = TypeScope.inNamespace(session.getIndex().namespaceOf(top));
        CType ret = session.getTypes().resolve(top.getReturnType(), scope);
        if (!ret.isVoid()) {
            throw TranslationException.unsupported("Top function '" + top.getName()
                    + "' of a block must return void", loc);
        }

        IrProc proc = new IrProc(session.uniqueName(block.getName()));
        IrBuilder b = new IrBuilder(proc);
        Map<String, IrChannel> channels = new LinkedHashMap<>();
        IoBackend backend = mode == ChannelMode.ALL_SINGLE_VALUE
                ? new SingleValueIoBackend(b, channels) : new StreamingIoBackend(b, channels);
        IoScheduler io = new IoScheduler(backend);
        FunctionContext ctx = new FunctionContext(session, b, io, scope, null, top);
        ctx.setReturnType(ret);

        final List<IrProc.StateElement> states = new ArrayList<>();
        ctx.setStaticStorage((name, type, initialValue) -> {
            String stateName = name;
            int suffix = 1;
            while (proc.getStateElement(stateName) != null) {
                stateName = name + "_" + suffix++;
            }
            IrProc.StateElement element = proc.addStateElement(stateName, initialValue);
            states.add(element);
            return element.getRead();
        });

        session.enter(top, loc);
        try {
            bindPorts(top, block, mode, scope, b, channels, ctx);
            session.statements().translateBody(top.getBody(), ctx);
            io.finish();
        } finally {
            session.exit(top);
        }

        List<Variable> statics = ctx.getStaticLocals();
        for (int i = 0; i < statics.size(); i++) {
            states.get(i).setNext(statics.get(i).getValue());
        }
        for (IrChannel channel : channels.values()) {
            session.addChannel(channel);
        }
        session.addProc(proc);
        LOG.fine("Generated proc " + proc.getName() + " with " + channels.size() + " channels, "
                + states.size() + " state elements and " + io.getOps().size() + " IO ops");
        return proc;
    }

    private void bindPorts(FunctionDecl top, HlsBlock block, ChannelMode mode, TypeScope scope, IrBuilder b,
                           Map<String, IrChannel> channels, FunctionContext ctx) {
        Set<String> used = new HashSet<>();
        List<ParamDecl> params = top.getParameters();
        for (ParamDecl p : params) {
            SourceLocation loc = p.getLocation();
            String name = p.getName();
            if (name == null) {
                throw TranslationException.unsupported("Parameters of a block top function must be named", loc);
            }
            HlsChannel port = block.getChannel(name);
            if (port == null) {
                throw TranslationException.notFound("Parameter '" + name + "' has no channel in block '"
                        + block.getName() + "'", loc);
            }
            used.add(name);
            CType type = session.getTypes().resolve(p.getType(), p.getArrayDimensions(), scope);
            if (type.isChannel()) {
                if (port.getType() != HlsChannelType.FIFO) {
                    throw TranslationException.unsupported("Channel parameter '" + name
                            + "' must map to a FIFO channel", loc);
                }
                IrChannel.Kind kind = mode == ChannelMode.ALL_SINGLE_VALUE
                        ? IrChannel.Kind.SINGLE_VALUE : IrChannel.Kind.STREAMING;
                IrChannel.Direction direction = port.isInput() ? IrChannel.Direction.IN : IrChannel.Direction.OUT;
                channels.put(name, new IrChannel(name, type.getElement().toIrType(), kind, direction));
                ctx.declareChannel(name, type, name, false, loc);
                continue;
            }
            if (port.getType() != HlsChannelType.DIRECT_IN) {
                throw TranslationException.unsupported("Parameter '" + name
                        + "' must map to a direct-in channel", loc);
            }
            channels.put(name, new IrChannel(name, type.toIrType(), IrChannel.Kind.SINGLE_VALUE,
                    IrChannel.Direction.IN));
            IrNode value = b.receive(name, type.toIrType(), null);
            ctx.declareValue(name, type, value, loc);
        }
        for (HlsChannel port : block.getChannels()) {
            if (!used.contains(port.getName())) {
                throw TranslationException.notFound("Block channel '" + port.getName()
                        + "' does not match any parameter of '" + top.getName() + "'", top.getLocation());
            }
        }
    }
}
