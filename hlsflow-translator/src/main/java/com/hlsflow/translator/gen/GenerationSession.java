package com.hlsflow.translator.gen;

import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.decl.FunctionDecl;
import com.hlsflow.ir.IrChannel;
import com.hlsflow.ir.IrFunction;
import com.hlsflow.ir.IrPackage;
import com.hlsflow.ir.IrProc;
import com.hlsflow.translator.TranslationException;
import com.hlsflow.translator.TranslatorOptions;
import com.hlsflow.translator.scan.DeclarationIndex;
import com.hlsflow.translator.seq.SequencingAnalyzer;
import com.hlsflow.translator.types.TypeResolver;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 一次生成请求的全部状态。
 *
 * <p>所有 IR 先写入草稿包，成功后才 {@link #commit()} 到目标包，失败时目标包保持不变。</p>
 */
public final class GenerationSession {

    private static final Logger LOG = Logger.getLogger(GenerationSession.class.getName());

    private final TypeResolver types;
    private final TranslatorOptions options;
    private final IrPackage target;
    private final IrPackage scratch;
    private final SequencingAnalyzer sequencing = new SequencingAnalyzer();
    private final Map<FunctionDecl, Map<String, CalleeFunction>> callees = new IdentityHashMap<>();
    private final Deque<FunctionDecl> callStack = new ArrayDeque<>();
    private final Set<String> reservedNames = new HashSet<>();
    private final ExpressionTranslator expressions;
    private final CallTranslator calls;
    private final StatementTranslator statements;
    private int nextContextId;

    public GenerationSession(DeclarationIndex index, TranslatorOptions options, IrPackage target) {
        this.types = new TypeResolver(index);
        this.options = options;
        this.target = target;
        this.scratch = new IrPackage(target.getName());
        this.expressions = new ExpressionTranslator(this);
        this.calls = new CallTranslator(this);
        this.statements = new StatementTranslator(this);
    }

    public TypeResolver getTypes() { return types; }
    public DeclarationIndex getIndex() { return types.getIndex(); }
    public TranslatorOptions getOptions() { return options; }
    public SequencingAnalyzer getSequencing() { return sequencing; }
    public IrPackage getScratch() { return scratch; }

    ExpressionTranslator expressions() { return expressions; }
    CallTranslator calls() { return calls; }
    StatementTranslator statements() { return statements; }

    int nextContextId() {
        return nextContextId++;
    }

    /** 在目标包与本次会话中都不冲突的名字，返回后即被占用 */
    public String uniqueName(String base) {
        String name = base;
        int suffix = 1;
        while (isTaken(name)) {
            name = base + "_" + suffix++;
        }
        reservedNames.add(name);
        return name;
    }

    private boolean isTaken(String name) {
        return reservedNames.contains(name) || target.hasFunction(name) || target.getProc(name) != null;
    }

    // ========== 调用栈 ==========

    void enter(FunctionDecl decl, SourceLocation loc) {
        if (callStack.contains(decl)) {
            throw TranslationException.unsupported("Recursion is not supported: '" + decl.getName() + "'", loc);
        }
        callStack.push(decl);
    }

    void exit(FunctionDecl decl) {
        FunctionDecl top = callStack.pop();
        if (top != decl) {
            throw new IllegalStateException("Unbalanced call stack: " + top.getName() + " vs " + decl.getName());
        }
    }

    CalleeFunction findCallee(FunctionDecl decl, String key) {
        Map<String, CalleeFunction> byKey = callees.get(decl);
        return byKey != null ? byKey.get(key) : null;
    }

    void registerCallee(FunctionDecl decl, String key, CalleeFunction callee) {
        callees.computeIfAbsent(decl, d -> new HashMap<String, CalleeFunction>()).put(key, callee);
        scratch.addFunction(callee.getFunction());
    }

    void addFunction(IrFunction function) {
        scratch.addFunction(function);
    }

    void addProc(IrProc proc) {
        scratch.addProc(proc);
    }

    void addChannel(IrChannel channel) {
        scratch.addChannel(channel);
    }

    /** 把草稿包的内容移入目标包 */
    public void commit() {
        for (IrChannel channel : scratch.getChannels()) {
            if (target.getChannel(channel.getName()) != null) {
                throw TranslationException.unsupported("Channel '" + channel.getName()
                        + "' already exists in package " + target.getName(), SourceLocation.UNKNOWN);
            }
        }
        for (IrChannel channel : scratch.getChannels()) {
            target.addChannel(channel);
        }
        for (IrFunction function : scratch.getFunctions()) {
            target.addFunction(function);
        }
        for (IrProc proc : scratch.getProcs()) {
            target.addProc(proc);
        }
        LOG.fine("Committed " + scratch.getFunctions().size() + " functions and "
                + scratch.getProcs().size() + " procs to package " + target.getName());
    }

    public IrPackage getTarget() {
        return target;
    }
}
