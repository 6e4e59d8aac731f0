package com.hlsflow.translator.gen;

import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.decl.FunctionDecl;
import com.hlsflow.ir.IrBuilder;
import com.hlsflow.ir.node.IrNode;
import com.hlsflow.translator.TranslationException;
import com.hlsflow.translator.io.IoScheduler;
import com.hlsflow.translator.seq.AccessSet;
import com.hlsflow.translator.types.CType;
import com.hlsflow.translator.types.StructLayout;
import com.hlsflow.translator.types.TypeScope;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一个函数体（或内联子程序体）的翻译上下文。
 *
 * <p>维护符号作用域、激活条件栈、单调的 returned / broken / continued 标志与返回值累加器。
 * 任何赋值与 IO 都以 {@link #activeCondition()} 为门控。</p>
 */
public final class FunctionContext {

    /** 可被 break 的结构 */
    abstract static class Frame {
    }

    static final class LoopFrame extends Frame {
        IrNode broken;
        IrNode continued;

        LoopFrame(IrNode broken, IrNode continued) {
            this.broken = broken;
            this.continued = continued;
        }
    }

    static final class SwitchFrame extends Frame {
        /** 当前分支开始时的条件栈深度 */
        int sectionDepth;
        boolean staticBreak;
    }

    private final GenerationSession session;
    private final IrBuilder builder;
    private final IoScheduler io;
    private final TypeScope typeScope;
    private final StructLayout owner;
    private final FunctionDecl function;
    private final int id;

    private final Deque<Map<String, Variable>> scopes = new ArrayDeque<>();
    private final Deque<IrNode> conditions = new ArrayDeque<>();
    private final Deque<Frame> frames = new ArrayDeque<>();
    private final List<Variable> staticLocals = new ArrayList<>();
    private IrNode outerCondition;
    private IrNode returned;
    private IrNode returnValue;
    private CType returnType = CType.VOID;
    private Variable thisVariable;
    private StaticStorage staticStorage;
    private int serial;
    private int unconditionalDepth;

    FunctionContext(GenerationSession session, IrBuilder builder, IoScheduler io, TypeScope typeScope,
                    StructLayout owner, FunctionDecl function) {
        this.session = session;
        this.builder = builder;
        this.io = io;
        this.typeScope = typeScope;
        this.owner = owner;
        this.function = function;
        this.id = session.nextContextId();
        this.outerCondition = builder.literalBool(true);
        this.returned = builder.literalBool(false);
        scopes.push(new LinkedHashMap<String, Variable>());
    }

    /**
     * 内联子程序的上下文：共用构建器与 IO 调度器，外层条件为调用点的激活条件
     */
    FunctionContext inlineChild(TypeScope calleeScope, StructLayout calleeOwner, FunctionDecl callee) {
        FunctionContext child = new FunctionContext(session, builder, io, calleeScope, calleeOwner, callee);
        child.outerCondition = activeCondition();
        return child;
    }

    /** 字段默认初始化器等独立表达式的上下文 */
    FunctionContext initializerChild(StructLayout layout) {
        return detachedChild(layout.getScope(), layout);
    }

    /** 共用构建器、不做 IO 的独立上下文（默认实参） */
    FunctionContext detachedChild(TypeScope scope, StructLayout scopeOwner) {
        return new FunctionContext(session, builder, null, scope, scopeOwner, null);
    }

    public GenerationSession getSession() { return session; }
    public IrBuilder getBuilder() { return builder; }
    public IoScheduler getIo() { return io; }
    public TypeScope getTypeScope() { return typeScope; }
    public StructLayout getOwner() { return owner; }
    public FunctionDecl getFunction() { return function; }
    public int getId() { return id; }

    // ========== 作用域 ==========

    void pushScope() {
        scopes.push(new LinkedHashMap<String, Variable>());
    }

    void popScope() {
        scopes.pop();
    }

    public Variable lookup(String name) {
        for (Map<String, Variable> scope : scopes) {
            Variable v = scope.get(name);
            if (v != null) {
                return v;
            }
        }
        return null;
    }

    /** 当前最内层作用域中声明的变量 */
    List<Variable> innermostVariables() {
        return new ArrayList<>(scopes.peek().values());
    }

    Variable declare(String name, CType type, Variable.Kind kind, SourceLocation loc) {
        Map<String, Variable> scope = scopes.peek();
        if (scope.containsKey(name)) {
            throw TranslationException.parse("redefinition of '" + name + "'", loc);
        }
        Variable v = new Variable(name, type, kind, AccessSet.variableRoot(id, name, serial++));
        scope.put(name, v);
        return v;
    }

    Variable declareValue(String name, CType type, IrNode value, SourceLocation loc) {
        Variable v = declare(name, type, Variable.Kind.VALUE, loc);
        v.setValue(value);
        return v;
    }

    Variable declareReference(String name, LValue target, SourceLocation loc) {
        Variable v = declare(name, target.getType(), Variable.Kind.REFERENCE, loc);
        v.setTarget(target);
        return v;
    }

    Variable declareChannel(String name, CType type, String channel, boolean alias, SourceLocation loc) {
        Variable v = declare(name, type, alias ? Variable.Kind.CHANNEL_ALIAS : Variable.Kind.CHANNEL, loc);
        v.setChannel(channel);
        return v;
    }

    /** 不进入作用域的临时对象，用于右值上的方法调用与构造 */
    Variable temporary(CType type, IrNode value) {
        Variable v = new Variable("<temporary>", type, Variable.Kind.VALUE,
                AccessSet.variableRoot(id, "<temporary>", serial++));
        v.setValue(value);
        return v;
    }

    // ========== this ==========

    public Variable getThisVariable() {
        return thisVariable;
    }

    void setThisVariable(Variable thisVariable) {
        this.thisVariable = thisVariable;
    }

    LValue thisLValue(SourceLocation loc) {
        if (thisVariable == null) {
            throw TranslationException.unsupported("'this' used outside of a non-static member function", loc);
        }
        return LValue.of(thisVariable);
    }

    // ========== 激活条件 ==========

    /**
     * 外层条件、条件栈、未 return、各层循环未 break / continue 的合取
     */
    public IrNode activeCondition() {
        if (unconditionalDepth > 0) {
            return builder.literalBool(true);
        }
        IrNode active = outerCondition;
        Iterator<IrNode> it = conditions.descendingIterator();
        while (it.hasNext()) {
            active = builder.and(active, it.next());
        }
        active = builder.and(active, builder.not(returned));
        for (Frame frame : frames) {
            if (frame instanceof LoopFrame) {
                LoopFrame loop = (LoopFrame) frame;
                active = builder.and(active, builder.not(loop.broken));
                active = builder.and(active, builder.not(loop.continued));
            }
        }
        return active;
    }

    /**
     * 展开循环的初始化、条件与步进子句不受激活条件门控，归纳变量因此保持可折叠
     */
    void beginUnconditional() {
        unconditionalDepth++;
    }

    void endUnconditional() {
        unconditionalDepth--;
    }

    void pushCondition(IrNode condition) {
        conditions.push(condition);
    }

    void popCondition() {
        conditions.pop();
    }

    int conditionDepth() {
        return conditions.size();
    }

    /** 在激活条件下用 newValue 替换 oldValue */
    IrNode gate(IrNode newValue, IrNode oldValue) {
        return builder.select(activeCondition(), newValue, oldValue);
    }

    // ========== break / continue / return ==========

    LoopFrame pushLoop() {
        LoopFrame frame = new LoopFrame(builder.literalBool(false), builder.literalBool(false));
        frames.push(frame);
        return frame;
    }

    SwitchFrame pushSwitch() {
        SwitchFrame frame = new SwitchFrame();
        frames.push(frame);
        return frame;
    }

    void popFrame() {
        frames.pop();
    }

    Frame innermostFrame() {
        return frames.peek();
    }

    LoopFrame innermostLoop() {
        for (Frame f : frames) {
            if (f instanceof LoopFrame) {
                return (LoopFrame) f;
            }
        }
        return null;
    }

    /** 当前 switch 分支是否已经无条件 break */
    boolean isStaticallyBroken() {
        Frame f = frames.peek();
        return f instanceof SwitchFrame && ((SwitchFrame) f).staticBreak;
    }

    void setReturnType(CType returnType) {
        this.returnType = returnType;
        if (!returnType.isVoid()) {
            returnValue = ValueOps.zero(builder, returnType);
        }
    }

    public CType getReturnType() {
        return returnType;
    }

    /** 在激活条件下记录返回值，并置位 returned */
    void recordReturn(IrNode value) {
        IrNode active = activeCondition();
        if (value != null) {
            returnValue = builder.select(active, value, returnValue);
        }
        returned = builder.or(returned, active);
    }

    public IrNode getReturnValue() {
        return returnValue;
    }

    // ========== 静态局部变量 ==========

    StaticStorage getStaticStorage() {
        return staticStorage;
    }

    void setStaticStorage(StaticStorage staticStorage) {
        this.staticStorage = staticStorage;
    }

    void addStaticLocal(Variable v) {
        staticLocals.add(v);
    }

    public List<Variable> getStaticLocals() {
        return Collections.unmodifiableList(staticLocals);
    }
}
