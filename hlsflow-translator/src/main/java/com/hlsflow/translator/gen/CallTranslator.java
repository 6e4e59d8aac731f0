package com.hlsflow.translator.gen;

import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.decl.FunctionDecl;
import com.hlsflow.compiler.ast.decl.MemberInitializer;
import com.hlsflow.compiler.ast.decl.ParamDecl;
import com.hlsflow.compiler.ast.decl.QualifiedName;
import com.hlsflow.compiler.ast.decl.TemplateParameter;
import com.hlsflow.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.hlsflow.compiler.ast.expr.CallExpr;
import com.hlsflow.compiler.ast.expr.ConditionalExpr;
import com.hlsflow.compiler.ast.expr.Expression;
import com.hlsflow.compiler.ast.expr.IndexExpr;
import com.hlsflow.compiler.ast.expr.InitListExpr;
import com.hlsflow.compiler.ast.expr.MemberExpr;
import com.hlsflow.compiler.ast.expr.NameExpr;
import com.hlsflow.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.hlsflow.compiler.ast.type.BuiltinNames;
import com.hlsflow.compiler.ast.type.NamedType;
import com.hlsflow.compiler.ast.type.TemplateArgument;
import com.hlsflow.compiler.ast.type.TypeRef;
import com.hlsflow.ir.IrBuilder;
import com.hlsflow.ir.IrFunction;
import com.hlsflow.ir.node.IrNode;
import com.hlsflow.translator.TranslationException;
import com.hlsflow.translator.io.IoOp;
import com.hlsflow.translator.io.IoScheduler;
import com.hlsflow.translator.seq.AccessSet;
import com.hlsflow.translator.seq.SequencingAnalyzer;
import com.hlsflow.translator.types.CType;
import com.hlsflow.translator.types.ConstantValue;
import com.hlsflow.translator.types.StructLayout;
import com.hlsflow.translator.types.TypeResolver;
import com.hlsflow.translator.types.TypeScope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 调用翻译：重载决议、模板实参推导、构造、转换与运算符重载。
 *
 * <p>没有通道参数的被调函数生成独立的 IR 函数并以 INVOKE 调用，结果元组携带返回值、
 * 更新后的 this 与各输出参数，调用点按激活条件写回；带通道参数的被调函数就地内联，
 * 其 IO 操作按调用位置并入调用者的操作序列。构造函数总是内联。</p>
 */
public final class CallTranslator {

    private static final Logger LOG = Logger.getLogger(CallTranslator.class.getName());

    private static final int REJECT = -1;
    private static final int CONVERSION = 1;
    private static final int PROMOTION = 2;
    private static final int EXACT = 3;

    /**
     * 已翻译的实参：通道、左值（同时读出当前值）或普通值
     */
    static final class Argument {
        final AccessSet access;
        final CValue value;
        final LValue lvalue;
        final Variable channel;

        private Argument(AccessSet access, CValue value, LValue lvalue, Variable channel) {
            this.access = access;
            this.value = value;
            this.lvalue = lvalue;
            this.channel = channel;
        }

        static Argument of(CValue value) {
            return new Argument(null, value, null, null);
        }

        CType getType() {
            return channel != null ? channel.getType() : value.getType();
        }
    }

    /**
     * 一个可行的被调函数：声明、所属布局、调用对象与实例化后的形参类型
     */
    private static final class Candidate {
        final FunctionDecl decl;
        final StructLayout owner;
        final LValue self;
        final TypeScope scope;
        final List<CType> paramTypes;
        final int score;

        Candidate(FunctionDecl decl, StructLayout owner, LValue self, TypeScope scope,
                  List<CType> paramTypes, int score) {
            this.decl = decl;
            this.owner = owner;
            this.self = self;
            this.scope = scope;
            this.paramTypes = paramTypes;
            this.score = score;
        }
    }

    private final GenerationSession session;

    CallTranslator(GenerationSession session) {
        this.session = session;
    }

    private ExpressionTranslator expressions() {
        return session.expressions();
    }

    private TypeResolver types() {
        return session.getTypes();
    }

    // ========== 调用表达式 ==========

    CValue translateCall(CallExpr call, FunctionContext ctx) {
        Expression callee = call.getCallee();
        SourceLocation loc = call.getLocation();
        if (callee instanceof MemberExpr) {
            return memberCall((MemberExpr) callee, call.getArguments(), ctx, loc);
        }
        if (callee instanceof NameExpr) {
            return nameCall((NameExpr) callee, call.getArguments(), ctx, loc);
        }
        throw TranslationException.unsupported("Unsupported call target '" + callee + "'", loc);
    }

    private CValue memberCall(MemberExpr callee, List<Expression> args, FunctionContext ctx, SourceLocation loc) {
        String member = callee.getMember();
        Expression target = callee.getTarget();
        Variable channel = channelVariable(target, ctx);
        if (channel != null) {
            return channelCall(channel, member, args, ctx, loc);
        }
        if (isChannelMethod(member) && mentionsChannel(target, ctx)) {
            throw TranslationException.channelUsage("IO ops should be on direct references", loc);
        }

        // 对象表达式先于实参求值
        LValue self = expressions().tryLValue(target, ctx);
        if (self == null) {
            CValue object = expressions().translate(target, ctx);
            self = LValue.of(ctx.temporary(object.getType(), object.getNode()));
        }
        if (self.getType().isChannel()) {
            throw TranslationException.channelUsage("IO ops should be on direct references", loc);
        }
        StructLayout layout = ExpressionTranslator.requireStruct(self.getType(), loc);
        List<StructLayout.Method> methods = layout.findMethods(member);
        if (methods.isEmpty()) {
            throw TranslationException.unsupported("No member named '" + member + "' in '" + layout.getName() + "'", loc);
        }
        List<Argument> arguments = translateArguments(args, ctx);
        Candidate chosen = resolveMethods(methods, self, Collections.<TemplateArgument>emptyList(),
                arguments, ctx, loc);
        return callCandidate(requireViable(chosen, member, loc), arguments, ctx, loc, false);
    }

    private CValue nameCall(NameExpr callee, List<Expression> args, FunctionContext ctx, SourceLocation loc) {
        QualifiedName name = callee.getName();
        List<TemplateArgument> templateArgs = callee.getTemplateArguments();
        String simple = name.getSimpleName();

        if (!name.isQualified()) {
            Variable local = ctx.lookup(simple);
            if (local != null) {
                if (local.getType().isStruct()) {
                    List<StructLayout.Method> functor = local.getType().getStruct().findMethods("operator()");
                    if (!functor.isEmpty()) {
                        List<Argument> arguments = translateArguments(args, ctx);
                        Candidate chosen = resolveMethods(functor, LValue.of(local), templateArgs, arguments, ctx, loc);
                        return callCandidate(requireViable(chosen, simple, loc), arguments, ctx, loc, false);
                    }
                }
                throw TranslationException.unsupported("'" + simple + "' is not a function", loc);
            }
            StructLayout owner = ctx.getOwner();
            if (owner != null) {
                List<StructLayout.Method> methods = owner.findMethods(simple);
                if (!methods.isEmpty()) {
                    LValue self = ctx.getThisVariable() != null ? ctx.thisLValue(loc) : null;
                    List<Argument> arguments = translateArguments(args, ctx);
                    Candidate chosen = resolveMethods(methods, self, templateArgs, arguments, ctx, loc);
                    return callCandidate(requireViable(chosen, simple, loc), arguments, ctx, loc, false);
                }
            }
        } else {
            QualifiedName qualifier = new QualifiedName(name.getParts().subList(0, name.getParts().size() - 1));
            CType type = types().tryResolveName(qualifier, ctx.getTypeScope());
            if (type != null && type.isStruct()) {
                return qualifiedMethodCall(type.getStruct(), simple, templateArgs, args, ctx, loc);
            }
        }

        List<FunctionDecl> functions = session.getIndex().findFunctions(name, ctx.getTypeScope().getNamespace());
        if (functions.isEmpty()) {
            throw TranslationException.parse("use of undeclared identifier '" + name + "'", loc);
        }
        List<Argument> arguments = translateArguments(args, ctx);
        Candidate best = null;
        for (FunctionDecl decl : functions) {
            best = better(best, bind(decl, null, null, templateArgs, arguments, ctx, loc));
        }
        return callCandidate(requireViable(best, name.toString(), loc), arguments, ctx, loc, false);
    }

    /** Type::m(...)：静态方法，或在派生类方法中调用基类方法 */
    private CValue qualifiedMethodCall(StructLayout layout, String member, List<TemplateArgument> templateArgs,
                                       List<Expression> args, FunctionContext ctx, SourceLocation loc) {
        List<StructLayout.Method> methods = layout.findMethods(member);
        if (methods.isEmpty()) {
            throw TranslationException.unsupported("No member named '" + member + "' in '" + layout.getName() + "'", loc);
        }
        LValue self = null;
        StructLayout owner = ctx.getOwner();
        if (ctx.getThisVariable() != null && owner != null && layout.isBaseOf(owner)) {
            self = ctx.thisLValue(loc);
        }
        List<Argument> arguments = translateArguments(args, ctx);
        Candidate chosen = resolveMethods(methods, self, templateArgs, arguments, ctx, loc);
        return callCandidate(requireViable(chosen, layout.getName() + "::" + member, loc), arguments, ctx, loc, false);
    }

    private static Candidate requireViable(Candidate candidate, String name, SourceLocation loc) {
        if (candidate == null) {
            throw TranslationException.parse("no matching function for call to '" + name + "'", loc);
        }
        return candidate;
    }

    // ========== 通道 ==========

    private static boolean isChannelMethod(String member) {
        return BuiltinNames.CHANNEL_READ.equals(member) || BuiltinNames.CHANNEL_WRITE.equals(member);
    }

    /** 直接命名通道符号的表达式 */
    private static Variable channelVariable(Expression expr, FunctionContext ctx) {
        if (expr instanceof NameExpr && ((NameExpr) expr).isSimple()) {
            Variable v = ctx.lookup(((NameExpr) expr).getName().getSimpleName());
            if (v != null && v.isChannel()) {
                return v;
            }
        }
        return null;
    }

    private static boolean mentionsChannel(Expression expr, FunctionContext ctx) {
        if (channelVariable(expr, ctx) != null) {
            return true;
        }
        if (expr instanceof MemberExpr) {
            return mentionsChannel(((MemberExpr) expr).getTarget(), ctx);
        }
        if (expr instanceof IndexExpr) {
            return mentionsChannel(((IndexExpr) expr).getTarget(), ctx);
        }
        if (expr instanceof ConditionalExpr) {
            ConditionalExpr c = (ConditionalExpr) expr;
            return mentionsChannel(c.getThenExpr(), ctx) || mentionsChannel(c.getElseExpr(), ctx);
        }
        return false;
    }

    private CValue channelCall(Variable channel, String member, List<Expression> args, FunctionContext ctx,
                               SourceLocation loc) {
        if (channel.getKind() == Variable.Kind.CHANNEL_ALIAS) {
            throw TranslationException.channelUsage("IO ops should be on channel parameters", loc);
        }
        IoScheduler io = ctx.getIo();
        if (io == null) {
            throw TranslationException.channelUsage("IO ops are not allowed in this context", loc);
        }
        CType element = channel.getType().getElement();
        SequencingAnalyzer seq = session.getSequencing();
        if (BuiltinNames.CHANNEL_READ.equals(member)) {
            if (!args.isEmpty()) {
                throw TranslationException.unsupported("read() takes no arguments", loc);
            }
            seq.recordChannel(channel.getChannel());
            IoOp op = io.recordReceive(channel.getChannel(), element, ctx.activeCondition());
            return new CValue(op.getValue(), element);
        }
        if (BuiltinNames.CHANNEL_WRITE.equals(member)) {
            if (args.size() != 1) {
                throw TranslationException.unsupported("write() takes exactly one argument", loc);
            }
            CValue payload = expressions().translateInitializer(args.get(0), element, ctx);
            seq.recordChannel(channel.getChannel());
            io.recordSend(channel.getChannel(), payload.getNode(), element, ctx.activeCondition());
            return ExpressionTranslator.voidValue(ctx.getBuilder());
        }
        throw TranslationException.unsupported("No member named '" + member + "' in '" + channel.getType() + "'", loc);
    }

    // ========== 实参 ==========

    private List<Argument> translateArguments(List<Expression> args, FunctionContext ctx) {
        List<Argument> translated = new ArrayList<>(args.size());
        for (Expression arg : args) {
            translated.add(translateArgument(arg, ctx));
        }
        return translated;
    }

    /** 每个实参是调用的一个未定序兄弟 */
    private Argument translateArgument(Expression arg, FunctionContext ctx) {
        SequencingAnalyzer seq = session.getSequencing();
        AccessSet access = seq.begin();
        try {
            Variable channel = channelVariable(arg, ctx);
            if (channel != null) {
                return new Argument(access, null, null, channel);
            }
            LValue lv = expressions().tryLValue(arg, ctx);
            if (lv != null) {
                if (lv.getType().isChannel()) {
                    throw TranslationException.channelUsage("IO ops should be on direct references", arg.getLocation());
                }
                return new Argument(access, expressions().readLValue(lv, ctx), lv, null);
            }
            return new Argument(access, expressions().translate(arg, ctx), null, null);
        } finally {
            seq.end(access);
        }
    }

    // ========== 重载决议 ==========

    private Candidate resolveMethods(List<StructLayout.Method> methods, LValue self,
                                     List<TemplateArgument> templateArgs, List<Argument> args,
                                     FunctionContext ctx, SourceLocation loc) {
        Candidate best = null;
        for (StructLayout.Method m : methods) {
            FunctionDecl decl = m.getDecl();
            LValue object = null;
            if (!decl.isStatic()) {
                if (self == null) {
                    continue;
                }
                object = adapt(self, m.getOwner());
            }
            best = better(best, bind(decl, m.getOwner(), object, templateArgs, args, ctx, loc));
        }
        if (best == null && self == null && !methods.isEmpty() && !methods.get(0).getDecl().isStatic()) {
            throw TranslationException.unsupported("Call to non-static member function '"
                    + methods.get(0).getDecl().getName() + "' without an object", loc);
        }
        return best;
    }

    private static Candidate better(Candidate best, Candidate next) {
        if (next == null) {
            return best;
        }
        if (best == null || next.score > best.score) {
            return next;
        }
        return best;
    }

    /** 把对象视为方法所属的（基类）布局 */
    private static LValue adapt(LValue self, StructLayout owner) {
        StructLayout actual = self.getType().getStruct();
        return actual == owner ? self : self.base(owner);
    }

    /**
     * 绑定模板实参与形参类型并打分；不可行时返回 null
     */
    private Candidate bind(FunctionDecl decl, StructLayout owner, LValue self, List<TemplateArgument> templateArgs,
                           List<Argument> args, FunctionContext ctx, SourceLocation loc) {
        List<ParamDecl> params = decl.getParameters();
        if (args.size() > params.size() || args.size() < decl.getRequiredParameterCount()) {
            return null;
        }
        TypeScope base = owner != null ? owner.getScope()
                : TypeScope.inNamespace(session.getIndex().namespaceOf(decl));
        TypeScope scope = base.child();
        if (!bindTemplateParameters(decl, templateArgs, args, scope, ctx.getTypeScope(), loc)) {
            return null;
        }

        List<CType> paramTypes = new ArrayList<>(params.size());
        int total = 0;
        for (int i = 0; i < params.size(); i++) {
            ParamDecl p = params.get(i);
            Argument a = i < args.size() ? args.get(i) : null;
            CType type = parameterType(p, scope, a);
            paramTypes.add(type);
            if (a != null) {
                int s = score(p, type, a);
                if (s == REJECT) {
                    return null;
                }
                total += s;
            }
        }
        return new Candidate(decl, owner, self, scope, paramTypes, total);
    }

    private boolean bindTemplateParameters(FunctionDecl decl, List<TemplateArgument> explicit, List<Argument> args,
                                           TypeScope scope, TypeScope callerScope, SourceLocation loc) {
        List<TemplateParameter> params = decl.getTemplateParameters();
        if (explicit.size() > params.size()) {
            return false;
        }
        for (int i = 0; i < params.size(); i++) {
            TemplateParameter tp = params.get(i);
            if (i < explicit.size()) {
                TemplateArgument a = explicit.get(i);
                if (tp.isTypeParameter() != a.isType()) {
                    return false;
                }
                if (a.isType()) {
                    scope.bindType(tp.getName(), types().resolve(a.getType(), callerScope));
                } else {
                    CType valueType = types().resolve(tp.getValueType(), scope);
                    ConstantValue value = types().getConstants().evaluateAs(a.getValue(), valueType, callerScope);
                    scope.bindConstant(tp.getName(), value);
                }
                continue;
            }
            if (!tp.isTypeParameter()) {
                return false;
            }
            CType deduced = deduce(tp.getName(), decl.getParameters(), args);
            if (deduced == null) {
                return false;
            }
            scope.bindType(tp.getName(), deduced);
        }
        return true;
    }

    /** 从形如 T 或 __hls_channel&lt;T&gt; 的形参推导 T */
    private static CType deduce(String name, List<ParamDecl> params, List<Argument> args) {
        for (int i = 0; i < params.size() && i < args.size(); i++) {
            TypeRef ref = params.get(i).getType();
            if (!(ref instanceof NamedType)) {
                continue;
            }
            NamedType named = (NamedType) ref;
            Argument a = args.get(i);
            if (!named.hasTemplateArguments() && named.getName().toString().equals(name) && a.channel == null) {
                CType t = a.getType();
                return params.get(i).isArray() ? null : t;
            }
            if (BuiltinNames.CHANNEL.equals(named.getName().toString()) && a.channel != null) {
                TemplateArgument inner = named.getTemplateArguments().get(0);
                if (inner.isType() && inner.getType() instanceof NamedType
                        && ((NamedType) inner.getType()).getName().toString().equals(name)) {
                    return a.channel.getType().getElement();
                }
            }
        }
        return null;
    }

    /** 形参类型；首维省略的数组形参取实参的长度 */
    private CType parameterType(ParamDecl p, TypeScope scope, Argument a) {
        List<Expression> dims = p.getArrayDimensions();
        if (!dims.isEmpty() && dims.get(0) == null && a != null && a.getType().isArray()) {
            CType rest = types().resolve(p.getType(), dims.subList(1, dims.size()), scope);
            return CType.arrayOf(rest, a.getType().getLength());
        }
        return types().resolve(p.getType(), dims, scope);
    }

    /** 非 const 引用与非 const 数组形参：被调函数的修改写回实参 */
    static boolean isOutParameter(ParamDecl p) {
        return !p.getType().isConst() && (p.getType().isReference() || p.isArray());
    }

    private static int score(ParamDecl p, CType type, Argument a) {
        if (type.isChannel()) {
            return a.channel != null && a.channel.getType().getElement().equals(type.getElement()) ? EXACT : REJECT;
        }
        if (a.channel != null) {
            return REJECT;
        }
        CType from = a.value.getType();
        boolean derived = type.isStruct() && from.isStruct() && type.getStruct().isBaseOf(from.getStruct());
        if (isOutParameter(p)) {
            if (a.lvalue == null) {
                return REJECT;
            }
            if (from.equals(type)) {
                return EXACT;
            }
            return derived ? PROMOTION : REJECT;
        }
        if (from.equals(type)) {
            return EXACT;
        }
        if ((from.isIntegral() && type.isIntegral()) || derived) {
            return PROMOTION;
        }
        if (type.isStruct() && !from.isArray()) {
            return CONVERSION;
        }
        if (from.isStruct() && type.isIntegral() && !from.getStruct().getConversions().isEmpty()) {
            return CONVERSION;
        }
        return REJECT;
    }

    private static boolean hasChannelParameter(Candidate c) {
        for (CType t : c.paramTypes) {
            if (t.isChannel()) {
                return true;
            }
        }
        return false;
    }

    private static LValue binding(LValue lv, CType type) {
        if (lv.getType().equals(type)) {
            return lv;
        }
        return lv.base(type.getStruct());
    }

    // ========== 调用 ==========

    private CValue callCandidate(Candidate c, List<Argument> args, FunctionContext ctx, SourceLocation loc,
                                 boolean operatorCall) {
        List<AccessSet> accesses = new ArrayList<>();
        for (Argument a : args) {
            if (a.access != null) {
                accesses.add(a.access);
            }
        }
        session.getSequencing().checkCallArguments(accesses, loc);
        List<Argument> all = withDefaults(c, args, ctx);
        if (hasChannelParameter(c)) {
            if (operatorCall) {
                throw TranslationException.channelUsage("IO ops in operator calls are not supported", loc);
            }
            return inline(c, all, ctx, loc);
        }
        return invoke(c, all, ctx, loc);
    }

    /** 补齐默认实参：在被调函数的作用域中求值 */
    private List<Argument> withDefaults(Candidate c, List<Argument> args, FunctionContext ctx) {
        List<ParamDecl> params = c.decl.getParameters();
        if (args.size() == params.size()) {
            return args;
        }
        List<Argument> all = new ArrayList<>(args);
        FunctionContext scope = ctx.detachedChild(c.scope, c.owner);
        for (int i = args.size(); i < params.size(); i++) {
            ParamDecl p = params.get(i);
            all.add(Argument.of(expressions().translateInitializer(p.getDefaultValue(), c.paramTypes.get(i), scope)));
        }
        return all;
    }

    private CType returnType(Candidate c) {
        return types().resolve(c.decl.getReturnType(), c.scope);
    }

    private static void requireBody(FunctionDecl decl, SourceLocation loc) {
        if (!decl.hasBody()) {
            throw TranslationException.unsupported("Function '" + decl.getName() + "' has no body", loc);
        }
    }

    /**
     * 就地内联：通道形参绑定到同一物理通道，输出形参成为指向实参的引用
     */
    private CValue inline(Candidate c, List<Argument> args, FunctionContext ctx, SourceLocation loc) {
        FunctionDecl decl = c.decl;
        requireBody(decl, loc);
        SequencingAnalyzer seq = session.getSequencing();
        session.enter(decl, loc);
        Deque<AccessSet> saved = seq.detach();
        AccessSet body = seq.begin();
        CValue result;
        try {
            FunctionContext child = ctx.inlineChild(c.scope, c.owner, decl);
            CType ret = returnType(c);
            child.setReturnType(ret);
            if (c.self != null) {
                child.setThisVariable(child.declareReference("this", c.self, loc));
            }
            bindParameters(c, args, child, ctx, loc);
            session.statements().translateBody(decl.getBody(), child);
            result = ret.isVoid() ? ExpressionTranslator.voidValue(ctx.getBuilder())
                    : new CValue(child.getReturnValue(), ret);
        } finally {
            seq.end(body);
            seq.reattach(saved);
            session.exit(decl);
        }
        seq.replay(body);
        return result;
    }

    private void bindParameters(Candidate c, List<Argument> args, FunctionContext child, FunctionContext caller,
                                SourceLocation loc) {
        List<ParamDecl> params = c.decl.getParameters();
        for (int i = 0; i < params.size(); i++) {
            ParamDecl p = params.get(i);
            CType type = c.paramTypes.get(i);
            Argument a = args.get(i);
            if (p.getName() == null) {
                continue;
            }
            if (type.isChannel()) {
                child.declareChannel(p.getName(), type, a.channel.getChannel(),
                        a.channel.getKind() == Variable.Kind.CHANNEL_ALIAS, loc);
            } else if (isOutParameter(p)) {
                child.declareReference(p.getName(), binding(a.lvalue, type), loc);
            } else {
                child.declareValue(p.getName(), type, expressions().convert(a.value, type, caller, loc).getNode(), loc);
            }
        }
    }

    private CValue invoke(Candidate c, List<Argument> args, FunctionContext ctx, SourceLocation loc) {
        CalleeFunction callee = calleeFunction(c, loc);
        IrBuilder b = ctx.getBuilder();
        List<ParamDecl> params = c.decl.getParameters();
        List<IrNode> operands = new ArrayList<>();
        if (callee.takesThis()) {
            operands.add(expressions().readLValue(c.self, ctx).getNode());
        }
        for (int i = 0; i < params.size(); i++) {
            CType type = c.paramTypes.get(i);
            Argument a = args.get(i);
            if (isOutParameter(params.get(i))) {
                operands.add(ValueOps.read(b, binding(a.lvalue, type)));
            } else {
                operands.add(expressions().convert(a.value, type, ctx, loc).getNode());
            }
        }
        IrNode result = b.invoke(callee.getFunction(), operands);

        int k = 0;
        CValue value = ExpressionTranslator.voidValue(b);
        if (callee.hasReturn()) {
            value = new CValue(b.tupleIndex(result, k++), callee.getReturnType());
        }
        if (callee.returnsThis()) {
            expressions().writeLValue(c.self, b.tupleIndex(result, k++), ctx, loc, false);
        }
        for (int index : callee.getOutParameters()) {
            LValue target = binding(args.get(index).lvalue, c.paramTypes.get(index));
            expressions().writeLValue(target, b.tupleIndex(result, k++), ctx, loc, false);
        }
        return value;
    }

    /**
     * 被调函数的 IR 函数，按（所属布局、模板绑定、形参类型）缓存
     */
    private CalleeFunction calleeFunction(Candidate c, SourceLocation loc) {
        FunctionDecl decl = c.decl;
        String key = (c.owner != null ? c.owner.getName() : "") + "|" + c.scope.bindingSignature()
                + "|" + c.paramTypes;
        CalleeFunction cached = session.findCallee(decl, key);
        if (cached != null) {
            return cached;
        }
        requireBody(decl, loc);
        SequencingAnalyzer seq = session.getSequencing();
        session.enter(decl, loc);
        Deque<AccessSet> saved = seq.detach();
        try {
            IrFunction function = new IrFunction(session.uniqueName(irName(c)));
            IrBuilder b = new IrBuilder(function);
            FunctionContext fctx = new FunctionContext(session, b, null, c.scope, c.owner, decl);
            CType ret = returnType(c);
            fctx.setReturnType(ret);

            boolean takesThis = c.owner != null && !decl.isStatic();
            boolean returnsThis = takesThis && !decl.isConstMethod();
            if (takesThis) {
                CType selfType = CType.struct(c.owner);
                fctx.setThisVariable(fctx.declareValue("this", selfType, b.param("this", selfType.toIrType()), loc));
            }
            List<ParamDecl> params = decl.getParameters();
            List<Integer> outParameters = new ArrayList<>();
            List<Variable> outVariables = new ArrayList<>();
            for (int i = 0; i < params.size(); i++) {
                ParamDecl p = params.get(i);
                CType type = c.paramTypes.get(i);
                String name = p.getName() != null ? p.getName() : "__unnamed" + i;
                Variable v = fctx.declareValue(name, type, b.param(name, type.toIrType()), p.getLocation());
                if (isOutParameter(p)) {
                    outParameters.add(i);
                    outVariables.add(v);
                }
            }

            session.statements().translateBody(decl.getBody(), fctx);

            List<IrNode> outputs = new ArrayList<>();
            if (!ret.isVoid()) {
                outputs.add(fctx.getReturnValue());
            }
            if (returnsThis) {
                outputs.add(fctx.getThisVariable().getValue());
            }
            for (Variable v : outVariables) {
                outputs.add(v.getValue());
            }
            function.setReturnValue(b.tuple(outputs));
            CalleeFunction callee = new CalleeFunction(function, ret, takesThis, returnsThis, outParameters);
            session.registerCallee(decl, key, callee);
            LOG.fine("Generated callee " + function.getName() + " with " + outputs.size() + " outputs");
            return callee;
        } finally {
            seq.reattach(saved);
            session.exit(decl);
        }
    }

    private String irName(Candidate c) {
        String base;
        if (c.owner != null) {
            base = c.owner.getName() + "_" + c.decl.getName();
        } else {
            base = session.getIndex().namespaceOf(c.decl) + c.decl.getName();
        }
        return base.replaceAll("[^A-Za-z0-9_]", "_");
    }

    // ========== 构造 ==========

    /**
     * 由实参表达式构造对象：用户构造函数、隐式复制或聚合初始化
     */
    CValue construct(StructLayout layout, List<Expression> exprs, FunctionContext ctx, SourceLocation loc) {
        if (layout.getConstructors().isEmpty()) {
            if (exprs.isEmpty()) {
                return defaultValue(layout, ctx, loc);
            }
            if (exprs.size() == 1 && !(exprs.get(0) instanceof InitListExpr)) {
                CValue v = expressions().translate(exprs.get(0), ctx);
                if (isSameOrDerived(v, layout)) {
                    return expressions().convert(v, CType.struct(layout), ctx, loc);
                }
                return aggregate(layout, Collections.singletonList(v), ctx, loc);
            }
            List<StructLayout.Field> fields = layout.getAllFields();
            if (exprs.size() > fields.size()) {
                throw TranslationException.unsupported("Too many initializers for '" + layout.getName() + "'", loc);
            }
            List<CValue> values = new ArrayList<>();
            for (int i = 0; i < exprs.size(); i++) {
                values.add(expressions().translateInitializer(exprs.get(i), fields.get(i).getType(), ctx));
            }
            return aggregate(layout, values, ctx, loc);
        }
        return constructWith(layout, translateArguments(exprs, ctx), ctx, loc);
    }

    /** 由已翻译的值构造（隐式转换） */
    CValue constructFromValues(StructLayout layout, List<CValue> values, FunctionContext ctx, SourceLocation loc) {
        if (layout.getConstructors().isEmpty()) {
            if (values.size() == 1 && isSameOrDerived(values.get(0), layout)) {
                return expressions().convert(values.get(0), CType.struct(layout), ctx, loc);
            }
            return aggregate(layout, values, ctx, loc);
        }
        List<Argument> args = new ArrayList<>();
        for (CValue v : values) {
            args.add(Argument.of(v));
        }
        return constructWith(layout, args, ctx, loc);
    }

    private static boolean isSameOrDerived(CValue v, StructLayout layout) {
        return v.getType().isStruct() && layout.isBaseOf(v.getType().getStruct());
    }

    private CValue constructWith(StructLayout layout, List<Argument> args, FunctionContext ctx, SourceLocation loc) {
        Candidate best = null;
        for (StructLayout.Method m : layout.getConstructors()) {
            best = better(best, bind(m.getDecl(), layout, null, Collections.<TemplateArgument>emptyList(),
                    args, ctx, loc));
        }
        // 隐式复制构造
        if (args.size() == 1 && args.get(0).channel == null && isSameOrDerived(args.get(0).value, layout)
                && (best == null || best.score < EXACT)) {
            return expressions().convert(args.get(0).value, CType.struct(layout), ctx, loc);
        }
        if (best == null) {
            if (args.isEmpty()) {
                throw TranslationException.unsupported("No default constructor for '" + layout.getName() + "'", loc);
            }
            throw TranslationException.parse("no matching constructor for initialization of '"
                    + layout.getName() + "'", loc);
        }
        List<AccessSet> accesses = new ArrayList<>();
        for (Argument a : args) {
            if (a.access != null) {
                accesses.add(a.access);
            }
        }
        session.getSequencing().checkCallArguments(accesses, loc);
        return runConstructor(best, withDefaults(best, args, ctx), ctx, loc);
    }

    private CValue runConstructor(Candidate c, List<Argument> args, FunctionContext ctx, SourceLocation loc) {
        FunctionDecl decl = c.decl;
        StructLayout layout = c.owner;
        CType type = CType.struct(layout);
        Variable object = ctx.temporary(type, ValueOps.zero(ctx.getBuilder(), type));
        SequencingAnalyzer seq = session.getSequencing();
        session.enter(decl, loc);
        Deque<AccessSet> saved = seq.detach();
        AccessSet body = seq.begin();
        try {
            FunctionContext child = ctx.inlineChild(c.scope, layout, decl);
            child.setThisVariable(child.declareReference("this", LValue.of(object), loc));
            bindParameters(c, args, child, ctx, loc);
            initializeMembers(layout, decl, child, loc);
            if (decl.hasBody()) {
                session.statements().translateBody(decl.getBody(), child);
            }
        } finally {
            seq.end(body);
            seq.reattach(saved);
            session.exit(decl);
        }
        seq.replay(body);
        return new CValue(object.getValue(), type);
    }

    /** 基类、成员初始化列表、默认成员初始化器，其余清零 */
    private void initializeMembers(StructLayout layout, FunctionDecl ctor, FunctionContext child, SourceLocation loc) {
        Map<String, MemberInitializer> inits = new HashMap<>();
        for (MemberInitializer mi : ctor.getMemberInitializers()) {
            inits.put(mi.getName(), mi);
        }
        LValue self = child.thisLValue(loc);
        StructLayout base = layout.getBase();
        int offset = 0;
        if (base != null) {
            MemberInitializer mi = inits.remove(base.getDecl().getName());
            CValue value = mi != null ? construct(base, mi.getArguments(), child, mi.getLocation())
                    : defaultValue(base, child, loc);
            expressions().writeLValue(self.base(base), value.getNode(), child, loc, false);
            offset = base.getFieldCount();
        }
        List<StructLayout.Field> own = layout.getOwnFields();
        for (int i = 0; i < own.size(); i++) {
            StructLayout.Field f = own.get(i);
            MemberInitializer mi = inits.remove(f.getName());
            if (f.getType().isChannel()) {
                continue;
            }
            CValue value = mi != null ? initializeField(f.getType(), mi.getArguments(), child, mi.getLocation())
                    : fieldDefault(f, child, loc);
            expressions().writeLValue(self.field(layout, offset + i), value.getNode(), child, loc, false);
        }
        if (!inits.isEmpty()) {
            MemberInitializer unknown = inits.values().iterator().next();
            throw TranslationException.unsupported("Member initializer '" + unknown.getName()
                    + "' does not name a field of '" + layout.getName() + "'", unknown.getLocation());
        }
    }

    private CValue initializeField(CType type, List<Expression> args, FunctionContext ctx, SourceLocation loc) {
        if (type.isStruct()) {
            return construct(type.getStruct(), args, ctx, loc);
        }
        if (args.isEmpty()) {
            return new CValue(ValueOps.zero(ctx.getBuilder(), type), type);
        }
        if (type.isArray()) {
            return expressions().translateInitializer(new InitListExpr(loc, args), type, ctx);
        }
        if (args.size() == 1) {
            return expressions().translateInitializer(args.get(0), type, ctx);
        }
        throw TranslationException.unsupported("Too many initializers for '" + type + "'", loc);
    }

    private CValue fieldDefault(StructLayout.Field f, FunctionContext ctx, SourceLocation loc) {
        CType type = f.getType();
        if (type.isChannel()) {
            return new CValue(ValueOps.zero(ctx.getBuilder(), type), type);
        }
        Expression init = f.getDecl().getInitializer();
        if (init != null) {
            return expressions().translateInitializer(init, type, ctx.initializerChild(f.getOwner()));
        }
        return defaultOf(type, ctx, loc);
    }

    /** 默认初始化：结构体走默认构造，数组逐元素，其余为零 */
    CValue defaultOf(CType type, FunctionContext ctx, SourceLocation loc) {
        if (type.isStruct()) {
            return defaultValue(type.getStruct(), ctx, loc);
        }
        if (type.isArray() && (type.getElement().isStruct() || type.getElement().isArray())) {
            IrNode element = defaultOf(type.getElement(), ctx, loc).getNode();
            return new CValue(ctx.getBuilder().array(Collections.nCopies(type.getLength(), element)), type);
        }
        return new CValue(ValueOps.zero(ctx.getBuilder(), type), type);
    }

    /** 默认构造的对象 */
    CValue defaultValue(StructLayout layout, FunctionContext ctx, SourceLocation loc) {
        if (!layout.getConstructors().isEmpty()) {
            return constructWith(layout, Collections.<Argument>emptyList(), ctx, loc);
        }
        IrBuilder b = ctx.getBuilder();
        List<IrNode> fields = new ArrayList<>();
        if (layout.getBase() != null) {
            fields.addAll(ValueOps.unpack(b, layout.getBase(), defaultValue(layout.getBase(), ctx, loc).getNode()));
        }
        for (StructLayout.Field f : layout.getOwnFields()) {
            fields.add(fieldDefault(f, ctx, loc).getNode());
        }
        return new CValue(ValueOps.pack(b, layout, fields), CType.struct(layout));
    }

    /** 聚合初始化：按展平字段顺序，缺省的字段取默认值 */
    private CValue aggregate(StructLayout layout, List<CValue> values, FunctionContext ctx, SourceLocation loc) {
        List<StructLayout.Field> fields = layout.getAllFields();
        if (values.size() > fields.size()) {
            throw TranslationException.unsupported("Too many initializers for '" + layout.getName() + "'", loc);
        }
        IrBuilder b = ctx.getBuilder();
        List<IrNode> nodes = new ArrayList<>();
        List<IrNode> defaults = null;
        for (int i = 0; i < fields.size(); i++) {
            if (i < values.size()) {
                nodes.add(expressions().convert(values.get(i), fields.get(i).getType(), ctx, loc).getNode());
            } else {
                if (defaults == null) {
                    defaults = ValueOps.unpack(b, layout, defaultValue(layout, ctx, loc).getNode());
                }
                nodes.add(defaults.get(i));
            }
        }
        return new CValue(ValueOps.pack(b, layout, nodes), CType.struct(layout));
    }

    // ========== 转换与运算符 ==========

    /**
     * 经转换运算符把结构体转为 target；target 为 null 时取第一个整数转换
     */
    CValue convertStruct(CValue v, CType target, FunctionContext ctx, SourceLocation loc) {
        StructLayout layout = v.getType().getStruct();
        StructLayout.Method chosen = null;
        for (StructLayout.Method m : layout.getConversions()) {
            CType to = types().resolve(m.getDecl().getReturnType(), m.getOwner().getScope());
            if (target != null && to.equals(target)) {
                chosen = m;
                break;
            }
            if (chosen == null && to.isIntegral()) {
                chosen = m;
            }
        }
        if (chosen == null) {
            throw TranslationException.unsupported("No conversion from '" + layout.getName() + "' to '"
                    + (target != null ? target.toString() : "integer") + "'", loc);
        }
        LValue self = adapt(LValue.of(ctx.temporary(v.getType(), v.getNode())), chosen.getOwner());
        Candidate c = bind(chosen.getDecl(), chosen.getOwner(), self, Collections.<TemplateArgument>emptyList(),
                Collections.<Argument>emptyList(), ctx, loc);
        return callCandidate(requireViable(c, chosen.getDecl().getName(), loc),
                Collections.<Argument>emptyList(), ctx, loc, true);
    }

    /** 二元运算符重载：成员优先，其次自由函数；都没有时返回 null */
    CValue binaryOperator(BinaryOp op, CValue left, CValue right, FunctionContext ctx, SourceLocation loc) {
        String name = "operator" + op.toSourceString();
        List<Argument> operands = new ArrayList<>();
        operands.add(Argument.of(left));
        operands.add(Argument.of(right));
        return overloadedOperator(name, operands, ctx, loc);
    }

    CValue unaryOperator(UnaryOp op, CValue operand, FunctionContext ctx, SourceLocation loc) {
        return overloadedOperator("operator" + op.toSourceString(),
                Collections.singletonList(Argument.of(operand)), ctx, loc);
    }

    private CValue overloadedOperator(String name, List<Argument> operands, FunctionContext ctx, SourceLocation loc) {
        CValue first = operands.get(0).value;
        if (first.getType().isStruct()) {
            List<StructLayout.Method> methods = first.getType().getStruct().findMethods(name);
            if (!methods.isEmpty()) {
                LValue self = LValue.of(ctx.temporary(first.getType(), first.getNode()));
                List<Argument> rest = operands.subList(1, operands.size());
                Candidate c = resolveMethods(methods, self, Collections.<TemplateArgument>emptyList(), rest, ctx, loc);
                if (c != null) {
                    return callCandidate(c, rest, ctx, loc, true);
                }
            }
        }
        Candidate best = null;
        for (FunctionDecl decl : session.getIndex().findFunctions(QualifiedName.of(name),
                ctx.getTypeScope().getNamespace())) {
            best = better(best, bind(decl, null, null, Collections.<TemplateArgument>emptyList(), operands, ctx, loc));
        }
        return best != null ? callCandidate(best, operands, ctx, loc, true) : null;
    }

    /**
     * ++ / -- 重载：后缀形式优先找带 int 形参的重载，否则调用前缀形式并返回旧值
     */
    CValue incrementOperator(LValue lv, UnaryOp op, FunctionContext ctx, SourceLocation loc) {
        boolean inc = op == UnaryOp.PRE_INC || op == UnaryOp.POST_INC;
        String name = inc ? "operator++" : "operator--";
        StructLayout layout = lv.getType().getStruct();
        List<StructLayout.Method> methods = layout.findMethods(name);
        if (methods.isEmpty()) {
            throw TranslationException.unsupported("No '" + name + "' for '" + layout.getName() + "'", loc);
        }
        List<TemplateArgument> none = Collections.emptyList();
        CValue result;
        if (op.isPostfix()) {
            List<Argument> dummy = Collections.singletonList(
                    Argument.of(new CValue(ctx.getBuilder().literal(32, 0), CType.INT)));
            Candidate postfix = resolveMethods(methods, lv, none, dummy, ctx, loc);
            if (postfix != null) {
                result = callCandidate(postfix, dummy, ctx, loc, true);
            } else {
                CValue old = expressions().readLValue(lv, ctx);
                List<Argument> noArgs = Collections.emptyList();
                callCandidate(requireViable(resolveMethods(methods, lv, none, noArgs, ctx, loc), name, loc),
                        noArgs, ctx, loc, true);
                result = old;
            }
        } else {
            List<Argument> noArgs = Collections.emptyList();
            result = callCandidate(requireViable(resolveMethods(methods, lv, none, noArgs, ctx, loc), name, loc),
                    noArgs, ctx, loc, true);
        }
        session.getSequencing().recordAssignment(lv.getRoot().getRoot());
        return result;
    }

    /**
     * 赋值类运算符重载（operator= / operator+= ...）；结构体没有该成员时返回 null
     */
    CValue assignmentOperator(LValue lv, String name, Expression value, FunctionContext ctx, SourceLocation loc) {
        StructLayout layout = lv.getType().getStruct();
        List<StructLayout.Method> methods = layout.findMethods(name);
        if (methods.isEmpty()) {
            return null;
        }
        List<Argument> args = Collections.singletonList(translateArgument(value, ctx));
        Candidate c = resolveMethods(methods, lv, Collections.<TemplateArgument>emptyList(), args, ctx, loc);
        CValue result;
        if (c != null) {
            result = callCandidate(c, args, ctx, loc, true);
        } else if ("operator=".equals(name) && args.get(0).channel == null) {
            result = expressions().convert(args.get(0).value, lv.getType(), ctx, loc);
            expressions().writeLValue(lv, result.getNode(), ctx, loc, true);
        } else {
            throw TranslationException.parse("no viable '" + name + "' for '" + layout.getName() + "'", loc);
        }
        session.getSequencing().recordAssignment(lv.getRoot().getRoot());
        return result;
    }
}
