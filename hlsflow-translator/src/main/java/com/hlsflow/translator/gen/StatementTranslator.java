package com.hlsflow.translator.gen;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.Pragma;
import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.expr.AssignExpr;
import com.hlsflow.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.hlsflow.compiler.ast.expr.Expression;
import com.hlsflow.compiler.ast.expr.InitListExpr;
import com.hlsflow.compiler.ast.expr.NameExpr;
import com.hlsflow.compiler.ast.stmt.BreakStmt;
import com.hlsflow.compiler.ast.stmt.CompoundStmt;
import com.hlsflow.compiler.ast.stmt.ContinueStmt;
import com.hlsflow.compiler.ast.stmt.DeclStmt;
import com.hlsflow.compiler.ast.stmt.EmptyStmt;
import com.hlsflow.compiler.ast.stmt.ExprStmt;
import com.hlsflow.compiler.ast.stmt.ForStmt;
import com.hlsflow.compiler.ast.stmt.IfStmt;
import com.hlsflow.compiler.ast.stmt.ReturnStmt;
import com.hlsflow.compiler.ast.stmt.Statement;
import com.hlsflow.compiler.ast.stmt.SwitchSection;
import com.hlsflow.compiler.ast.stmt.SwitchStmt;
import com.hlsflow.compiler.ast.stmt.TypeDeclStmt;
import com.hlsflow.compiler.ast.stmt.VarDecl;
import com.hlsflow.compiler.ast.stmt.WhileStmt;
import com.hlsflow.compiler.ast.type.TypeRef;
import com.hlsflow.ir.IrBuilder;
import com.hlsflow.ir.node.IrNode;
import com.hlsflow.translator.TranslationException;
import com.hlsflow.translator.types.CType;
import com.hlsflow.translator.types.TypeResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 语句翻译：把结构化控制流展平为门控的直线代码。
 *
 * <p>if / switch 的各分支在各自的激活条件下翻译；for 循环按迭代逐份展开，
 * break / continue / return 只会把单调标志从假变真。</p>
 */
public final class StatementTranslator implements AstVisitor<Void, FunctionContext> {

    private static final Logger LOG = Logger.getLogger(StatementTranslator.class.getName());

    private final GenerationSession session;

    StatementTranslator(GenerationSession session) {
        this.session = session;
    }

    private ExpressionTranslator expressions() {
        return session.expressions();
    }

    /** 函数体直接在上下文的当前作用域中翻译（与形参同一作用域） */
    void translateBody(CompoundStmt body, FunctionContext ctx) {
        for (Statement s : body.getStatements()) {
            translate(s, ctx);
        }
    }

    void translate(Statement statement, FunctionContext ctx) {
        // switch 分支中 break 之后的语句不可达
        if (ctx.isStaticallyBroken()) {
            return;
        }
        statement.accept(this, ctx);
    }

    private void translateScoped(Statement statement, FunctionContext ctx) {
        ctx.pushScope();
        try {
            translate(statement, ctx);
        } finally {
            ctx.popScope();
        }
    }

    @Override
    public Void visitCompoundStmt(CompoundStmt node, FunctionContext ctx) {
        ctx.pushScope();
        try {
            for (Statement s : node.getStatements()) {
                translate(s, ctx);
            }
        } finally {
            ctx.popScope();
        }
        return null;
    }

    @Override
    public Void visitEmptyStmt(EmptyStmt node, FunctionContext ctx) {
        return null;
    }

    @Override
    public Void visitExprStmt(ExprStmt node, FunctionContext ctx) {
        expressions().translate(node.getExpression(), ctx);
        return null;
    }

    @Override
    public Void visitTypeDeclStmt(TypeDeclStmt node, FunctionContext ctx) {
        throw TranslationException.unsupported("DeclStmt other than Var", node.getLocation());
    }

    // ========== 声明 ==========

    @Override
    public Void visitDeclStmt(DeclStmt node, FunctionContext ctx) {
        for (VarDecl v : node.getVariables()) {
            declareVariable(v, ctx);
        }
        return null;
    }

    private void declareVariable(VarDecl v, FunctionContext ctx) {
        SourceLocation loc = v.getLocation();
        TypeRef ref = v.getType();
        if (v.isStatic()) {
            declareStatic(v, ctx);
            return;
        }
        if (TypeResolver.isAuto(ref)) {
            Expression init = singleInitializer(v);
            if (init == null || init instanceof InitListExpr) {
                throw TranslationException.unsupported("Declaration of '" + v.getName()
                        + "' with type 'auto' requires an initializer", loc);
            }
            if (ref.isReference()) {
                ctx.declareReference(v.getName(), expressions().requireLValue(init, ctx), loc);
                return;
            }
            CValue value = expressions().translate(init, ctx);
            ctx.declareValue(v.getName(), value.getType(), value.getNode(), loc);
            return;
        }

        CType type = variableType(v, ctx);
        if (type.isChannel()) {
            declareChannelAlias(v, type, ctx);
            return;
        }
        if (ref.isReference()) {
            declareReference(v, type, ctx);
            return;
        }
        CValue value = initialValue(v, type, ctx);
        ctx.declareValue(v.getName(), type, value.getNode(), loc);
    }

    /** 变量类型；首维省略的数组取初始化列表的长度 */
    private CType variableType(VarDecl v, FunctionContext ctx) {
        TypeResolver types = session.getTypes();
        List<Expression> dims = v.getArrayDimensions();
        if (!dims.isEmpty() && dims.get(0) == null && v.getInitializer() instanceof InitListExpr) {
            CType element = types.resolve(v.getType(), dims.subList(1, dims.size()), ctx.getTypeScope());
            return CType.arrayOf(element, ((InitListExpr) v.getInitializer()).getElements().size());
        }
        return types.resolve(v.getType(), dims, ctx.getTypeScope());
    }

    /** = e 或 (e) 形式的单个初始化表达式 */
    private static Expression singleInitializer(VarDecl v) {
        if (v.hasInitializer()) {
            return v.getInitializer();
        }
        if (v.hasConstructorArguments() && v.getConstructorArguments().size() == 1) {
            return v.getConstructorArguments().get(0);
        }
        return null;
    }

    private CValue initialValue(VarDecl v, CType type, FunctionContext ctx) {
        CallTranslator calls = session.calls();
        SourceLocation loc = v.getLocation();
        if (v.hasConstructorArguments()) {
            List<Expression> args = v.getConstructorArguments();
            if (type.isStruct()) {
                return calls.construct(type.getStruct(), args, ctx, loc);
            }
            if (args.isEmpty()) {
                return new CValue(ValueOps.zero(ctx.getBuilder(), type), type);
            }
            if (args.size() > 1) {
                throw TranslationException.unsupported("Too many initializers for '" + v.getName() + "'", loc);
            }
            return expressions().translateInitializer(args.get(0), type, ctx);
        }
        if (v.hasInitializer()) {
            return expressions().translateInitializer(v.getInitializer(), type, ctx);
        }
        return calls.defaultOf(type, ctx, loc);
    }

    private void declareReference(VarDecl v, CType type, FunctionContext ctx) {
        SourceLocation loc = v.getLocation();
        Expression init = singleInitializer(v);
        if (init == null) {
            throw TranslationException.unsupported("Declaration of reference variable '" + v.getName()
                    + "' requires an initializer", loc);
        }
        LValue target = expressions().tryLValue(init, ctx);
        if (target == null) {
            if (!v.getType().isConst()) {
                throw TranslationException.unsupported("Non-const reference '" + v.getName()
                        + "' cannot bind to a temporary", loc);
            }
            CValue value = expressions().translateInitializer(init, type, ctx);
            ctx.declareValue(v.getName(), type, value.getNode(), loc);
            return;
        }
        if (!target.getType().equals(type)) {
            if (!type.isStruct() || !target.getType().isStruct() || !type.getStruct().isBaseOf(target.getType().getStruct())) {
                throw TranslationException.unsupported("Reference '" + v.getName() + "' of type '" + type
                        + "' cannot bind to '" + target.getType() + "'", loc);
            }
            target = target.base(type.getStruct());
        }
        ctx.declareReference(v.getName(), target, loc);
    }

    /** 局部通道引用只是别名，之后在其上的 IO 会被拒绝 */
    private void declareChannelAlias(VarDecl v, CType type, FunctionContext ctx) {
        SourceLocation loc = v.getLocation();
        Expression init = singleInitializer(v);
        if (!v.getType().isReference() || !(init instanceof NameExpr) || !((NameExpr) init).isSimple()) {
            throw TranslationException.channelUsage("Local channel '" + v.getName()
                    + "' must be a reference to a channel parameter", loc);
        }
        Variable source = ctx.lookup(((NameExpr) init).getName().getSimpleName());
        if (source == null || !source.isChannel()) {
            throw TranslationException.channelUsage("Local channel '" + v.getName()
                    + "' must be a reference to a channel parameter", loc);
        }
        ctx.declareChannel(v.getName(), type, source.getChannel(), true, loc);
    }

    /**
     * 顶层函数的静态局部变量：初始值必须折叠为常量，之后的读写与普通变量相同
     */
    private void declareStatic(VarDecl v, FunctionContext ctx) {
        SourceLocation loc = v.getLocation();
        StaticStorage storage = ctx.getStaticStorage();
        if (storage == null) {
            throw TranslationException.unsupported("Static variable '" + v.getName()
                    + "' is only supported in the top function", loc);
        }
        if (ctx.innermostLoop() != null) {
            throw TranslationException.unsupported("Static variable '" + v.getName()
                    + "' cannot be declared inside a loop", loc);
        }
        if (v.getType().isReference()) {
            throw TranslationException.unsupported("Static reference '" + v.getName() + "' is not supported", loc);
        }
        CType type = variableType(v, ctx);
        CValue init = initialValue(v, type, ctx);
        if (!init.getNode().isLiteral()) {
            throw TranslationException.unsupported("Initializer of static variable '" + v.getName()
                    + "' must be a constant", loc);
        }
        IrNode read = storage.declare(v.getName(), type, init.getNode().getLiteral());
        ctx.addStaticLocal(ctx.declareValue(v.getName(), type, read, loc));
    }

    // ========== 分支 ==========

    @Override
    public Void visitIfStmt(IfStmt node, FunctionContext ctx) {
        IrBuilder b = ctx.getBuilder();
        IrNode condition = expressions().translateCondition(node.getCondition(), ctx);
        ctx.pushCondition(condition);
        try {
            translateScoped(node.getThenBranch(), ctx);
        } finally {
            ctx.popCondition();
        }
        if (node.hasElse()) {
            ctx.pushCondition(b.not(condition));
            try {
                translateScoped(node.getElseBranch(), ctx);
            } finally {
                ctx.popCondition();
            }
        }
        return null;
    }

    /**
     * 各分支的条件：自身标签匹配，或上一分支激活且未 break；default 在没有标签匹配时匹配
     */
    @Override
    public Void visitSwitchStmt(SwitchStmt node, FunctionContext ctx) {
        IrBuilder b = ctx.getBuilder();
        CValue scrutinee = expressions().translateIntegral(node.getScrutinee(), ctx);
        List<SwitchSection> sections = node.getSections();

        List<IrNode> matches = new ArrayList<>();
        IrNode anyLabel = b.literalBool(false);
        for (SwitchSection section : sections) {
            IrNode match = b.literalBool(false);
            for (Expression label : section.getLabels()) {
                CValue value = expressions().translateIntegral(label, ctx);
                CValue eq = expressions().binary(BinaryOp.EQ, scrutinee, value, ctx, label.getLocation());
                match = b.or(match, eq.getNode());
            }
            anyLabel = b.or(anyLabel, match);
            matches.add(match);
        }
        IrNode noLabel = b.not(anyLabel);

        FunctionContext.SwitchFrame frame = ctx.pushSwitch();
        ctx.pushScope();
        try {
            IrNode fallthrough = b.literalBool(false);
            for (int i = 0; i < sections.size(); i++) {
                SwitchSection section = sections.get(i);
                IrNode enter = b.or(matches.get(i), fallthrough);
                if (section.hasDefault()) {
                    enter = b.or(enter, noLabel);
                }
                frame.staticBreak = false;
                ctx.pushCondition(enter);
                try {
                    frame.sectionDepth = ctx.conditionDepth();
                    for (Statement s : section.getStatements()) {
                        translate(s, ctx);
                    }
                } finally {
                    ctx.popCondition();
                }
                fallthrough = frame.staticBreak ? b.literalBool(false) : enter;
            }
        } finally {
            ctx.popScope();
            ctx.popFrame();
        }
        return null;
    }

    // ========== 循环 ==========

    @Override
    public Void visitWhileStmt(WhileStmt node, FunctionContext ctx) {
        throw TranslationException.controlFlow("Only unrolled for loops are supported", node.getLocation());
    }

    /**
     * 按迭代展开：条件折叠为假时停止，否则像 break 一样门控本次及之后的迭代
     */
    @Override
    public Void visitForStmt(ForStmt node, FunctionContext ctx) {
        SourceLocation loc = node.getLocation();
        Pragma unroll = Pragma.find(node.getPragmas(), Pragma.UNROLL);
        if (unroll == null || !isUnrollEnabled(unroll)) {
            throw TranslationException.controlFlow("Only unrolled for loops are supported", loc);
        }
        if (node.getInitializer() == null) {
            throw TranslationException.controlFlow("Unrolled loop must have an initializer", loc);
        }
        if (node.getCondition() == null) {
            throw TranslationException.controlFlow("Unrolled loop must have a condition", loc);
        }
        if (node.getUpdate() == null) {
            throw TranslationException.controlFlow("Unrolled loop must have an increment", loc);
        }

        IrBuilder b = ctx.getBuilder();
        int maxIterations = session.getOptions().getMaxUnrollIterations();
        IrNode entryActive = ctx.activeCondition();
        Variable outer = assignedInductionVariable(node.getInitializer(), ctx);
        IrNode outerBefore = outer == null ? null : outer.getValue();
        ctx.pushScope();
        try {
            ctx.beginUnconditional();
            try {
                translate(node.getInitializer(), ctx);
            } finally {
                ctx.endUnconditional();
            }
            List<Variable> induction = inductionVariables(node.getInitializer(), ctx);
            // 循环外可见的归纳变量：只有真正执行的迭代才推进它
            IrNode outerValue = outer == null ? null : b.select(entryActive, outer.getValue(), outerBefore);
            FunctionContext.LoopFrame loop = ctx.pushLoop();
            try {
                int iterations = 0;
                while (true) {
                    IrNode condition = headerCondition(node.getCondition(), ctx);
                    if (IrBuilder.isLiteralFalse(condition)) {
                        break;
                    }
                    if (iterations >= maxIterations) {
                        throw TranslationException.controlFlow("Loop unrolling: maximum iterations exceeded ("
                                + maxIterations + ")", loc);
                    }
                    if (!IrBuilder.isLiteralTrue(condition)) {
                        loop.broken = b.or(loop.broken, b.not(condition));
                    }
                    if (IrBuilder.isLiteralFalse(ctx.activeCondition())) {
                        break;
                    }
                    iterations++;

                    setLocked(induction, true);
                    try {
                        translateScoped(node.getBody(), ctx);
                    } finally {
                        setLocked(induction, false);
                    }
                    loop.continued = b.literalBool(false);
                    IrNode running = ctx.activeCondition();
                    ctx.beginUnconditional();
                    try {
                        expressions().translate(node.getUpdate(), ctx);
                    } finally {
                        ctx.endUnconditional();
                    }
                    if (outer != null) {
                        outerValue = b.select(running, outer.getValue(), outerValue);
                    }
                }
                LOG.fine("Unrolled loop at " + loc + " into " + iterations + " iterations");
            } finally {
                ctx.popFrame();
            }
            if (outer != null) {
                outer.setValue(outerValue);
            }
        } finally {
            ctx.popScope();
        }
        return null;
    }

    private IrNode headerCondition(Expression condition, FunctionContext ctx) {
        ctx.beginUnconditional();
        try {
            return expressions().translateCondition(condition, ctx);
        } finally {
            ctx.endUnconditional();
        }
    }

    private static boolean isUnrollEnabled(Pragma unroll) {
        List<String> args = unroll.getArguments();
        if (args.isEmpty() || "yes".equals(args.get(0))) {
            return true;
        }
        LOG.warning("Ignoring " + unroll + " at " + unroll.getLocation());
        return false;
    }

    /** i = 0 形式的初始化子句所赋值的已有变量 */
    private static Variable assignedInductionVariable(Statement init, FunctionContext ctx) {
        if (init instanceof ExprStmt && ((ExprStmt) init).getExpression() instanceof AssignExpr) {
            Expression target = ((AssignExpr) ((ExprStmt) init).getExpression()).getTarget();
            if (target instanceof NameExpr && ((NameExpr) target).isSimple()) {
                Variable v = ctx.lookup(((NameExpr) target).getName().getSimpleName());
                if (v != null && v.getTarget() == null && v.getValue() != null) {
                    return v;
                }
            }
        }
        return null;
    }

    /** 初始化子句声明的变量，或 i = 0 形式赋值的变量 */
    private static List<Variable> inductionVariables(Statement init, FunctionContext ctx) {
        List<Variable> result = new ArrayList<>();
        if (init instanceof DeclStmt) {
            for (VarDecl v : ((DeclStmt) init).getVariables()) {
                Variable declared = ctx.lookup(v.getName());
                if (declared != null) {
                    result.add(declared);
                }
            }
        } else if (init instanceof ExprStmt && ((ExprStmt) init).getExpression() instanceof AssignExpr) {
            Expression target = ((AssignExpr) ((ExprStmt) init).getExpression()).getTarget();
            if (target instanceof NameExpr && ((NameExpr) target).isSimple()) {
                Variable v = ctx.lookup(((NameExpr) target).getName().getSimpleName());
                if (v != null) {
                    result.add(v);
                }
            }
        }
        return result;
    }

    private static void setLocked(List<Variable> variables, boolean locked) {
        for (Variable v : variables) {
            v.setLocked(locked);
        }
    }

    // ========== 跳转 ==========

    @Override
    public Void visitBreakStmt(BreakStmt node, FunctionContext ctx) {
        FunctionContext.Frame frame = ctx.innermostFrame();
        if (frame == null) {
            throw TranslationException.controlFlow("'break' statement not in loop or switch statement", node.getLocation());
        }
        if (frame instanceof FunctionContext.SwitchFrame) {
            FunctionContext.SwitchFrame sw = (FunctionContext.SwitchFrame) frame;
            if (ctx.conditionDepth() > sw.sectionDepth) {
                throw TranslationException.controlFlow("conditional breaks are not supported", node.getLocation());
            }
            sw.staticBreak = true;
            return null;
        }
        FunctionContext.LoopFrame loop = (FunctionContext.LoopFrame) frame;
        loop.broken = ctx.getBuilder().or(loop.broken, ctx.activeCondition());
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, FunctionContext ctx) {
        FunctionContext.LoopFrame loop = ctx.innermostLoop();
        if (loop == null) {
            throw TranslationException.controlFlow("'continue' statement not in loop statement", node.getLocation());
        }
        loop.continued = ctx.getBuilder().or(loop.continued, ctx.activeCondition());
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, FunctionContext ctx) {
        CType type = ctx.getReturnType();
        if (!node.hasValue()) {
            if (!type.isVoid()) {
                throw TranslationException.unsupported("Non-void function should return a value", node.getLocation());
            }
            ctx.recordReturn(null);
            return null;
        }
        if (type.isVoid()) {
            expressions().translate(node.getValue(), ctx);
            ctx.recordReturn(null);
            return null;
        }
        CValue value = expressions().translateInitializer(node.getValue(), type, ctx);
        ctx.recordReturn(value.getNode());
        return null;
    }
}
