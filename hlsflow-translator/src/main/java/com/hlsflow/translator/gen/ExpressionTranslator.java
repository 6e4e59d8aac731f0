package com.hlsflow.translator.gen;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.decl.GlobalVarDecl;
import com.hlsflow.compiler.ast.decl.QualifiedName;
import com.hlsflow.compiler.ast.expr.AssignExpr;
import com.hlsflow.compiler.ast.expr.BinaryExpr;
import com.hlsflow.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.hlsflow.compiler.ast.expr.BoolLiteral;
import com.hlsflow.compiler.ast.expr.CallExpr;
import com.hlsflow.compiler.ast.expr.CastExpr;
import com.hlsflow.compiler.ast.expr.ConditionalExpr;
import com.hlsflow.compiler.ast.expr.ConstructExpr;
import com.hlsflow.compiler.ast.expr.Expression;
import com.hlsflow.compiler.ast.expr.IndexExpr;
import com.hlsflow.compiler.ast.expr.InitListExpr;
import com.hlsflow.compiler.ast.expr.IntLiteral;
import com.hlsflow.compiler.ast.expr.MemberExpr;
import com.hlsflow.compiler.ast.expr.NameExpr;
import com.hlsflow.compiler.ast.expr.ThisExpr;
import com.hlsflow.compiler.ast.expr.UnaryExpr;
import com.hlsflow.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.hlsflow.ir.IrBuilder;
import com.hlsflow.ir.node.IrNode;
import com.hlsflow.translator.TranslationException;
import com.hlsflow.translator.seq.AccessSet;
import com.hlsflow.translator.seq.SequencingAnalyzer;
import com.hlsflow.translator.types.CType;
import com.hlsflow.translator.types.ConstantValue;
import com.hlsflow.translator.types.StructLayout;
import com.hlsflow.translator.types.TypeRules;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 表达式翻译：把表达式树降级为门控的直线 IR。
 *
 * <p>赋值是符号的重新绑定；成员、数组元素等嵌套路径写回根变量（元组重建、数组更新）。
 * 二元运算的两个操作数、条件表达式的三个分支作为未定序兄弟交给 {@link SequencingAnalyzer}。</p>
 */
public final class ExpressionTranslator implements AstVisitor<CValue, FunctionContext> {

    private final GenerationSession session;

    ExpressionTranslator(GenerationSession session) {
        this.session = session;
    }

    public CValue translate(Expression expr, FunctionContext ctx) {
        CValue value = expr.accept(this, ctx);
        if (value == null) {
            throw TranslationException.unsupported("Unsupported expression '" + expr + "'", expr.getLocation());
        }
        return value;
    }

    /** 翻译为整数或布尔值，结构体经转换运算符 */
    CValue translateIntegral(Expression expr, FunctionContext ctx) {
        return toIntegral(translate(expr, ctx), ctx, expr.getLocation());
    }

    /** 翻译为 1 位条件 */
    IrNode translateCondition(Expression expr, FunctionContext ctx) {
        return ValueOps.toBool(ctx.getBuilder(), translateIntegral(expr, ctx));
    }

    CValue toIntegral(CValue v, FunctionContext ctx, SourceLocation loc) {
        if (v.getType().isIntegral()) {
            return v;
        }
        if (v.getType().isStruct()) {
            return session.calls().convertStruct(v, null, ctx, loc);
        }
        throw TranslationException.unsupported("Expected an integer value, got '" + v.getType() + "'", loc);
    }

    /**
     * 隐式 / 显式转换到目标类型
     */
    CValue convert(CValue v, CType target, FunctionContext ctx, SourceLocation loc) {
        CType from = v.getType();
        if (from.equals(target)) {
            return v;
        }
        IrBuilder b = ctx.getBuilder();
        if (target.isVoid()) {
            return voidValue(b);
        }
        if (target.isIntegral()) {
            if (from.isIntegral()) {
                return new CValue(ValueOps.convertIntegral(b, v, target), target);
            }
            if (from.isStruct()) {
                return convert(session.calls().convertStruct(v, target, ctx, loc), target, ctx, loc);
            }
        }
        if (target.isStruct()) {
            StructLayout layout = target.getStruct();
            if (from.isStruct() && layout.isBaseOf(from.getStruct())) {
                return new CValue(ValueOps.baseSlice(b, from.getStruct(), layout, v.getNode()), target);
            }
            return session.calls().constructFromValues(layout, Collections.singletonList(v), ctx, loc);
        }
        throw TranslationException.unsupported("Cannot convert '" + from + "' to '" + target + "'", loc);
    }

    static CValue voidValue(IrBuilder b) {
        return new CValue(ValueOps.zero(b, CType.VOID), CType.VOID);
    }

    /**
     * 带目标类型的初始化：初始化列表或普通表达式
     */
    CValue translateInitializer(Expression init, CType type, FunctionContext ctx) {
        if (init instanceof InitListExpr) {
            return translateInitList((InitListExpr) init, type, ctx);
        }
        return convert(translate(init, ctx), type, ctx, init.getLocation());
    }

    private CValue translateInitList(InitListExpr list, CType type, FunctionContext ctx) {
        List<Expression> elements = list.getElements();
        SourceLocation loc = list.getLocation();
        IrBuilder b = ctx.getBuilder();
        if (elements.isEmpty()) {
            if (type.isStruct()) {
                return session.calls().defaultValue(type.getStruct(), ctx, loc);
            }
            return new CValue(ValueOps.zero(b, type), type);
        }
        if (type.isArray()) {
            if (elements.size() != type.getLength()) {
                throw TranslationException.unsupported("Array initializer has " + elements.size()
                        + " elements, expected " + type.getLength(), loc);
            }
            List<IrNode> nodes = new ArrayList<>();
            for (Expression e : elements) {
                nodes.add(translateInitializer(e, type.getElement(), ctx).getNode());
            }
            return new CValue(b.array(nodes), type);
        }
        if (type.isStruct()) {
            return session.calls().construct(type.getStruct(), elements, ctx, loc);
        }
        if (elements.size() == 1) {
            return translateInitializer(elements.get(0), type, ctx);
        }
        throw TranslationException.unsupported("Too many initializers for '" + type + "'", loc);
    }

    // ========== 左值 ==========

    /**
     * 可赋值表达式的左值；不是左值时返回 null（不产生任何节点）
     */
    LValue tryLValue(Expression expr, FunctionContext ctx) {
        if (expr instanceof NameExpr) {
            return nameLValue((NameExpr) expr, ctx);
        }
        if (expr instanceof ThisExpr) {
            return ctx.thisLValue(expr.getLocation());
        }
        if (expr instanceof UnaryExpr) {
            UnaryExpr u = (UnaryExpr) expr;
            if (u.getOperator() == UnaryOp.DEREF && u.getOperand() instanceof ThisExpr) {
                return ctx.thisLValue(expr.getLocation());
            }
            return null;
        }
        if (expr instanceof MemberExpr) {
            MemberExpr m = (MemberExpr) expr;
            LValue base = tryLValue(m.getTarget(), ctx);
            if (base == null) {
                return null;
            }
            StructLayout layout = requireStruct(base.getType(), m.getLocation());
            return base.field(layout, fieldIndex(layout, m.getMember(), m.getLocation()));
        }
        if (expr instanceof IndexExpr) {
            IndexExpr ix = (IndexExpr) expr;
            LValue base = tryLValue(ix.getTarget(), ctx);
            if (base == null) {
                return null;
            }
            requireArray(base.getType(), ix.getLocation());
            return base.index(translateIntegral(ix.getIndex(), ctx).getNode());
        }
        return null;
    }

    LValue requireLValue(Expression expr, FunctionContext ctx) {
        LValue lv = tryLValue(expr, ctx);
        if (lv == null) {
            throw TranslationException.unsupported("Expression '" + expr + "' is not assignable", expr.getLocation());
        }
        return lv;
    }

    private LValue nameLValue(NameExpr node, FunctionContext ctx) {
        if (!node.isSimple()) {
            return null;
        }
        String name = node.getName().getSimpleName();
        Variable v = ctx.lookup(name);
        if (v != null) {
            return v.isChannel() ? null : LValue.of(v);
        }
        StructLayout owner = ctx.getOwner();
        if (owner != null && ctx.getThisVariable() != null) {
            int index = owner.indexOfField(name);
            if (index >= 0) {
                return ctx.thisLValue(node.getLocation()).field(owner, index);
            }
        }
        return null;
    }

    CValue readLValue(LValue lv, FunctionContext ctx) {
        session.getSequencing().recordRead(lv.getRoot().getRoot());
        return new CValue(ValueOps.read(ctx.getBuilder(), lv), lv.getType());
    }

    /**
     * 在激活条件下写入左值
     *
     * @param assignment 赋值 / 自增自减（参与调用实参的未定序判定），否则为调用写回
     */
    void writeLValue(LValue lv, IrNode value, FunctionContext ctx, SourceLocation loc, boolean assignment) {
        Variable root = lv.getRoot();
        if (root.isLocked()) {
            throw TranslationException.controlFlow("Assignment to '" + root.getName()
                    + "' is forbidden in this context", loc);
        }
        IrNode updated = ValueOps.update(ctx.getBuilder(), lv, value);
        root.setValue(ctx.gate(updated, root.getValue()));
        if (assignment) {
            session.getSequencing().recordAssignment(root.getRoot());
        } else {
            session.getSequencing().recordWrite(root.getRoot());
        }
    }

    static StructLayout requireStruct(CType type, SourceLocation loc) {
        if (!type.isStruct()) {
            throw TranslationException.unsupported("Member access on non-struct type '" + type + "'", loc);
        }
        return type.getStruct();
    }

    private static void requireArray(CType type, SourceLocation loc) {
        if (!type.isArray()) {
            throw TranslationException.unsupported("Subscript on non-array type '" + type + "'", loc);
        }
    }

    private static int fieldIndex(StructLayout layout, String member, SourceLocation loc) {
        int index = layout.indexOfField(member);
        if (index < 0) {
            throw TranslationException.unsupported("No member named '" + member + "' in '" + layout.getName() + "'", loc);
        }
        return index;
    }

    // ========== 字面量与名字 ==========

    @Override
    public CValue visitIntLiteral(IntLiteral node, FunctionContext ctx) {
        CType type = TypeRules.literalType(node);
        return new CValue(ctx.getBuilder().literal(type.getWidth(), node.getValue()), type);
    }

    @Override
    public CValue visitBoolLiteral(BoolLiteral node, FunctionContext ctx) {
        return new CValue(ctx.getBuilder().literalBool(node.getValue()), CType.BOOL);
    }

    @Override
    public CValue visitNameExpr(NameExpr node, FunctionContext ctx) {
        SourceLocation loc = node.getLocation();
        LValue lv = nameLValue(node, ctx);
        if (lv != null) {
            return readLValue(lv, ctx);
        }
        if (node.isSimple()) {
            Variable v = ctx.lookup(node.getName().getSimpleName());
            if (v != null && v.isChannel()) {
                throw TranslationException.channelUsage("Channel '" + v.getName()
                        + "' can only be used through read() and write()", loc);
            }
        }
        ConstantValue constant = lookupConstant(node.getName(), ctx, loc);
        if (constant != null) {
            return literal(constant, ctx);
        }
        throw TranslationException.parse("use of undeclared identifier '" + node.getName() + "'", loc);
    }

    private ConstantValue lookupConstant(QualifiedName name, FunctionContext ctx, SourceLocation loc) {
        if (!name.isQualified()) {
            ConstantValue bound = ctx.getTypeScope().lookupConstant(name.getSimpleName());
            if (bound != null) {
                return bound;
            }
        } else {
            CType qualifier = session.getTypes().tryResolveName(
                    new QualifiedName(name.getParts().subList(0, name.getParts().size() - 1)), ctx.getTypeScope());
            if (qualifier != null && qualifier.isStruct()) {
                ConstantValue member = qualifier.getStruct().getScope().lookupConstant(name.getSimpleName());
                if (member != null) {
                    return member;
                }
            }
        }
        GlobalVarDecl global = session.getIndex().findGlobal(name, ctx.getTypeScope().getNamespace());
        if (global == null) {
            return null;
        }
        ConstantValue value = session.getTypes().getConstants().evaluateGlobal(global);
        if (value == null) {
            throw TranslationException.unsupported("Global variable '" + name + "' must be an integer constant", loc);
        }
        return value;
    }

    private static CValue literal(ConstantValue c, FunctionContext ctx) {
        return new CValue(ctx.getBuilder().literal(c.getType().getWidth(), c.getValue()), c.getType());
    }

    @Override
    public CValue visitThisExpr(ThisExpr node, FunctionContext ctx) {
        return readLValue(ctx.thisLValue(node.getLocation()), ctx);
    }

    @Override
    public CValue visitMemberExpr(MemberExpr node, FunctionContext ctx) {
        LValue lv = tryLValue(node, ctx);
        if (lv != null) {
            return readLValue(lv, ctx);
        }
        CValue object = translate(node.getTarget(), ctx);
        StructLayout layout = requireStruct(object.getType(), node.getLocation());
        int index = fieldIndex(layout, node.getMember(), node.getLocation());
        IrNode field = ValueOps.field(ctx.getBuilder(), layout, object.getNode(), index);
        return new CValue(field, layout.getAllFields().get(index).getType());
    }

    @Override
    public CValue visitIndexExpr(IndexExpr node, FunctionContext ctx) {
        LValue lv = tryLValue(node, ctx);
        if (lv != null) {
            return readLValue(lv, ctx);
        }
        CValue array = translate(node.getTarget(), ctx);
        requireArray(array.getType(), node.getLocation());
        CValue index = translateIntegral(node.getIndex(), ctx);
        return new CValue(ctx.getBuilder().arrayIndex(array.getNode(), index.getNode()),
                array.getType().getElement());
    }

    // ========== 赋值 ==========

    @Override
    public CValue visitAssignExpr(AssignExpr node, FunctionContext ctx) {
        SourceLocation loc = node.getLocation();
        LValue lv = requireLValue(node.getTarget(), ctx);
        CType type = lv.getType();
        BinaryOp op = node.getCompoundOperator();
        if (type.isStruct()) {
            String operator = "operator" + (op == null ? "" : op.toSourceString()) + "=";
            CValue overloaded = session.calls().assignmentOperator(lv, operator, node.getValue(), ctx, loc);
            if (overloaded != null) {
                return overloaded;
            }
            if (op != null) {
                throw TranslationException.unsupported("No '" + operator + "' for '" + type + "'", loc);
            }
            CValue converted = translateInitializer(node.getValue(), type, ctx);
            writeLValue(lv, converted.getNode(), ctx, loc, true);
            return converted;
        }
        CValue value;
        if (op == null) {
            value = translateInitializer(node.getValue(), type, ctx);
        } else {
            CValue current = readLValue(lv, ctx);
            CValue rhs = translateIntegral(node.getValue(), ctx);
            value = convert(arithmetic(op, toIntegral(current, ctx, loc), rhs, ctx), type, ctx, loc);
        }
        writeLValue(lv, value.getNode(), ctx, loc, true);
        return value;
    }

    // ========== 运算符 ==========

    @Override
    public CValue visitBinaryExpr(BinaryExpr node, FunctionContext ctx) {
        BinaryOp op = node.getOperator();
        if (op == BinaryOp.AND || op == BinaryOp.OR) {
            return logical(node, ctx);
        }
        SequencingAnalyzer seq = session.getSequencing();
        AccessSet leftAccess = seq.begin();
        CValue left;
        try {
            left = translate(node.getLeft(), ctx);
        } finally {
            seq.end(leftAccess);
        }
        AccessSet rightAccess = seq.begin();
        CValue right;
        try {
            right = translate(node.getRight(), ctx);
        } finally {
            seq.end(rightAccess);
        }
        seq.check(Arrays.asList(leftAccess, rightAccess), node.getLocation());
        return binary(op, left, right, ctx, node.getLocation());
    }

    /** 结构体操作数先找重载，找不到再转换为整数 */
    CValue binary(BinaryOp op, CValue left, CValue right, FunctionContext ctx, SourceLocation loc) {
        if (left.getType().isStruct() || right.getType().isStruct()) {
            CValue overloaded = session.calls().binaryOperator(op, left, right, ctx, loc);
            if (overloaded != null) {
                return overloaded;
            }
        }
        return arithmetic(op, toIntegral(left, ctx, loc), toIntegral(right, ctx, loc), ctx);
    }

    /** && 与 ||：右操作数只在左操作数允许时生效 */
    private CValue logical(BinaryExpr node, FunctionContext ctx) {
        IrBuilder b = ctx.getBuilder();
        boolean isAnd = node.getOperator() == BinaryOp.AND;
        IrNode left = translateCondition(node.getLeft(), ctx);
        ctx.pushCondition(isAnd ? left : b.not(left));
        IrNode right;
        try {
            right = translateCondition(node.getRight(), ctx);
        } finally {
            ctx.popCondition();
        }
        return new CValue(isAnd ? b.and(left, right) : b.or(left, right), CType.BOOL);
    }

    /**
     * 整数二元运算：常用算术转换后按符号选择 IR 操作
     */
    CValue arithmetic(BinaryOp op, CValue left, CValue right, FunctionContext ctx) {
        IrBuilder b = ctx.getBuilder();
        if (op.isShift()) {
            CType type = TypeRules.promote(left.getType());
            IrNode value = ValueOps.convertIntegral(b, left, type);
            IrNode amount = ValueOps.convertIntegral(b, right, TypeRules.promote(right.getType()));
            if (op == BinaryOp.SHL) {
                return new CValue(b.shll(value, amount), type);
            }
            return new CValue(type.isSigned() ? b.shra(value, amount) : b.shrl(value, amount), type);
        }
        CType type = TypeRules.common(left.getType(), right.getType());
        IrNode l = ValueOps.convertIntegral(b, left, type);
        IrNode r = ValueOps.convertIntegral(b, right, type);
        boolean signed = type.isSigned();
        switch (op) {
            case EQ: return new CValue(b.eq(l, r), CType.BOOL);
            case NE: return new CValue(b.ne(l, r), CType.BOOL);
            case LT: return new CValue(signed ? b.slt(l, r) : b.ult(l, r), CType.BOOL);
            case GT: return new CValue(signed ? b.sgt(l, r) : b.ugt(l, r), CType.BOOL);
            case LE: return new CValue(signed ? b.sle(l, r) : b.ule(l, r), CType.BOOL);
            case GE: return new CValue(signed ? b.sge(l, r) : b.uge(l, r), CType.BOOL);
            case ADD: return new CValue(b.add(l, r), type);
            case SUB: return new CValue(b.sub(l, r), type);
            case MUL: return new CValue(b.mul(l, r), type);
            case DIV: return new CValue(signed ? b.sdiv(l, r) : b.udiv(l, r), type);
            case MOD: return new CValue(signed ? b.smod(l, r) : b.umod(l, r), type);
            case BIT_AND: return new CValue(b.and(l, r), type);
            case BIT_OR: return new CValue(b.or(l, r), type);
            case BIT_XOR: return new CValue(b.xor(l, r), type);
            default:
                throw new IllegalArgumentException("Unexpected operator " + op);
        }
    }

    @Override
    public CValue visitUnaryExpr(UnaryExpr node, FunctionContext ctx) {
        SourceLocation loc = node.getLocation();
        UnaryOp op = node.getOperator();
        IrBuilder b = ctx.getBuilder();
        switch (op) {
            case DEREF:
                if (node.getOperand() instanceof ThisExpr) {
                    return readLValue(ctx.thisLValue(loc), ctx);
                }
                throw TranslationException.unsupported("Pointers are not supported", loc);
            case ADDRESS_OF:
                throw TranslationException.unsupported("Pointers are not supported", loc);
            case PRE_INC:
            case PRE_DEC:
            case POST_INC:
            case POST_DEC:
                return increment(node, ctx);
            default:
                break;
        }
        CValue operand = translate(node.getOperand(), ctx);
        if (operand.getType().isStruct()) {
            CValue overloaded = session.calls().unaryOperator(op, operand, ctx, loc);
            if (overloaded != null) {
                return overloaded;
            }
        }
        CValue v = toIntegral(operand, ctx, loc);
        if (op == UnaryOp.NOT) {
            return new CValue(b.not(ValueOps.toBool(b, v)), CType.BOOL);
        }
        CType type = TypeRules.promote(v.getType());
        IrNode value = ValueOps.convertIntegral(b, v, type);
        switch (op) {
            case PLUS:
                return new CValue(value, type);
            case NEG:
                return new CValue(b.neg(value), type);
            case BIT_NOT:
                return new CValue(b.not(value), type);
            default:
                throw new IllegalArgumentException("Unexpected operator " + op);
        }
    }

    private CValue increment(UnaryExpr node, FunctionContext ctx) {
        SourceLocation loc = node.getLocation();
        UnaryOp op = node.getOperator();
        LValue lv = requireLValue(node.getOperand(), ctx);
        if (lv.getType().isStruct()) {
            return session.calls().incrementOperator(lv, op, ctx, loc);
        }
        if (!lv.getType().isIntegral()) {
            throw TranslationException.unsupported("Cannot increment '" + lv.getType() + "'", loc);
        }
        IrBuilder b = ctx.getBuilder();
        CValue old = readLValue(lv, ctx);
        IrNode one = ValueOps.one(b, lv.getType());
        boolean inc = op == UnaryOp.PRE_INC || op == UnaryOp.POST_INC;
        IrNode updated = inc ? b.add(old.getNode(), one) : b.sub(old.getNode(), one);
        writeLValue(lv, updated, ctx, loc, true);
        return op.isPostfix() ? old : new CValue(updated, lv.getType());
    }

    @Override
    public CValue visitConditionalExpr(ConditionalExpr node, FunctionContext ctx) {
        SequencingAnalyzer seq = session.getSequencing();
        IrBuilder b = ctx.getBuilder();
        AccessSet condAccess = seq.begin();
        IrNode cond;
        try {
            cond = translateCondition(node.getCondition(), ctx);
        } finally {
            seq.end(condAccess);
        }
        AccessSet thenAccess = seq.begin();
        CValue a;
        ctx.pushCondition(cond);
        try {
            a = translate(node.getThenExpr(), ctx);
        } finally {
            ctx.popCondition();
            seq.end(thenAccess);
        }
        AccessSet elseAccess = seq.begin();
        CValue c;
        ctx.pushCondition(b.not(cond));
        try {
            c = translate(node.getElseExpr(), ctx);
        } finally {
            ctx.popCondition();
            seq.end(elseAccess);
        }
        seq.check(Arrays.asList(condAccess, thenAccess, elseAccess), node.getLocation());

        CType type;
        if (a.getType().isIntegral() && c.getType().isIntegral()) {
            type = TypeRules.common(a.getType(), c.getType());
        } else if (a.getType().isStruct() || a.getType().equals(c.getType())) {
            type = a.getType();
        } else {
            type = c.getType();
        }
        a = convert(a, type, ctx, node.getLocation());
        c = convert(c, type, ctx, node.getLocation());
        return new CValue(b.select(cond, a.getNode(), c.getNode()), type);
    }

    // ========== 转换、构造、调用 ==========

    @Override
    public CValue visitCastExpr(CastExpr node, FunctionContext ctx) {
        CType target = session.getTypes().resolve(node.getTargetType(), ctx.getTypeScope());
        if (target.isStruct()) {
            return session.calls().construct(target.getStruct(), Collections.singletonList(node.getOperand()),
                    ctx, node.getLocation());
        }
        CValue v = translate(node.getOperand(), ctx);
        return convert(v, target, ctx, node.getLocation());
    }

    @Override
    public CValue visitConstructExpr(ConstructExpr node, FunctionContext ctx) {
        CType type = session.getTypes().resolve(node.getType(), ctx.getTypeScope());
        if (type.isStruct()) {
            return session.calls().construct(type.getStruct(), node.getArguments(), ctx, node.getLocation());
        }
        List<Expression> args = node.getArguments();
        if (args.isEmpty()) {
            return new CValue(ValueOps.zero(ctx.getBuilder(), type), type);
        }
        if (args.size() == 1) {
            return translateInitializer(args.get(0), type, ctx);
        }
        throw TranslationException.unsupported("Too many initializers for '" + type + "'", node.getLocation());
    }

    @Override
    public CValue visitInitListExpr(InitListExpr node, FunctionContext ctx) {
        throw TranslationException.unsupported("Initializer list requires a declared type", node.getLocation());
    }

    @Override
    public CValue visitCallExpr(CallExpr node, FunctionContext ctx) {
        return session.calls().translateCall(node, ctx);
    }
}
