package com.hlsflow.translator.types;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.decl.GlobalVarDecl;
import com.hlsflow.compiler.ast.expr.BinaryExpr;
import com.hlsflow.compiler.ast.expr.BoolLiteral;
import com.hlsflow.compiler.ast.expr.CastExpr;
import com.hlsflow.compiler.ast.expr.ConditionalExpr;
import com.hlsflow.compiler.ast.expr.Expression;
import com.hlsflow.compiler.ast.expr.IntLiteral;
import com.hlsflow.compiler.ast.expr.NameExpr;
import com.hlsflow.compiler.ast.expr.UnaryExpr;
import com.hlsflow.compiler.ast.stmt.VarDecl;
import com.hlsflow.translator.TranslationException;
import com.hlsflow.translator.scan.DeclarationIndex;

import java.util.HashSet;
import java.util.Set;

/**
 * 编译期常量求值：数组维度、非类型模板实参、const 全局量。
 *
 * <p>只接受字面量、常量名与算术 / 逻辑 / 条件 / 转换表达式。</p>
 */
public final class ConstantEvaluator implements AstVisitor<ConstantValue, TypeScope> {

    private final DeclarationIndex index;
    private final TypeResolver types;
    /** 正在求值的全局常量，防止自引用 */
    private final Set<GlobalVarDecl> evaluating = new HashSet<>();

    ConstantEvaluator(DeclarationIndex index, TypeResolver types) {
        this.index = index;
        this.types = types;
    }

    public ConstantValue evaluate(Expression expr, TypeScope scope) {
        ConstantValue value = expr.accept(this, scope);
        if (value == null) {
            throw notConstant(expr);
        }
        return value;
    }

    /** 求值并转换为目标类型 */
    public ConstantValue evaluateAs(Expression expr, CType type, TypeScope scope) {
        ConstantValue v = evaluate(expr, scope);
        return new ConstantValue(TypeRules.normalize(v.getValue(), type), type);
    }

    /**
     * 全局 const 变量的值；不是常量时返回 null
     */
    public ConstantValue evaluateGlobal(GlobalVarDecl global) {
        VarDecl var = global.getVariable();
        if (!var.getType().isConst() || !var.hasInitializer() || !var.getArrayDimensions().isEmpty()) {
            return null;
        }
        if (!evaluating.add(global)) {
            throw TranslationException.unsupported("constant '" + var.getName() + "' depends on itself",
                    var.getLocation());
        }
        try {
            TypeScope scope = TypeScope.inNamespace(index.namespaceOf(global));
            CType type = types.resolve(var.getType(), scope);
            if (!type.isIntegral()) {
                return null;
            }
            return evaluateAs(var.getInitializer(), type, scope);
        } finally {
            evaluating.remove(global);
        }
    }

    private static TranslationException notConstant(Expression expr) {
        return TranslationException.unsupported("expression '" + expr + "' is not a compile-time constant",
                expr.getLocation());
    }

    @Override
    public ConstantValue visitIntLiteral(IntLiteral node, TypeScope scope) {
        CType type = TypeRules.literalType(node);
        return new ConstantValue(TypeRules.normalize(node.getValue(), type), type);
    }

    @Override
    public ConstantValue visitBoolLiteral(BoolLiteral node, TypeScope scope) {
        return new ConstantValue(node.getValue() ? 1 : 0, CType.BOOL);
    }

    @Override
    public ConstantValue visitNameExpr(NameExpr node, TypeScope scope) {
        if (node.isSimple()) {
            ConstantValue bound = scope.lookupConstant(node.getName().getSimpleName());
            if (bound != null) {
                return bound;
            }
        }
        GlobalVarDecl global = index.findGlobal(node.getName(), scope.getNamespace());
        if (global != null) {
            ConstantValue v = evaluateGlobal(global);
            if (v != null) {
                return v;
            }
        }
        throw notConstant(node);
    }

    @Override
    public ConstantValue visitCastExpr(CastExpr node, TypeScope scope) {
        CType target = types.resolve(node.getTargetType(), scope);
        if (!target.isIntegral()) {
            throw notConstant(node);
        }
        return evaluateAs(node.getOperand(), target, scope);
    }

    @Override
    public ConstantValue visitConditionalExpr(ConditionalExpr node, TypeScope scope) {
        ConstantValue cond = evaluate(node.getCondition(), scope);
        ConstantValue a = evaluate(node.getThenExpr(), scope);
        ConstantValue b = evaluate(node.getElseExpr(), scope);
        CType type = TypeRules.common(a.getType(), b.getType());
        ConstantValue chosen = cond.getValue() != 0 ? a : b;
        return new ConstantValue(TypeRules.normalize(chosen.getValue(), type), type);
    }

    @Override
    public ConstantValue visitUnaryExpr(UnaryExpr node, TypeScope scope) {
        ConstantValue v = evaluate(node.getOperand(), scope);
        CType type = TypeRules.promote(v.getType());
        long x = TypeRules.normalize(v.getValue(), type);
        switch (node.getOperator()) {
            case PLUS:
                return new ConstantValue(x, type);
            case NEG:
                return new ConstantValue(TypeRules.normalize(-x, type), type);
            case BIT_NOT:
                return new ConstantValue(TypeRules.normalize(~x, type), type);
            case NOT:
                return new ConstantValue(x == 0 ? 1 : 0, CType.BOOL);
            default:
                throw notConstant(node);
        }
    }

    @Override
    public ConstantValue visitBinaryExpr(BinaryExpr node, TypeScope scope) {
        ConstantValue l = evaluate(node.getLeft(), scope);
        ConstantValue r = evaluate(node.getRight(), scope);
        BinaryExpr.BinaryOp op = node.getOperator();
        if (op.isLogical()) {
            boolean lv = l.getValue() != 0;
            boolean rv = r.getValue() != 0;
            boolean result = op == BinaryExpr.BinaryOp.AND ? lv && rv : lv || rv;
            return new ConstantValue(result ? 1 : 0, CType.BOOL);
        }
        if (op.isShift()) {
            CType type = TypeRules.promote(l.getType());
            long x = TypeRules.normalize(l.getValue(), type);
            int amount = (int) r.getValue();
            if (amount < 0 || amount >= type.getWidth()) {
                throw TranslationException.unsupported("shift amount " + amount + " out of range",
                        node.getLocation());
            }
            long shifted;
            if (op == BinaryExpr.BinaryOp.SHL) {
                shifted = x << amount;
            } else {
                shifted = type.isSigned() ? x >> amount : unsignedBits(x, type) >>> amount;
            }
            return new ConstantValue(TypeRules.normalize(shifted, type), type);
        }
        CType type = TypeRules.common(l.getType(), r.getType());
        long a = TypeRules.normalize(l.getValue(), type);
        long b = TypeRules.normalize(r.getValue(), type);
        boolean signed = type.isSigned();
        if (op.isComparison()) {
            int cmp = signed ? Long.compare(a, b) : Long.compareUnsigned(unsignedBits(a, type), unsignedBits(b, type));
            return new ConstantValue(compare(op, cmp) ? 1 : 0, CType.BOOL);
        }
        long result;
        switch (op) {
            case ADD: result = a + b; break;
            case SUB: result = a - b; break;
            case MUL: result = a * b; break;
            case DIV:
            case MOD:
                if (b == 0) {
                    throw TranslationException.unsupported("division by zero in constant expression",
                            node.getLocation());
                }
                if (signed) {
                    result = op == BinaryExpr.BinaryOp.DIV ? a / b : a % b;
                } else {
                    long ua = unsignedBits(a, type);
                    long ub = unsignedBits(b, type);
                    result = op == BinaryExpr.BinaryOp.DIV
                            ? Long.divideUnsigned(ua, ub) : Long.remainderUnsigned(ua, ub);
                }
                break;
            case BIT_AND: result = a & b; break;
            case BIT_OR: result = a | b; break;
            case BIT_XOR: result = a ^ b; break;
            default:
                throw notConstant(node);
        }
        return new ConstantValue(TypeRules.normalize(result, type), type);
    }

    private static long unsignedBits(long v, CType type) {
        return type.getWidth() >= 64 ? v : v & ((1L << type.getWidth()) - 1);
    }

    private static boolean compare(BinaryExpr.BinaryOp op, int cmp) {
        switch (op) {
            case EQ: return cmp == 0;
            case NE: return cmp != 0;
            case LT: return cmp < 0;
            case GT: return cmp > 0;
            case LE: return cmp <= 0;
            case GE: return cmp >= 0;
            default: throw new IllegalArgumentException("Not a comparison: " + op);
        }
    }
}
