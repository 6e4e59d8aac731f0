package com.hlsflow.compiler.parser;

import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.decl.QualifiedName;
import com.hlsflow.compiler.ast.expr.*;
import com.hlsflow.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.hlsflow.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.hlsflow.compiler.ast.type.TemplateArgument;
import com.hlsflow.compiler.ast.type.TypeRef;
import com.hlsflow.compiler.lexer.Token;
import com.hlsflow.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.hlsflow.compiler.lexer.TokenType.*;

/**
 * 表达式解析器（按 C++ 优先级逐层下降）
 */
class ExprParser {

    private final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析完整表达式（赋值级别，不支持逗号运算符）
     */
    Expression parseExpression() {
        return parseAssignment();
    }

    /**
     * 模板实参中的表达式：在移位级别截断，避免把 '&gt;' 当作比较运算
     */
    Expression parseTemplateArgumentExpression() {
        return parseAdditive();
    }

    // ============ 赋值 / 三元 ============

    private Expression parseAssignment() {
        Expression left = parseConditional();
        SourceLocation loc = parser.location();
        TokenType type = parser.current().getType();
        if (type == ASSIGN) {
            parser.advance();
            return new AssignExpr(loc, left, null, parseAssignment());
        }
        BinaryOp compound = compoundOperator(type);
        if (compound != null) {
            parser.advance();
            return new AssignExpr(loc, left, compound, parseAssignment());
        }
        return left;
    }

    private static BinaryOp compoundOperator(TokenType type) {
        switch (type) {
            case PLUS_ASSIGN: return BinaryOp.ADD;
            case MINUS_ASSIGN: return BinaryOp.SUB;
            case STAR_ASSIGN: return BinaryOp.MUL;
            case SLASH_ASSIGN: return BinaryOp.DIV;
            case PERCENT_ASSIGN: return BinaryOp.MOD;
            case AMP_ASSIGN: return BinaryOp.BIT_AND;
            case PIPE_ASSIGN: return BinaryOp.BIT_OR;
            case CARET_ASSIGN: return BinaryOp.BIT_XOR;
            case SHL_ASSIGN: return BinaryOp.SHL;
            case SHR_ASSIGN: return BinaryOp.SHR;
            default: return null;
        }
    }

    private Expression parseConditional() {
        Expression condition = parseLogicalOr();
        if (parser.check(QUESTION)) {
            SourceLocation loc = parser.location();
            parser.advance();
            Expression thenExpr = parseExpression();
            parser.expect(COLON, "Expected ':' in conditional expression");
            Expression elseExpr = parseAssignment();
            return new ConditionalExpr(loc, condition, thenExpr, elseExpr);
        }
        return condition;
    }

    // ============ 二元运算 ============

    private Expression parseLogicalOr() {
        Expression left = parseLogicalAnd();
        while (parser.check(OR_OR)) {
            SourceLocation loc = parser.location();
            parser.advance();
            left = new BinaryExpr(loc, left, BinaryOp.OR, parseLogicalAnd());
        }
        return left;
    }

    private Expression parseLogicalAnd() {
        Expression left = parseBitOr();
        while (parser.check(AND_AND)) {
            SourceLocation loc = parser.location();
            parser.advance();
            left = new BinaryExpr(loc, left, BinaryOp.AND, parseBitOr());
        }
        return left;
    }

    private Expression parseBitOr() {
        Expression left = parseBitXor();
        while (parser.check(PIPE)) {
            SourceLocation loc = parser.location();
            parser.advance();
            left = new BinaryExpr(loc, left, BinaryOp.BIT_OR, parseBitXor());
        }
        return left;
    }

    private Expression parseBitXor() {
        Expression left = parseBitAnd();
        while (parser.check(CARET)) {
            SourceLocation loc = parser.location();
            parser.advance();
            left = new BinaryExpr(loc, left, BinaryOp.BIT_XOR, parseBitAnd());
        }
        return left;
    }

    private Expression parseBitAnd() {
        Expression left = parseEquality();
        while (parser.check(AMP)) {
            SourceLocation loc = parser.location();
            parser.advance();
            left = new BinaryExpr(loc, left, BinaryOp.BIT_AND, parseEquality());
        }
        return left;
    }

    private Expression parseEquality() {
        Expression left = parseRelational();
        while (parser.checkAny(EQ, NE)) {
            SourceLocation loc = parser.location();
            BinaryOp op = parser.advance().is(EQ) ? BinaryOp.EQ : BinaryOp.NE;
            left = new BinaryExpr(loc, left, op, parseRelational());
        }
        return left;
    }

    private Expression parseRelational() {
        Expression left = parseShift();
        while (parser.checkAny(LT, LE, GT, GE)) {
            SourceLocation loc = parser.location();
            Token t = parser.advance();
            BinaryOp op;
            switch (t.getType()) {
                case LT: op = BinaryOp.LT; break;
                case LE: op = BinaryOp.LE; break;
                case GT: op = BinaryOp.GT; break;
                default: op = BinaryOp.GE; break;
            }
            left = new BinaryExpr(loc, left, op, parseShift());
        }
        return left;
    }

    private Expression parseShift() {
        Expression left = parseAdditive();
        while (parser.checkAny(SHL, SHR)) {
            SourceLocation loc = parser.location();
            BinaryOp op = parser.advance().is(SHL) ? BinaryOp.SHL : BinaryOp.SHR;
            left = new BinaryExpr(loc, left, op, parseAdditive());
        }
        return left;
    }

    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (parser.checkAny(PLUS, MINUS)) {
            SourceLocation loc = parser.location();
            BinaryOp op = parser.advance().is(PLUS) ? BinaryOp.ADD : BinaryOp.SUB;
            left = new BinaryExpr(loc, left, op, parseMultiplicative());
        }
        return left;
    }

    private Expression parseMultiplicative() {
        Expression left = parseUnary();
        while (parser.checkAny(STAR, SLASH, PERCENT)) {
            SourceLocation loc = parser.location();
            Token t = parser.advance();
            BinaryOp op = t.is(STAR) ? BinaryOp.MUL : t.is(SLASH) ? BinaryOp.DIV : BinaryOp.MOD;
            left = new BinaryExpr(loc, left, op, parseUnary());
        }
        return left;
    }

    // ============ 一元 / 类型转换 ============

    private Expression parseUnary() {
        SourceLocation loc = parser.location();
        switch (parser.current().getType()) {
            case PLUS: parser.advance(); return new UnaryExpr(loc, UnaryOp.PLUS, parseUnary());
            case MINUS: parser.advance(); return new UnaryExpr(loc, UnaryOp.NEG, parseUnary());
            case BANG: parser.advance(); return new UnaryExpr(loc, UnaryOp.NOT, parseUnary());
            case TILDE: parser.advance(); return new UnaryExpr(loc, UnaryOp.BIT_NOT, parseUnary());
            case INC: parser.advance(); return new UnaryExpr(loc, UnaryOp.PRE_INC, parseUnary());
            case DEC: parser.advance(); return new UnaryExpr(loc, UnaryOp.PRE_DEC, parseUnary());
            case STAR: parser.advance(); return new UnaryExpr(loc, UnaryOp.DEREF, parseUnary());
            case AMP: parser.advance(); return new UnaryExpr(loc, UnaryOp.ADDRESS_OF, parseUnary());
            case KW_SIZEOF: throw parser.error("sizeof is not supported");
            case LPAREN:
                if (isCStyleCast()) {
                    parser.advance();
                    TypeRef type = parser.typeParser.parseType();
                    parser.expect(RPAREN, "Expected ')' after cast type");
                    return new CastExpr(loc, type, parseUnary(), CastExpr.Style.C_STYLE);
                }
                return parsePostfix();
            default:
                return parsePostfix();
        }
    }

    /** '(' 之后是类型且紧跟 ')' 即为 C 风格转换 */
    private boolean isCStyleCast() {
        int mark = parser.mark();
        try {
            parser.advance();
            if (!parser.typeParser.isTypeStart()) {
                return false;
            }
            parser.typeParser.parseType();
            return parser.check(RPAREN);
        } catch (ParseException e) {
            return false;
        } finally {
            parser.reset(mark);
        }
    }

    // ============ 后缀 ============

    private Expression parsePostfix() {
        Expression expr = parsePrimary();
        while (true) {
            SourceLocation loc = parser.location();
            if (parser.match(LPAREN)) {
                expr = new CallExpr(loc, expr, parseArguments());
            } else if (parser.match(LBRACKET)) {
                Expression index = parseExpression();
                parser.expect(RBRACKET, "Expected ']' after index");
                expr = new IndexExpr(loc, expr, index);
            } else if (parser.check(DOT) || parser.check(ARROW)) {
                boolean arrow = parser.advance().is(ARROW);
                String member;
                if (parser.match(KW_OPERATOR)) {
                    member = "operator" + parser.declParser.parseOperatorSymbol();
                } else {
                    member = parser.expect(IDENTIFIER, "Expected member name").getLexeme();
                }
                expr = new MemberExpr(loc, expr, member, arrow);
            } else if (parser.match(INC)) {
                expr = new UnaryExpr(loc, UnaryOp.POST_INC, expr);
            } else if (parser.match(DEC)) {
                expr = new UnaryExpr(loc, UnaryOp.POST_DEC, expr);
            } else {
                break;
            }
        }
        return expr;
    }

    /** 解析实参列表（'(' 已消耗） */
    List<Expression> parseArguments() {
        List<Expression> args = new ArrayList<>();
        if (parser.match(RPAREN)) {
            return args;
        }
        do {
            args.add(parseExpression());
        } while (parser.match(COMMA));
        parser.expect(RPAREN, "Expected ')' after arguments");
        return args;
    }

    // ============ 基本表达式 ============

    private Expression parsePrimary() {
        SourceLocation loc = parser.location();
        Token t = parser.current();
        switch (t.getType()) {
            case INT_LITERAL:
                parser.advance();
                return intLiteral(loc, t);
            case CHAR_LITERAL:
                parser.advance();
                return new IntLiteral(loc, (Long) t.getLiteral(), false, 0, true, true);
            case KW_TRUE:
                parser.advance();
                return new BoolLiteral(loc, true);
            case KW_FALSE:
                parser.advance();
                return new BoolLiteral(loc, false);
            case KW_THIS:
                parser.advance();
                return new ThisExpr(loc);
            case LPAREN: {
                parser.advance();
                Expression inner = parseExpression();
                parser.expect(RPAREN, "Expected ')'");
                return inner;
            }
            case LBRACE:
                return parseInitList();
            case KW_STATIC_CAST: {
                parser.advance();
                parser.expect(LT, "Expected '<' after static_cast");
                TypeRef type = parser.typeParser.parseType();
                parser.expectCloseAngle();
                parser.expect(LPAREN, "Expected '(' after static_cast<...>");
                Expression operand = parseExpression();
                parser.expect(RPAREN, "Expected ')'");
                return new CastExpr(loc, type, operand, CastExpr.Style.STATIC_CAST);
            }
            default:
                break;
        }

        if (TypeParser.isBuiltinTypeKeyword(t.getType())) {
            // 函数式转换 int(x) / bool(a)
            TypeRef type = parser.typeParser.parseType();
            if (parser.match(LPAREN)) {
                List<Expression> args = parseArguments();
                if (args.size() != 1) {
                    throw parser.error("Functional cast to '" + type + "' expects one argument");
                }
                return new CastExpr(loc, type, args.get(0), CastExpr.Style.FUNCTIONAL);
            }
            throw parser.error("Expected '(' after type in expression");
        }

        if (t.is(IDENTIFIER) || t.is(DOUBLE_COLON)) {
            parser.match(DOUBLE_COLON); // 全局限定 ::name
            if (parser.typeParser.isTypeStart()) {
                int mark = parser.mark();
                TypeRef type = parser.typeParser.parseType();
                if (parser.match(LPAREN)) {
                    return new ConstructExpr(loc, type, parseArguments());
                }
                if (parser.check(LBRACE)) {
                    InitListExpr list = parseInitList();
                    return new ConstructExpr(loc, type, list.getElements());
                }
                parser.reset(mark);
            }
            QualifiedName name = parseNameWithOperator();
            List<TemplateArgument> templateArgs = null;
            if (parser.check(LT) && parser.typeParser.isTemplateName(name.toString())) {
                templateArgs = parser.typeParser.parseTemplateArguments();
            }
            return new NameExpr(loc, name, templateArgs);
        }

        throw parser.error("Expected expression");
    }

    /** 名字，允许以 operator 符号结尾：Test::operator+ */
    private QualifiedName parseNameWithOperator() {
        List<String> parts = new ArrayList<>();
        if (parser.match(KW_OPERATOR)) {
            parts.add("operator" + parser.declParser.parseOperatorSymbol());
            return new QualifiedName(parts);
        }
        parts.add(parser.expect(IDENTIFIER, "Expected identifier").getLexeme());
        while (parser.check(DOUBLE_COLON)) {
            parser.advance();
            if (parser.match(KW_OPERATOR)) {
                parts.add("operator" + parser.declParser.parseOperatorSymbol());
                break;
            }
            parts.add(parser.expect(IDENTIFIER, "Expected identifier after '::'").getLexeme());
        }
        return new QualifiedName(parts);
    }

    InitListExpr parseInitList() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACE, "Expected '{'");
        List<Expression> elements = new ArrayList<>();
        while (!parser.check(RBRACE)) {
            elements.add(parseExpression());
            if (!parser.match(COMMA)) {
                break;
            }
        }
        parser.expect(RBRACE, "Expected '}' after initializer list");
        return new InitListExpr(loc, elements);
    }

    private IntLiteral intLiteral(SourceLocation loc, Token t) {
        String lexeme = t.getLexeme().toLowerCase();
        boolean unsigned = false;
        int longCount = 0;
        int end = lexeme.length();
        while (end > 0) {
            char c = lexeme.charAt(end - 1);
            if (c == 'u') {
                unsigned = true;
            } else if (c == 'l') {
                longCount++;
            } else {
                break;
            }
            end--;
        }
        boolean decimal = !(lexeme.startsWith("0") && end > 1);
        return new IntLiteral(loc, (Long) t.getLiteral(), unsigned, longCount, false, decimal);
    }
}
