package com.hlsflow.compiler.parser;

import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.decl.QualifiedName;
import com.hlsflow.compiler.ast.type.BuiltinType;
import com.hlsflow.compiler.ast.type.NamedType;
import com.hlsflow.compiler.ast.type.TemplateArgument;
import com.hlsflow.compiler.ast.type.TypeRef;
import com.hlsflow.compiler.lexer.Token;
import com.hlsflow.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.hlsflow.compiler.lexer.TokenType.*;

/**
 * 类型解析器
 */
class TypeParser {

    private final Parser parser;

    TypeParser(Parser parser) {
        this.parser = parser;
    }

    static boolean isBuiltinTypeKeyword(TokenType type) {
        switch (type) {
            case KW_VOID: case KW_BOOL: case KW_CHAR: case KW_SHORT: case KW_INT:
            case KW_LONG: case KW_SIGNED: case KW_UNSIGNED: case KW_AUTO:
                return true;
            default:
                return false;
        }
    }

    /**
     * 当前位置是否以类型开头（不消耗 token）
     */
    boolean isTypeStart() {
        int offset = 0;
        while (parser.peek(offset).isOneOf(KW_CONST, KW_VOLATILE, KW_TYPENAME, KW_CONSTEXPR)) {
            offset++;
        }
        Token t = parser.peek(offset);
        if (isBuiltinTypeKeyword(t.getType())) {
            return true;
        }
        if (!t.is(IDENTIFIER)) {
            return false;
        }
        return isTypeName(qualifiedNameAt(offset));
    }

    /** 名字是否为已知类型（考虑当前命名空间） */
    boolean isTypeName(String name) {
        if (parser.isTypeName(name)) {
            return true;
        }
        String prefix = parser.namespacePrefix();
        return !prefix.isEmpty() && parser.isTypeName(prefix + name);
    }

    boolean isTemplateName(String name) {
        if (parser.isTemplateName(name)) {
            return true;
        }
        String prefix = parser.namespacePrefix();
        return !prefix.isEmpty() && parser.isTemplateName(prefix + name);
    }

    /** 从 offset 起读取 a::b::c 形式的名字（不消耗 token） */
    String qualifiedNameAt(int offset) {
        StringBuilder sb = new StringBuilder(parser.peek(offset).getLexeme());
        int i = offset + 1;
        while (parser.peek(i).is(DOUBLE_COLON) && parser.peek(i + 1).is(IDENTIFIER)) {
            sb.append("::").append(parser.peek(i + 1).getLexeme());
            i += 2;
        }
        return sb.toString();
    }

    /** 读取并消耗 a::b::c */
    QualifiedName parseQualifiedName() {
        List<String> parts = new ArrayList<>();
        parts.add(parser.expect(IDENTIFIER, "Expected identifier").getLexeme());
        while (parser.check(DOUBLE_COLON) && parser.peek(1).is(IDENTIFIER)) {
            parser.advance();
            parts.add(parser.advance().getLexeme());
        }
        return new QualifiedName(parts);
    }

    /**
     * 解析类型（含 const、引用限定）
     */
    TypeRef parseType() {
        SourceLocation loc = parser.location();
        boolean isConst = false;
        while (parser.checkAny(KW_CONST, KW_VOLATILE, KW_TYPENAME, KW_CONSTEXPR)) {
            if (parser.advance().isOneOf(KW_CONST, KW_CONSTEXPR)) {
                isConst = true;
            }
        }

        TypeRef base;
        if (isBuiltinTypeKeyword(parser.current().getType())) {
            base = parseBuiltin(loc);
        } else if (parser.check(IDENTIFIER)) {
            QualifiedName name = parseQualifiedName();
            List<TemplateArgument> args = null;
            if (parser.check(LT) && isTemplateName(name.toString())) {
                args = parseTemplateArguments();
            }
            base = new NamedType(loc, name, args, false, false);
        } else {
            throw parser.error("Expected type");
        }

        // 后置限定
        boolean isReference = false;
        while (true) {
            if (parser.match(KW_CONST) || parser.match(KW_VOLATILE)) {
                isConst = isConst || parser.previous().is(KW_CONST);
            } else if (parser.check(AMP)) {
                parser.advance();
                isReference = true;
            } else if (parser.check(AND_AND)) {
                throw parser.error("Rvalue references are not supported");
            } else if (parser.check(STAR)) {
                throw parser.error("Pointer types are not supported");
            } else {
                break;
            }
        }
        return base.withQualifiers(isConst, isReference);
    }

    private TypeRef parseBuiltin(SourceLocation loc) {
        boolean unsigned = false;
        int longCount = 0;
        BuiltinType.Kind kind = null;
        boolean sawIntKeyword = false;

        while (true) {
            Token t = parser.current();
            if (t.is(KW_UNSIGNED)) {
                unsigned = true;
            } else if (t.is(KW_SIGNED)) {
                unsigned = false;
            } else if (t.is(KW_LONG)) {
                longCount++;
            } else if (t.is(KW_SHORT)) {
                kind = BuiltinType.Kind.SHORT;
            } else if (t.is(KW_INT)) {
                sawIntKeyword = true;
            } else if (t.is(KW_CHAR)) {
                kind = BuiltinType.Kind.CHAR;
            } else if (t.is(KW_BOOL)) {
                kind = BuiltinType.Kind.BOOL;
            } else if (t.is(KW_VOID)) {
                kind = BuiltinType.Kind.VOID;
            } else if (t.is(KW_AUTO)) {
                kind = BuiltinType.Kind.AUTO;
            } else if (t.is(KW_CONST) && parser.peek(1).isOneOf(KW_INT, KW_LONG, KW_SHORT, KW_CHAR)) {
                // unsigned const int
                parser.advance();
                continue;
            } else {
                break;
            }
            parser.advance();
        }

        if (kind == null) {
            if (longCount == 1) {
                kind = BuiltinType.Kind.LONG;
            } else if (longCount >= 2) {
                kind = BuiltinType.Kind.LONG_LONG;
            } else {
                kind = BuiltinType.Kind.INT;
            }
        } else if (longCount > 0 && kind != BuiltinType.Kind.INT) {
            throw parser.error("Invalid combination of 'long' with '" + kind.getSpelling() + "'");
        }
        if (sawIntKeyword && (kind == BuiltinType.Kind.CHAR || kind == BuiltinType.Kind.BOOL
                || kind == BuiltinType.Kind.VOID)) {
            throw parser.error("Invalid combination of 'int' with '" + kind.getSpelling() + "'");
        }
        return new BuiltinType(loc, kind, unsigned, false, false);
    }

    /**
     * 解析模板实参列表 &lt;T, 5, ...&gt;（当前 token 为 '&lt;'）
     */
    List<TemplateArgument> parseTemplateArguments() {
        parser.expect(LT, "Expected '<'");
        List<TemplateArgument> args = new ArrayList<>();
        if (parser.check(GT) || parser.check(SHR)) {
            parser.expectCloseAngle();
            return args;
        }
        do {
            if (isTypeStart()) {
                args.add(TemplateArgument.ofType(parseType()));
            } else {
                args.add(TemplateArgument.ofValue(parser.exprParser.parseTemplateArgumentExpression()));
            }
        } while (parser.match(COMMA));
        parser.expectCloseAngle();
        return args;
    }
}
