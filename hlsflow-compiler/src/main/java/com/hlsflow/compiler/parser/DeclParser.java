package com.hlsflow.compiler.parser;

import com.hlsflow.compiler.ast.Pragma;
import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.decl.*;
import com.hlsflow.compiler.ast.expr.Expression;
import com.hlsflow.compiler.ast.stmt.CompoundStmt;
import com.hlsflow.compiler.ast.stmt.VarDecl;
import com.hlsflow.compiler.ast.type.BuiltinType;
import com.hlsflow.compiler.ast.type.NamedType;
import com.hlsflow.compiler.ast.type.TypeRef;
import com.hlsflow.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.hlsflow.compiler.lexer.TokenType.*;

/**
 * 声明解析器：命名空间、typedef、模板、结构体、函数
 */
class DeclParser {

    private final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析一个顶层（或命名空间内）声明，结果追加到 out
     */
    void parseTopLevel(List<Declaration> out) {
        SourceLocation loc = parser.location();
        switch (parser.current().getType()) {
            case PRAGMA:
                parser.addPendingPragma(parser.advance());
                return;
            case SEMICOLON:
                parser.advance();
                return;
            case KW_NAMESPACE:
                out.add(parseNamespace());
                return;
            case KW_TYPEDEF: {
                TypedefDecl typedef = parseTypedef(out);
                if (typedef != null) {
                    out.add(typedef);
                }
                return;
            }
            case KW_USING: {
                TypedefDecl alias = parseUsing();
                if (alias != null) {
                    out.add(alias);
                }
                return;
            }
            case KW_TEMPLATE:
                parseTemplated(out);
                return;
            case KW_STRUCT:
            case KW_CLASS: {
                if (parser.peek(1).is(IDENTIFIER) && parser.peek(2).is(SEMICOLON)) {
                    // 前置声明
                    parser.advance();
                    parser.registerTypeName(parser.advance().getLexeme());
                    parser.advance();
                    return;
                }
                StructDecl struct = parseStruct(parser.takePendingPragmas(), Collections.emptyList());
                parser.expect(SEMICOLON, "Expected ';' after struct declaration");
                out.add(struct);
                return;
            }
            case KW_ENUM:
                throw parser.error("enum declarations are not supported");
            case KW_UNION:
                throw parser.error("union declarations are not supported");
            default:
                break;
        }
        parseFunctionOrVariable(out, loc, Collections.emptyList());
    }

    private NamespaceDecl parseNamespace() {
        SourceLocation loc = parser.location();
        parser.expect(KW_NAMESPACE, "Expected 'namespace'");
        String name = parser.expect(IDENTIFIER, "Expected namespace name").getLexeme();
        parser.expect(LBRACE, "Expected '{' after namespace name");
        parser.namespaces.push(name);
        List<Declaration> declarations = new ArrayList<>();
        try {
            while (!parser.check(RBRACE) && !parser.isAtEnd()) {
                parseTopLevel(declarations);
            }
        } finally {
            parser.namespaces.pop();
        }
        parser.expect(RBRACE, "Expected '}' to close namespace");
        return new NamespaceDecl(loc, name, declarations);
    }

    /**
     * typedef T Name; 或 typedef struct [Tag] { ... } Name;
     * 匿名结构体直接以别名命名，追加到 out。
     */
    TypedefDecl parseTypedef(List<Declaration> out) {
        SourceLocation loc = parser.location();
        parser.expect(KW_TYPEDEF, "Expected 'typedef'");
        List<Pragma> pragmas = parser.takePendingPragmas();
        if (parser.checkAny(KW_STRUCT, KW_CLASS) && (parser.peek(1).is(LBRACE)
                || parser.peek(1).is(IDENTIFIER) && parser.peek(2).isOneOf(LBRACE, COLON))) {
            StructDecl struct = parseStruct(pragmas, Collections.emptyList());
            Token aliasToken = parser.expect(IDENTIFIER, "Expected typedef name");
            parser.expect(SEMICOLON, "Expected ';' after typedef");
            parser.registerTypeName(aliasToken.getLexeme());
            if (struct.isAnonymous()) {
                out.add(struct.renamed(aliasToken.getLexeme(), Collections.emptyList()));
                return null;
            }
            out.add(struct);
            return new TypedefDecl(loc, aliasToken.getLexeme(),
                    new NamedType(loc, QualifiedName.of(struct.getName()),
                            null, false, false));
        }
        if (parser.checkAny(KW_STRUCT, KW_CLASS)) {
            parser.advance();
        }
        TypeRef type = parser.typeParser.parseType();
        String name = parser.expect(IDENTIFIER, "Expected typedef name").getLexeme();
        if (parser.check(LBRACKET)) {
            throw parser.error("Array typedefs are not supported");
        }
        parser.expect(SEMICOLON, "Expected ';' after typedef");
        parser.registerTypeName(name);
        return new TypedefDecl(loc, name, type);
    }

    /** using Name = Type; 或 using namespace X;（后者忽略） */
    private TypedefDecl parseUsing() {
        SourceLocation loc = parser.location();
        parser.expect(KW_USING, "Expected 'using'");
        if (parser.match(KW_NAMESPACE)) {
            parser.typeParser.parseQualifiedName();
            parser.expect(SEMICOLON, "Expected ';' after using namespace");
            return null;
        }
        String name = parser.expect(IDENTIFIER, "Expected alias name").getLexeme();
        parser.expect(ASSIGN, "Expected '=' in alias declaration");
        TypeRef type = parser.typeParser.parseType();
        parser.expect(SEMICOLON, "Expected ';' after alias declaration");
        parser.registerTypeName(name);
        return new TypedefDecl(loc, name, type);
    }

    // ============ 模板 ============

    List<TemplateParameter> parseTemplateHeader() {
        parser.expect(KW_TEMPLATE, "Expected 'template'");
        parser.expect(LT, "Expected '<' after 'template'");
        List<TemplateParameter> params = new ArrayList<>();
        if (!parser.check(GT)) {
            do {
                SourceLocation loc = parser.location();
                if (parser.match(KW_TYPENAME) || parser.match(KW_CLASS)) {
                    String name = parser.expect(IDENTIFIER, "Expected template parameter name").getLexeme();
                    params.add(new TemplateParameter(loc, name, null));
                } else {
                    TypeRef valueType = parser.typeParser.parseType();
                    String name = parser.expect(IDENTIFIER, "Expected template parameter name").getLexeme();
                    params.add(new TemplateParameter(loc, name, valueType));
                }
                if (parser.check(ASSIGN)) {
                    throw parser.error("Default template arguments are not supported");
                }
            } while (parser.match(COMMA));
        }
        parser.expectCloseAngle();
        return params;
    }

    private static Set<String> typeParameterNames(List<TemplateParameter> params) {
        Set<String> names = new HashSet<>();
        for (TemplateParameter p : params) {
            if (p.isTypeParameter()) {
                names.add(p.getName());
            }
        }
        return names;
    }

    private void parseTemplated(List<Declaration> out) {
        SourceLocation loc = parser.location();
        List<TemplateParameter> params = parseTemplateHeader();
        parser.pushTemplateScope(typeParameterNames(params));
        try {
            if (parser.checkAny(KW_STRUCT, KW_CLASS)) {
                StructDecl struct = parseStruct(parser.takePendingPragmas(), params);
                parser.expect(SEMICOLON, "Expected ';' after struct declaration");
                out.add(struct);
            } else {
                parseFunctionOrVariable(out, loc, params);
            }
        } finally {
            parser.popTemplateScope();
        }
    }

    // ============ 结构体 ============

    /**
     * 解析 struct/class 头与成员（不含结尾分号）
     */
    StructDecl parseStruct(List<Pragma> pragmas, List<TemplateParameter> templateParams) {
        SourceLocation loc = parser.location();
        boolean isClass = parser.advance().is(KW_CLASS);
        String name = null;
        if (parser.check(IDENTIFIER)) {
            name = parser.advance().getLexeme();
            parser.registerTypeName(name);
            if (!templateParams.isEmpty()) {
                parser.registerTemplateName(name);
            }
        }

        List<BaseSpecifier> bases = new ArrayList<>();
        if (parser.match(COLON)) {
            do {
                boolean virtual = false;
                while (parser.checkAny(KW_PUBLIC, KW_PRIVATE, KW_PROTECTED, KW_VIRTUAL)) {
                    if (parser.advance().is(KW_VIRTUAL)) {
                        virtual = true;
                    }
                }
                bases.add(new BaseSpecifier(parser.typeParser.parseType(), virtual));
            } while (parser.match(COMMA));
        }

        List<FieldDecl> fields = new ArrayList<>();
        List<FunctionDecl> methods = new ArrayList<>();
        parser.expect(LBRACE, "Expected '{' in struct declaration");
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            parseMember(name, fields, methods);
        }
        parser.expect(RBRACE, "Expected '}' after struct body");
        return new StructDecl(loc, name, pragmas, isClass, templateParams, bases, fields, methods);
    }

    private void parseMember(String structName, List<FieldDecl> fields, List<FunctionDecl> methods) {
        SourceLocation loc = parser.location();
        if (parser.checkAny(KW_PUBLIC, KW_PRIVATE, KW_PROTECTED) && parser.peek(1).is(COLON)) {
            parser.advance();
            parser.advance();
            return;
        }
        if (parser.check(PRAGMA)) {
            parser.addPendingPragma(parser.advance());
            return;
        }
        if (parser.match(SEMICOLON)) {
            return;
        }
        if (parser.checkAny(KW_STRUCT, KW_CLASS)) {
            throw parser.error("Nested struct declarations are not supported");
        }
        if (parser.check(TILDE)) {
            throw parser.error("Destructors are not supported");
        }

        List<TemplateParameter> templateParams = Collections.emptyList();
        if (parser.check(KW_TEMPLATE)) {
            templateParams = parseTemplateHeader();
        }
        parser.pushTemplateScope(typeParameterNames(templateParams));
        try {
            parseMemberDeclaration(loc, structName, templateParams, fields, methods);
        } finally {
            parser.popTemplateScope();
        }
    }

    private void parseMemberDeclaration(SourceLocation loc, String structName,
                                        List<TemplateParameter> templateParams,
                                        List<FieldDecl> fields, List<FunctionDecl> methods) {
        boolean isStatic = false;
        while (true) {
            if (parser.match(KW_STATIC)) {
                isStatic = true;
            } else if (parser.match(KW_INLINE)) {
                continue;
            } else if (parser.check(KW_VIRTUAL)) {
                throw parser.error("Virtual functions are not supported");
            } else if (parser.check(IDENTIFIER) && "explicit".equals(parser.current().getLexeme())) {
                parser.advance();
            } else {
                break;
            }
        }
        List<Pragma> pragmas = parser.takePendingPragmas();

        // 构造函数
        if (parser.check(IDENTIFIER) && parser.current().getLexeme().equals(structName)
                && parser.peek(1).is(LPAREN)) {
            parser.advance();
            List<ParamDecl> params = parseParameters();
            List<MemberInitializer> inits = new ArrayList<>();
            if (parser.match(COLON)) {
                do {
                    SourceLocation initLoc = parser.location();
                    String member = parser.typeParser.parseQualifiedName().getSimpleName();
                    if (parser.check(LT)) {
                        parser.typeParser.parseTemplateArguments();
                    }
                    List<Expression> args;
                    if (parser.check(LBRACE)) {
                        args = parser.exprParser.parseInitList().getElements();
                    } else {
                        parser.expect(LPAREN, "Expected '(' in member initializer");
                        args = parser.exprParser.parseArguments();
                    }
                    inits.add(new MemberInitializer(initLoc, member, args));
                } while (parser.match(COMMA));
            }
            CompoundStmt body = parseFunctionBody();
            methods.add(new FunctionDecl(loc, structName, pragmas, FunctionDecl.Kind.CONSTRUCTOR,
                    new BuiltinType(loc, BuiltinType.Kind.VOID, false, false, false),
                    params, body, templateParams, inits, false, false));
            return;
        }

        // 转换运算符 operator int() const
        if (parser.check(KW_OPERATOR) && isConversionOperator()) {
            parser.advance();
            TypeRef target = parser.typeParser.parseType();
            List<ParamDecl> params = parseParameters();
            boolean constMethod = parser.match(KW_CONST);
            CompoundStmt body = parseFunctionBody();
            methods.add(new FunctionDecl(loc, "operator " + target.getSpelling(), pragmas,
                    FunctionDecl.Kind.CONVERSION, target, params, body, templateParams,
                    Collections.emptyList(), false, constMethod));
            return;
        }

        TypeRef type = parser.typeParser.parseType();
        String name;
        if (parser.match(KW_OPERATOR)) {
            name = "operator" + parseOperatorSymbol();
        } else {
            name = parser.expect(IDENTIFIER, "Expected member name").getLexeme();
        }

        if (parser.check(LPAREN)) {
            List<ParamDecl> params = parseParameters();
            boolean constMethod = parser.match(KW_CONST);
            CompoundStmt body = parseFunctionBody();
            methods.add(new FunctionDecl(loc, name, pragmas, FunctionDecl.Kind.METHOD, type, params, body,
                    templateParams, Collections.emptyList(), isStatic, constMethod));
            return;
        }

        // 字段（可含多个声明符）
        while (true) {
            List<Expression> dims = parseArrayDimensions();
            Expression init = null;
            if (parser.match(ASSIGN)) {
                init = parser.check(LBRACE) ? parser.exprParser.parseInitList() : parser.exprParser.parseExpression();
            } else if (parser.check(LBRACE)) {
                init = parser.exprParser.parseInitList();
            }
            fields.add(new FieldDecl(loc, name, type, dims, init, isStatic));
            if (!parser.match(COMMA)) {
                break;
            }
            TypeRef next = type;
            if (parser.match(AMP)) {
                next = type.withQualifiers(type.isConst(), true);
            }
            loc = parser.location();
            name = parser.expect(IDENTIFIER, "Expected member name").getLexeme();
            type = next;
        }
        parser.expect(SEMICOLON, "Expected ';' after member declaration");
    }

    private boolean isConversionOperator() {
        int mark = parser.mark();
        try {
            parser.advance();
            return parser.typeParser.isTypeStart();
        } finally {
            parser.reset(mark);
        }
    }

    /**
     * operator 关键字之后的运算符拼写，如 "+", "+=", "()", "[]"
     */
    String parseOperatorSymbol() {
        Token t = parser.current();
        if (t.is(LPAREN) && parser.peek(1).is(RPAREN)) {
            parser.advance();
            parser.advance();
            return "()";
        }
        if (t.is(LBRACKET) && parser.peek(1).is(RBRACKET)) {
            parser.advance();
            parser.advance();
            return "[]";
        }
        switch (t.getType()) {
            case PLUS: case MINUS: case STAR: case SLASH: case PERCENT:
            case AMP: case PIPE: case CARET: case TILDE: case BANG:
            case AND_AND: case OR_OR: case EQ: case NE: case LT: case LE: case GT: case GE:
            case SHL: case SHR: case INC: case DEC: case ASSIGN:
            case PLUS_ASSIGN: case MINUS_ASSIGN: case STAR_ASSIGN: case SLASH_ASSIGN:
            case PERCENT_ASSIGN: case AMP_ASSIGN: case PIPE_ASSIGN: case CARET_ASSIGN:
            case SHL_ASSIGN: case SHR_ASSIGN:
                parser.advance();
                return t.getLexeme();
            default:
                throw parser.error("Expected operator symbol after 'operator'");
        }
    }

    // ============ 函数 / 全局变量 ============

    private void parseFunctionOrVariable(List<Declaration> out, SourceLocation loc,
                                         List<TemplateParameter> templateParams) {
        boolean isStatic = false;
        while (true) {
            if (parser.match(KW_STATIC)) {
                isStatic = true;
            } else if (parser.match(KW_INLINE)) {
                continue;
            } else if (parser.check(IDENTIFIER) && "extern".equals(parser.current().getLexeme())) {
                parser.advance();
            } else {
                break;
            }
        }
        List<Pragma> pragmas = parser.takePendingPragmas();
        TypeRef type = parser.typeParser.parseType();

        int nameMark = parser.mark();
        String name;
        if (parser.match(KW_OPERATOR)) {
            name = "operator" + parseOperatorSymbol();
        } else {
            QualifiedName qualified = parser.typeParser.parseQualifiedName();
            if (qualified.isQualified()) {
                throw new ParseException("Out-of-line member definitions are not supported", parser.previous());
            }
            name = qualified.getSimpleName();
        }

        if (parser.check(LPAREN)) {
            if (!templateParams.isEmpty()) {
                parser.registerTemplateName(name);
            }
            List<ParamDecl> params = parseParameters();
            CompoundStmt body = parseFunctionBody();
            out.add(new FunctionDecl(loc, name, pragmas, FunctionDecl.Kind.FUNCTION, type, params, body,
                    templateParams, Collections.emptyList(), isStatic, false));
            return;
        }

        if (!templateParams.isEmpty()) {
            throw parser.error("Variable templates are not supported");
        }
        parser.reset(nameMark);
        do {
            VarDecl var = parser.stmtParser.parseDeclarator(type, isStatic);
            out.add(new GlobalVarDecl(var.getLocation(), var));
        } while (parser.match(COMMA));
        parser.expect(SEMICOLON, "Expected ';' after variable declaration");
    }

    /** 解析形参列表（含括号） */
    List<ParamDecl> parseParameters() {
        parser.expect(LPAREN, "Expected '('");
        List<ParamDecl> params = new ArrayList<>();
        if (parser.match(RPAREN)) {
            return params;
        }
        if (parser.check(KW_VOID) && parser.peek(1).is(RPAREN)) {
            parser.advance();
            parser.advance();
            return params;
        }
        do {
            SourceLocation loc = parser.location();
            TypeRef type = parser.typeParser.parseType();
            String name = null;
            if (parser.check(IDENTIFIER)) {
                name = parser.advance().getLexeme();
            }
            List<Expression> dims = parseArrayDimensions();
            Expression defaultValue = null;
            if (parser.match(ASSIGN)) {
                defaultValue = parser.exprParser.parseExpression();
            }
            params.add(new ParamDecl(loc, name, type, dims, defaultValue));
        } while (parser.match(COMMA));
        parser.expect(RPAREN, "Expected ')' after parameters");
        return params;
    }

    /** 函数体，或仅声明时的 ';'（以及 = default） */
    private CompoundStmt parseFunctionBody() {
        if (parser.match(SEMICOLON)) {
            return null;
        }
        if (parser.match(ASSIGN)) {
            Token t = parser.advance();
            if (!t.is(KW_DEFAULT)) {
                throw new ParseException("Only '= default' is supported", t);
            }
            parser.expect(SEMICOLON, "Expected ';' after '= default'");
            return new CompoundStmt(parser.location(t), new ArrayList<>());
        }
        return parser.stmtParser.parseCompound();
    }

    /** 数组维度 [N][M]，空维度 [] 以 null 表示 */
    List<Expression> parseArrayDimensions() {
        List<Expression> dims = new ArrayList<>();
        while (parser.match(LBRACKET)) {
            if (parser.match(RBRACKET)) {
                dims.add(null);
                continue;
            }
            dims.add(parser.exprParser.parseExpression());
            parser.expect(RBRACKET, "Expected ']'");
        }
        return dims;
    }
}
