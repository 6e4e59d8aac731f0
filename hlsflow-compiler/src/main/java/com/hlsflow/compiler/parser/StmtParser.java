package com.hlsflow.compiler.parser;

import com.hlsflow.compiler.ast.Pragma;
import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.decl.StructDecl;
import com.hlsflow.compiler.ast.decl.TypedefDecl;
import com.hlsflow.compiler.ast.expr.Expression;
import com.hlsflow.compiler.ast.stmt.*;
import com.hlsflow.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.hlsflow.compiler.lexer.TokenType.*;

/**
 * 语句解析器
 */
class StmtParser {

    private final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析单条语句
     */
    Statement parseStatement() {
        while (parser.check(PRAGMA)) {
            parser.addPendingPragma(parser.advance());
        }
        SourceLocation loc = parser.location();
        switch (parser.current().getType()) {
            case LBRACE:
                dropPragmas();
                return parseCompound();
            case KW_IF:
                dropPragmas();
                return parseIf();
            case KW_SWITCH:
                dropPragmas();
                return parseSwitch();
            case KW_FOR:
                return parseFor();
            case KW_WHILE:
                dropPragmas();
                return parseWhile();
            case KW_DO:
                dropPragmas();
                return parseDoWhile();
            case KW_RETURN: {
                parser.advance();
                Expression value = null;
                if (!parser.check(SEMICOLON)) {
                    value = parser.exprParser.parseExpression();
                }
                parser.expect(SEMICOLON, "Expected ';' after return");
                return new ReturnStmt(loc, value);
            }
            case KW_BREAK:
                parser.advance();
                parser.expect(SEMICOLON, "Expected ';' after break");
                return new BreakStmt(loc);
            case KW_CONTINUE:
                parser.advance();
                parser.expect(SEMICOLON, "Expected ';' after continue");
                return new ContinueStmt(loc);
            case SEMICOLON:
                parser.advance();
                return new EmptyStmt(loc);
            case KW_STRUCT:
            case KW_CLASS: {
                List<Pragma> pragmas = parser.takePendingPragmas();
                StructDecl decl = parser.declParser.parseStruct(pragmas, Collections.emptyList());
                // struct { ... } s; 之类带声明符的写法同样视为类型声明
                while (!parser.check(SEMICOLON) && !parser.isAtEnd()) {
                    parser.advance();
                }
                parser.expect(SEMICOLON, "Expected ';' after struct declaration");
                return new TypeDeclStmt(loc, decl);
            }
            case KW_TYPEDEF: {
                dropPragmas();
                TypedefDecl decl = parser.declParser.parseTypedef(new ArrayList<>());
                return new TypeDeclStmt(loc, decl);
            }
            default:
                break;
        }

        dropPragmas();
        if (isDeclarationStart()) {
            DeclStmt decl = parseDeclStmt();
            parser.expect(SEMICOLON, "Expected ';' after declaration");
            return decl;
        }

        Expression expr = parser.exprParser.parseExpression();
        parser.expect(SEMICOLON, "Expected ';' after expression");
        return new ExprStmt(loc, expr);
    }

    /** 非 for 语句前的 pragma 不产生语义 */
    private void dropPragmas() {
        parser.takePendingPragmas();
    }

    CompoundStmt parseCompound() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACE, "Expected '{'");
        List<Statement> statements = new ArrayList<>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            statements.add(parseStatement());
        }
        parser.expect(RBRACE, "Expected '}'");
        return new CompoundStmt(loc, statements);
    }

    private Statement parseIf() {
        SourceLocation loc = parser.location();
        parser.expect(KW_IF, "Expected 'if'");
        parser.expect(LPAREN, "Expected '(' after 'if'");
        Expression condition = parser.exprParser.parseExpression();
        parser.expect(RPAREN, "Expected ')' after if condition");
        Statement thenBranch = parseStatement();
        Statement elseBranch = null;
        if (parser.match(KW_ELSE)) {
            elseBranch = parseStatement();
        }
        return new IfStmt(loc, condition, thenBranch, elseBranch);
    }

    private Statement parseSwitch() {
        SourceLocation loc = parser.location();
        parser.expect(KW_SWITCH, "Expected 'switch'");
        parser.expect(LPAREN, "Expected '(' after 'switch'");
        Expression scrutinee = parser.exprParser.parseExpression();
        parser.expect(RPAREN, "Expected ')' after switch value");
        parser.expect(LBRACE, "Expected '{' after switch");

        List<SwitchSection> sections = new ArrayList<>();
        SourceLocation sectionLoc = null;
        List<Expression> labels = new ArrayList<>();
        boolean hasDefault = false;
        List<Statement> statements = new ArrayList<>();

        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            if (parser.checkAny(KW_CASE, KW_DEFAULT)) {
                if (!statements.isEmpty()) {
                    sections.add(new SwitchSection(sectionLoc, labels, hasDefault, statements));
                    labels = new ArrayList<>();
                    hasDefault = false;
                    statements = new ArrayList<>();
                }
                if (sectionLoc == null || labels.isEmpty() && !hasDefault) {
                    sectionLoc = parser.location();
                }
                if (parser.match(KW_CASE)) {
                    labels.add(parser.exprParser.parseExpression());
                } else {
                    parser.advance();
                    hasDefault = true;
                }
                parser.expect(COLON, "Expected ':' after case label");
            } else {
                if (labels.isEmpty() && !hasDefault) {
                    throw parser.error("Statement before first case label in switch");
                }
                statements.add(parseStatement());
            }
        }
        parser.expect(RBRACE, "Expected '}' after switch body");
        if (!labels.isEmpty() || hasDefault) {
            sections.add(new SwitchSection(sectionLoc, labels, hasDefault, statements));
        }
        return new SwitchStmt(loc, scrutinee, sections);
    }

    private Statement parseFor() {
        List<Pragma> pragmas = parser.takePendingPragmas();
        SourceLocation loc = parser.location();
        parser.expect(KW_FOR, "Expected 'for'");
        parser.expect(LPAREN, "Expected '(' after 'for'");

        Statement initializer = null;
        if (!parser.match(SEMICOLON)) {
            SourceLocation initLoc = parser.location();
            if (isDeclarationStart()) {
                initializer = parseDeclStmt();
            } else {
                initializer = new ExprStmt(initLoc, parser.exprParser.parseExpression());
            }
            parser.expect(SEMICOLON, "Expected ';' after for initializer");
        }

        Expression condition = null;
        if (!parser.check(SEMICOLON)) {
            condition = parser.exprParser.parseExpression();
        }
        parser.expect(SEMICOLON, "Expected ';' after for condition");

        Expression update = null;
        if (!parser.check(RPAREN)) {
            update = parser.exprParser.parseExpression();
        }
        parser.expect(RPAREN, "Expected ')' after for clauses");

        Statement body = parseStatement();
        return new ForStmt(loc, pragmas, initializer, condition, update, body);
    }

    private Statement parseWhile() {
        SourceLocation loc = parser.location();
        parser.expect(KW_WHILE, "Expected 'while'");
        parser.expect(LPAREN, "Expected '(' after 'while'");
        Expression condition = parser.exprParser.parseExpression();
        parser.expect(RPAREN, "Expected ')' after while condition");
        Statement body = parseStatement();
        return new WhileStmt(loc, condition, body, false);
    }

    private Statement parseDoWhile() {
        SourceLocation loc = parser.location();
        parser.expect(KW_DO, "Expected 'do'");
        Statement body = parseStatement();
        parser.expect(KW_WHILE, "Expected 'while' after do body");
        parser.expect(LPAREN, "Expected '(' after 'while'");
        Expression condition = parser.exprParser.parseExpression();
        parser.expect(RPAREN, "Expected ')' after while condition");
        parser.expect(SEMICOLON, "Expected ';' after do-while");
        return new WhileStmt(loc, condition, body, true);
    }

    // ============ 声明语句 ============

    /**
     * 当前是否为变量声明：修饰符、内置类型，或已知类型名后跟标识符
     */
    boolean isDeclarationStart() {
        if (parser.checkAny(KW_STATIC, KW_CONST, KW_CONSTEXPR, KW_VOLATILE)) {
            return true;
        }
        if (TypeParser.isBuiltinTypeKeyword(parser.current().getType())) {
            return !parser.peek(1).is(LPAREN);
        }
        if (!parser.typeParser.isTypeStart()) {
            return false;
        }
        int mark = parser.mark();
        try {
            parser.typeParser.parseType();
            return parser.check(IDENTIFIER);
        } catch (ParseException e) {
            return false;
        } finally {
            parser.reset(mark);
        }
    }

    /**
     * 解析声明语句（不含结尾分号）
     */
    DeclStmt parseDeclStmt() {
        SourceLocation loc = parser.location();
        boolean isStatic = false;
        while (parser.checkAny(KW_STATIC, KW_INLINE)) {
            if (parser.advance().is(KW_STATIC)) {
                isStatic = true;
            }
        }
        TypeRef baseType = parser.typeParser.parseType();
        List<VarDecl> variables = new ArrayList<>();
        do {
            variables.add(parseDeclarator(baseType, isStatic));
        } while (parser.match(COMMA));
        return new DeclStmt(loc, variables);
    }

    /**
     * 解析单个声明符，逗号后的声明符可以带自己的 '&amp;'
     */
    VarDecl parseDeclarator(TypeRef baseType, boolean isStatic) {
        TypeRef type = baseType;
        if (parser.match(AMP)) {
            type = baseType.withQualifiers(baseType.isConst(), true);
        } else if (parser.check(STAR)) {
            throw parser.error("Pointer types are not supported");
        }
        SourceLocation loc = parser.location();
        String name = parser.expect(IDENTIFIER, "Expected variable name").getLexeme();
        List<Expression> dims = parser.declParser.parseArrayDimensions();

        Expression initializer = null;
        List<Expression> ctorArgs = null;
        if (parser.match(ASSIGN)) {
            if (parser.check(LBRACE)) {
                initializer = parser.exprParser.parseInitList();
            } else {
                initializer = parser.exprParser.parseExpression();
            }
        } else if (parser.check(LBRACE)) {
            initializer = parser.exprParser.parseInitList();
        } else if (parser.match(LPAREN)) {
            ctorArgs = parser.exprParser.parseArguments();
        }
        return new VarDecl(loc, name, type, dims, initializer, ctorArgs, isStatic);
    }
}
