package com.hlsflow.compiler.parser;

import com.hlsflow.compiler.ast.Pragma;
import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.decl.Declaration;
import com.hlsflow.compiler.ast.decl.TranslationUnit;
import com.hlsflow.compiler.ast.type.BuiltinNames;
import com.hlsflow.compiler.lexer.Lexer;
import com.hlsflow.compiler.lexer.Token;
import com.hlsflow.compiler.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.hlsflow.compiler.lexer.TokenType.*;

/**
 * C++ 子集语法分析器（递归下降）
 *
 * <p>C++ 的语法依赖名字的种类（a &lt; b 可能是比较也可能是模板实参），
 * 因此解析器维护已声明的类型名与模板名集合。</p>
 */
public class Parser {

    final String fileName;
    private final List<Token> tokens;
    private int position;

    // === 名字登记 ===
    private final Set<String> typeNames = new HashSet<>();
    private final Set<String> templateNames = new HashSet<>();
    /** 当前模板形参作用域（嵌套模板时逐层压栈） */
    private final Deque<Set<String>> templateScopes = new ArrayDeque<>();
    /** 当前所在命名空间路径 */
    final Deque<String> namespaces = new ArrayDeque<>();

    /** 尚未附着的 #pragma */
    private final List<Pragma> pendingPragmas = new ArrayList<>();

    // === Helper 实例 ===
    final TypeParser typeParser = new TypeParser(this);
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer) {
        this.fileName = lexer.getFileName();
        this.tokens = new ArrayList<>(lexer.scanTokens());
        this.position = 0;
        typeNames.addAll(BuiltinNames.FIXED_WIDTH_ALIASES.keySet());
        typeNames.add(BuiltinNames.CHANNEL);
        templateNames.add(BuiltinNames.CHANNEL);
    }

    public Parser(String source, String fileName) {
        this(new Lexer(source, fileName));
    }

    /**
     * 解析整个翻译单元
     */
    public TranslationUnit parse() {
        for (Token t : tokens) {
            if (t.is(ERROR)) {
                throw new ParseException(t.getLexeme(), t);
            }
        }
        SourceLocation loc = location();
        List<Declaration> declarations = new ArrayList<>();
        while (!isAtEnd()) {
            declParser.parseTopLevel(declarations);
        }
        return new TranslationUnit(loc, fileName, declarations);
    }

    // ============ 基础方法 ============

    Token current() {
        return tokens.get(position);
    }

    Token peek(int offset) {
        int index = Math.min(position + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    Token previous() {
        return tokens.get(Math.max(0, position - 1));
    }

    Token advance() {
        Token t = tokens.get(position);
        if (!t.is(EOF)) {
            position++;
        }
        return t;
    }

    boolean isAtEnd() {
        return current().is(EOF);
    }

    boolean check(TokenType type) {
        return current().is(type);
    }

    boolean checkAny(TokenType... types) {
        return current().isOneOf(types);
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current());
    }

    /**
     * 期望模板实参列表的闭合 '&gt;'，必要时把 '&gt;&gt;' 拆为两个 '&gt;'
     */
    void expectCloseAngle() {
        if (match(GT)) {
            return;
        }
        if (check(SHR)) {
            Token t = current();
            tokens.set(position, t.withType(GT, ">", 1));
            return;
        }
        throw new ParseException("Expected '>' to close template argument list", current());
    }

    ParseException error(String message) {
        return new ParseException(message, current());
    }

    SourceLocation location() {
        return location(current());
    }

    SourceLocation location(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn());
    }

    // ============ 回溯 ============

    int mark() {
        return position;
    }

    void reset(int mark) {
        position = mark;
    }

    // ============ pragma ============

    void addPendingPragma(Token token) {
        String text = String.valueOf(token.getLiteral());
        List<String> words = new ArrayList<>(Arrays.asList(text.trim().split("\\s+")));
        if (words.isEmpty() || words.get(0).isEmpty()) {
            return;
        }
        String name = words.remove(0);
        pendingPragmas.add(new Pragma(name, Collections.unmodifiableList(words), location(token)));
    }

    /** 取走所有待附着的 pragma */
    List<Pragma> takePendingPragmas() {
        if (pendingPragmas.isEmpty()) {
            return Collections.emptyList();
        }
        List<Pragma> result = new ArrayList<>(pendingPragmas);
        pendingPragmas.clear();
        return result;
    }

    // ============ 名字登记 ============

    void registerTypeName(String name) {
        typeNames.add(name);
        String prefix = namespacePrefix();
        if (!prefix.isEmpty()) {
            typeNames.add(prefix + name);
        }
    }

    void registerTemplateName(String name) {
        templateNames.add(name);
        String prefix = namespacePrefix();
        if (!prefix.isEmpty()) {
            templateNames.add(prefix + name);
        }
    }

    boolean isTypeName(String name) {
        for (Set<String> scope : templateScopes) {
            if (scope.contains(name)) {
                return true;
            }
        }
        return typeNames.contains(name);
    }

    boolean isTemplateName(String name) {
        return templateNames.contains(name);
    }

    void pushTemplateScope(Set<String> typeParameterNames) {
        templateScopes.push(typeParameterNames);
    }

    void popTemplateScope() {
        templateScopes.pop();
    }

    String namespacePrefix() {
        if (namespaces.isEmpty()) {
            return "";
        }
        List<String> parts = new ArrayList<>(namespaces);
        Collections.reverse(parts);
        return String.join("::", parts) + "::";
    }
}
