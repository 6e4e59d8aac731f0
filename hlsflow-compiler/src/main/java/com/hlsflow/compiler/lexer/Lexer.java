package com.hlsflow.compiler.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * C++ 子集词法分析器
 *
 * <p>注释在此阶段被丢弃，因此注释中的 {@code #pragma} 不会产生 PRAGMA token。
 * 除 {@code #pragma} 以外的预处理行（如 {@code #include}）整行跳过。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    /** 当前行是否只出现过空白（预处理指令只能出现在行首） */
    private boolean lineStart = true;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 内置类型
        map.put("void", TokenType.KW_VOID);
        map.put("bool", TokenType.KW_BOOL);
        map.put("char", TokenType.KW_CHAR);
        map.put("short", TokenType.KW_SHORT);
        map.put("int", TokenType.KW_INT);
        map.put("long", TokenType.KW_LONG);
        map.put("signed", TokenType.KW_SIGNED);
        map.put("unsigned", TokenType.KW_UNSIGNED);
        map.put("auto", TokenType.KW_AUTO);

        // 声明
        map.put("struct", TokenType.KW_STRUCT);
        map.put("class", TokenType.KW_CLASS);
        map.put("typedef", TokenType.KW_TYPEDEF);
        map.put("using", TokenType.KW_USING);
        map.put("namespace", TokenType.KW_NAMESPACE);
        map.put("template", TokenType.KW_TEMPLATE);
        map.put("typename", TokenType.KW_TYPENAME);
        map.put("operator", TokenType.KW_OPERATOR);
        map.put("enum", TokenType.KW_ENUM);
        map.put("union", TokenType.KW_UNION);

        // 修饰符
        map.put("const", TokenType.KW_CONST);
        map.put("constexpr", TokenType.KW_CONSTEXPR);
        map.put("static", TokenType.KW_STATIC);
        map.put("inline", TokenType.KW_INLINE);
        map.put("virtual", TokenType.KW_VIRTUAL);
        map.put("public", TokenType.KW_PUBLIC);
        map.put("private", TokenType.KW_PRIVATE);
        map.put("protected", TokenType.KW_PROTECTED);
        map.put("volatile", TokenType.KW_VOLATILE);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("switch", TokenType.KW_SWITCH);
        map.put("case", TokenType.KW_CASE);
        map.put("default", TokenType.KW_DEFAULT);
        map.put("for", TokenType.KW_FOR);
        map.put("while", TokenType.KW_WHILE);
        map.put("do", TokenType.KW_DO);
        map.put("return", TokenType.KW_RETURN);
        map.put("break", TokenType.KW_BREAK);
        map.put("continue", TokenType.KW_CONTINUE);

        // 其他
        map.put("this", TokenType.KW_THIS);
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);
        map.put("static_cast", TokenType.KW_STATIC_CAST);
        map.put("sizeof", TokenType.KW_SIZEOF);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }

        tokens.add(new Token(TokenType.EOF, "", null, line, column, current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '?': addToken(TokenType.QUESTION); break;
            case '~': addToken(TokenType.TILDE); break;
            case '.': addToken(TokenType.DOT); break;

            case '#':
                if (lineStart) {
                    directive();
                } else {
                    error("Unexpected character: #");
                }
                return;

            case ':':
                addToken(match(':') ? TokenType.DOUBLE_COLON : TokenType.COLON);
                break;

            case '+':
                if (match('+')) addToken(TokenType.INC);
                else if (match('=')) addToken(TokenType.PLUS_ASSIGN);
                else addToken(TokenType.PLUS);
                break;

            case '-':
                if (match('-')) addToken(TokenType.DEC);
                else if (match('=')) addToken(TokenType.MINUS_ASSIGN);
                else if (match('>')) addToken(TokenType.ARROW);
                else addToken(TokenType.MINUS);
                break;

            case '*':
                addToken(match('=') ? TokenType.STAR_ASSIGN : TokenType.STAR);
                break;

            case '/':
                if (match('/')) {
                    // 单行注释
                    while (peek() != '\n' && !isAtEnd()) advance();
                    return;
                } else if (match('*')) {
                    blockComment();
                    return;
                } else if (match('=')) {
                    addToken(TokenType.SLASH_ASSIGN);
                } else {
                    addToken(TokenType.SLASH);
                }
                break;

            case '%':
                addToken(match('=') ? TokenType.PERCENT_ASSIGN : TokenType.PERCENT);
                break;

            case '^':
                addToken(match('=') ? TokenType.CARET_ASSIGN : TokenType.CARET);
                break;

            case '=':
                addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
                break;

            case '!':
                addToken(match('=') ? TokenType.NE : TokenType.BANG);
                break;

            case '<':
                if (match('<')) {
                    addToken(match('=') ? TokenType.SHL_ASSIGN : TokenType.SHL);
                } else {
                    addToken(match('=') ? TokenType.LE : TokenType.LT);
                }
                break;

            case '>':
                if (match('>')) {
                    addToken(match('=') ? TokenType.SHR_ASSIGN : TokenType.SHR);
                } else {
                    addToken(match('=') ? TokenType.GE : TokenType.GT);
                }
                break;

            case '&':
                if (match('&')) addToken(TokenType.AND_AND);
                else if (match('=')) addToken(TokenType.AMP_ASSIGN);
                else addToken(TokenType.AMP);
                break;

            case '|':
                if (match('|')) addToken(TokenType.OR_OR);
                else if (match('=')) addToken(TokenType.PIPE_ASSIGN);
                else addToken(TokenType.PIPE);
                break;

            // 空白字符
            case ' ':
            case '\r':
            case '\t':
            case '\f':
                return;

            case '\n':
                newLine();
                return;

            case '"':
                string();
                break;

            case '\'':
                character();
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
        lineStart = false;
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
        lineStart = true;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        int tokenColumn = column - (current - start);
        tokens.add(new Token(type, lexeme, literal, line, tokenColumn, start));
    }

    private void error(String message) {
        int tokenColumn = column - (current - start);
        tokens.add(new Token(TokenType.ERROR, message, null, line, tokenColumn, start));
    }

    // === 复杂 Token 扫描 ===

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            if (advance() == '\n') {
                line++;
                column = 1;
            }
        }
        error("Unterminated block comment");
    }

    /**
     * 预处理指令：读取到行尾（支持反斜杠续行）。
     * 只保留 #pragma，其他指令丢弃。
     */
    private void directive() {
        StringBuilder text = new StringBuilder();
        while (!isAtEnd() && peek() != '\n') {
            char c = advance();
            if (c == '\\' && peek() == '\n') {
                advance();
                line++;
                column = 1;
                text.append(' ');
                continue;
            }
            if (c == '/' && peek() == '/') {
                while (!isAtEnd() && peek() != '\n') advance();
                break;
            }
            text.append(c);
        }
        String body = text.toString().trim();
        if (body.startsWith("pragma")) {
            String pragma = body.substring("pragma".length()).trim();
            addToken(TokenType.PRAGMA, pragma);
        }
    }

    private void string() {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\n') {
                error("Unterminated string");
                return;
            }
            if (peek() == '\\') {
                advance();
                value.append(escapeChar());
            } else {
                value.append(advance());
            }
        }
        if (isAtEnd()) {
            error("Unterminated string");
            return;
        }
        advance(); // 闭合的 "
        addToken(TokenType.STRING_LITERAL, value.toString());
    }

    private void character() {
        if (isAtEnd() || peek() == '\'') {
            error("Empty character literal");
            return;
        }
        char value;
        if (peek() == '\\') {
            advance();
            value = escapeChar();
        } else {
            value = advance();
        }
        if (!match('\'')) {
            error("Unterminated character literal");
            return;
        }
        addToken(TokenType.CHAR_LITERAL, (long) value);
    }

    private char escapeChar() {
        char c = advance();
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            case '0': return '\0';
            case 'a': return (char) 7;
            case 'b': return '\b';
            case 'f': return '\f';
            case 'v': return (char) 11;
            case '\\': return '\\';
            case '\'': return '\'';
            case '"': return '"';
            case 'x': {
                int value = 0;
                while (isHexDigit(peek())) {
                    value = value * 16 + Character.digit(advance(), 16);
                }
                return (char) (value & 0xFF);
            }
            default: return c;
        }
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    /**
     * 整数字面量：十进制、0x、0b、八进制，以及 u/l/ll 后缀。
     * literal 为 64 位补码值，后缀由解析器从 lexeme 读取。
     */
    private void number() {
        int radix = 10;
        int digitsStart = start;
        if (source.charAt(start) == '0' && (peek() == 'x' || peek() == 'X')) {
            advance();
            radix = 16;
            digitsStart = current;
            while (isHexDigit(peek()) || peek() == '\'') advance();
        } else if (source.charAt(start) == '0' && (peek() == 'b' || peek() == 'B')) {
            advance();
            radix = 2;
            digitsStart = current;
            while (peek() == '0' || peek() == '1' || peek() == '\'') advance();
        } else {
            while (isDigit(peek()) || peek() == '\'') advance();
            if (source.charAt(start) == '0' && current - start > 1) {
                radix = 8;
                digitsStart = start + 1;
            }
        }
        String digits = source.substring(digitsStart, current).replace("'", "");

        // 后缀
        while (peek() == 'u' || peek() == 'U' || peek() == 'l' || peek() == 'L') {
            advance();
        }
        if (isAlphaNumeric(peek())) {
            while (isAlphaNumeric(peek())) advance();
            error("Invalid integer literal: " + source.substring(start, current));
            return;
        }
        if (digits.isEmpty()) {
            addToken(TokenType.INT_LITERAL, 0L);
            return;
        }
        try {
            addToken(TokenType.INT_LITERAL, Long.parseUnsignedLong(digits, radix));
        } catch (NumberFormatException e) {
            error("Integer literal out of range: " + source.substring(start, current));
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) {
            type = TokenType.IDENTIFIER;
        }
        addToken(type);
    }
}
