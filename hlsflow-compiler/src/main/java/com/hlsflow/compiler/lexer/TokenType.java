package com.hlsflow.compiler.lexer;

/**
 * C++ 子集词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL,
    CHAR_LITERAL,
    STRING_LITERAL,

    // === 标识符 ===
    IDENTIFIER,

    // === 预处理 ===
    PRAGMA,                 // #pragma ...

    // === 关键词 - 内置类型 ===
    KW_VOID, KW_BOOL, KW_CHAR, KW_SHORT, KW_INT, KW_LONG,
    KW_SIGNED, KW_UNSIGNED, KW_AUTO,

    // === 关键词 - 声明 ===
    KW_STRUCT, KW_CLASS, KW_TYPEDEF, KW_USING, KW_NAMESPACE,
    KW_TEMPLATE, KW_TYPENAME, KW_OPERATOR, KW_ENUM, KW_UNION,

    // === 关键词 - 修饰符 ===
    KW_CONST, KW_CONSTEXPR, KW_STATIC, KW_INLINE, KW_VIRTUAL,
    KW_PUBLIC, KW_PRIVATE, KW_PROTECTED, KW_VOLATILE,

    // === 关键词 - 控制流 ===
    KW_IF, KW_ELSE, KW_SWITCH, KW_CASE, KW_DEFAULT,
    KW_FOR, KW_WHILE, KW_DO, KW_RETURN, KW_BREAK, KW_CONTINUE,

    // === 关键词 - 其他 ===
    KW_THIS, KW_TRUE, KW_FALSE, KW_STATIC_CAST, KW_SIZEOF,

    // === 分隔符 ===
    LPAREN,                 // (
    RPAREN,                 // )
    LBRACE,                 // {
    RBRACE,                 // }
    LBRACKET,               // [
    RBRACKET,               // ]
    COMMA,                  // ,
    SEMICOLON,              // ;
    COLON,                  // :
    DOUBLE_COLON,           // ::
    DOT,                    // .
    ARROW,                  // ->
    QUESTION,               // ?

    // === 运算符 ===
    PLUS,                   // +
    MINUS,                  // -
    STAR,                   // *
    SLASH,                  // /
    PERCENT,                // %
    AMP,                    // &
    PIPE,                   // |
    CARET,                  // ^
    TILDE,                  // ~
    BANG,                   // !
    AND_AND,                // &&
    OR_OR,                  // ||
    EQ,                     // ==
    NE,                     // !=
    LT,                     // <
    LE,                     // <=
    GT,                     // >
    GE,                     // >=
    SHL,                    // <<
    SHR,                    // >>
    INC,                    // ++
    DEC,                    // --

    // === 赋值 ===
    ASSIGN,                 // =
    PLUS_ASSIGN,            // +=
    MINUS_ASSIGN,           // -=
    STAR_ASSIGN,            // *=
    SLASH_ASSIGN,           // /=
    PERCENT_ASSIGN,         // %=
    AMP_ASSIGN,             // &=
    PIPE_ASSIGN,            // |=
    CARET_ASSIGN,           // ^=
    SHL_ASSIGN,             // <<=
    SHR_ASSIGN,             // >>=

    // === 特殊 ===
    ERROR,                  // 词法错误，lexeme 为错误描述
    EOF
}
