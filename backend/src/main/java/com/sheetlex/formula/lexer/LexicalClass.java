package com.sheetlex.formula.lexer;

/**
 * Lexical class of a single character seen outside any quoted, bracketed or
 * error context. The scanner dispatches on this instead of on raw characters.
 */
enum LexicalClass {
    OPEN_PAREN,
    CLOSE_PAREN,
    OPEN_BRACE,
    CLOSE_BRACE,
    OPEN_BRACKET,
    HASH,
    COMMA,
    COLON,
    SEMICOLON,
    DOUBLE_QUOTE,
    SINGLE_QUOTE,
    INFIX_OPERATOR,
    PERCENT,
    SPACE,
    OTHER;

    static LexicalClass of(int codePoint) {
        return switch (codePoint) {
            case '(' -> OPEN_PAREN;
            case ')' -> CLOSE_PAREN;
            case '{' -> OPEN_BRACE;
            case '}' -> CLOSE_BRACE;
            case '[' -> OPEN_BRACKET;
            case '#' -> HASH;
            case ',' -> COMMA;
            case ':' -> COLON;
            case ';' -> SEMICOLON;
            case '"' -> DOUBLE_QUOTE;
            case '\'' -> SINGLE_QUOTE;
            case '+', '-', '*', '/', '^', '&', '=', '>', '<' -> INFIX_OPERATOR;
            case '%' -> PERCENT;
            case ' ' -> SPACE;
            default -> OTHER;
        };
    }
}
