package com.sheetlex.formula.lexer;

/**
 * Sub-context the scanner is in. At most one is active at a time.
 */
enum ScanState {
    NORMAL,
    /** Inside a double-quoted text literal. */
    IN_STRING,
    /** Inside a single-quoted sheet name. */
    IN_PATH,
    /** Inside {@code [...]}, e.g. an external workbook or table column. */
    IN_BRACKET_RANGE,
    /** Reading an error literal that starts with {@code #}. */
    IN_ERROR
}
