package com.sheetlex.formula.lexer;

import com.sheetlex.formula.dto.FormulaToken;
import com.sheetlex.formula.dto.FormulaToken.TokenSubType;
import com.sheetlex.formula.dto.FormulaToken.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import static com.sheetlex.formula.dto.FormulaToken.ARRAY;
import static com.sheetlex.formula.dto.FormulaToken.ARRAY_ROW;

/**
 * Single-pass scanner that turns spreadsheet formula text into a flat list of
 * {@link FormulaToken}s.
 * <p>
 * Malformed input is never rejected: unbalanced parentheses, unterminated
 * strings and truncated arrays still produce a best-effort token list.
 * <p>
 * An instance keeps the state of the scan in progress and is reset at the
 * start of every {@link #parse(String)} call. Reusing one instance
 * sequentially is fine; sharing one between threads is not.
 */
public class FormulaTokenizer {

    private static final Logger logger = LoggerFactory.getLogger(FormulaTokenizer.class);

    private static final Set<String> BARE_OPERATORS = Set.of("+", "-", "*", "/");

    private static final Set<String> COMPARISON_OPERATORS = Set.of("<=", ">=", "<>");

    private static final String ERROR_TERMINATORS = "+-*/^&=<>,()";

    private static final Pattern NUMBER_PATTERN = Pattern.compile("(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private final List<FormulaToken> tokens = new ArrayList<>();

    /** Indices into {@link #tokens} of the currently open Start tokens. */
    private final Deque<Integer> scopes = new ArrayDeque<>();

    private final StringBuilder buffer = new StringBuilder();

    private int[] chars = new int[0];
    private int offset;
    private ScanState state = ScanState.NORMAL;

    /**
     * Tokenizes {@code formula}. A single leading {@code =} is ignored.
     *
     * @return whitespace-free, classified tokens; empty for blank input or a
     *         lone {@code + - * /}
     */
    public List<FormulaToken> parse(String formula) {
        String text = stripLeadingEquals(formula);
        if (text.isBlank() || BARE_OPERATORS.contains(text)) {
            return List.of();
        }

        reset(text);

        while (offset < chars.length) {
            scanNext();
        }

        if (state != ScanState.NORMAL) {
            logger.debug("Formula ended inside {} context, keeping '{}' as operand text", state, buffer);
        }
        flushBuffer();

        if (!scopes.isEmpty()) {
            logger.debug("Formula ended with {} unclosed scope(s)", scopes.size());
        }

        return postProcess();
    }

    private static String stripLeadingEquals(String formula) {
        if (formula == null) {
            return "";
        }
        return formula.startsWith("=") ? formula.substring(1) : formula;
    }

    private void reset(String text) {
        tokens.clear();
        scopes.clear();
        buffer.setLength(0);
        chars = text.codePoints().toArray();
        offset = 0;
        state = ScanState.NORMAL;
    }

    private void scanNext() {
        int c = chars[offset];

        switch (state) {
            case IN_STRING -> scanString(c);
            case IN_PATH -> scanPath(c);
            case IN_BRACKET_RANGE -> scanBracketRange(c);
            case IN_ERROR -> scanError();
            case NORMAL -> scanNormal(c);
        }
    }

    private void scanString(int c) {
        if (c == '"') {
            if (peek(1) == '"') {
                buffer.append('"');
                offset += 2;
                return;
            }
            state = ScanState.NORMAL;
            emit(FormulaToken.of(takeBuffer(), TokenType.OPERAND, TokenSubType.TEXT));
        } else {
            buffer.appendCodePoint(c);
        }
        offset++;
    }

    private void scanPath(int c) {
        if (c == '\'') {
            if (peek(1) == '\'') {
                buffer.append('\'');
                offset += 2;
                return;
            }
            // The sheet name stays in the buffer; the reference continues after it.
            buffer.append('\'');
            state = ScanState.NORMAL;
        } else {
            buffer.appendCodePoint(c);
        }
        offset++;
    }

    private void scanBracketRange(int c) {
        buffer.appendCodePoint(c);
        if (c == ']') {
            state = ScanState.NORMAL;
        }
        offset++;
    }

    private void scanError() {
        while (offset < chars.length && !isErrorTerminator(chars[offset])) {
            buffer.appendCodePoint(chars[offset]);
            offset++;
        }
        state = ScanState.NORMAL;
        emit(FormulaToken.of(takeBuffer(), TokenType.OPERAND, TokenSubType.ERROR));
    }

    private static boolean isErrorTerminator(int c) {
        return Character.isWhitespace(c) || ERROR_TERMINATORS.indexOf(c) >= 0;
    }

    private void scanNormal(int c) {
        switch (LexicalClass.of(c)) {
            case OPEN_PAREN -> openParen();
            case CLOSE_PAREN -> closeParen();
            case OPEN_BRACE -> openArray();
            case CLOSE_BRACE -> closeArray();
            case OPEN_BRACKET -> enter(ScanState.IN_BRACKET_RANGE, "[");
            case HASH -> {
                flushBuffer();
                enter(ScanState.IN_ERROR, "#");
            }
            case COMMA -> comma();
            case COLON -> {
                flushBuffer();
                emit(FormulaToken.of(":", TokenType.OPERATOR_INFIX, TokenSubType.RANGE));
                offset++;
            }
            case SEMICOLON -> semicolon();
            case DOUBLE_QUOTE -> {
                flushBuffer();
                enter(ScanState.IN_STRING, "");
            }
            case SINGLE_QUOTE -> enter(ScanState.IN_PATH, "'");
            case INFIX_OPERATOR -> infixOperator(c);
            case PERCENT -> {
                flushBuffer();
                emit(FormulaToken.of("%", TokenType.OPERATOR_POSTFIX));
                offset++;
            }
            case SPACE -> whitespace();
            case OTHER -> {
                buffer.appendCodePoint(c);
                offset++;
            }
        }
    }

    private void enter(ScanState newState, String retained) {
        buffer.append(retained);
        state = newState;
        offset++;
    }

    private void openParen() {
        flushBuffer();

        int previous = tokens.size() - 1;
        if (previous >= 0 && tokens.get(previous).is(TokenType.OPERAND)) {
            // The operand just read is the function name.
            tokens.set(previous, tokens.get(previous).withType(TokenType.FUNCTION, TokenSubType.START));
            scopes.push(previous);
        } else {
            scopes.push(emit(FormulaToken.of("", TokenType.SUBEXPRESSION, TokenSubType.START)));
        }
        offset++;
    }

    private void closeParen() {
        flushBuffer();

        if (scopes.isEmpty()) {
            logger.debug("Unmatched ')' at offset {}", offset);
            emit(FormulaToken.of("", TokenType.SUBEXPRESSION, TokenSubType.STOP));
        } else {
            FormulaToken opener = tokens.get(scopes.pop());
            TokenType closing = opener.is(TokenType.FUNCTION) ? TokenType.FUNCTION : TokenType.SUBEXPRESSION;
            emit(FormulaToken.of("", closing, TokenSubType.STOP));
        }
        offset++;
    }

    private void openArray() {
        flushBuffer();
        scopes.push(emit(FormulaToken.of(ARRAY, TokenType.FUNCTION, TokenSubType.START)));
        offset++;
    }

    private void closeArray() {
        flushBuffer();
        emit(FormulaToken.of(ARRAY, TokenType.FUNCTION, TokenSubType.STOP));

        if (isOpenArrayRow()) {
            scopes.pop();
        }
        if (scopes.isEmpty()) {
            logger.debug("Unmatched '}' at offset {}", offset);
        } else {
            scopes.pop();
        }
        offset++;
    }

    private void comma() {
        flushBuffer();

        if (anyOpenScope(FormulaToken::isArrayMarker)) {
            emit(FormulaToken.of(",", TokenType.OPERATOR_INFIX, TokenSubType.UNION));
        } else if (anyOpenScope(token -> token.is(TokenType.FUNCTION))) {
            emit(FormulaToken.of(",", TokenType.ARGUMENT));
        } else {
            emit(FormulaToken.of(",", TokenType.OPERATOR_INFIX, TokenSubType.UNION));
        }
        offset++;
    }

    private void semicolon() {
        flushBuffer();

        long openArrays = scopes.stream()
                .map(tokens::get)
                .filter(token -> token.is(TokenType.FUNCTION) && ARRAY.equals(token.value()))
                .count();

        if (openArrays == 1) {
            // Row boundary of a top-level array literal.
            if (isOpenArrayRow()) {
                scopes.pop();
            }
            emit(FormulaToken.of(ARRAY_ROW, TokenType.FUNCTION, TokenSubType.STOP));
            emit(FormulaToken.of(";", TokenType.ARGUMENT));
            scopes.push(emit(FormulaToken.of(ARRAY_ROW, TokenType.FUNCTION, TokenSubType.START)));
        } else {
            emit(FormulaToken.of(";", TokenType.ARGUMENT));
        }
        offset++;
    }

    private void infixOperator(int c) {
        flushBuffer();

        int next = peek(1);
        if (next >= 0) {
            String pair = new StringBuilder().appendCodePoint(c).appendCodePoint(next).toString();
            if (COMPARISON_OPERATORS.contains(pair)) {
                emit(FormulaToken.of(pair, TokenType.OPERATOR_INFIX, TokenSubType.LOGICAL));
                offset += 2;
                return;
            }
        }

        emit(FormulaToken.of(Character.toString(c), TokenType.OPERATOR_INFIX));
        offset++;
    }

    private void whitespace() {
        flushBuffer();
        emit(FormulaToken.of(" ", TokenType.WHITESPACE));
        offset++;

        while (peek(0) == ' ') {
            offset++;
        }
    }

    private boolean isOpenArrayRow() {
        if (scopes.isEmpty()) {
            return false;
        }
        FormulaToken top = tokens.get(scopes.peek());
        return top.is(TokenType.FUNCTION) && ARRAY_ROW.equals(top.value());
    }

    private boolean anyOpenScope(Predicate<FormulaToken> condition) {
        return scopes.stream().map(tokens::get).anyMatch(condition);
    }

    private int peek(int ahead) {
        int index = offset + ahead;
        return index < chars.length ? chars[index] : -1;
    }

    private String takeBuffer() {
        String value = buffer.toString();
        buffer.setLength(0);
        return value;
    }

    private int emit(FormulaToken token) {
        tokens.add(token);
        return tokens.size() - 1;
    }

    private void flushBuffer() {
        if (buffer.length() == 0) {
            return;
        }
        String value = takeBuffer();
        emit(FormulaToken.of(value, TokenType.OPERAND, classifyOperand(value)));
    }

    private static TokenSubType classifyOperand(String value) {
        if (isNumber(value)) {
            return TokenSubType.NUMBER;
        }
        if ("TRUE".equals(value) || "FALSE".equals(value)) {
            return TokenSubType.LOGICAL;
        }
        return TokenSubType.RANGE;
    }

    private static boolean isNumber(String value) {
        return NUMBER_PATTERN.matcher(value).matches() && Double.isFinite(Double.parseDouble(value));
    }

    private List<FormulaToken> postProcess() {
        List<FormulaToken> result = new ArrayList<>(tokens.size());

        for (FormulaToken token : tokens) {
            if (token.is(TokenType.WHITESPACE) || (token.is(TokenType.FUNCTION) && "(".equals(token.value()))) {
                continue;
            }
            result.add(refine(token));
        }

        logger.debug("Tokenized formula into {} tokens", result.size());
        return List.copyOf(result);
    }

    /**
     * Assigns the final subtype of infix operators that have none yet and
     * reclassifies {@code #...} references as errors. Subtypes set while
     * scanning (comparison pairs, union, range) are left alone.
     */
    private static FormulaToken refine(FormulaToken token) {
        if (token.is(TokenType.OPERATOR_INFIX) && token.subtype() == null) {
            return token.withSubtype(switch (token.value()) {
                case "&" -> TokenSubType.CONCATENATION;
                case "=", "<", ">" -> TokenSubType.LOGICAL;
                default -> TokenSubType.MATH;
            });
        }
        if (token.is(TokenType.OPERAND, TokenSubType.RANGE) && token.value().startsWith("#")) {
            return token.withSubtype(TokenSubType.ERROR);
        }
        return token;
    }
}
