package com.sheetlex.formula.lexer;

import com.sheetlex.formula.dto.FormulaToken;
import com.sheetlex.formula.dto.FormulaToken.TokenSubType;

import java.util.List;
import java.util.regex.Pattern;

import static com.sheetlex.formula.dto.FormulaToken.ARRAY;
import static com.sheetlex.formula.dto.FormulaToken.ARRAY_ROW;

/**
 * Rebuilds formula text from a token list. Works on any list of tokens, not
 * only on ones produced by {@link FormulaTokenizer}; the result is normalized
 * text rather than a byte-exact copy of the original input.
 */
public class FormulaRenderer {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern SPACE_AFTER_OPERATOR = Pattern.compile("([+\\-*/^=<>])\\s+");
    private static final Pattern SPACE_BEFORE_OPERATOR = Pattern.compile("\\s+([+\\-*/^=<>])");

    public String render(List<FormulaToken> tokens) {
        StringBuilder output = new StringBuilder();
        int arrayDepth = 0;

        for (FormulaToken token : tokens) {
            String value = token.value() == null ? "" : token.value();
            if (token.type() == null) {
                output.append(value);
                continue;
            }

            switch (token.type()) {
                case FUNCTION -> {
                    if (ARRAY.equals(value)) {
                        if (token.isStart()) {
                            output.append('{');
                            arrayDepth++;
                        } else {
                            output.append('}');
                            arrayDepth--;
                        }
                    } else if (!ARRAY_ROW.equals(value)) {
                        // Row markers print nothing; the ';' argument between them does.
                        output.append(token.isStart() ? value + "(" : ")");
                    }
                }
                case SUBEXPRESSION -> output.append(token.isStart() ? '(' : ')');
                case OPERATOR_INFIX -> {
                    if (",".equals(value)) {
                        output.append(',');
                    } else {
                        output.append(' ').append(value).append(' ');
                    }
                }
                case OPERATOR_POSTFIX -> output.append(value);
                case ARGUMENT -> output.append(argumentSeparator(value, arrayDepth));
                case OPERAND -> {
                    if (token.subtype() == TokenSubType.TEXT) {
                        output.append('"').append(value).append('"');
                    } else {
                        output.append(value);
                    }
                }
                default -> output.append(value);
            }
        }

        return normalize(output.toString());
    }

    private static char argumentSeparator(String value, int arrayDepth) {
        if (arrayDepth > 1 || (arrayDepth == 1 && ";".equals(value))) {
            return ';';
        }
        return ',';
    }

    private static String normalize(String text) {
        String result = WHITESPACE_RUN.matcher(text).replaceAll(" ");
        result = SPACE_AFTER_OPERATOR.matcher(result).replaceAll("$1");
        result = SPACE_BEFORE_OPERATOR.matcher(result).replaceAll("$1");
        return result.replace("\" \"", "\"\"").trim();
    }
}
