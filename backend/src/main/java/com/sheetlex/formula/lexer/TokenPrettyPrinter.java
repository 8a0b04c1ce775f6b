package com.sheetlex.formula.lexer;

import com.sheetlex.formula.dto.FormulaToken;

import java.util.List;

/**
 * Indented, one-token-per-line dump of a token list, for debugging.
 */
public class TokenPrettyPrinter {

    private static final String INDENT = "  ";

    public String prettyPrint(List<FormulaToken> tokens) {
        StringBuilder output = new StringBuilder();
        int indent = 0;

        for (FormulaToken token : tokens) {
            if (token.isStop()) {
                indent = Math.max(0, indent - 1);
            }

            output.append(INDENT.repeat(indent))
                    .append(token.value())
                    .append(" <").append(token.type() == null ? "" : token.type().label()).append('>')
                    .append(" <").append(token.subtype() == null ? "" : token.subtype().label()).append('>')
                    .append('\n');

            if (token.isStart()) {
                indent++;
            }
        }

        return output.toString();
    }
}
