package com.sheetlex.formula.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import jakarta.validation.constraints.NotNull;

/**
 * One lexical unit of a spreadsheet formula. {@code subtype} is {@code null}
 * when the token carries no subtype (separators, whitespace, unrefined operators).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FormulaToken(
    @NotNull(message = "Token value cannot be null")
    String value,

    @NotNull(message = "Token type cannot be null")
    TokenType type,

    TokenSubType subtype
) {

    public static final String ARRAY = "ARRAY";
    public static final String ARRAY_ROW = "ARRAYROW";

    public static FormulaToken of(String value, TokenType type) {
        return new FormulaToken(value, type, null);
    }

    public static FormulaToken of(String value, TokenType type, TokenSubType subtype) {
        return new FormulaToken(value, type, subtype);
    }

    public FormulaToken withType(TokenType newType, TokenSubType newSubtype) {
        return new FormulaToken(value, newType, newSubtype);
    }

    public FormulaToken withSubtype(TokenSubType newSubtype) {
        return new FormulaToken(value, type, newSubtype);
    }

    public boolean is(TokenType expectedType) {
        return type == expectedType;
    }

    public boolean is(TokenType expectedType, TokenSubType expectedSubtype) {
        return type == expectedType && subtype == expectedSubtype;
    }

    @JsonIgnore
    public boolean isStart() {
        return subtype == TokenSubType.START;
    }

    @JsonIgnore
    public boolean isStop() {
        return subtype == TokenSubType.STOP;
    }

    /** {@code ARRAY} or {@code ARRAYROW} scope marker. */
    @JsonIgnore
    public boolean isArrayMarker() {
        return type == TokenType.FUNCTION && (ARRAY.equals(value) || ARRAY_ROW.equals(value));
    }

    public enum TokenType {
        NOOP("Noop"),
        OPERAND("Operand"),
        FUNCTION("Function"),
        SUBEXPRESSION("Subexpression"),
        ARGUMENT("Argument"),
        OPERATOR_PREFIX("OperatorPrefix"),
        OPERATOR_INFIX("OperatorInfix"),
        OPERATOR_POSTFIX("OperatorPostfix"),
        WHITESPACE("Whitespace"),
        UNKNOWN("Unknown");

        private final String label;

        TokenType(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }
    }

    public enum TokenSubType {
        START("Start"),
        STOP("Stop"),
        TEXT("Text"),
        NUMBER("Number"),
        LOGICAL("Logical"),
        ERROR("Error"),
        RANGE("Range"),
        MATH("Math"),
        CONCATENATION("Concatenation"),
        INTERSECTION("Intersection"),
        UNION("Union");

        private final String label;

        TokenSubType(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }
    }
}
