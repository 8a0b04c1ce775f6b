package com.sheetlex.formula.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Positive;

@ConfigurationProperties(prefix = "sheetlex.tokenizer")
@Validated
public record FormulaTokenizerProperties(
    @Positive
    @DefaultValue("8192")
    Integer maxFormulaLength,

    @Positive
    @DefaultValue("10000")
    Integer maxTokenCount,

    @DefaultValue("false")
    boolean logTokenStream
) {

    public static FormulaTokenizerProperties defaults() {
        return new FormulaTokenizerProperties(8192, 10000, false);
    }
}
