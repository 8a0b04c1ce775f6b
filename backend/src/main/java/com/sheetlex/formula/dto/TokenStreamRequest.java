package com.sheetlex.formula.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record TokenStreamRequest(
        @NotNull(message = "Tokens cannot be null")
        List<@Valid @NotNull FormulaToken> tokens) {
}
