package com.sheetlex.formula.dto;

import jakarta.validation.constraints.NotNull;

public record TokenizeRequest(
    @NotNull(message = "Formula cannot be null")
    String formula
) {

    public String sanitizedFormula() {
        if (formula == null) {
            return "";
        }

        return formula
            .replace("\0", "")
            .replace("\r\n", "\n")
            .replace("\r", "\n");
    }
}
