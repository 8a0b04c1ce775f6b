package com.sheetlex.formula.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenizeResponse(
        boolean success,
        List<FormulaToken> tokens,
        String normalized,
        String error,
        long analysisTimeMs) {

    public static TokenizeResponse success(List<FormulaToken> tokens, String normalized, long analysisTimeMs) {
        return new TokenizeResponse(true, tokens, normalized, null, analysisTimeMs);
    }

    public static TokenizeResponse error(String error, long analysisTimeMs) {
        return new TokenizeResponse(false, List.of(), null, error, analysisTimeMs);
    }
}
