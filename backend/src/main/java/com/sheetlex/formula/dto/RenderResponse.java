package com.sheetlex.formula.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RenderResponse(
        boolean success,
        String formula,
        String error) {

    public static RenderResponse success(String formula) {
        return new RenderResponse(true, formula, null);
    }

    public static RenderResponse error(String error) {
        return new RenderResponse(false, null, error);
    }
}
