package com.sheetlex.formula.exception;

public class FormulaAnalysisException extends Exception {

    public FormulaAnalysisException(String message) {
        super(message);
    }

    public FormulaAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
