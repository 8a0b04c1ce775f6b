package com.sheetlex.formula.service;

import com.sheetlex.formula.config.FormulaTokenizerProperties;
import com.sheetlex.formula.dto.FormulaToken;
import com.sheetlex.formula.dto.TokenizeRequest;
import com.sheetlex.formula.dto.TokenizeResponse;
import com.sheetlex.formula.exception.FormulaAnalysisException;
import com.sheetlex.formula.lexer.FormulaRenderer;
import com.sheetlex.formula.lexer.FormulaTokenizer;
import com.sheetlex.formula.lexer.TokenPrettyPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class FormulaAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(FormulaAnalysisService.class);

    private final FormulaTokenizerProperties properties;

    private final FormulaRenderer renderer = new FormulaRenderer();

    private final TokenPrettyPrinter prettyPrinter = new TokenPrettyPrinter();

    public FormulaAnalysisService(FormulaTokenizerProperties properties) {
        this.properties = properties;
    }

    public TokenizeResponse analyze(TokenizeRequest request) throws FormulaAnalysisException {
        long startTime = System.currentTimeMillis();

        String formula = request.sanitizedFormula();
        logger.info("Tokenizing formula of {} characters", formula.length());

        List<FormulaToken> tokens = tokenize(formula);
        String normalized = renderer.render(tokens);

        long analysisTime = System.currentTimeMillis() - startTime;
        logger.info("Tokenized formula into {} tokens in {}ms", tokens.size(), analysisTime);

        return TokenizeResponse.success(tokens, normalized, analysisTime);
    }

    /**
     * Tokenizes {@code formula} with a fresh {@link FormulaTokenizer}, so the
     * service can be shared between request threads.
     */
    public List<FormulaToken> tokenize(String formula) throws FormulaAnalysisException {
        if (formula == null) {
            throw new FormulaAnalysisException("Formula cannot be null");
        }
        if (formula.length() > properties.maxFormulaLength()) {
            throw new FormulaAnalysisException(
                "Formula exceeds maximum length of " + properties.maxFormulaLength() + " characters");
        }

        List<FormulaToken> tokens = new FormulaTokenizer().parse(formula);
        logTokenMapping(tokens);
        return tokens;
    }

    public String render(List<FormulaToken> tokens) throws FormulaAnalysisException {
        checkTokenCount(tokens);

        String formula = renderer.render(tokens);
        logger.info("Rendered {} tokens into {} characters", tokens.size(), formula.length());
        return formula;
    }

    public String prettyPrint(List<FormulaToken> tokens) throws FormulaAnalysisException {
        checkTokenCount(tokens);

        logger.debug("Pretty printing {} tokens", tokens.size());
        return prettyPrinter.prettyPrint(tokens);
    }

    private void checkTokenCount(List<FormulaToken> tokens) throws FormulaAnalysisException {
        if (tokens == null) {
            throw new FormulaAnalysisException("Token list cannot be null");
        }
        if (tokens.size() > properties.maxTokenCount()) {
            throw new FormulaAnalysisException(
                "Token list exceeds maximum size of " + properties.maxTokenCount() + " tokens");
        }
    }

    private void logTokenMapping(List<FormulaToken> tokens) {
        if (properties.logTokenStream()) {
            for (int i = 0; i < tokens.size(); i++) {
                FormulaToken token = tokens.get(i);
                logger.info("Token {}: '{}' -> {} {}", i, token.value(), token.type(), token.subtype());
            }
        } else if (logger.isDebugEnabled()) {
            logger.debug("Token stream:\n{}", prettyPrinter.prettyPrint(tokens));
        }
    }
}
