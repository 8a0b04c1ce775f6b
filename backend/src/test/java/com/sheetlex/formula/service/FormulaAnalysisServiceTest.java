package com.sheetlex.formula.service;

import com.sheetlex.formula.config.FormulaTokenizerProperties;
import com.sheetlex.formula.dto.FormulaToken;
import com.sheetlex.formula.dto.FormulaToken.TokenSubType;
import com.sheetlex.formula.dto.FormulaToken.TokenType;
import com.sheetlex.formula.dto.TokenizeRequest;
import com.sheetlex.formula.dto.TokenizeResponse;
import com.sheetlex.formula.exception.FormulaAnalysisException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormulaAnalysisServiceTest {

    private final FormulaAnalysisService service = new FormulaAnalysisService(FormulaTokenizerProperties.defaults());

    @Test
    void analyzeReturnsTokensAndNormalizedFormula() throws Exception {
        TokenizeResponse response = service.analyze(new TokenizeRequest("=SUM(A1, 2) + 1"));

        assertThat(response.success()).isTrue();
        assertThat(response.error()).isNull();
        assertThat(response.normalized()).isEqualTo("SUM(A1,2)+1");
        assertThat(response.tokens()).first()
                .isEqualTo(FormulaToken.of("SUM", TokenType.FUNCTION, TokenSubType.START));
    }

    @Test
    void analyzeRemovesNullCharacters() throws Exception {
        TokenizeResponse response = service.analyze(new TokenizeRequest("A\0" + "1"));

        assertThat(response.tokens()).containsExactly(FormulaToken.of("A1", TokenType.OPERAND, TokenSubType.RANGE));
    }

    @Test
    void rejectsFormulaOverConfiguredLength() {
        FormulaAnalysisService limited = new FormulaAnalysisService(new FormulaTokenizerProperties(5, 100, false));

        assertThatThrownBy(() -> limited.tokenize("=SUM(A1:A9)"))
                .isInstanceOf(FormulaAnalysisException.class)
                .hasMessageContaining("maximum length of 5");
    }

    @Test
    void rejectsNullFormula() {
        assertThatThrownBy(() -> service.tokenize(null))
                .isInstanceOf(FormulaAnalysisException.class);
    }

    @Test
    void rejectsTooManyTokens() {
        FormulaAnalysisService limited = new FormulaAnalysisService(new FormulaTokenizerProperties(100, 2, true));
        List<FormulaToken> tokens = List.of(
                FormulaToken.of("1", TokenType.OPERAND, TokenSubType.NUMBER),
                FormulaToken.of("+", TokenType.OPERATOR_INFIX, TokenSubType.MATH),
                FormulaToken.of("1", TokenType.OPERAND, TokenSubType.NUMBER));

        assertThatThrownBy(() -> limited.render(tokens))
                .isInstanceOf(FormulaAnalysisException.class)
                .hasMessageContaining("2 tokens");
        assertThatThrownBy(() -> limited.prettyPrint(tokens))
                .isInstanceOf(FormulaAnalysisException.class);
    }

    @Test
    void renderAndPrettyPrintDelegate() throws Exception {
        List<FormulaToken> tokens = service.tokenize("{1;2}");

        assertThat(service.render(tokens)).isEqualTo("{1;2}");
        assertThat(service.prettyPrint(tokens)).startsWith("ARRAY <Function> <Start>\n");
    }

    @Test
    void tokenizeIsSafeAcrossThreads() throws Exception {
        String formula = "=IF(A1>=10,{1,2;3,4},SUM(B1:B9,\"x\"\"y\"))";
        List<FormulaToken> expected = service.tokenize(formula);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<List<FormulaToken>>> tasks = IntStream.range(0, 64)
                    .mapToObj(i -> (Callable<List<FormulaToken>>) () -> service.tokenize(formula))
                    .collect(Collectors.toList());

            for (Future<List<FormulaToken>> result : executor.invokeAll(tasks)) {
                assertThat(result.get()).isEqualTo(expected);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
