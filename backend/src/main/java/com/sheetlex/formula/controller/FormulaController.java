package com.sheetlex.formula.controller;

import com.sheetlex.formula.dto.ErrorResponse;
import com.sheetlex.formula.dto.RenderResponse;
import com.sheetlex.formula.dto.TokenStreamRequest;
import com.sheetlex.formula.dto.TokenizeRequest;
import com.sheetlex.formula.dto.TokenizeResponse;
import com.sheetlex.formula.exception.FormulaAnalysisException;
import com.sheetlex.formula.service.FormulaAnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/formula")
@Validated
public class FormulaController {

    private static final Logger logger = LoggerFactory.getLogger(FormulaController.class);

    private final FormulaAnalysisService analysisService;

    public FormulaController(FormulaAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping("/tokenize")
    public ResponseEntity<TokenizeResponse> tokenize(@Valid @RequestBody TokenizeRequest request) {
        logger.debug("Received tokenize request for {} characters", request.formula().length());

        try {
            TokenizeResponse response = analysisService.analyze(request);

            logger.debug("Tokenize completed: success={}, tokens={}",
                response.success(), response.tokens().size());

            return ResponseEntity.ok(response);

        } catch (FormulaAnalysisException e) {
            logger.warn("Rejected tokenize request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(TokenizeResponse.error(e.getMessage(), 0));
        } catch (Exception e) {
            logger.error("Unexpected error during tokenization", e);
            return ResponseEntity.internalServerError()
                .body(TokenizeResponse.error("Internal server error: " + e.getMessage(), 0));
        }
    }

    @PostMapping("/render")
    public ResponseEntity<RenderResponse> render(@Valid @RequestBody TokenStreamRequest request) {
        try {
            return ResponseEntity.ok(RenderResponse.success(analysisService.render(request.tokens())));

        } catch (FormulaAnalysisException e) {
            logger.warn("Rejected render request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(RenderResponse.error(e.getMessage()));
        } catch (Exception e) {
            logger.error("Unexpected error during rendering", e);
            return ResponseEntity.internalServerError()
                .body(RenderResponse.error("Internal server error: " + e.getMessage()));
        }
    }

    @PostMapping(value = "/pretty-print", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> prettyPrint(@Valid @RequestBody TokenStreamRequest request) {
        try {
            return ResponseEntity.ok(analysisService.prettyPrint(request.tokens()));

        } catch (FormulaAnalysisException e) {
            logger.warn("Rejected pretty-print request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(e.getMessage());
        } catch (Exception e) {
            logger.error("Unexpected error during pretty printing", e);
            return ResponseEntity.internalServerError().body("Internal server error: " + e.getMessage());
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Formula tokenizer service is running");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {

        StringBuilder errorMessage = new StringBuilder("Validation error: ");

        e.getBindingResult().getFieldErrors().forEach(error ->
            errorMessage.append(error.getField())
                       .append(" - ")
                       .append(error.getDefaultMessage())
                       .append("; ")
        );

        logger.warn("Validation error: {}", errorMessage);

        return ResponseEntity.badRequest().body(ErrorResponse.of(errorMessage.toString()));
    }
}
