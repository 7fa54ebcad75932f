package com.gymcoach.analysis.controller;

import com.gymcoach.common.exception.AnalysisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.net.URI;
import java.util.Map;

/**
 * Maps contract violations to RFC 7807 problem responses. Bad training data never reaches
 * here: analyzers report it inside their {@code Result}.
 */
@RestControllerAdvice
public class AnalysisExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(AnalysisExceptionHandler.class);

    private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
        HttpStatus.BAD_REQUEST, "invalid-request",
        HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
    );

    @ExceptionHandler({AnalysisException.class, ServerWebInputException.class, IllegalArgumentException.class})
    public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, ServerHttpRequest request) {
        ResponseEntity<ProblemDetail> response = buildProblem(HttpStatus.BAD_REQUEST, ex, request);
        if (ex instanceof AnalysisException analysisException) {
            response.getBody().setProperty("component", analysisException.getComponent());
        }
        return response;
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleServerError(Exception ex, ServerHttpRequest request) {
        return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
    }

    private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex, ServerHttpRequest request) {
        logException(status, ex, request);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detailFor(status, ex));
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create("https://gymcoach.dev/problems/"
            + TYPE_SLUGS.getOrDefault(status, "error")));
        problem.setProperty("path", request.getPath().value());
        return ResponseEntity.status(status).body(problem);
    }

    private String detailFor(HttpStatus status, Exception ex) {
        if (status.is5xxServerError() || ex.getMessage() == null) {
            return status.getReasonPhrase();
        }
        return ex.getMessage();
    }

    private void logException(HttpStatus status, Exception ex, ServerHttpRequest request) {
        if (status.is5xxServerError()) {
            log.error("Request failed path={} status={}", request.getPath().value(), status.value(), ex);
        } else {
            log.warn("Request rejected path={} status={} reason={}",
                     request.getPath().value(), status.value(), ex.getMessage());
        }
    }
}
