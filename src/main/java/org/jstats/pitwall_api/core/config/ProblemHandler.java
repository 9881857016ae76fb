package org.jstats.pitwall_api.core.config;

import jakarta.validation.ConstraintViolationException;
import org.jstats.pitwall_api.modules.openf1_gatherer.ingest.OpenF1Client;
import org.jstats.pitwall_api.modules.strategy_engine.exception.ConfigException;
import org.jstats.pitwall_api.modules.strategy_engine.exception.ModelNotFoundException;
import org.jstats.pitwall_api.modules.strategy_engine.exception.ModelNotReadyException;
import org.jstats.pitwall_api.modules.strategy_engine.exception.SchemaException;
import org.jstats.pitwall_api.modules.strategy_engine.exception.TrainingFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.net.URI;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestControllerAdvice
public class ProblemHandler {

    private static final Logger log = LoggerFactory.getLogger(ProblemHandler.class);

    private static final String PROBLEMS = "https://api.jstats.org/problems/";

    // Anything thrown as ResponseStatusException becomes a Problem
    @ExceptionHandler(ResponseStatusException.class)
    public ProblemDetail handle(ResponseStatusException ex) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(ex.getStatusCode(), ex.getReason());
        pd.setType(URI.create(PROBLEMS + ex.getStatusCode().value()));
        if (ex.getStatusCode().isSameCodeAs(NOT_FOUND)) {
            pd.setTitle("Resource Not Found");
        } else if (ex.getStatusCode().isSameCodeAs(BAD_REQUEST)) {
            pd.setTitle("Bad Request");
        } else {
            pd.setTitle("Request Failed");
        }
        return pd;
    }

    @ExceptionHandler(SchemaException.class)
    public ProblemDetail schema(SchemaException ex) {
        ProblemDetail pd = problem(HttpStatus.BAD_REQUEST, "invalid-features", "Invalid Features", ex.getMessage());
        pd.setProperty("field", ex.getField());
        return pd;
    }

    @ExceptionHandler(ConfigException.class)
    public ProblemDetail config(ConfigException ex) {
        return problem(HttpStatus.BAD_REQUEST, "invalid-configuration", "Invalid Configuration", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail unreadable(HttpMessageNotReadableException ex) {
        return problem(HttpStatus.BAD_REQUEST, "malformed-body", "Bad Request", "Request body is not valid JSON");
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ProblemDetail constraintViolation(ConstraintViolationException ex) {
        return problem(HttpStatus.BAD_REQUEST, "invalid-parameter", "Bad Request", ex.getMessage());
    }

    // missing or non-numeric query and path parameters, e.g. session_key=abc
    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ProblemDetail badParameter(Exception ex) {
        return problem(HttpStatus.BAD_REQUEST, "invalid-parameter", "Bad Request", ex.getMessage());
    }

    @ExceptionHandler(ModelNotFoundException.class)
    public ProblemDetail notFound(ModelNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "model-not-found", "Model Not Found", ex.getMessage());
    }

    @ExceptionHandler(ModelNotReadyException.class)
    public ProblemDetail notReady(ModelNotReadyException ex) {
        ProblemDetail pd = problem(HttpStatus.CONFLICT, "model-not-ready", "Model Not Ready",
                ex.getMessage() + ". Train it first via POST /api/models/train/" + ex.getModelName());
        pd.setProperty("model", ex.getModelName());
        return pd;
    }

    @ExceptionHandler(TrainingFailureException.class)
    public ProblemDetail trainingFailed(TrainingFailureException ex) {
        log.error("Training of {} failed", ex.getModelName(), ex);
        ProblemDetail pd = problem(HttpStatus.INTERNAL_SERVER_ERROR, "training-failed", "Training Failed", ex.getMessage());
        pd.setProperty("model", ex.getModelName());
        return pd;
    }

    @ExceptionHandler(OpenF1Client.RateLimitedException.class)
    public ResponseEntity<ProblemDetail> rateLimited(OpenF1Client.RateLimitedException ex) {
        var pd = problem(HttpStatus.TOO_MANY_REQUESTS, "rate-limit", "Too Many Requests",
                "Rate limit reached at OpenF1. Please retry later.");
        var headers = new HttpHeaders();
        headers.add(HttpHeaders.RETRY_AFTER, String.valueOf(ex.retryAfter.toSeconds()));
        return new ResponseEntity<>(pd, headers, HttpStatus.TOO_MANY_REQUESTS);
    }

    @ExceptionHandler(OpenF1Client.Upstream5xxException.class)
    public ProblemDetail upstream(OpenF1Client.Upstream5xxException ex) {
        var pd = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
        pd.setDetail("Upstream error from OpenF1: " + ex.status);
        return pd;
    }

    // Catch any other unexpected exception as a 500 Problem (avoid leaking internals)
    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "internal-error", "Internal Server Error",
                "Unexpected error. If this persists, contact support.");
    }

    private static ProblemDetail problem(HttpStatus status, String type, String title, String detail) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(status, detail);
        pd.setType(URI.create(PROBLEMS + type));
        pd.setTitle(title);
        return pd;
    }
}
