package com.chicu.aifinetune.web.controller.api;

import com.chicu.aifinetune.ai.tuning.error.DeploymentException;
import com.chicu.aifinetune.ai.tuning.error.FineTuningException;
import com.chicu.aifinetune.ai.tuning.error.ModelNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiErrorHandler {

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e, HttpServletRequest req) {
        log.warn("400 Bad Request at {}: {}", safePath(req), e.toString());
        return ResponseEntity.status(400).body(body(400, e, req));
    }

    @ExceptionHandler(ModelNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ModelNotFoundException e, HttpServletRequest req) {
        log.warn("404 at {}: modelId={}", safePath(req), e.getModelId());
        Map<String, Object> body = body(404, e, req);
        body.put("modelId", e.getModelId());
        return ResponseEntity.status(404).body(body);
    }

    /**
     * Модель уже в реестре, упала только выкладка: отдаём двухфазный итог.
     */
    @ExceptionHandler(DeploymentException.class)
    public ResponseEntity<Map<String, Object>> handleDeployment(DeploymentException e, HttpServletRequest req) {
        log.error("502 deployment at {}: {}", safePath(req), safeMsg(e));
        Map<String, Object> body = body(502, e, req);
        body.put("errorType", e.getType());
        if (e.getResult() != null) {
            body.put("deployment", e.getResult().deployment());
            body.put("result", e.getResult());
        }
        return ResponseEntity.status(502).body(body);
    }

    @ExceptionHandler(FineTuningException.class)
    public ResponseEntity<Map<String, Object>> handleFineTuning(FineTuningException e, HttpServletRequest req) {
        log.warn("422 at {}: type={} {}", safePath(req), e.getType(), safeMsg(e));
        Map<String, Object> body = body(422, e, req);
        body.put("errorType", e.getType());
        return ResponseEntity.status(422).body(body);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleMethodNotAllowed(HttpRequestMethodNotSupportedException e,
                                                                      HttpServletRequest req) {
        log.warn("405 Method Not Allowed at {}: {}", safePath(req), e.getMethod());
        return ResponseEntity.status(405).body(body(405, e, req));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handle(Exception e, HttpServletRequest req) {
        // общий неожиданный 500
        log.error("500 at {}: {}", safePath(req), safeMsg(e), e);
        return ResponseEntity.status(500).body(body(500, e, req));
    }

    // ---------- helpers ----------

    private Map<String, Object> body(int status, Exception e, HttpServletRequest req) {
        Map<String, Object> body = new HashMap<>();
        body.put("status", "error");
        body.put("code", status);
        body.put("error", e.getClass().getSimpleName());
        body.put("message", safeMsg(e));
        body.put("path", safePath(req));
        body.put("timestamp", System.currentTimeMillis());
        return body;
    }

    private String safeMsg(Throwable e) {
        String m = (e != null ? e.getMessage() : null);
        return (m != null && !m.isBlank()) ? m : (e != null ? e.getClass().getSimpleName() : "Error");
    }

    private String safePath(HttpServletRequest req) {
        return req != null ? req.getRequestURI() : "/";
    }
}
