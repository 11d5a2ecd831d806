package com.wordsonphone.backend.customcategory.web;

import com.wordsonphone.backend.common.web.RequestIdFilter;
import com.wordsonphone.backend.customcategory.controller.CustomCategoryController;
import com.wordsonphone.backend.customcategory.dto.CustomCategoryErrorResponse;
import com.wordsonphone.backend.customcategory.provider.GenerationClientException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice(assignableTypes = CustomCategoryController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CustomCategoryExceptionAdvice {

    @ExceptionHandler(QuotaExceededException.class)
    public ResponseEntity<CustomCategoryErrorResponse> handleQuota(QuotaExceededException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.retryAfterSec()))
                .body(new CustomCategoryErrorResponse(
                        "QUOTA_EXCEEDED",
                        safeMsgOrCode(e, "QUOTA_EXCEEDED"),
                        rid(req),
                        e.clientAction(),
                        e.retryAfterSec()
                ));
    }

    @ExceptionHandler(InsufficientSampleWordsException.class)
    public ResponseEntity<CustomCategoryErrorResponse> handleInsufficient(InsufficientSampleWordsException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(err("INSUFFICIENT_SAMPLE_WORDS", e, req, "TRY_DIFFERENT_CATEGORY"));
    }

    @ExceptionHandler(EmptyAfterDedupException.class)
    public ResponseEntity<CustomCategoryErrorResponse> handleEmpty(EmptyAfterDedupException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(err("EMPTY_AFTER_DEDUP", e, req, "TRY_DIFFERENT_CATEGORY"));
    }

    @ExceptionHandler(AllBatchesFailedException.class)
    public ResponseEntity<CustomCategoryErrorResponse> handleAllFailed(AllBatchesFailedException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(err("ALL_BATCHES_FAILED", e, req, "RETRY_LATER"));
    }

    @ExceptionHandler(GenerationCancelledException.class)
    public ResponseEntity<CustomCategoryErrorResponse> handleCancelled(GenerationCancelledException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(err("GENERATION_CANCELLED", e, req, "RETRY_LATER"));
    }

    @ExceptionHandler(CategoryNotFoundException.class)
    public ResponseEntity<CustomCategoryErrorResponse> handleNotFound(CategoryNotFoundException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(err("CATEGORY_NOT_FOUND", e, req, null));
    }

    /**
     * preview 階段 provider 直接失敗（batch 階段的失敗在 orchestrator 裡就吃掉了）
     */
    @ExceptionHandler(GenerationClientException.class)
    public ResponseEntity<CustomCategoryErrorResponse> handleProvider(GenerationClientException e, HttpServletRequest req) {
        HttpStatus status = switch (e.code()) {
            case PROVIDER_RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
            case PROVIDER_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            default -> HttpStatus.BAD_GATEWAY;
        };

        ResponseEntity.BodyBuilder b = ResponseEntity.status(status);
        if (e.retryAfterSec() != null) b.header(HttpHeaders.RETRY_AFTER, String.valueOf(e.retryAfterSec()));

        return b.body(new CustomCategoryErrorResponse(
                e.code().name(),
                safeMsgOrCode(e, e.code().name()),
                rid(req),
                "RETRY_LATER",
                e.retryAfterSec()
        ));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<CustomCategoryErrorResponse> handleValidation(MethodArgumentNotValidException e, HttpServletRequest req) {
        var fieldErrors = e.getBindingResult().getFieldErrors();
        String msg = fieldErrors.isEmpty()
                ? "VALIDATION_FAILED"
                : fieldErrors.get(0).getField() + " " + fieldErrors.get(0).getDefaultMessage();

        return ResponseEntity.badRequest()
                .body(new CustomCategoryErrorResponse("VALIDATION_FAILED", msg, rid(req), null, null));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<CustomCategoryErrorResponse> handleUnreadable(HttpMessageNotReadableException e, HttpServletRequest req) {
        return ResponseEntity.badRequest()
                .body(new CustomCategoryErrorResponse("BAD_REQUEST", "Malformed request body", rid(req), null, null));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<CustomCategoryErrorResponse> handleIllegalArg(IllegalArgumentException e, HttpServletRequest req) {
        String code = norm(e.getMessage(), "BAD_REQUEST");
        return ResponseEntity.badRequest().body(err(code, e, req, null));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<CustomCategoryErrorResponse> handleIllegalState(IllegalStateException e, HttpServletRequest req) {
        String code = norm(e.getMessage(), "ILLEGAL_STATE");
        HttpStatus status = code.startsWith("PROVIDER_NOT_CONFIGURED")
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.INTERNAL_SERVER_ERROR;
        if (status.is5xxServerError() && status != HttpStatus.SERVICE_UNAVAILABLE) {
            log.error("custom_category_illegal_state rid={} code={}", rid(req), code, e);
        }
        return ResponseEntity.status(status).body(err(code, e, req, null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<CustomCategoryErrorResponse> handleUnknown(Exception e, HttpServletRequest req) {
        log.error("custom_category_unhandled rid={}", rid(req), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new CustomCategoryErrorResponse("INTERNAL_ERROR", "Unexpected error", rid(req), null, null));
    }

    // ===== helpers =====

    private static CustomCategoryErrorResponse err(String code, Throwable e, HttpServletRequest req, String clientAction) {
        return new CustomCategoryErrorResponse(code, safeMsgOrCode(e, code), rid(req), clientAction, null);
    }

    private static String rid(HttpServletRequest req) {
        return RequestIdFilter.getOrCreate(req);
    }

    private static String norm(String msg, String fallback) {
        if (msg == null) return fallback;
        String c = msg.trim();
        return c.isEmpty() ? fallback : c;
    }

    private static String safeMsgOrCode(Throwable t, String code) {
        String m = t.getMessage();
        if (m == null || m.isBlank()) return code;
        return m;
    }
}
