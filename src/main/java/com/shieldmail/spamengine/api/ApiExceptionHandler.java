package com.shieldmail.spamengine.api;

import com.shieldmail.spamengine.api.dto.ErrorResponse;
import com.shieldmail.spamengine.domain.exception.EmptyInputException;
import com.shieldmail.spamengine.domain.exception.InvalidRequestException;
import com.shieldmail.spamengine.domain.exception.ModelNotLoadedException;
import com.shieldmail.spamengine.domain.exception.PredictionFailedException;
import com.shieldmail.spamengine.domain.exception.PredictionNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(PredictionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(PredictionNotFoundException ex, HttpServletRequest request) {
        log.debug("[API] 예측 없음: id={}", ex.getPredictionId());
        return build(HttpStatus.NOT_FOUND, "Prediction Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(ModelNotLoadedException.class)
    public ResponseEntity<ErrorResponse> handleNotLoaded(ModelNotLoadedException ex, HttpServletRequest request) {
        log.warn("[API] 모델 미로딩 상태에서 요청: path={}", request.getRequestURI());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Model Not Loaded", ex.getMessage(), request);
    }

    @ExceptionHandler({EmptyInputException.class, InvalidRequestException.class})
    public ResponseEntity<ErrorResponse> handleBadInput(RuntimeException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", "Malformed request body", request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                           HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Invalid Request",
                "Invalid value for parameter '" + ex.getName() + "'", request);
    }

    @ExceptionHandler({
            NoResourceFoundException.class,
            NoHandlerFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class,
            HttpMediaTypeNotAcceptableException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleMvcRejection(Exception ex, HttpServletRequest request) {
        HttpStatusCode status = ((org.springframework.web.ErrorResponse) ex).getStatusCode();
        log.debug("[API] 요청 거부: status={}, path={}, reason={}", status.value(), request.getRequestURI(), ex.getMessage());
        return build(status, reasonPhrase(status), ex.getMessage(), request);
    }

    @ExceptionHandler(PredictionFailedException.class)
    public ResponseEntity<ErrorResponse> handlePredictionFailed(PredictionFailedException ex, HttpServletRequest request) {
        log.error("[API] 예측 실패: path={}", request.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Prediction Failed", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("[API] 처리되지 않은 예외: path={}", request.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", ex.getMessage(), request);
    }

    private static String reasonPhrase(HttpStatusCode status) {
        HttpStatus known = HttpStatus.resolve(status.value());
        return known != null ? known.getReasonPhrase() : "Error";
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatusCode status, String error, String message,
                                                       HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(Instant.now().toString())
                .status(status.value())
                .error(error)
                .message(message)
                .path(request.getRequestURI())
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
