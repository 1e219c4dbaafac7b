package com.multimap.backend.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String GENERIC_MESSAGE = "Something went wrong. Try again later";

    // MethodArgumentNotValidException(@RequestBody) 도 BindException 하위 타입
    @ExceptionHandler(BindException.class)
    public ResponseEntity<Map<String, String>> handleValid(BindException e) {
        String message = e.getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining(", "));
        log.debug("잘못된 요청: {}", message);
        return ResponseEntity.badRequest().body(
                Map.of("error", "INVALID_REQUEST", "message", message)
        );
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException e) {
        log.debug("요청 바디 파싱 실패: {}", e.getMessage());
        return ResponseEntity.badRequest().body(
                Map.of("error", "INVALID_REQUEST", "message", "Malformed request body")
        );
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<Map<String, String>> handleUpstream(UpstreamException e) {
        // 원인 로그는 서비스에서 이미 남김
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "UPSTREAM_ERROR", "message", GENERIC_MESSAGE));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleAny(Exception e) {
        // 404 / 405 / 415 등 스프링 MVC 가 상태코드를 정해둔 예외는 그대로
        if (e instanceof ErrorResponse er) {
            return ResponseEntity.status(er.getStatusCode())
                    .body(Map.of("error", "REQUEST_ERROR", "message", String.valueOf(er.getBody().getTitle())));
        }
        log.error("처리되지 않은 예외", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "INTERNAL_ERROR", "message", GENERIC_MESSAGE));
    }

    private static String describe(FieldError fe) {
        return fe.getField() + ": " + fe.getDefaultMessage();
    }
}
