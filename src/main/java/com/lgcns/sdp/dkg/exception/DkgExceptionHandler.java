package com.lgcns.sdp.dkg.exception;

import com.lgcns.sdp.dkg.dto.ErrorResponseDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class DkgExceptionHandler {

    @ExceptionHandler(InvalidQueryException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidQuery(InvalidQueryException e) {
        return respond(HttpStatus.BAD_REQUEST, e, e.getField());
    }

    @ExceptionHandler(UnboundedUnconstrainedQueryException.class)
    public ResponseEntity<ErrorResponseDto> handleUnboundedUnconstrained(UnboundedUnconstrainedQueryException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e, null);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponseDto> handleStoreUnavailable(StoreUnavailableException e) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e, null);
    }

    @ExceptionHandler(StoreTimeoutException.class)
    public ResponseEntity<ErrorResponseDto> handleStoreTimeout(StoreTimeoutException e) {
        return respond(HttpStatus.GATEWAY_TIMEOUT, e, null);
    }

    @ExceptionHandler(StoreProtocolException.class)
    public ResponseEntity<ErrorResponseDto> handleStoreProtocol(StoreProtocolException e) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e, null);
    }

    // 잘못된 JSON (예: relation_max_hops 에 문자열)
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDto> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponseDto.builder()
                .error("InvalidQuery")
                .field("body")
                .message("Malformed query specification")
                .build());
    }

    private ResponseEntity<ErrorResponseDto> respond(HttpStatus status, DkgQueryException e, String field) {
        if (status.is4xxClientError()) {
            log.warn("Request refused with {}: {}", e.getErrorCode(), e.getMessage());
        } else {
            log.debug("Request failed with {} ({})", e.getErrorCode(), status.value());
        }
        return ResponseEntity.status(status).body(ErrorResponseDto.builder()
                .error(e.getErrorCode())
                .field(field)
                .message(e.getMessage())
                .build());
    }
}
