package lab.reconciler.common;

import jakarta.servlet.http.HttpServletRequest;
import lab.reconciler.adapter.RpcUnavailableException;
import lab.reconciler.domain.order.OrderStateException;
import lab.reconciler.ledger.InsufficientBalanceException;
import lab.reconciler.orchestration.AddressPoolExhaustedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.regex.Pattern;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    // private keys, merchant keys and signatures are all long hex runs
    private static final Pattern SENSITIVE_HEX_PATTERN = Pattern.compile("(0x)?[a-fA-F0-9]{64,}");

    @ExceptionHandler({InvalidRequestException.class, IllegalArgumentException.class, MissingRequestHeaderException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String message = "Invalid value '%s' for parameter '%s'".formatted(ex.getValue(), ex.getName());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", message, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex, HttpServletRequest request) {
        String detail = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        String message = "Invalid JSON body";
        if (detail != null && !detail.isBlank()) {
            message += ": " + detail;
        }
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", message, request);
    }

    @ExceptionHandler(SignatureVerificationException.class)
    public ResponseEntity<ErrorResponse> handleSignature(SignatureVerificationException ex, HttpServletRequest request) {
        return respond(HttpStatus.UNAUTHORIZED, "SIGNATURE_INVALID", ex.getMessage(), request);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), request);
    }

    @ExceptionHandler(IdempotencyConflictException.class)
    public ResponseEntity<ErrorResponse> handleIdempotencyConflict(IdempotencyConflictException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "IDEMPOTENCY_CONFLICT", ex.getMessage(), request);
    }

    @ExceptionHandler(AddressPoolExhaustedException.class)
    public ResponseEntity<ErrorResponse> handleAddressPool(AddressPoolExhaustedException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "ADDRESS_POOL_EXHAUSTED", ex.getMessage(), request);
    }

    @ExceptionHandler(OrderStateException.class)
    public ResponseEntity<ErrorResponse> handleOrderState(OrderStateException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "ORDER_STATE_CONFLICT", ex.getMessage(), request);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDuplicate(DataIntegrityViolationException ex, HttpServletRequest request) {
        log.warn("event=api.request.conflict path={} error={}", request.getRequestURI(), ex.getMostSpecificCause().getClass().getSimpleName());
        return respond(HttpStatus.CONFLICT, "DUPLICATE", "Concurrent duplicate request", request);
    }

    @ExceptionHandler(InsufficientBalanceException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientBalance(InsufficientBalanceException ex, HttpServletRequest request) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "INSUFFICIENT_BALANCE", ex.getMessage(), request);
    }

    @ExceptionHandler(RpcUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleRpcUnavailable(RpcUnavailableException ex, HttpServletRequest request) {
        log.warn("event=api.request.rpc_unavailable path={} chain={} error={}", request.getRequestURI(), ex.getChain(), ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "CHAIN_UNAVAILABLE", ex.getMessage(), request);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleRuntimeException(RuntimeException ex, HttpServletRequest request) {
        log.error("event=api.request.failed path={}", request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", ex.getMessage(), request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message, HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(status.value(), code, sanitizeMessage(message, status), request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }

    static String sanitizeMessage(String message, HttpStatus status) {
        if (message == null || message.isBlank()) {
            return status.is5xxServerError() ? "Unexpected server error" : status.getReasonPhrase();
        }
        return SENSITIVE_HEX_PATTERN.matcher(message).replaceAll("[REDACTED]");
    }

    public record ErrorResponse(
            int status,
            String code,
            String message,
            String path
    ) {}
}
