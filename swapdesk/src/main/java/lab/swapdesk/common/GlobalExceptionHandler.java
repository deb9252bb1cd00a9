package lab.swapdesk.common;

import jakarta.servlet.http.HttpServletRequest;
import lab.swapdesk.domain.swap.Chain;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    // Long hex, base64 and base58 runs: tx payloads, tokens, keys.
    private static final Pattern SENSITIVE_PATTERN = Pattern.compile(
            "(0x)?[a-fA-F0-9]{64,}|[A-Za-z0-9+/_=-]{88,}|[1-9A-HJ-NP-Za-km-z]{87,}");
    private static final String KEY_FAILURE_MESSAGE = "Wallet secret could not be used; operation aborted";

    @ExceptionHandler(SwapException.class)
    public ResponseEntity<ErrorResponse> handleSwapException(SwapException ex) {
        HttpStatus status = statusOf(ex.kind());
        String message = ex.kind() == SwapErrorKind.KEY_DECRYPTION_FAILED
                ? KEY_FAILURE_MESSAGE
                : sanitizeMessage(ex.getMessage());
        return ResponseEntity.status(status)
                .body(new ErrorResponse(status.value(), ex.kind().name(), message, ex.kind().isRetryable(), details(ex)));
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        String message = ex.getMessage();
        if (ex instanceof MethodArgumentTypeMismatchException mismatch) {
            message = "Invalid value '%s' for %s".formatted(mismatch.getValue(), mismatch.getName());
        }
        return ResponseEntity.badRequest().body(new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(),
                SwapErrorKind.INVALID_INPUT.name(),
                sanitizeMessage(message),
                false,
                Map.of("allowedChains", Chain.names())));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        String detail = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        String message = "Invalid JSON body.";
        if (detail != null && !detail.isBlank()) {
            message += " Detail: " + detail;
        }
        return ResponseEntity.badRequest().body(new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(), SwapErrorKind.INVALID_INPUT.name(), sanitizeMessage(message), false, Map.of()));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
        return ResponseEntity.badRequest().body(new ErrorResponse(
                HttpStatus.BAD_REQUEST.value(), SwapErrorKind.INVALID_INPUT.name(),
                "Missing required header: " + ex.getHeaderName(), false, Map.of()));
    }

    @ExceptionHandler({IllegalStateException.class, RuntimeException.class})
    public ResponseEntity<RuntimeErrorResponse> handleRuntimeException(Exception ex, HttpServletRequest request) {
        log.error("event=http.unhandled path={} error={}", request.getRequestURI(), ex.toString(), ex);
        RuntimeErrorResponse body = new RuntimeErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                sanitizeMessage(ex.getMessage()),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    static HttpStatus statusOf(SwapErrorKind kind) {
        return switch (kind) {
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case INSUFFICIENT_FUNDS -> HttpStatus.UNPROCESSABLE_ENTITY;
            case NO_LIQUIDITY_DATA, RPC_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case NETWORK_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case SUBMISSION_FAILED -> HttpStatus.BAD_GATEWAY;
            case SWAP_IN_PROGRESS, SWAP_CANCELLED -> HttpStatus.CONFLICT;
            case KEY_DECRYPTION_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static Map<String, Object> details(SwapException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (ex instanceof InsufficientFundsException funds) {
            details.put("asset", funds.getAsset());
            details.put("requiredRaw", funds.getRequiredRaw());
            details.put("availableRaw", funds.getAvailableRaw());
            details.put("shortfallRaw", funds.getShortfallRaw());
        } else if (ex instanceof NetworkTimeoutException timeout) {
            details.put("possiblyDelivered", timeout.isPossiblyDelivered());
        } else if (ex instanceof RpcUnavailableException rpc) {
            details.put("triedEndpoints", rpc.getTriedEndpoints().size());
        }
        return details;
    }

    static String sanitizeMessage(String message) {
        if (message == null || message.isBlank()) {
            return "Unexpected server error";
        }
        return SENSITIVE_PATTERN.matcher(message).replaceAll("[REDACTED]");
    }

    public record ErrorResponse(
            int status,
            String kind,
            String message,
            boolean retryable,
            Map<String, Object> details
    ) {}

    public record RuntimeErrorResponse(
            int status,
            String message,
            String path
    ) {
    }
}
