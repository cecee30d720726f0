package com.lpzapper.api.controller;

import com.lpzapper.api.dto.ErrorBody;
import com.lpzapper.balance.InsufficientFundsException;
import com.lpzapper.chain.RpcException;
import com.lpzapper.ledger.LedgerPersistenceException;
import com.lpzapper.session.NoPositionsException;
import com.lpzapper.session.flow.FlowStateException;
import com.lpzapper.zap.ZapExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Optional;

/**
 * Maps domain failures to HTTP statuses with {@link ErrorBody}: validation 400, no positions 404,
 * failed zap or wrong flow state 409, insufficient funds 422, ledger write 500, node or oracle down 503.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, userFacingMessage(error, ex)));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getReason()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(NoPositionsException.class)
    public ResponseEntity<ErrorBody> handleNoPositions(NoPositionsException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of("NO_POSITIONS", ex.getMessage()));
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ErrorBody> handleInsufficientFunds(InsufficientFundsException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(ErrorBody.of("INSUFFICIENT_FUNDS", ex.getMessage()));
    }

    @ExceptionHandler(ZapExecutionException.class)
    public ResponseEntity<ErrorBody> handleZapFailed(ZapExecutionException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorBody.of("ZAP_FAILED", ex.getMessage()));
    }

    @ExceptionHandler(FlowStateException.class)
    public ResponseEntity<ErrorBody> handleFlowState(FlowStateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorBody.of("INVALID_FLOW_STATE", ex.getMessage()));
    }

    @ExceptionHandler(LedgerPersistenceException.class)
    public ResponseEntity<ErrorBody> handleLedger(LedgerPersistenceException ex) {
        log.error("Ledger persistence failure: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorBody.of("LEDGER_WRITE_FAILED", ex.getMessage()));
    }

    @ExceptionHandler(RpcException.class)
    public ResponseEntity<ErrorBody> handleUpstream(RpcException ex) {
        log.warn("Upstream unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorBody.of("UPSTREAM_UNAVAILABLE", ex.getMessage()));
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_ADDRESS" -> "Invalid token address format";
            case "INVALID_AMOUNT" -> "Amount must be a positive number of ETH";
            case "INVALID_PERCENT" -> "Percent must be between 1 and 100";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
