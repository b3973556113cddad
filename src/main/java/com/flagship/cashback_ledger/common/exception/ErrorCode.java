package com.flagship.cashback_ledger.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Stable error codes for money-path failures, with the HTTP status an API layer should map them to.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_AMOUNT(HttpStatus.BAD_REQUEST),
    INSUFFICIENT_FUNDS(HttpStatus.UNPROCESSABLE_ENTITY),
    WALLET_NOT_FOUND(HttpStatus.NOT_FOUND),
    IDEMPOTENCY_CONFLICT(HttpStatus.CONFLICT),
    CONCURRENT_MODIFICATION(HttpStatus.CONFLICT),
    INVALID_TRANSITION(HttpStatus.CONFLICT),
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND),
    ORDER_FROZEN(HttpStatus.CONFLICT),
    BALANCE_LIMIT_EXCEEDED(HttpStatus.UNPROCESSABLE_ENTITY),
    UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus httpStatus;
}
