package com.work.escrow.demo.web;

import com.work.escrow.core.exception.ChallengeReusedException;
import com.work.escrow.core.exception.EscrowException;
import com.work.escrow.core.exception.InsufficientFundsException;
import com.work.escrow.core.exception.InvalidPurchaseException;
import com.work.escrow.core.exception.ItemDispatchAbandonedException;
import com.work.escrow.core.exception.ItemDispatchRejectedException;
import com.work.escrow.core.exception.ItemLockContentionException;
import com.work.escrow.core.exception.ItemNotListedException;
import com.work.escrow.core.exception.ItemReservedException;
import com.work.escrow.core.exception.NotBuyerException;
import com.work.escrow.core.exception.ItemOutcomeUnknownException;
import com.work.escrow.core.exception.NotSellerException;
import com.work.escrow.demo.web.dto.ErrorView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 协议异常到 HTTP 状态码的映射：
 * 可重试的冲突 -> 409，身份不符 -> 403，未上架 -> 404，参数/业务校验 -> 400，
 * 内部一致性被破坏 -> 500（ERROR 日志告警），执行队列繁忙/操作未开始即撤下 -> 503（可重试），
 * 操作已开始但结果未知 -> 504（不可直接重试，需先查询 item 状态）。
 */
@RestControllerAdvice
public class EscrowExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(EscrowExceptionHandler.class);

    @ExceptionHandler({ItemReservedException.class, ItemLockContentionException.class})
    public ResponseEntity<ErrorView> handleConflict(EscrowException e) {
        return error(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler({NotBuyerException.class, NotSellerException.class})
    public ResponseEntity<ErrorView> handleForbidden(EscrowException e) {
        return error(HttpStatus.FORBIDDEN, e);
    }

    @ExceptionHandler(ItemNotListedException.class)
    public ResponseEntity<ErrorView> handleNotListed(ItemNotListedException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({InvalidPurchaseException.class, ChallengeReusedException.class, InsufficientFundsException.class})
    public ResponseEntity<ErrorView> handleBadRequest(EscrowException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(EscrowException.class)
    public ResponseEntity<ErrorView> handleEscrow(EscrowException e) {
        if (e.isInvariantViolation()) {
            log.error("[escrow] invariant violation: {}", e.getMessage(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorView> handleIllegalArgument(IllegalArgumentException e) {
        return body(HttpStatus.BAD_REQUEST, "IllegalArgument", e.getMessage(), false);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorView> handleInvalidBody(MethodArgumentNotValidException e) {
        FieldError fieldError = e.getBindingResult().getFieldError();
        String message = fieldError != null ? fieldError.getDefaultMessage() : "请求参数不合法";
        return body(HttpStatus.BAD_REQUEST, "InvalidRequest", message, false);
    }

    @ExceptionHandler({ItemDispatchRejectedException.class, ItemDispatchAbandonedException.class})
    public ResponseEntity<ErrorView> handleDispatch(EscrowException e) {
        log.warn("[escrow] operation not executed: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(ItemOutcomeUnknownException.class)
    public ResponseEntity<ErrorView> handleOutcomeUnknown(ItemOutcomeUnknownException e) {
        log.warn("[escrow] operation outcome unknown: {}", e.getMessage());
        return error(HttpStatus.GATEWAY_TIMEOUT, e);
    }

    private static ResponseEntity<ErrorView> error(HttpStatus status, EscrowException e) {
        return body(status, e.getClass().getSimpleName(), e.getMessage(), e.isRetryable());
    }

    private static ResponseEntity<ErrorView> body(HttpStatus status, String code, String message, boolean retryable) {
        ErrorView v = new ErrorView();
        v.setCode(code);
        v.setMessage(message);
        v.setRetryable(retryable);
        return ResponseEntity.status(status).body(v);
    }
}
