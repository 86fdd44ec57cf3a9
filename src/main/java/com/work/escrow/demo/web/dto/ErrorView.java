package com.work.escrow.demo.web.dto;

/**
 * 统一错误体：retryable 表示稍后重试可能成功（例如 item 正被预留）。
 */
public class ErrorView {

    private String code;
    private String message;
    private boolean retryable;

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public void setRetryable(boolean retryable) {
        this.retryable = retryable;
    }
}
