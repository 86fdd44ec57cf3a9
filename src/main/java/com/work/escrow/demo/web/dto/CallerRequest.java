package com.work.escrow.demo.web.dto;

import javax.validation.constraints.NotBlank;

/**
 * 撤回 / 下架 / 取回共用：只需要调用方身份。
 */
public class CallerRequest {

    @NotBlank(message = "caller 不能为空")
    private String caller;

    public String getCaller() {
        return caller;
    }

    public void setCaller(String caller) {
        this.caller = caller;
    }
}
