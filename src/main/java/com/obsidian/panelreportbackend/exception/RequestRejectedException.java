package com.obsidian.panelreportbackend.exception;

/*
 * 描述: 后端以 4xx (404 除外) 拒绝请求时抛出，例如鉴权失败或查询语法错误。
 */
public class RequestRejectedException extends PanelDataException {

    public static final String CODE = "REQUEST_REJECTED";

    public RequestRejectedException(String message) {
        super(message);
    }

    public RequestRejectedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
