package com.obsidian.panelreportbackend.exception;

/*
 * 描述: 后端响应结构不符合预期时抛出。
 */
public class MalformedResponseException extends PanelDataException {

    public static final String CODE = "MALFORMED_RESPONSE";

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
