package com.obsidian.panelreportbackend.exception;

/*
 * 描述: 后端无法连接、超时或返回 5xx 时抛出。
 */
public class BackendUnavailableException extends PanelDataException {

    public static final String CODE = "BACKEND_UNAVAILABLE";

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
