package com.obsidian.panelreportbackend.exception;

/*
 * 描述: 仪表盘或面板不存在时抛出。
 */
public class NotFoundException extends PanelDataException {

    public static final String CODE = "NOT_FOUND";

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
