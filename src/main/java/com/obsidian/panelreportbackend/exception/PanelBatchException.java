package com.obsidian.panelreportbackend.exception;

/*
 * 描述: 批量请求无法产生任何可用面板时抛出。
 */
public class PanelBatchException extends PanelDataException {

    public static final String CODE = "BATCH_FAILED";

    public PanelBatchException(String message) {
        super(message);
    }

    public PanelBatchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
