package com.obsidian.panelreportbackend.exception;

/*
 * 描述: 面板数据流程中所有失败的基类。
 *       每个子类带有一个稳定的错误码，最终写入 PanelInfo.errorCode。
 */
public abstract class PanelDataException extends RuntimeException {

    protected PanelDataException(String message) {
        super(message);
    }

    protected PanelDataException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getCode();
}
