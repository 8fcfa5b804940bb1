package com.obsidian.panelreportbackend.exception;

/*
 * 描述: 没有配置所需类型的默认数据源时抛出。
 */
public class NoDatasourceException extends PanelDataException {

    public static final String CODE = "NO_DATASOURCE";

    public NoDatasourceException(String message) {
        super(message);
    }

    public NoDatasourceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}
