package com.obsidian.panelreportbackend.service;

import com.obsidian.panelreportbackend.dto.PanelInfo;
import com.obsidian.panelreportbackend.dto.PanelResult;
import com.obsidian.panelreportbackend.model.PanelDescriptor;

import java.util.ArrayList;
import java.util.List;

/*
 * 描述: 构造面板结果 (包括错误占位结果) 的工具方法。
 *       错误结果的结构固定为 fields=["Error"]、一行错误信息，保证报告生成总能拿到合法结构。
 */
public final class PanelResults {

    public static final String ERROR_FIELD = "Error";
    public static final String CONTENT_FIELD = "Content";

    static final String UNKNOWN_TITLE = "Unknown Panel";
    static final String UNKNOWN_TYPE = "unknown";

    private PanelResults() {
    }

    public static PanelInfo info(PanelDescriptor panel) {
        return PanelInfo.builder()
                .id(panel.getId())
                .title(panel.getTitle())
                .type(panel.getTypeName())
                .description(panel.getDescription())
                .build();
    }

    /*
     * panel 为 null 表示面板本身没有找到，此时使用 "Unknown Panel" 占位。
     */
    public static PanelResult error(int panelId, PanelDescriptor panel, String message, String code) {
        PanelInfo info = panel != null
                ? info(panel)
                : PanelInfo.builder().id(panelId).title(UNKNOWN_TITLE).type(UNKNOWN_TYPE).description("").build();
        return error(info, message, code);
    }

    public static PanelResult error(PanelInfo info, String message, String code) {
        info.setError(message);
        info.setErrorCode(code);
        PanelResult result = new PanelResult(singletonField(ERROR_FIELD), singletonRow(message), null);
        result.setPanel(info);
        return result;
    }

    public static PanelResult text(PanelDescriptor panel) {
        PanelResult result = new PanelResult(singletonField(CONTENT_FIELD), singletonRow(panel.getContent()), null);
        result.setPanel(info(panel));
        return result;
    }

    private static List<String> singletonField(String name) {
        List<String> fields = new ArrayList<>();
        fields.add(name);
        return fields;
    }

    private static List<List<Object>> singletonRow(Object value) {
        List<Object> row = new ArrayList<>();
        row.add(value);
        List<List<Object>> rows = new ArrayList<>();
        rows.add(row);
        return rows;
    }
}
