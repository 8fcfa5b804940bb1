package com.obsidian.panelreportbackend.dto;

import com.obsidian.panelreportbackend.model.TimeRange;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/*
 * 描述: GET /api/reports/panel-data 的响应，用于前端预览单个面板的数据。
 */
@Data
@Builder
public class PanelDataResponse {
    private PanelInfo panelInfo;
    private List<String> fields;
    private List<List<Object>> rows;
    private int rowCount;
    private TimeRange timeRange;

    public static PanelDataResponse of(PanelResult result, TimeRange timeRange) {
        return PanelDataResponse.builder()
                .panelInfo(result.getPanel())
                .fields(result.getFields())
                .rows(result.getRows())
                .rowCount(result.getRows() == null ? 0 : result.getRows().size())
                .timeRange(timeRange)
                .build();
    }
}
