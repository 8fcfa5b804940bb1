package com.obsidian.panelreportbackend.dto;

import com.obsidian.panelreportbackend.model.TimeRange;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/*
 * 描述: 封装从前端发送过来的多面板报告生成请求。
 */
@Data
public class PanelReportRequest {

    /*
     * 多仪表盘格式: 每个元素包含仪表盘 UID 和面板ID列表。
     */
    private List<PanelSelection> dashboards = new ArrayList<>();

    /*
     * 旧格式: 单个仪表盘 UID + 面板ID列表。仅当 dashboards 为空时使用。
     */
    private String dashboardUid;

    private List<Integer> panelIds;

    private TimeRange timeRange;

    private String reportTitle;

    private String companyName;

    /*
     * 合并新旧两种格式，返回最终要处理的仪表盘列表。
     */
    public List<PanelSelection> resolveSelections() {
        if (dashboards != null && !dashboards.isEmpty()) {
            return dashboards;
        }
        if (dashboardUid == null || panelIds == null) {
            return List.of();
        }
        return List.of(new PanelSelection(dashboardUid, panelIds));
    }
}
