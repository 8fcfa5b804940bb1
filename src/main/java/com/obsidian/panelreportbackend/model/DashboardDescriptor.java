package com.obsidian.panelreportbackend.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/*
 * 描述: 解析后的仪表盘。panels 已经拍平，不包含 row 容器。
 */
@Data
public class DashboardDescriptor {

    private String uid;

    private String title;

    private List<TemplatingVar> templatingVariables = new ArrayList<>();

    private List<PanelDescriptor> panels = new ArrayList<>();

    public Optional<PanelDescriptor> findPanel(int panelId) {
        return panels.stream()
                .filter(panel -> panel.getId() == panelId)
                .findFirst();
    }
}
