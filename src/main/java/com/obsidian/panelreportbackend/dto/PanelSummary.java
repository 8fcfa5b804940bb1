package com.obsidian.panelreportbackend.dto;

import com.obsidian.panelreportbackend.model.DatasourceRef;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/*
 * 描述: 面板选择列表中的一项。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PanelSummary {
    private int id;
    private String title;
    private String type;
    private String description;
    private DatasourceRef datasource;
}
