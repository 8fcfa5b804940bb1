package com.obsidian.panelreportbackend.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/*
 * 描述: 拍平后的单个面板定义。
 */
@Data
public class PanelDescriptor {

    /*
     * 仪表盘内唯一的面板ID。
     */
    private int id;

    private String title;

    private PanelType type = PanelType.OTHER;

    /*
     * JSON 中原始的 type 字符串，用于报告展示 (例如 "piechart")。
     */
    private String typeName;

    private String description;

    private List<QueryTarget> targets = new ArrayList<>();

    private DatasourceRef datasourceHint;

    /*
     * 仅 text 面板使用的文本内容。
     */
    private String content;
}
