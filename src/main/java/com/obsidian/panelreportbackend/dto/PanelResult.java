package com.obsidian.panelreportbackend.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/*
 * 描述: 单个面板的表格化结果，是报告生成的唯一输入结构。
 *       rows 中每一行与 fields 一一对应。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PanelResult {

    private List<String> fields = new ArrayList<>();

    private List<List<Object>> rows = new ArrayList<>();

    /*
     * 人类可读的摘要，例如 "12 rows" 或 "Sum of Count column = 10"。
     */
    private String summary;

    private PanelInfo panel;

    public PanelResult(List<String> fields, List<List<Object>> rows, String summary) {
        this.fields = fields;
        this.rows = rows;
        this.summary = summary;
    }

    @JsonIgnore
    public boolean isError() {
        return panel != null && panel.getError() != null;
    }
}
