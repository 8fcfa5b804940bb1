package com.obsidian.panelreportbackend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/*
 * 描述: 一个仪表盘及其被选中的面板ID列表。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PanelSelection {

    /*
     * 仪表盘 UID。
     */
    private String uid;

    private List<Integer> panels = new ArrayList<>();
}
