package com.obsidian.panelreportbackend.service;

import com.obsidian.panelreportbackend.dto.PanelSummary;
import com.obsidian.panelreportbackend.model.DashboardDescriptor;

import java.util.List;

/*
 * 描述: 获取仪表盘定义并把 row 容器中的面板拍平。
 */
public interface DashboardFetcher {

    /*
     * 仪表盘不存在时抛出 NotFoundException，无法连接后端时抛出 BackendUnavailableException。
     */
    DashboardDescriptor fetch(String dashboardUid);

    List<PanelSummary> listPanels(String dashboardUid);
}
