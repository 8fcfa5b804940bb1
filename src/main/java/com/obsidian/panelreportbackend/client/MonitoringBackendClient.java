package com.obsidian.panelreportbackend.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.obsidian.panelreportbackend.model.DatasourceDescriptor;
import com.obsidian.panelreportbackend.model.QueryRequest;
import com.obsidian.panelreportbackend.model.QueryResponse;

import java.util.List;

/*
 * 描述: 监控后端 (仪表盘、数据源、查询执行) 的调用接口。
 *       实现类负责把传输层失败转换为 PanelDataException:
 *       资源不存在 -> NotFoundException，连接失败或 5xx -> BackendUnavailableException，
 *       其余 4xx -> RequestRejectedException，响应结构异常 -> MalformedResponseException。
 */
public interface MonitoringBackendClient {

    /*
     * 返回原始的仪表盘信封 {"dashboard": {...}, "meta": {...}}。
     */
    JsonNode getDashboard(String dashboardUid);

    List<DatasourceDescriptor> listDatasources();

    QueryResponse query(QueryRequest request);
}
