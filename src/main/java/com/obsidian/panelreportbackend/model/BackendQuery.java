package com.obsidian.panelreportbackend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.List;
import java.util.Map;

/*
 * 描述: 发送给 /api/ds/query 的单个查询对象。
 *       可选字段为 null 时不序列化，与原始面板 target 中"没有该键"保持一致。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BackendQuery {

    private String refId;

    private DatasourceRef datasource;

    private Long datasourceId;

    private long intervalMs;

    private int maxDataPoints;

    private int panelId;

    private String query;

    private List<Map<String, Object>> bucketAggs;

    private List<Map<String, Object>> metrics;

    private String alias;

    private String timeField;

    private String format;

    private String queryType;

    private String luceneQueryType;
}
