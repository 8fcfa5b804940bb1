package com.obsidian.panelreportbackend.model;

import lombok.Data;

import java.util.List;
import java.util.Map;

/*
 * 描述: 面板中的单个查询目标 (panel.targets[i])。
 *       只保留构建后端查询时会读取的字段，字段为 null 表示原始 JSON 中没有该键。
 */
@Data
public class QueryTarget {

    private String refId;

    private boolean hide;

    /*
     * Lucene 查询字符串，可能包含 ${var} 形式的模板变量。
     */
    private String query;

    private String alias;

    private String timeField;

    private String format;

    private String queryType;

    private String luceneQueryType;

    private List<Map<String, Object>> bucketAggs;

    private List<Map<String, Object>> metrics;

    private DatasourceRef datasource;
}
