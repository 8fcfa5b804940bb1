package com.obsidian.panelreportbackend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/*
 * 描述: /api/ds/query 的请求体。from/to 已经归一化 (相对表达式或毫秒时间戳字符串)。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {
    private String from;
    private String to;
    private List<BackendQuery> queries;
    private String requestId;
}
