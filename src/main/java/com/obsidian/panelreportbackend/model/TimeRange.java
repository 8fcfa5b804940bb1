package com.obsidian.panelreportbackend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/*
 * 描述: 报告的时间范围。
 *       每个边界可以是相对表达式 (以 "now" 开头，例如 "now-24h") 或 ISO-8601 绝对时间。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TimeRange {

    public static final String DEFAULT_FROM = "now-24h";
    public static final String DEFAULT_TO = "now";

    private String from;

    private String to;

    public String fromOrDefault() {
        return from == null || from.isEmpty() ? DEFAULT_FROM : from;
    }

    public String toOrDefault() {
        return to == null || to.isEmpty() ? DEFAULT_TO : to;
    }
}
