package com.obsidian.panelreportbackend.service;

import com.obsidian.panelreportbackend.config.GrafanaProperties;
import com.obsidian.panelreportbackend.model.BackendQuery;
import com.obsidian.panelreportbackend.model.DashboardDescriptor;
import com.obsidian.panelreportbackend.model.DatasourceDescriptor;
import com.obsidian.panelreportbackend.model.PanelDescriptor;
import com.obsidian.panelreportbackend.model.QueryRequest;
import com.obsidian.panelreportbackend.model.QueryTarget;
import com.obsidian.panelreportbackend.model.TimeRange;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/*
 * 描述: 把面板的查询目标和时间范围转换为 /api/ds/query 请求。
 */
@Component
public class QueryBuilder {

    private static final String RELATIVE_TIME_PREFIX = "now";

    private final TemplateResolver templateResolver;
    private final GrafanaProperties properties;
    private final ZoneId zone;

    public QueryBuilder(TemplateResolver templateResolver, GrafanaProperties properties) {
        this.templateResolver = templateResolver;
        this.properties = properties;
        this.zone = StringUtils.isBlank(properties.getTimeZone())
                ? ZoneId.systemDefault()
                : ZoneId.of(properties.getTimeZone());
    }

    /*
     * 返回的请求中 queries 可能为空 (所有 target 都被隐藏)，由调用方处理。
     */
    public QueryRequest build(DashboardDescriptor dashboard, PanelDescriptor panel,
                              DatasourceDescriptor datasource, TimeRange timeRange) {
        List<BackendQuery> queries = buildQueries(dashboard, panel, datasource);
        return new QueryRequest(
                normalizeTimeBound(timeRange.fromOrDefault()),
                normalizeTimeBound(timeRange.toOrDefault()),
                queries,
                "Q" + panel.getId());
    }

    List<BackendQuery> buildQueries(DashboardDescriptor dashboard, PanelDescriptor panel,
                                    DatasourceDescriptor datasource) {
        List<BackendQuery> queries = new ArrayList<>();
        List<QueryTarget> targets = panel.getTargets();
        for (int i = 0; i < targets.size(); i++) {
            QueryTarget target = targets.get(i);
            if (target.isHide()) {
                continue;
            }
            BackendQuery query = new BackendQuery();
            query.setRefId(target.getRefId() != null ? target.getRefId() : String.valueOf((char) ('A' + i)));
            query.setDatasource(datasource.toRef());
            query.setDatasourceId(datasource.getId());
            query.setIntervalMs(properties.getIntervalMs());
            query.setMaxDataPoints(properties.getMaxDataPoints());
            query.setPanelId(panel.getId());

            query.setAlias(target.getAlias());
            query.setTimeField(target.getTimeField());
            query.setFormat(target.getFormat());
            query.setQueryType(target.getQueryType());
            query.setLuceneQueryType(target.getLuceneQueryType());
            query.setMetrics(target.getMetrics());
            query.setBucketAggs(normalizeBucketAggs(target.getBucketAggs()));
            if (target.getQuery() != null) {
                query.setQuery(templateResolver.resolve(target.getQuery(), dashboard.getTemplatingVariables()));
            }
            queries.add(query);
        }
        return queries;
    }

    /*
     * 后端要求 size / interval 等设置为数值，而面板 JSON 中有时是字符串 ("10")。
     * 返回副本，不修改原始面板定义。
     */
    @SuppressWarnings("unchecked")
    List<Map<String, Object>> normalizeBucketAggs(List<Map<String, Object>> bucketAggs) {
        if (bucketAggs == null) {
            return null;
        }
        List<Map<String, Object>> normalized = new ArrayList<>();
        for (Map<String, Object> agg : bucketAggs) {
            Map<String, Object> copy = new LinkedHashMap<>(agg);
            Object settings = copy.get("settings");
            if (settings instanceof Map) {
                Map<String, Object> settingsCopy = new LinkedHashMap<>((Map<String, Object>) settings);
                settingsCopy.replaceAll((key, value) -> toIntegerIfDigits(value));
                copy.put("settings", settingsCopy);
            }
            normalized.add(copy);
        }
        return normalized;
    }

    private Object toIntegerIfDigits(Object value) {
        if (!(value instanceof String) || !StringUtils.isNumeric((String) value)) {
            return value;
        }
        BigInteger number = new BigInteger((String) value);
        if (number.bitLength() < Integer.SIZE) {
            return number.intValue();
        }
        if (number.bitLength() < Long.SIZE) {
            return number.longValue();
        }
        return number;
    }

    /*
     * "now" 开头的相对表达式原样传给后端；绝对时间转换为毫秒时间戳字符串；
     * 无法解析时原样返回，不让整个请求失败。
     */
    String normalizeTimeBound(String value) {
        if (value.startsWith(RELATIVE_TIME_PREFIX)) {
            return value;
        }
        try {
            return String.valueOf(toEpochMillis(value));
        } catch (DateTimeParseException ex) {
            return value;
        }
    }

    private long toEpochMillis(String value) {
        if (value.indexOf('T') < 0) {
            return LocalDate.parse(value).atStartOfDay(zone).toInstant().toEpochMilli();
        }
        // 没有时区偏移的时间按配置时区解释
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value, ZonedDateTime::from, LocalDateTime::from);
        if (parsed instanceof ZonedDateTime) {
            return ((ZonedDateTime) parsed).toInstant().toEpochMilli();
        }
        return ((LocalDateTime) parsed).atZone(zone).toInstant().toEpochMilli();
    }
}
