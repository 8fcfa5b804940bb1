package com.obsidian.panelreportbackend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/*
 * 描述: Grafana 连接与查询相关的配置 (application.yml 中的 grafana.*)。
 */
@Data
@ConfigurationProperties(prefix = "grafana")
public class GrafanaProperties {

    private String url = "http://localhost:3000";

    /*
     * Service account token / API key，为空时不发送 Authorization 头。
     */
    private String apiKey;

    private Integer timeoutSeconds = 30;

    /*
     * 查询时要求的默认数据源类型。
     */
    private String datasourceType = "grafana-opensearch-datasource";

    private long intervalMs = 60000L;

    private int maxDataPoints = 500;

    /*
     * 时间戳格式化使用的时区，为空时使用系统默认时区。
     */
    private String timeZone;
}
