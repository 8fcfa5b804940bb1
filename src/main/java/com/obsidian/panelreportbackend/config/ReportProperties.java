package com.obsidian.panelreportbackend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "report")
public class ReportProperties {

    private String defaultTitle = "Security Report";

    // 同时处理的面板数上限
    private int panelConcurrency = 4;

    private int panelTimeoutSeconds = 60;
}
