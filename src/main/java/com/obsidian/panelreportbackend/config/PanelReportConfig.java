package com.obsidian.panelreportbackend.config;

import com.obsidian.panelreportbackend.service.TimestampFormatter;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/*
 * 描述: 面板数据管线的 Bean 装配。
 */
@Configuration
@EnableConfigurationProperties({GrafanaProperties.class, ReportProperties.class})
public class PanelReportConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService panelExecutor(ReportProperties reportProperties) {
        int threads = Math.max(1, reportProperties.getPanelConcurrency());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "panel-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }

    @Bean
    public TimestampFormatter timestampFormatter(GrafanaProperties grafanaProperties) {
        ZoneId zone = StringUtils.isBlank(grafanaProperties.getTimeZone())
                ? ZoneId.systemDefault()
                : ZoneId.of(grafanaProperties.getTimeZone());
        return new TimestampFormatter(zone);
    }
}
