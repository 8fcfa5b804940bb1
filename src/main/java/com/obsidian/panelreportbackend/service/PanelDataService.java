package com.obsidian.panelreportbackend.service;

import com.obsidian.panelreportbackend.client.MonitoringBackendClient;
import com.obsidian.panelreportbackend.config.GrafanaProperties;
import com.obsidian.panelreportbackend.config.ReportProperties;
import com.obsidian.panelreportbackend.dto.PanelInfo;
import com.obsidian.panelreportbackend.dto.PanelResult;
import com.obsidian.panelreportbackend.dto.PanelSelection;
import com.obsidian.panelreportbackend.exception.BackendUnavailableException;
import com.obsidian.panelreportbackend.exception.NoDatasourceException;
import com.obsidian.panelreportbackend.exception.NotFoundException;
import com.obsidian.panelreportbackend.exception.PanelBatchException;
import com.obsidian.panelreportbackend.exception.PanelDataException;
import com.obsidian.panelreportbackend.model.DashboardDescriptor;
import com.obsidian.panelreportbackend.model.DatasourceDescriptor;
import com.obsidian.panelreportbackend.model.PanelDescriptor;
import com.obsidian.panelreportbackend.model.PanelType;
import com.obsidian.panelreportbackend.model.QueryRequest;
import com.obsidian.panelreportbackend.model.QueryResponse;
import com.obsidian.panelreportbackend.model.TimeRange;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/*
 * 描述: 面板数据获取的核心服务。
 *       单个面板: 获取仪表盘 -> 定位面板 -> 解析数据源 -> 构建查询 -> 调用后端 -> 归一化 -> 按类型聚合。
 *       任何单个面板的失败都会被转换为错误占位结果，不会影响同一批次中的其他面板。
 */
@Slf4j
@Service
public class PanelDataService {

    static final String NO_QUERY = "NO_QUERY";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final DashboardFetcher dashboardFetcher;
    private final MonitoringBackendClient client;
    private final DatasourceResolver datasourceResolver;
    private final QueryBuilder queryBuilder;
    private final FrameNormalizer frameNormalizer;
    private final PanelAggregator panelAggregator;
    private final GrafanaProperties grafanaProperties;
    private final ReportProperties reportProperties;
    private final ExecutorService panelExecutor;

    public PanelDataService(DashboardFetcher dashboardFetcher,
                            MonitoringBackendClient client,
                            DatasourceResolver datasourceResolver,
                            QueryBuilder queryBuilder,
                            FrameNormalizer frameNormalizer,
                            PanelAggregator panelAggregator,
                            GrafanaProperties grafanaProperties,
                            ReportProperties reportProperties,
                            ExecutorService panelExecutor) {
        this.dashboardFetcher = dashboardFetcher;
        this.client = client;
        this.datasourceResolver = datasourceResolver;
        this.queryBuilder = queryBuilder;
        this.frameNormalizer = frameNormalizer;
        this.panelAggregator = panelAggregator;
        this.grafanaProperties = grafanaProperties;
        this.reportProperties = reportProperties;
        this.panelExecutor = panelExecutor;
    }

    /**
     * 获取单个面板的数据。永远不会抛出异常，失败时返回 fields=["Error"] 的占位结果。
     */
    public PanelResult fetchPanelData(String dashboardUid, int panelId, TimeRange timeRange) {
        return fetchPanel(dashboardUid, panelId, timeRange).result;
    }

    private PanelOutcome fetchPanel(String dashboardUid, int panelId, TimeRange timeRange) {
        PanelDescriptor panel = null;
        try {
            DashboardDescriptor dashboard = dashboardFetcher.fetch(dashboardUid);
            Optional<PanelDescriptor> found = dashboard.findPanel(panelId);
            if (found.isEmpty()) {
                return PanelOutcome.unresolved(PanelResults.error(panelId, null, "Panel not found", NotFoundException.CODE));
            }
            panel = found.get();
            return PanelOutcome.resolved(loadPanel(dashboard, panel, timeRange));
        } catch (PanelDataException ex) {
            log.error("[ERROR] panel data dashboard={} panel={}: {}", dashboardUid, panelId, ex.getMessage(), ex);
            return new PanelOutcome(PanelResults.error(panelId, panel, "Error: " + ex.getMessage(), ex.getCode()),
                    panel != null);
        } catch (RuntimeException ex) {
            log.error("[ERROR] panel data dashboard={} panel={}", dashboardUid, panelId, ex);
            return new PanelOutcome(PanelResults.error(panelId, panel, "Error: " + ex.getMessage(), INTERNAL_ERROR),
                    panel != null);
        }
    }

    private PanelResult loadPanel(DashboardDescriptor dashboard, PanelDescriptor panel, TimeRange timeRange) {
        if (panel.getType() == PanelType.TEXT) {
            return PanelResults.text(panel);
        }
        if (panel.getTargets().isEmpty()) {
            return PanelResults.error(panel.getId(), panel, "No query targets", NO_QUERY);
        }

        // 每次请求都重新获取数据源列表，不做缓存
        DatasourceDescriptor datasource;
        try {
            datasource = datasourceResolver.resolve(grafanaProperties.getDatasourceType(), client.listDatasources());
        } catch (NoDatasourceException ex) {
            log.warn("panel {} skipped: {}", panel.getId(), ex.getMessage());
            return PanelResults.error(panel.getId(), panel, ex.getMessage(), ex.getCode());
        }

        QueryRequest request = queryBuilder.build(dashboard, panel, datasource, timeRange);
        if (request.getQueries().isEmpty()) {
            return PanelResults.error(panel.getId(), panel, "No valid queries", NO_QUERY);
        }

        QueryResponse response = client.query(request);
        NormalizedTable table = frameNormalizer.normalize(response, panel);
        PanelResult result = panelAggregator.aggregate(panel.getType(), table);
        result.setPanel(PanelResults.info(panel));
        log.debug("[PROCESS] panel '{}' type={} -> {} rows", panel.getTitle(), panel.getTypeName(),
                result.getRows().size());
        return result;
    }

    /**
     * 批量获取多个仪表盘中的面板数据。
     * 面板在线程池中并行处理，结果顺序与请求顺序一致，请求 N 个面板一定返回 N 个结果。
     *
     * @throws PanelBatchException 请求中没有任何面板，或没有任何一个面板能被定位 (仪表盘获取失败或面板不存在)
     */
    public List<PanelResult> fetchPanelDataBatch(List<PanelSelection> selections, TimeRange timeRange) {
        List<PanelRef> refs = flatten(selections);
        if (refs.isEmpty()) {
            throw new PanelBatchException("No panels selected");
        }

        List<Future<PanelOutcome>> futures = new ArrayList<>(refs.size());
        for (PanelRef ref : refs) {
            futures.add(panelExecutor.submit(() -> fetchPanel(ref.dashboardUid, ref.panelId, timeRange)));
        }

        List<PanelOutcome> outcomes = new ArrayList<>(refs.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                outcomes.add(await(futures.get(i), refs.get(i)));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                futures.forEach(future -> future.cancel(true));
                throw new PanelBatchException("Interrupted while collecting panel data", ex);
            }
        }

        // 只要有一个面板被定位到，查询失败也只产生占位结果
        if (outcomes.stream().noneMatch(outcome -> outcome.resolved)) {
            throw new PanelBatchException("Failed to fetch data for any of the selected panels: "
                    + outcomes.get(0).result.getPanel().getError());
        }
        List<PanelResult> results = new ArrayList<>(outcomes.size());
        outcomes.forEach(outcome -> results.add(outcome.result));
        return results;
    }

    private PanelOutcome await(Future<PanelOutcome> future, PanelRef ref) throws InterruptedException {
        int timeoutSeconds = Math.max(1, reportProperties.getPanelTimeoutSeconds());
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("panel {} of dashboard {} timed out after {}s", ref.panelId, ref.dashboardUid, timeoutSeconds);
            return PanelOutcome.unresolved(PanelResults.error(batchErrorInfo(ref),
                    "Failed to fetch data: timed out after " + timeoutSeconds + "s",
                    BackendUnavailableException.CODE));
        } catch (ExecutionException ex) {
            log.error("panel {} of dashboard {} failed", ref.panelId, ref.dashboardUid, ex.getCause());
            return PanelOutcome.unresolved(PanelResults.error(batchErrorInfo(ref),
                    "Failed to fetch data: " + ex.getCause().getMessage(), INTERNAL_ERROR));
        }
    }

    private PanelInfo batchErrorInfo(PanelRef ref) {
        return PanelInfo.builder()
                .id(ref.panelId)
                .title("Panel " + ref.panelId + " (Error)")
                .type(PanelResults.UNKNOWN_TYPE)
                .description("Error fetching panel data")
                .build();
    }

    private List<PanelRef> flatten(List<PanelSelection> selections) {
        List<PanelRef> refs = new ArrayList<>();
        if (selections == null) {
            return refs;
        }
        for (PanelSelection selection : selections) {
            if (selection == null || StringUtils.isBlank(selection.getUid()) || selection.getPanels() == null) {
                continue;
            }
            for (Integer panelId : selection.getPanels()) {
                if (panelId != null) {
                    refs.add(new PanelRef(selection.getUid(), panelId));
                }
            }
        }
        return refs;
    }

    private static final class PanelRef {
        private final String dashboardUid;
        private final int panelId;

        private PanelRef(String dashboardUid, int panelId) {
            this.dashboardUid = dashboardUid;
            this.panelId = panelId;
        }
    }

    /*
     * resolved 表示仪表盘已获取且面板已定位，与后续查询是否成功无关。
     */
    private static final class PanelOutcome {
        private final PanelResult result;
        private final boolean resolved;

        private PanelOutcome(PanelResult result, boolean resolved) {
            this.result = result;
            this.resolved = resolved;
        }

        private static PanelOutcome resolved(PanelResult result) {
            return new PanelOutcome(result, true);
        }

        private static PanelOutcome unresolved(PanelResult result) {
            return new PanelOutcome(result, false);
        }
    }
}
