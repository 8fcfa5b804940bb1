package com.obsidian.panelreportbackend.service;

import com.obsidian.panelreportbackend.client.MonitoringBackendClient;
import com.obsidian.panelreportbackend.config.GrafanaProperties;
import com.obsidian.panelreportbackend.config.ReportProperties;
import com.obsidian.panelreportbackend.dto.PanelResult;
import com.obsidian.panelreportbackend.dto.PanelSelection;
import com.obsidian.panelreportbackend.exception.BackendUnavailableException;
import com.obsidian.panelreportbackend.exception.MalformedResponseException;
import com.obsidian.panelreportbackend.exception.NoDatasourceException;
import com.obsidian.panelreportbackend.exception.NotFoundException;
import com.obsidian.panelreportbackend.exception.PanelBatchException;
import com.obsidian.panelreportbackend.model.DashboardDescriptor;
import com.obsidian.panelreportbackend.model.DatasourceDescriptor;
import com.obsidian.panelreportbackend.model.FieldSchema;
import com.obsidian.panelreportbackend.model.Frame;
import com.obsidian.panelreportbackend.model.PanelDescriptor;
import com.obsidian.panelreportbackend.model.PanelType;
import com.obsidian.panelreportbackend.model.QueryRequest;
import com.obsidian.panelreportbackend.model.QueryResponse;
import com.obsidian.panelreportbackend.model.QueryTarget;
import com.obsidian.panelreportbackend.model.TimeRange;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class PanelDataServiceTest {

    private static final String UID = "sec-overview";
    private static final TimeRange LAST_DAY = new TimeRange("now-24h", "now");

    private DashboardFetcher dashboardFetcher;
    private MonitoringBackendClient client;
    private ReportProperties reportProperties;
    private ExecutorService executor;
    private PanelDataService service;

    @BeforeEach
    public void setUp() {
        dashboardFetcher = mock(DashboardFetcher.class);
        client = mock(MonitoringBackendClient.class);
        GrafanaProperties grafanaProperties = new GrafanaProperties();
        grafanaProperties.setTimeZone("UTC");
        reportProperties = new ReportProperties();
        executor = Executors.newFixedThreadPool(2);

        service = new PanelDataService(
                dashboardFetcher,
                client,
                new DatasourceResolver(),
                new QueryBuilder(new TemplateResolver(), grafanaProperties),
                new FrameNormalizer(new TimestampFormatter(ZoneOffset.UTC)),
                new PanelAggregator(),
                grafanaProperties,
                reportProperties,
                executor);

        when(dashboardFetcher.fetch(UID)).thenReturn(dashboard());
        when(client.listDatasources()).thenReturn(List.of(
                new DatasourceDescriptor(9L, "os-main", "OpenSearch", "grafana-opensearch-datasource", true)));
        when(client.query(any(QueryRequest.class))).thenReturn(termsResponse());
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void testStatPanelReducedToTotal() {
        PanelResult result = service.fetchPanelData(UID, 5, LAST_DAY);

        Assertions.assertFalse(result.isError());
        Assertions.assertEquals(List.of("TOTAL"), result.getFields());
        Assertions.assertEquals(10L, result.getRows().get(0).get(0));
        Assertions.assertEquals("Events", result.getPanel().getTitle());
        Assertions.assertEquals("stat", result.getPanel().getType());
    }

    @Test
    public void testTablePanelPassesThrough() {
        PanelResult result = service.fetchPanelData(UID, 6, LAST_DAY);

        Assertions.assertEquals(Arrays.asList("Term", "Count"), result.getFields());
        Assertions.assertEquals(2, result.getRows().size());
        Assertions.assertEquals("2 rows", result.getSummary());
    }

    @Test
    public void testTextPanelNeverQueries() {
        PanelResult result = service.fetchPanelData(UID, 8, LAST_DAY);

        Assertions.assertEquals(List.of(PanelResults.CONTENT_FIELD), result.getFields());
        Assertions.assertEquals("Read me first", result.getRows().get(0).get(0));
        verify(client, never()).listDatasources();
        verify(client, never()).query(any());
    }

    @Test
    public void testPanelNotFound() {
        PanelResult result = service.fetchPanelData(UID, 99, LAST_DAY);

        Assertions.assertTrue(result.isError());
        Assertions.assertEquals(List.of(PanelResults.ERROR_FIELD), result.getFields());
        Assertions.assertEquals("Panel not found", result.getRows().get(0).get(0));
        Assertions.assertEquals("Unknown Panel", result.getPanel().getTitle());
        Assertions.assertEquals("unknown", result.getPanel().getType());
        Assertions.assertEquals(NotFoundException.CODE, result.getPanel().getErrorCode());
    }

    @Test
    public void testPanelWithoutTargets() {
        PanelResult result = service.fetchPanelData(UID, 10, LAST_DAY);

        Assertions.assertEquals("No query targets", result.getPanel().getError());
        Assertions.assertEquals(PanelDataService.NO_QUERY, result.getPanel().getErrorCode());
        Assertions.assertEquals("Pie", result.getPanel().getTitle());
    }

    @Test
    public void testAllTargetsHidden() {
        PanelResult result = service.fetchPanelData(UID, 11, LAST_DAY);

        Assertions.assertEquals("No valid queries", result.getPanel().getError());
        verify(client, never()).query(any());
    }

    @Test
    public void testNoDatasource() {
        when(client.listDatasources()).thenReturn(List.of(
                new DatasourceDescriptor(1L, "prom", "Prometheus", "prometheus", true)));

        PanelResult result = service.fetchPanelData(UID, 5, LAST_DAY);

        Assertions.assertEquals("No default datasource of type 'grafana-opensearch-datasource' found",
                result.getRows().get(0).get(0));
        Assertions.assertEquals(NoDatasourceException.CODE, result.getPanel().getErrorCode());
        Assertions.assertEquals("Events", result.getPanel().getTitle());
    }

    @Test
    public void testBackendErrorBecomesPlaceholder() {
        when(client.query(any(QueryRequest.class))).thenThrow(new MalformedResponseException("Query response has no 'results' object"));

        PanelResult result = service.fetchPanelData(UID, 5, LAST_DAY);

        Assertions.assertEquals("Error: Query response has no 'results' object", result.getPanel().getError());
        Assertions.assertEquals(MalformedResponseException.CODE, result.getPanel().getErrorCode());
    }

    @Test
    public void testUnexpectedErrorBecomesPlaceholder() {
        when(dashboardFetcher.fetch("broken")).thenThrow(new IllegalStateException("boom"));

        PanelResult result = service.fetchPanelData("broken", 1, LAST_DAY);

        Assertions.assertEquals("Error: boom", result.getPanel().getError());
        Assertions.assertEquals(PanelDataService.INTERNAL_ERROR, result.getPanel().getErrorCode());
    }

    @Test
    public void testBatchKeepsOrderAndIsolatesFailures() {
        when(client.query(any(QueryRequest.class))).thenAnswer(invocation -> {
            QueryRequest request = invocation.getArgument(0);
            if ("Q6".equals(request.getRequestId())) {
                throw new BackendUnavailableException("Query Q6 failed: HTTP 503");
            }
            return termsResponse();
        });

        List<PanelResult> results = service.fetchPanelDataBatch(
                List.of(new PanelSelection(UID, Arrays.asList(5, 6, 7))), LAST_DAY);

        Assertions.assertEquals(3, results.size());
        Assertions.assertEquals(5, results.get(0).getPanel().getId());
        Assertions.assertEquals(6, results.get(1).getPanel().getId());
        Assertions.assertEquals(7, results.get(2).getPanel().getId());
        Assertions.assertFalse(results.get(0).isError());
        Assertions.assertTrue(results.get(1).isError());
        Assertions.assertEquals(BackendUnavailableException.CODE, results.get(1).getPanel().getErrorCode());
        Assertions.assertEquals("2 points", results.get(2).getSummary());
    }

    @Test
    public void testBatchAcrossDashboards() {
        DashboardDescriptor other = new DashboardDescriptor();
        other.setUid("other");
        other.getPanels().add(textPanel(1, "Other dashboard"));
        when(dashboardFetcher.fetch("other")).thenReturn(other);

        List<PanelResult> results = service.fetchPanelDataBatch(Arrays.asList(
                new PanelSelection("other", List.of(1)),
                new PanelSelection(" ", List.of(5)),
                new PanelSelection(UID, Arrays.asList(8, null))), LAST_DAY);

        Assertions.assertEquals(2, results.size());
        Assertions.assertEquals("Other dashboard", results.get(0).getRows().get(0).get(0));
        Assertions.assertEquals("Read me first", results.get(1).getRows().get(0).get(0));
    }

    @Test
    public void testBatchFailsWhenDashboardUnreachable() {
        when(dashboardFetcher.fetch(UID)).thenThrow(new BackendUnavailableException("Dashboard sec-overview failed: HTTP 502"));

        PanelBatchException ex = Assertions.assertThrows(PanelBatchException.class,
                () -> service.fetchPanelDataBatch(List.of(new PanelSelection(UID, Arrays.asList(5, 6))), LAST_DAY));
        Assertions.assertTrue(ex.getMessage().contains("Dashboard sec-overview failed: HTTP 502"));
    }

    @Test
    public void testBatchFailsWhenNoPanelExists() {
        Assertions.assertThrows(PanelBatchException.class,
                () -> service.fetchPanelDataBatch(List.of(new PanelSelection(UID, Arrays.asList(98, 99))), LAST_DAY));
    }

    @Test
    public void testBatchReturnsPlaceholdersWhenEveryQueryFails() {
        when(client.query(any(QueryRequest.class))).thenThrow(new BackendUnavailableException("Query failed: HTTP 400"));

        List<PanelResult> results = service.fetchPanelDataBatch(
                List.of(new PanelSelection(UID, Arrays.asList(5, 6))), LAST_DAY);

        Assertions.assertEquals(2, results.size());
        for (PanelResult result : results) {
            Assertions.assertTrue(result.isError());
            Assertions.assertEquals(BackendUnavailableException.CODE, result.getPanel().getErrorCode());
            Assertions.assertEquals("Error: Query failed: HTTP 400", result.getPanel().getError());
        }
        Assertions.assertEquals("Events", results.get(0).getPanel().getTitle());
        Assertions.assertEquals("Top Hosts", results.get(1).getPanel().getTitle());
    }

    @Test
    public void testBatchWithMixedErrorsIsNotFatal() {
        when(client.listDatasources()).thenThrow(new BackendUnavailableException("Datasource list failed: HTTP 502"));

        List<PanelResult> results = service.fetchPanelDataBatch(
                List.of(new PanelSelection(UID, Arrays.asList(5, 99))), LAST_DAY);

        Assertions.assertEquals(2, results.size());
        Assertions.assertTrue(results.get(0).isError());
        Assertions.assertEquals(NotFoundException.CODE, results.get(1).getPanel().getErrorCode());
    }

    @Test
    public void testBatchWithoutPanels() {
        Assertions.assertThrows(PanelBatchException.class, () -> service.fetchPanelDataBatch(List.of(), LAST_DAY));
        Assertions.assertThrows(PanelBatchException.class, () -> service.fetchPanelDataBatch(
                List.of(new PanelSelection(UID, List.of())), LAST_DAY));
    }

    @Test
    public void testSlowPanelTimesOut() {
        reportProperties.setPanelTimeoutSeconds(1);
        when(client.query(any(QueryRequest.class))).thenAnswer(invocation -> {
            Thread.sleep(10_000);
            return termsResponse();
        });

        List<PanelResult> results = service.fetchPanelDataBatch(
                List.of(new PanelSelection(UID, Arrays.asList(5, 8))), LAST_DAY);

        Assertions.assertEquals(2, results.size());
        Assertions.assertEquals("Panel 5 (Error)", results.get(0).getPanel().getTitle());
        Assertions.assertEquals("Failed to fetch data: timed out after 1s", results.get(0).getPanel().getError());
        Assertions.assertEquals(BackendUnavailableException.CODE, results.get(0).getPanel().getErrorCode());
        Assertions.assertFalse(results.get(1).isError());
    }

    private static DashboardDescriptor dashboard() {
        DashboardDescriptor dashboard = new DashboardDescriptor();
        dashboard.setUid(UID);
        dashboard.setTitle("Security Overview");
        dashboard.getPanels().add(queryPanel(5, "Events", PanelType.STAT, "stat"));
        dashboard.getPanels().add(queryPanel(6, "Top Hosts", PanelType.TABLE, "table"));
        dashboard.getPanels().add(queryPanel(7, "Timeline", PanelType.TIMESERIES, "timeseries"));
        dashboard.getPanels().add(textPanel(8, "Read me first"));

        PanelDescriptor pie = new PanelDescriptor();
        pie.setId(10);
        pie.setTitle("Pie");
        pie.setTypeName("piechart");
        dashboard.getPanels().add(pie);

        PanelDescriptor hidden = queryPanel(11, "Hidden", PanelType.TABLE, "table");
        hidden.getTargets().get(0).setHide(true);
        dashboard.getPanels().add(hidden);
        return dashboard;
    }

    private static PanelDescriptor queryPanel(int id, String title, PanelType type, String typeName) {
        PanelDescriptor panel = new PanelDescriptor();
        panel.setId(id);
        panel.setTitle(title);
        panel.setType(type);
        panel.setTypeName(typeName);
        QueryTarget target = new QueryTarget();
        target.setRefId("A");
        target.setQuery("*");
        panel.getTargets().add(target);
        return panel;
    }

    private static PanelDescriptor textPanel(int id, String content) {
        PanelDescriptor panel = new PanelDescriptor();
        panel.setId(id);
        panel.setTitle("Notes");
        panel.setType(PanelType.TEXT);
        panel.setTypeName("text");
        panel.setContent(content);
        return panel;
    }

    private static QueryResponse termsResponse() {
        Frame frame = new Frame(
                Arrays.asList(new FieldSchema("Term", null), new FieldSchema("Count", "Count")),
                Arrays.asList(Arrays.asList("a", "b"), Arrays.asList(3, 7)));
        QueryResponse response = new QueryResponse();
        response.getFramesByRefId().put("A", List.of(frame));
        return response;
    }
}
