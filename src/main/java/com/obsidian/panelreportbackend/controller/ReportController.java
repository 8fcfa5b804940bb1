// com/obsidian/panelreportbackend/controller/ReportController.java
package com.obsidian.panelreportbackend.controller;

import com.obsidian.panelreportbackend.config.ReportProperties;
import com.obsidian.panelreportbackend.dto.PanelDataResponse;
import com.obsidian.panelreportbackend.dto.PanelReportRequest;
import com.obsidian.panelreportbackend.dto.PanelResult;
import com.obsidian.panelreportbackend.dto.PanelSummary;
import com.obsidian.panelreportbackend.model.TimeRange;
import com.obsidian.panelreportbackend.service.DashboardFetcher;
import com.obsidian.panelreportbackend.service.PanelDataService;
import com.obsidian.panelreportbackend.service.PanelReportService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.List;
import java.util.Map;

/*
 * 描述: API 控制器，定义了面板数据预览和报告生成的端点(endpoint)。
 *       它负责接收HTTP请求，调用服务处理，并返回 JSON 或文件响应。
 */
@Slf4j
@RestController
@RequestMapping("/api/reports") // 所有请求都以 /api/reports 为前缀
@CrossOrigin(origins = "*", exposedHeaders = {"Content-Disposition"})
public class ReportController {

    private static final MediaType XLSX = MediaType.valueOf("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final PanelDataService panelDataService;
    private final PanelReportService reportService;
    private final DashboardFetcher dashboardFetcher;
    private final ReportProperties reportProperties;

    public ReportController(PanelDataService panelDataService,
                            PanelReportService reportService,
                            DashboardFetcher dashboardFetcher,
                            ReportProperties reportProperties) {
        this.panelDataService = panelDataService;
        this.reportService = reportService;
        this.dashboardFetcher = dashboardFetcher;
        this.reportProperties = reportProperties;
    }

    /*
     * 列出仪表盘中 (拍平后) 的所有面板，供前端选择。
     */
    @GetMapping("/panels")
    public Map<String, List<PanelSummary>> getDashboardPanels(@RequestParam("dashboardUid") String dashboardUid) {
        return Map.of("panels", dashboardFetcher.listPanels(dashboardUid));
    }

    /*
     * 预览单个面板的数据。面板失败时仍返回 200，错误信息在 panelInfo.error 中。
     */
    @GetMapping("/panel-data")
    public PanelDataResponse getPanelData(@RequestParam("dashboardUid") String dashboardUid,
                                          @RequestParam("panelId") int panelId,
                                          @RequestParam(value = "from", defaultValue = TimeRange.DEFAULT_FROM) String from,
                                          @RequestParam(value = "to", defaultValue = TimeRange.DEFAULT_TO) String to) {
        TimeRange timeRange = new TimeRange(from, to);
        PanelResult result = panelDataService.fetchPanelData(dashboardUid, panelId, timeRange);
        return PanelDataResponse.of(result, timeRange);
    }

    /*
     * 根据选中的面板生成多工作表 XLSX 报告。
     * @param request 包含仪表盘/面板选择、时间范围和报告标题的 JSON 对象
     * @return 返回一个包含文件内容的HTTP响应
     */
    @PostMapping(value = "/generate-from-panels", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<byte[]> generateReportFromPanels(@RequestBody PanelReportRequest request) throws IOException {
        TimeRange timeRange = request.getTimeRange();
        if (timeRange == null || StringUtils.isBlank(timeRange.getFrom()) || StringUtils.isBlank(timeRange.getTo())) {
            throw new IllegalArgumentException("timeRange must be an object with 'from' and 'to' fields");
        }

        List<PanelResult> panels = panelDataService.fetchPanelDataBatch(request.resolveSelections(), timeRange);
        String title = StringUtils.defaultIfBlank(request.getReportTitle(), reportProperties.getDefaultTitle());
        byte[] reportBytes = reportService.generatePanelReport(panels, title, timeRange, request.getCompanyName());
        log.info("report '{}' generated with {} panels, {} bytes", title, panels.size(), reportBytes.length);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentDisposition(ContentDisposition.attachment()
                .filename(generateFilename(title), StandardCharsets.UTF_8)
                .build());
        headers.setContentType(XLSX);
        return new ResponseEntity<>(reportBytes, headers, HttpStatus.OK);
    }

    /*
     * 根据报告标题生成文件名，例如 Security_Report_20240101_120000.xlsx。
     */
    private String generateFilename(String title) {
        String timestamp = new SimpleDateFormat("yyyyMMdd_HHmmss").format(new Date());
        return title.replace(' ', '_') + "_" + timestamp + ".xlsx";
    }
}
