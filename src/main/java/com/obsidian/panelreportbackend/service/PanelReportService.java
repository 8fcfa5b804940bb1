// src/main/java/com/obsidian/panelreportbackend/service/PanelReportService.java
package com.obsidian.panelreportbackend.service;

import com.obsidian.panelreportbackend.config.ReportProperties;
import com.obsidian.panelreportbackend.dto.PanelInfo;
import com.obsidian.panelreportbackend.dto.PanelResult;
import com.obsidian.panelreportbackend.model.TimeRange;
import org.apache.commons.lang3.StringUtils;
import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/*
 * 描述: 把面板结果写入 XLSX 报告。
 *       第一个工作表 "Summary" 是封面和目录，之后每个面板一个工作表 (Sheet1, Sheet2, ...)。
 */
@Service
public class PanelReportService {

    private static final String SUMMARY_SHEET = "Summary";
    private static final DateTimeFormatter GENERATED_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // 面板工作表中表头所在的行 (0-based，即 Excel 第 4 行)
    static final int PANEL_HEADER_ROW = 3;

    private static final int COVER_WIDTH = 5;
    private static final int MIN_COLUMN_WIDTH = 10;
    private static final int MAX_COLUMN_WIDTH = 60;

    private final ReportProperties reportProperties;

    public PanelReportService(ReportProperties reportProperties) {
        this.reportProperties = reportProperties;
    }

    public byte[] generatePanelReport(List<PanelResult> panels, String reportTitle,
                                      TimeRange timeRange, String companyName) throws IOException {
        if (panels == null) {
            throw new IllegalArgumentException("面板结果列表不能为空。");
        }
        String title = StringUtils.defaultIfBlank(reportTitle, reportProperties.getDefaultTitle());

        try (XSSFWorkbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream baos = new ByteArrayOutputStream()) {

            Styles styles = new Styles(workbook);
            Sheet cover = workbook.createSheet(SUMMARY_SHEET);
            int row = writeCoverHeader(cover, styles, title, timeRange, companyName);

            for (int i = 0; i < panels.size(); i++) {
                PanelResult result = panels.get(i);
                PanelInfo info = result.getPanel() == null ? new PanelInfo() : result.getPanel();
                String sheetName = "Sheet" + (i + 1);
                String panelTitle = StringUtils.defaultIfBlank(info.getTitle(), "Panel " + (i + 1));
                String panelType = StringUtils.defaultIfBlank(info.getType(), "unknown");
                String description = StringUtils.defaultString(info.getDescription());

                // 目录行
                String[] tocValues = {sheetName, panelTitle, panelType, description};
                for (int col = 0; col < tocValues.length; col++) {
                    PoiHelper.setCellValue(cover, row, col, tocValues[col], styles.tocCell);
                }
                row++;

                Sheet sheet = workbook.createSheet(sheetName);
                writePanelSheet(sheet, styles, result, panelTitle, description);
            }

            PoiHelper.autosizeColumns(cover, 0, row - 1, 4, MIN_COLUMN_WIDTH, MAX_COLUMN_WIDTH);
            workbook.write(baos);
            return baos.toByteArray();
        }
    }

    private int writeCoverHeader(Sheet cover, Styles styles, String title, TimeRange timeRange, String companyName) {
        int row = 0;
        PoiHelper.writeMergedLine(cover, row, COVER_WIDTH, title, styles.title);
        row += 2;

        if (StringUtils.isNotBlank(companyName)) {
            PoiHelper.writeMergedLine(cover, row++, COVER_WIDTH, "Company: " + companyName, styles.header);
        }
        if (timeRange != null && StringUtils.isNotBlank(timeRange.getFrom()) && StringUtils.isNotBlank(timeRange.getTo())) {
            PoiHelper.writeMergedLine(cover, row++, COVER_WIDTH,
                    "Time Range: " + timeRange.getFrom() + " to " + timeRange.getTo(), styles.header);
        }
        PoiHelper.writeMergedLine(cover, row, COVER_WIDTH,
                "Generated: " + LocalDateTime.now().format(GENERATED_FORMAT), styles.small);
        row += 2;

        PoiHelper.writeMergedLine(cover, row++, COVER_WIDTH, "Report Contents", styles.subtitle);
        String[] headers = {"Sheet", "Title", "Type", "Description"};
        for (int col = 0; col < headers.length; col++) {
            PoiHelper.setCellValue(cover, row, col, headers[col], styles.tocHeader);
        }
        return row + 1;
    }

    private void writePanelSheet(Sheet sheet, Styles styles, PanelResult result, String panelTitle, String description) {
        PoiHelper.writeMergedLine(sheet, 0, COVER_WIDTH, panelTitle, styles.title);
        if (!description.isEmpty()) {
            PoiHelper.writeMergedLine(sheet, 1, COVER_WIDTH, description, styles.normal);
        }

        List<String> fields = result.getFields();
        List<List<Object>> rows = result.getRows();
        if (fields == null || fields.isEmpty()) {
            return;
        }

        for (int col = 0; col < fields.size(); col++) {
            String header = fields.get(col) == null ? "" : fields.get(col);
            PoiHelper.setCellValue(sheet, PANEL_HEADER_ROW, col, header, styles.panelHeader);
        }

        // 没有数据行时仍保留表头
        int r = PANEL_HEADER_ROW + 1;
        for (List<Object> values : rows == null ? List.<List<Object>>of() : rows) {
            // 超出表头宽度的值直接丢弃
            int width = Math.min(values.size(), fields.size());
            for (int col = 0; col < width; col++) {
                PoiHelper.setCellValue(sheet, r, col, values.get(col));
            }
            r++;
        }

        sheet.createFreezePane(0, PANEL_HEADER_ROW + 1);
        PoiHelper.autosizeColumns(sheet, PANEL_HEADER_ROW, r - 1, fields.size(), MIN_COLUMN_WIDTH, MAX_COLUMN_WIDTH);
    }

    /*
     * 报告中用到的单元格样式，每个工作簿创建一次。
     */
    private static final class Styles {
        private final CellStyle title;
        private final CellStyle subtitle;
        private final CellStyle header;
        private final CellStyle normal;
        private final CellStyle small;
        private final CellStyle tocHeader;
        private final CellStyle tocCell;
        private final CellStyle panelHeader;

        private Styles(Workbook workbook) {
            title = fontStyle(workbook, 16, true, false);
            subtitle = fontStyle(workbook, 14, true, false);
            header = fontStyle(workbook, 12, true, false);
            normal = fontStyle(workbook, 11, false, false);
            small = fontStyle(workbook, 10, false, true);

            tocHeader = fontStyle(workbook, 12, true, false);
            tocHeader.setFillForegroundColor(IndexedColors.PALE_BLUE.getIndex());
            tocHeader.setFillPattern(FillPatternType.SOLID_FOREGROUND);
            tocHeader.setAlignment(HorizontalAlignment.CENTER);
            thinBorder(tocHeader);

            tocCell = fontStyle(workbook, 11, false, false);
            tocCell.setAlignment(HorizontalAlignment.LEFT);
            thinBorder(tocCell);

            panelHeader = fontStyle(workbook, 12, true, false);
            panelHeader.setFillForegroundColor(IndexedColors.ROYAL_BLUE.getIndex());
            panelHeader.setFillPattern(FillPatternType.SOLID_FOREGROUND);
            panelHeader.setAlignment(HorizontalAlignment.CENTER);
        }

        private static CellStyle fontStyle(Workbook workbook, int size, boolean bold, boolean italic) {
            Font font = workbook.createFont();
            font.setFontHeightInPoints((short) size);
            font.setBold(bold);
            font.setItalic(italic);
            CellStyle style = workbook.createCellStyle();
            style.setFont(font);
            style.setVerticalAlignment(VerticalAlignment.CENTER);
            return style;
        }

        private static void thinBorder(CellStyle style) {
            style.setBorderTop(BorderStyle.THIN);
            style.setBorderBottom(BorderStyle.THIN);
            style.setBorderLeft(BorderStyle.THIN);
            style.setBorderRight(BorderStyle.THIN);
        }
    }
}
