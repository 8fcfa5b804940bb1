// com/obsidian/panelreportbackend/service/PoiHelper.java
package com.obsidian.panelreportbackend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.CellRangeAddress;

import java.util.Collection;
import java.util.Map;
import java.util.stream.Collectors;

public class PoiHelper {

    private static final ObjectMapper JSON = new ObjectMapper();

    public static Cell setCellValue(Sheet sheet, int rowIndex, int colIndex, Object value) {
        Row row = sheet.getRow(rowIndex);
        if (row == null) {
            row = sheet.createRow(rowIndex);
        }
        Cell cell = row.getCell(colIndex);
        if (cell == null) {
            cell = row.createCell(colIndex);
        }

        Object display = displayValue(value);
        if (display instanceof String) {
            cell.setCellValue((String) display);
        } else if (display instanceof Number) {
            cell.setCellValue(((Number) display).doubleValue());
        } else if (display instanceof Boolean) {
            cell.setCellValue((Boolean) display);
        } else if (display != null) {
            cell.setCellValue(String.valueOf(display));
        }
        return cell;
    }

    public static Cell setCellValue(Sheet sheet, int rowIndex, int colIndex, Object value, CellStyle style) {
        Cell cell = setCellValue(sheet, rowIndex, colIndex, value);
        if (style != null) {
            cell.setCellStyle(style);
        }
        return cell;
    }

    /**
     * 把嵌套结构转换为可以写入单元格的值。
     * 列表用 ", " 连接，Map 序列化为 JSON，其余原样返回。
     */
    public static Object displayValue(Object value) {
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream()
                    .map(String::valueOf)
                    .collect(Collectors.joining(", "));
        }
        if (value instanceof Map) {
            try {
                return JSON.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return String.valueOf(value);
            }
        }
        return value;
    }

    /*
     * 合并一行中的 [0, lastCol] 单元格并写入标题文本。
     */
    public static void writeMergedLine(Sheet sheet, int rowIndex, int lastCol, String text, CellStyle style) {
        setCellValue(sheet, rowIndex, 0, text, style);
        if (lastCol > 0) {
            sheet.addMergedRegion(new CellRangeAddress(rowIndex, rowIndex, 0, lastCol));
        }
    }

    /**
     * 根据表头和数据行的内容长度设置列宽 (单位: 字符)。
     */
    public static void autosizeColumns(Sheet sheet, int headerRow, int lastRow, int columnCount,
                                       int minWidth, int maxWidth) {
        if (lastRow < headerRow) {
            return;
        }
        for (int col = 0; col < columnCount; col++) {
            int maxLen = 0;
            for (int r = headerRow; r <= lastRow; r++) {
                Row row = sheet.getRow(r);
                Cell cell = row == null ? null : row.getCell(col);
                if (cell != null) {
                    maxLen = Math.max(maxLen, Math.min(cellText(cell).length(), maxWidth));
                }
            }
            int width = Math.max(minWidth, Math.min(maxWidth, maxLen + 2));
            sheet.setColumnWidth(col, width * 256);
        }
    }

    private static String cellText(Cell cell) {
        switch (cell.getCellType()) {
            case STRING:
                return cell.getStringCellValue();
            case NUMERIC:
                return String.valueOf(cell.getNumericCellValue());
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                return "";
        }
    }
}
