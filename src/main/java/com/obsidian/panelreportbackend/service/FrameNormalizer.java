package com.obsidian.panelreportbackend.service;

import com.obsidian.panelreportbackend.model.Frame;
import com.obsidian.panelreportbackend.model.PanelDescriptor;
import com.obsidian.panelreportbackend.model.QueryResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/*
 * 描述: 把列式数据帧转换为 {fields, rows} 行式表格。
 *       字段列表只取第一个帧的 schema，后续帧的行直接追加在同一字段列表下，不做对齐。
 */
@Slf4j
@Component
public class FrameNormalizer {

    private final TimestampFormatter timestampFormatter;

    public FrameNormalizer(TimestampFormatter timestampFormatter) {
        this.timestampFormatter = timestampFormatter;
    }

    public NormalizedTable normalize(QueryResponse response, PanelDescriptor panel) {
        List<Frame> frames = response.primaryFrames();
        List<String> fields = new ArrayList<>();
        List<List<Object>> rows = new ArrayList<>();

        if (frames.isEmpty()) {
            log.warn("[PROCESS] No frames for panel '{}' (id={})", panel.getTitle(), panel.getId());
            return new NormalizedTable(fields, rows, frames);
        }

        for (Frame frame : frames) {
            if (fields.isEmpty()) {
                fields.addAll(frame.fieldNames());
            }
            if (frame.isColumnar()) {
                rows.addAll(transpose(frame));
            }
        }
        return new NormalizedTable(fields, rows, frames);
    }

    /*
     * 按最短列的长度截断，与 zip 的语义一致。
     */
    private List<List<Object>> transpose(Frame frame) {
        List<List<?>> columns = new ArrayList<>();
        int length = Integer.MAX_VALUE;
        for (int i = 0; i < frame.getValues().size(); i++) {
            List<?> column = frame.column(i);
            columns.add(column);
            length = Math.min(length, column.size());
        }

        List<List<Object>> rows = new ArrayList<>(length);
        for (int r = 0; r < length; r++) {
            List<Object> row = new ArrayList<>(columns.size());
            for (List<?> column : columns) {
                row.add(timestampFormatter.format(column.get(r)));
            }
            rows.add(row);
        }
        return rows;
    }
}
