package com.obsidian.panelreportbackend.service;

import com.obsidian.panelreportbackend.dto.PanelResult;
import com.obsidian.panelreportbackend.model.PanelType;
import org.springframework.stereotype.Component;

/*
 * 描述: 按面板类型对归一化后的表格做后处理。
 *       stat 面板归约为单个总数，其余类型保留原始行并附加摘要。
 */
@Component
public class PanelAggregator {

    public PanelResult aggregate(PanelType type, NormalizedTable table) {
        if (type == PanelType.STAT) {
            if (table.getFrames().isEmpty()) {
                return StatReduction.empty();
            }
            return StatReduction.reduce(table.getFrames().get(0));
        }

        int rowCount = table.getRows().size();
        String summary;
        switch (type) {
            case TABLE:
                summary = rowCount + " rows";
                break;
            case TIMESERIES:
                summary = rowCount + " points";
                break;
            default:
                summary = rowCount + " rows (generic parse)";
                break;
        }
        return new PanelResult(table.getFields(), table.getRows(), summary);
    }
}
