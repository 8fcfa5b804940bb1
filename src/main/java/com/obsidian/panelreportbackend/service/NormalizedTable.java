package com.obsidian.panelreportbackend.service;

import com.obsidian.panelreportbackend.model.Frame;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/*
 * 描述: 帧转置后的行式表格，同时保留原始帧供聚合规则使用。
 */
@Getter
@AllArgsConstructor
public class NormalizedTable {

    private final List<String> fields;

    private final List<List<Object>> rows;

    private final List<Frame> frames;
}
