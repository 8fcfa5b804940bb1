package com.obsidian.panelreportbackend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/*
 * 描述: 帧 schema 中的一个字段。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FieldSchema {

    /*
     * 字段名，后端可能不返回 (null)。
     */
    private String name;

    /*
     * config.displayNameFromDS，例如 "Count" 或 "Average bytes"。
     */
    private String displayNameFromDS;
}
