package com.obsidian.panelreportbackend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/*
 * 描述: 仪表盘级别的模板变量。
 *       currentValue 可能是单个标量，也可能是标量列表 (多选变量)。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TemplatingVar {

    private String name;

    /*
     * 为 null 时表示变量没有当前值，解析时按通配符 "*" 处理。
     */
    private Object currentValue;
}
