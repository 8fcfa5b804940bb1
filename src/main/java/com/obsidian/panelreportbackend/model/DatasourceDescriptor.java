package com.obsidian.panelreportbackend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/*
 * 描述: Grafana 中配置的一个数据源 (/api/datasources 的单个元素)。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DatasourceDescriptor {
    private Long id;
    private String uid;
    private String name;
    private String type;
    private boolean isDefault;

    public DatasourceRef toRef() {
        return new DatasourceRef(uid, type);
    }
}
