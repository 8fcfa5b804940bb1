package com.obsidian.panelreportbackend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DatasourceRef {
    private String uid;
    private String type;
}
