package com.obsidian.panelreportbackend.model;

/*
 * 描述: 面板的渲染类型。
 *       只有 stat / table / timeseries / text 有专门的处理逻辑，其余类型统一归为 OTHER。
 */
public enum PanelType {

    STAT("stat"),

    TABLE("table"),

    TIMESERIES("timeseries"),

    TEXT("text"),

    // 行容器，只在拍平面板列表时使用，不会出现在结果中
    ROW("row"),

    OTHER("");

    private final String typeName;

    PanelType(String typeName) {
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }

    /*
     * 根据 Grafana JSON 中的 type 字符串解析枚举，未知类型返回 OTHER。
     */
    public static PanelType fromName(String name) {
        if (name == null) {
            return OTHER;
        }
        for (PanelType type : values()) {
            if (type != OTHER && type.typeName.equals(name)) {
                return type;
            }
        }
        return OTHER;
    }
}
