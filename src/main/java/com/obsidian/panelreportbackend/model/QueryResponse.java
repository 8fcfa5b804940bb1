package com.obsidian.panelreportbackend.model;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/*
 * 描述: /api/ds/query 的响应，按 refId 分组的帧列表。保持后端返回的 refId 顺序。
 */
@Data
public class QueryResponse {

    public static final String PRIMARY_REF_ID = "A";

    private Map<String, List<Frame>> framesByRefId = new LinkedHashMap<>();

    /*
     * 主序列 "A" 的帧；没有 "A" 时取第一个 refId 的帧。
     */
    public List<Frame> primaryFrames() {
        List<Frame> primary = framesByRefId.get(PRIMARY_REF_ID);
        if (primary != null) {
            return primary;
        }
        return framesByRefId.values().stream().findFirst().orElse(List.of());
    }
}
