package com.obsidian.panelreportbackend.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.obsidian.panelreportbackend.exception.MalformedResponseException;
import com.obsidian.panelreportbackend.model.DatasourceDescriptor;
import com.obsidian.panelreportbackend.model.DatasourceRef;
import com.obsidian.panelreportbackend.model.FieldSchema;
import com.obsidian.panelreportbackend.model.Frame;
import com.obsidian.panelreportbackend.model.QueryResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/*
 * 描述: Grafana 响应 JSON 到类型化模型的转换工具。
 *       结构不符合预期时抛出 MalformedResponseException，而不是返回默认值。
 */
@Slf4j
public final class GrafanaJson {

    private GrafanaJson() {
    }

    public static List<DatasourceDescriptor> parseDatasources(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new MalformedResponseException("Datasource list response is not an array");
        }
        List<DatasourceDescriptor> datasources = new ArrayList<>();
        for (JsonNode node : root) {
            if (!node.isObject()) {
                throw new MalformedResponseException("Datasource entry is not an object: " + node);
            }
            DatasourceDescriptor ds = new DatasourceDescriptor();
            ds.setId(node.hasNonNull("id") ? node.get("id").asLong() : null);
            ds.setUid(text(node, "uid"));
            ds.setName(text(node, "name"));
            ds.setType(text(node, "type"));
            ds.setDefault(node.path("isDefault").asBoolean(false));
            datasources.add(ds);
        }
        return datasources;
    }

    public static QueryResponse parseQueryResponse(JsonNode root, ObjectMapper objectMapper) {
        if (root == null || !root.path("results").isObject()) {
            throw new MalformedResponseException("Query response has no 'results' object");
        }
        QueryResponse response = new QueryResponse();
        Iterator<Map.Entry<String, JsonNode>> results = root.get("results").fields();
        while (results.hasNext()) {
            Map.Entry<String, JsonNode> entry = results.next();
            JsonNode refResult = entry.getValue();
            if (refResult.hasNonNull("error")) {
                log.warn("query {} returned an error: {}", entry.getKey(), refResult.get("error").asText());
            }
            JsonNode framesNode = refResult.path("frames");
            List<Frame> frames = new ArrayList<>();
            if (framesNode.isArray()) {
                for (JsonNode frameNode : framesNode) {
                    frames.add(parseFrame(frameNode, objectMapper));
                }
            } else if (!framesNode.isMissingNode() && !framesNode.isNull()) {
                throw new MalformedResponseException("'frames' of query " + entry.getKey() + " is not an array");
            }
            response.getFramesByRefId().put(entry.getKey(), frames);
        }
        return response;
    }

    static Frame parseFrame(JsonNode frameNode, ObjectMapper objectMapper) {
        if (!frameNode.isObject()) {
            throw new MalformedResponseException("Frame is not an object: " + frameNode);
        }
        Frame frame = new Frame();
        JsonNode fieldsNode = frameNode.path("schema").path("fields");
        if (fieldsNode.isArray()) {
            for (JsonNode fieldNode : fieldsNode) {
                frame.getFields().add(new FieldSchema(
                        text(fieldNode, "name"),
                        text(fieldNode.path("config"), "displayNameFromDS")));
            }
        }
        JsonNode valuesNode = frameNode.path("data").path("values");
        if (valuesNode.isArray()) {
            for (JsonNode column : valuesNode) {
                frame.getValues().add(objectMapper.convertValue(column, Object.class));
            }
        } else if (!valuesNode.isMissingNode() && !valuesNode.isNull()) {
            throw new MalformedResponseException("Frame 'data.values' is not an array");
        }
        return frame;
    }

    /*
     * 解析 {"uid": ..., "type": ...} 形式的数据源引用；字符串形式只有 type。
     */
    public static DatasourceRef parseDatasourceRef(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            return new DatasourceRef(textOrEmpty(node, "uid"), textOrEmpty(node, "type"));
        }
        if (node.isTextual()) {
            return new DatasourceRef("", node.asText());
        }
        return null;
    }

    public static String text(JsonNode node, String key) {
        JsonNode value = node == null ? null : node.get(key);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    public static String textOrEmpty(JsonNode node, String key) {
        String value = text(node, key);
        return value == null ? "" : value;
    }
}
