package com.obsidian.panelreportbackend.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.obsidian.panelreportbackend.client.GrafanaJson;
import com.obsidian.panelreportbackend.client.MonitoringBackendClient;
import com.obsidian.panelreportbackend.dto.PanelSummary;
import com.obsidian.panelreportbackend.exception.MalformedResponseException;
import com.obsidian.panelreportbackend.model.DashboardDescriptor;
import com.obsidian.panelreportbackend.model.DatasourceRef;
import com.obsidian.panelreportbackend.model.PanelDescriptor;
import com.obsidian.panelreportbackend.model.PanelType;
import com.obsidian.panelreportbackend.model.QueryTarget;
import com.obsidian.panelreportbackend.model.TemplatingVar;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/*
 * 描述: 通过 Grafana API 获取仪表盘，并把原始 JSON 解析为 DashboardDescriptor。
 *       row 类型的面板只是分组容器，其子面板 (包括折叠的 row) 会被提升到顶层，row 本身被丢弃。
 */
@Service
public class GrafanaDashboardFetcher implements DashboardFetcher {

    private static final TypeReference<List<Map<String, Object>>> LIST_OF_MAPS = new TypeReference<>() {
    };

    private final MonitoringBackendClient client;
    private final ObjectMapper objectMapper;

    public GrafanaDashboardFetcher(MonitoringBackendClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public DashboardDescriptor fetch(String dashboardUid) {
        JsonNode envelope = client.getDashboard(dashboardUid);
        return parseDashboard(dashboardUid, envelope);
    }

    @Override
    public List<PanelSummary> listPanels(String dashboardUid) {
        return fetch(dashboardUid).getPanels().stream()
                .map(panel -> new PanelSummary(
                        panel.getId(),
                        StringUtils.defaultIfBlank(panel.getTitle(), "Unnamed Panel"),
                        panel.getTypeName(),
                        panel.getDescription(),
                        panel.getDatasourceHint()))
                .collect(Collectors.toList());
    }

    DashboardDescriptor parseDashboard(String requestedUid, JsonNode envelope) {
        JsonNode dashboard = envelope == null ? null : envelope.get("dashboard");
        if (dashboard == null || !dashboard.isObject()) {
            throw new MalformedResponseException("Dashboard " + requestedUid + " response has no 'dashboard' object");
        }

        DashboardDescriptor descriptor = new DashboardDescriptor();
        descriptor.setUid(StringUtils.defaultIfBlank(GrafanaJson.text(dashboard, "uid"), requestedUid));
        descriptor.setTitle(GrafanaJson.textOrEmpty(dashboard, "title"));
        descriptor.setTemplatingVariables(parseTemplating(dashboard.path("templating").path("list")));
        flattenPanels(dashboard.path("panels"), descriptor.getPanels());
        return descriptor;
    }

    private List<TemplatingVar> parseTemplating(JsonNode list) {
        List<TemplatingVar> variables = new ArrayList<>();
        if (!list.isArray()) {
            return variables;
        }
        for (JsonNode node : list) {
            String name = GrafanaJson.text(node, "name");
            if (name == null) {
                continue;
            }
            JsonNode value = node.path("current").path("value");
            Object currentValue = value.isMissingNode() || value.isNull()
                    ? null
                    : objectMapper.convertValue(value, Object.class);
            variables.add(new TemplatingVar(name, currentValue));
        }
        return variables;
    }

    private void flattenPanels(JsonNode panels, List<PanelDescriptor> out) {
        if (panels.isMissingNode() || panels.isNull()) {
            return;
        }
        if (!panels.isArray()) {
            throw new MalformedResponseException("Dashboard 'panels' is not an array");
        }
        for (JsonNode node : panels) {
            if (!node.isObject()) {
                throw new MalformedResponseException("Panel entry is not an object: " + node);
            }
            if (PanelType.fromName(GrafanaJson.text(node, "type")) == PanelType.ROW) {
                flattenPanels(node.path("panels"), out);
            } else {
                out.add(parsePanel(node));
            }
        }
    }

    private PanelDescriptor parsePanel(JsonNode node) {
        PanelDescriptor panel = new PanelDescriptor();
        panel.setId(node.path("id").asInt(0));
        panel.setTitle(GrafanaJson.textOrEmpty(node, "title"));
        panel.setTypeName(GrafanaJson.textOrEmpty(node, "type"));
        panel.setType(PanelType.fromName(panel.getTypeName()));
        panel.setDescription(GrafanaJson.textOrEmpty(node, "description"));

        JsonNode targets = node.path("targets");
        if (targets.isArray()) {
            for (JsonNode target : targets) {
                panel.getTargets().add(parseTarget(target));
            }
        }
        panel.setDatasourceHint(resolveDatasourceHint(node, targets));

        if (panel.getType() == PanelType.TEXT) {
            String content = GrafanaJson.text(node, "content");
            if (content == null) {
                content = GrafanaJson.text(node.path("options"), "content");
            }
            panel.setContent(content == null ? "No content" : content);
        }
        return panel;
    }

    private QueryTarget parseTarget(JsonNode node) {
        if (!node.isObject()) {
            throw new MalformedResponseException("Query target is not an object: " + node);
        }
        QueryTarget target = new QueryTarget();
        target.setRefId(GrafanaJson.text(node, "refId"));
        target.setHide(node.path("hide").asBoolean(false));
        target.setQuery(GrafanaJson.text(node, "query"));
        target.setAlias(GrafanaJson.text(node, "alias"));
        target.setTimeField(GrafanaJson.text(node, "timeField"));
        target.setFormat(GrafanaJson.text(node, "format"));
        target.setQueryType(GrafanaJson.text(node, "queryType"));
        target.setLuceneQueryType(GrafanaJson.text(node, "luceneQueryType"));
        target.setBucketAggs(readListOfMaps(node, "bucketAggs"));
        target.setMetrics(readListOfMaps(node, "metrics"));
        target.setDatasource(GrafanaJson.parseDatasourceRef(node.get("datasource")));
        return target;
    }

    private List<Map<String, Object>> readListOfMaps(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isArray()) {
            throw new MalformedResponseException("Query target '" + key + "' is not an array");
        }
        try {
            return objectMapper.convertValue(value, LIST_OF_MAPS);
        } catch (IllegalArgumentException ex) {
            throw new MalformedResponseException("Query target '" + key + "' has non-object entries", ex);
        }
    }

    /*
     * 新版 Grafana 在 target 上定义数据源，旧版在面板上定义。
     */
    private DatasourceRef resolveDatasourceHint(JsonNode panel, JsonNode targets) {
        if (targets.isArray() && targets.size() > 0 && targets.get(0).path("datasource").isObject()) {
            return GrafanaJson.parseDatasourceRef(targets.get(0).get("datasource"));
        }
        DatasourceRef panelLevel = GrafanaJson.parseDatasourceRef(panel.get("datasource"));
        return panelLevel != null ? panelLevel : new DatasourceRef("", "");
    }
}
