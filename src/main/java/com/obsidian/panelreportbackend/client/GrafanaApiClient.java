package com.obsidian.panelreportbackend.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.obsidian.panelreportbackend.config.GrafanaProperties;
import com.obsidian.panelreportbackend.exception.BackendUnavailableException;
import com.obsidian.panelreportbackend.exception.MalformedResponseException;
import com.obsidian.panelreportbackend.exception.NotFoundException;
import com.obsidian.panelreportbackend.exception.RequestRejectedException;
import com.obsidian.panelreportbackend.model.DatasourceDescriptor;
import com.obsidian.panelreportbackend.model.QueryRequest;
import com.obsidian.panelreportbackend.model.QueryResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;
import java.util.List;

/*
 * 描述: 基于 RestTemplate 的 Grafana HTTP API 客户端。
 *       只负责 HTTP 调用和响应结构校验，不包含任何面板处理逻辑。
 */
@Slf4j
@Component
public class GrafanaApiClient implements MonitoringBackendClient {

    private static final String DASHBOARD_API = "/api/dashboards/uid/{uid}";
    private static final String DATASOURCE_API = "/api/datasources";
    private static final String QUERY_API = "/api/ds/query";

    private final GrafanaProperties properties;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    @Autowired
    public GrafanaApiClient(GrafanaProperties properties, ObjectMapper objectMapper) {
        this(properties, objectMapper, createRestTemplate(properties));
    }

    GrafanaApiClient(GrafanaProperties properties, ObjectMapper objectMapper, RestTemplate restTemplate) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.restTemplate = restTemplate;
        this.baseUrl = normalizeBaseUrl(properties.getUrl());
    }

    private static RestTemplate createRestTemplate(GrafanaProperties properties) {
        int timeoutMs = Math.max(1,
                properties.getTimeoutSeconds() == null ? 30 : properties.getTimeoutSeconds()) * 1000;
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    @Override
    public JsonNode getDashboard(String dashboardUid) {
        if (StringUtils.isBlank(dashboardUid)) {
            throw new IllegalArgumentException("dashboard uid is required");
        }
        return exchange(DASHBOARD_API, HttpMethod.GET, null, "Dashboard " + dashboardUid, dashboardUid);
    }

    @Override
    public List<DatasourceDescriptor> listDatasources() {
        JsonNode body = exchange(DATASOURCE_API, HttpMethod.GET, null, "Datasource list");
        return GrafanaJson.parseDatasources(body);
    }

    @Override
    public QueryResponse query(QueryRequest request) {
        if (log.isDebugEnabled()) {
            log.debug("[QUERY PAYLOAD] {}", toJson(request));
        }
        JsonNode body = exchange(QUERY_API, HttpMethod.POST, request, "Query " + request.getRequestId());
        return GrafanaJson.parseQueryResponse(body, objectMapper);
    }

    private JsonNode exchange(String path, HttpMethod method, Object payload, String what, Object... uriVariables) {
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(baseUrl + path, method,
                    new HttpEntity<>(payload, buildHeaders()), JsonNode.class, uriVariables);
            JsonNode body = response.getBody();
            if (body == null) {
                throw new MalformedResponseException(what + ": empty response body");
            }
            return body;
        } catch (HttpClientErrorException.NotFound ex) {
            throw new NotFoundException(what + " not found");
        } catch (HttpStatusCodeException ex) {
            int status = ex.getStatusCode().value();
            if (ex.getStatusCode().is5xxServerError()) {
                throw new BackendUnavailableException(what + " failed: HTTP " + status, ex);
            }
            // 4xx 说明请求本身被拒绝 (鉴权、查询语法等)，重试无意义
            throw new RequestRejectedException(what + " rejected: HTTP " + status, ex);
        } catch (ResourceAccessException ex) {
            throw new BackendUnavailableException(what + " failed: " + ex.getMessage(), ex);
        } catch (RestClientException ex) {
            throw new MalformedResponseException(what + ": unreadable response (" + ex.getMessage() + ")", ex);
        }
    }

    private HttpHeaders buildHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));
        if (StringUtils.isNotBlank(properties.getApiKey())) {
            headers.setBearerAuth(properties.getApiKey());
        }
        return headers;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            return String.valueOf(value);
        }
    }

    private String normalizeBaseUrl(String url) {
        if (StringUtils.isBlank(url)) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
