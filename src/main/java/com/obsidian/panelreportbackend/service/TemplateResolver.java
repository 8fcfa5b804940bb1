package com.obsidian.panelreportbackend.service;

import com.obsidian.panelreportbackend.model.TemplatingVar;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/*
 * 描述: 把查询字符串中的仪表盘模板变量替换为具体值。
 *       ${name:lucene} 和 ${name} 替换为变量当前值，多选值用 " OR " 连接，
 *       "All" ($__all) 和空列表替换为通配符 "*"。
 */
@Component
public class TemplateResolver {

    static final String ALL_VALUE = "$__all";
    static final String WILDCARD = "*";

    /*
     * Grafana 内部的 ad-hoc 过滤器变量，后端无法识别，直接去掉。
     */
    private static final List<String> RESERVED_PLACEHOLDERS = List.of("${Filters:lucene}", "${Filters}");

    public String resolve(String query, List<TemplatingVar> variables) {
        if (query == null || query.isEmpty()) {
            return query;
        }
        String out = query;
        for (Map.Entry<String, String> entry : buildReplacements(variables).entrySet()) {
            // 先替换带 :lucene 的形式，避免 ${name} 匹配到它的前缀
            out = out.replace("${" + entry.getKey() + ":lucene}", entry.getValue());
            out = out.replace("${" + entry.getKey() + "}", entry.getValue());
        }
        out = out.replace(ALL_VALUE, WILDCARD);
        for (String placeholder : RESERVED_PLACEHOLDERS) {
            out = out.replace(placeholder, "");
        }
        return out;
    }

    Map<String, String> buildReplacements(List<TemplatingVar> variables) {
        Map<String, String> replacements = new LinkedHashMap<>();
        if (variables == null) {
            return replacements;
        }
        for (TemplatingVar variable : variables) {
            if (variable.getName() == null) {
                continue;
            }
            replacements.put(variable.getName(), renderValue(variable.getCurrentValue()));
        }
        return replacements;
    }

    private String renderValue(Object value) {
        if (value == null || ALL_VALUE.equals(value)) {
            return WILDCARD;
        }
        if (value instanceof Collection) {
            Collection<?> values = (Collection<?>) value;
            if (values.isEmpty() || (values.size() == 1 && values.contains(ALL_VALUE))) {
                return WILDCARD;
            }
            return values.stream()
                    .map(String::valueOf)
                    .collect(Collectors.joining(" OR "));
        }
        return String.valueOf(value);
    }
}
