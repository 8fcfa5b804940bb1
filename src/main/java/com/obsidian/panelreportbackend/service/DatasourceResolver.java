package com.obsidian.panelreportbackend.service;

import com.obsidian.panelreportbackend.exception.NoDatasourceException;
import com.obsidian.panelreportbackend.model.DatasourceDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/*
 * 描述: 从已配置的数据源中选出指定类型的默认数据源。
 */
@Slf4j
@Component
public class DatasourceResolver {

    public DatasourceDescriptor resolve(String requiredType, List<DatasourceDescriptor> datasources) {
        List<DatasourceDescriptor> candidates = datasources == null ? List.of() : datasources.stream()
                .filter(ds -> requiredType.equals(ds.getType()) && ds.isDefault())
                .collect(Collectors.toList());

        if (candidates.isEmpty()) {
            throw new NoDatasourceException("No default datasource of type '" + requiredType + "' found");
        }
        if (candidates.size() > 1) {
            log.warn("{} default datasources of type {} found, using uid={}",
                    candidates.size(), requiredType, candidates.get(0).getUid());
        }
        return candidates.get(0);
    }
}
