package com.obsidian.panelreportbackend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/*
 * 描述: /api/ds/query 返回的列式数据帧。
 *       values.get(i) 是 fields.get(i) 对应的整列数据；正常情况下每个元素都是 List。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Frame {

    private List<FieldSchema> fields = new ArrayList<>();

    private List<Object> values = new ArrayList<>();

    public List<String> fieldNames() {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < fields.size(); i++) {
            String name = fields.get(i).getName();
            names.add(name != null ? name : "f" + i);
        }
        return names;
    }

    public int indexOfField(String name) {
        for (int i = 0; i < fields.size(); i++) {
            if (name.equals(fields.get(i).getName())) {
                return i;
            }
        }
        return -1;
    }

    /*
     * 返回第 index 列；越界或该列不是列表时返回空列表。
     */
    public List<?> column(int index) {
        if (index < 0 || index >= values.size()) {
            return List.of();
        }
        Object column = values.get(index);
        return column instanceof List ? (List<?>) column : List.of();
    }

    public boolean isColumnar() {
        return !values.isEmpty() && values.stream().allMatch(v -> v instanceof List);
    }
}
