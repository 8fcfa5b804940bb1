package com.obsidian.panelreportbackend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/*
 * 描述: 面板结果中附带的面板元信息。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PanelInfo {

    private int id;

    private String title;

    private String type;

    private String description;

    /*
     * 失败时的错误信息；成功时为 null。
     */
    private String error;

    /*
     * 失败原因代码，例如 NOT_FOUND / BACKEND_UNAVAILABLE。
     */
    private String errorCode;
}
