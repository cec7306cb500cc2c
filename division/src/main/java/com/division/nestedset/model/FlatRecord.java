package com.division.nestedset.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 数据文件中的一条区划记录
 *
 * @author ZhangBoyuan
 * @since 2026-10-18
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlatRecord {

    /**
     * 区划编码
     */
    private String code;

    /**
     * 名称
     */
    private String name;

    /**
     * 父级编码，省级为 0，可为空
     */
    @JsonProperty("parent_code")
    private String parentCode;

}
