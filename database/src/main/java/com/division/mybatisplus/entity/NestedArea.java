package com.division.mybatisplus.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;

/**
 * 行政区划嵌套集合表的一行，lft/rgt 为先序遍历时的进入、离开编号
 *
 * @author ZhangBoyuan
 * @since 2026-10-18
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@TableName("nested")
public class NestedArea implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 插入语句的字段顺序
     */
    public static final List<String> INSERT_FIELDS = List.of("id", "node", "pid", "depth", "lft", "rgt");

    /**
     * 区划编码
     */
    @TableId(value = "id", type = IdType.INPUT)
    private String id;

    /**
     * 名称
     */
    @TableField("node")
    private String node;

    /**
     * 父级编码，省级为 0
     */
    @TableField("pid")
    private String pid;

    /**
     * 层级（1=省，2=市，3=区县，4=街道）
     */
    @TableField("depth")
    private Integer depth;

    /**
     * 左值
     */
    @TableField("lft")
    private Integer lft;

    /**
     * 右值
     */
    @TableField("rgt")
    private Integer rgt;

}
