package com.example.kb.service.entity;

/**
 * 实体抽取接口
 */
public interface EntityExtractor {

    /**
     * 从原文中抽取实体, 相同输入必须得到相同结果
     */
    EntityExtractionResult extract(String text);
}
