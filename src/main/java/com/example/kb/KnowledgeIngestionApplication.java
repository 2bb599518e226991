package com.example.kb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 知识入库服务主启动类
 *
 * 功能特性:
 * - 批量文档上传与类型校验
 * - 文本切片与规则实体抽取
 * - Qdrant 向量库同步
 * - 逐文档处理进度查询与订阅
 */
@SpringBootApplication
public class KnowledgeIngestionApplication {

    public static void main(String[] args) {
        SpringApplication.run(KnowledgeIngestionApplication.class, args);
    }
}
