package com.example.kb.service.parser;

/**
 * 文档解析服务接口 - 将原始文件转换为纯文本
 *
 * 调用是阻塞的, 内部不做重试; 失败通过 {@link ParseResult#isSuccess()} 报告。
 */
public interface DocumentParserClient {

    /**
     * 解析文档
     *
     * @param content  文件字节
     * @param filename 原始文件名, 用于判断类型
     * @param mimeType 上传时声明的 MIME 类型, 可能为空
     */
    ParseResult parse(byte[] content, String filename, String mimeType);
}
