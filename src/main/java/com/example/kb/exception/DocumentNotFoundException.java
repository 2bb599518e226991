package com.example.kb.exception;

/**
 * 文档不存在
 */
public class DocumentNotFoundException extends RuntimeException {

    public DocumentNotFoundException(String documentId) {
        super("文档不存在: " + documentId);
    }
}
