package com.example.kb.exception;

/**
 * 文档入库异常
 */
public class IngestionException extends RuntimeException {

    private final ErrorType errorType;

    public IngestionException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public IngestionException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    /**
     * 面向用户的错误描述, 形如 "[PARSE_ERROR] PDF文件解析失败"
     */
    public String describe() {
        return "[" + errorType.name() + "] " + getMessage();
    }

    public enum ErrorType {
        UNSUPPORTED_FILE_TYPE, // 入库前拒绝, 不产生任务
        PARSE_ERROR,           // 解析失败
        EMPTY_CONTENT,         // 无可用文本
        STORE_UNAVAILABLE,     // 向量库不可达
        STORE_WRITE_ERROR,     // 向量库写入失败
        UNKNOWN                // 其他异常
    }
}
