package com.example.kb.service.parser;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 解析结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ParseResult {
    private boolean success;
    private String content;
    private String error;
    private int wordCount;

    public static ParseResult success(String content, int wordCount) {
        return new ParseResult(true, content, null, wordCount);
    }

    public static ParseResult failure(String error) {
        return new ParseResult(false, null, error, 0);
    }

    /**
     * 字数统计: 中文按字计, 其他按空白分隔的词计
     */
    public static int countWords(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int count = 0;
        boolean inWord = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.UnicodeScript.of(c) == Character.UnicodeScript.HAN) {
                count++;
                inWord = false;
            } else if (Character.isLetterOrDigit(c)) {
                if (!inWord) {
                    count++;
                    inWord = true;
                }
            } else {
                inWord = false;
            }
        }
        return count;
    }
}
