package com.example.kb.service.chunking;

import com.example.kb.config.AppProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 文本切片服务 - 按句末标点与换行切分
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TextChunker {

    // 句子主体 + 紧随的结束符(中英文句末标点或换行), 结束符保留在句尾;
    // 英文句点仅在其后为空白或文本结尾时视为句末, 避免切开 "3.5mm" 这类数字
    private static final Pattern SENTENCE_PATTERN = Pattern.compile(
            "(?:[^。！？!?.\\n]|\\.(?!\\s|$))+(?:[。！？!?\\n]|\\.(?=\\s|$))*");

    private final AppProperties appProperties;

    /**
     * 将文档文本切分为有序切片, 空白文本返回空列表
     */
    public List<TextChunk> chunk(String documentId, String text) {
        List<String> pieces = split(text,
                appProperties.getChunking().getMinChunkLength(),
                appProperties.getChunking().getMaxChunkLength());

        List<TextChunk> chunks = new ArrayList<>(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            chunks.add(new TextChunk(documentId, i, pieces.get(i)));
        }
        log.info("文档切片完成: documentId={}, 总块数={}", documentId, chunks.size());
        return chunks;
    }

    /**
     * 切分文本
     *
     * @param minLength 去除首尾空白后的最短长度, 更短的片段丢弃
     * @param maxLength 单个切片最大长度, 超长句子按长度硬切
     */
    public static List<String> split(String text, int minLength, int maxLength) {
        List<String> chunks = new ArrayList<>();
        if (text == null || text.trim().isEmpty()) {
            return chunks;
        }

        Matcher matcher = SENTENCE_PATTERN.matcher(text);
        while (matcher.find()) {
            String sentence = matcher.group().trim();
            if (sentence.length() < minLength) {
                continue;
            }
            if (maxLength > 0 && sentence.length() > maxLength) {
                chunks.addAll(hardSplit(sentence, minLength, maxLength));
            } else {
                chunks.add(sentence);
            }
        }

        // 没有合格的切分点时整篇作为一个切片
        if (chunks.isEmpty()) {
            String whole = text.trim();
            if (maxLength > 0 && whole.length() > maxLength) {
                chunks.addAll(hardSplit(whole, 1, maxLength));
            } else {
                chunks.add(whole);
            }
        }
        return chunks;
    }

    private static List<String> hardSplit(String sentence, int minLength, int maxLength) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        while (start < sentence.length()) {
            int end = Math.min(start + maxLength, sentence.length());
            // 不在代理对中间切开
            if (end < sentence.length() && end - 1 > start && Character.isHighSurrogate(sentence.charAt(end - 1))) {
                end--;
            }
            String part = sentence.substring(start, end).trim();
            if (part.length() < minLength && !parts.isEmpty()) {
                // 尾部过短, 并入上一段
                int last = parts.size() - 1;
                parts.set(last, parts.get(last) + part);
            } else if (!part.isEmpty()) {
                parts.add(part);
            }
            start = end;
        }
        return parts;
    }
}
