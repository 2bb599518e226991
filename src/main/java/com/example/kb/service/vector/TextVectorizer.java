package com.example.kb.service.vector;

import com.example.kb.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 简单的文本向量化 - 词哈希到固定维度, 按位置衰减加权后归一化
 *
 * 没有嵌入模型时使用; 结果只用于近似检索, 与具体模型无关。
 */
@Component
public class TextVectorizer {

    // 汉字逐字成词, 其他按连续字母数字成词
    private static final Pattern TOKEN_PATTERN = Pattern.compile("\\p{IsHan}|[\\p{L}\\p{N}&&[^\\p{IsHan}]]+");

    private final int dimension;

    @Autowired
    public TextVectorizer(AppProperties appProperties) {
        this(appProperties.getVector().getDimension());
    }

    TextVectorizer(int dimension) {
        this.dimension = dimension;
    }

    public int getDimension() {
        return dimension;
    }

    public float[] vectorize(String text) {
        float[] vector = new float[dimension];
        if (text == null) {
            return vector;
        }

        Matcher matcher = TOKEN_PATTERN.matcher(text.toLowerCase());
        int position = 0;
        while (matcher.find()) {
            int index = Math.floorMod(matcher.group().hashCode(), dimension);
            vector[index] += 1.0f / (1.0f + position * 0.1f);
            position++;
        }

        double norm = 0.0;
        for (float v : vector) {
            norm += v * v;
        }
        if (norm > 0) {
            float scale = (float) (1.0 / Math.sqrt(norm));
            for (int i = 0; i < vector.length; i++) {
                vector[i] *= scale;
            }
        }
        return vector;
    }
}
