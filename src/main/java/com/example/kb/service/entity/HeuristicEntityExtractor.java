package com.example.kb.service.entity;

import com.example.kb.config.AppProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 基于规则的实体抽取 - 括号/引号/键值字段匹配
 *
 * 这是一个近似实现, 不是 NLP 模型。关系数量按 floor(实体数 * 系数) 估算,
 * 系数默认 0.5, 只是占位启发式, 需产品确认后再替换为真正的关系抽取。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HeuristicEntityExtractor implements EntityExtractor {

    // 顺序固定, 决定结果集合的插入顺序
    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("【([^【】\\n]+)】"),
            Pattern.compile("「([^「」\\n]+)」"),
            Pattern.compile("『([^『』\\n]+)』"),
            Pattern.compile("《([^《》\\n]+)》"),
            Pattern.compile("“([^“”\\n]+)”"),
            Pattern.compile("\"([^\"\\n]+)\""),
            // 取值到逗号、句号或行尾为止, 值中可以有空格
            Pattern.compile("(?:设备|型号|部件|故障|device|model|component|fault)\\s*[:：]\\s*([^，,。\\n]+?)\\s*(?=[，,。\\n]|$)",
                    Pattern.CASE_INSENSITIVE)
    );

    private final AppProperties appProperties;

    @Override
    public EntityExtractionResult extract(String text) {
        if (text == null || text.isEmpty()) {
            return new EntityExtractionResult(Collections.emptySet(), 0);
        }

        int maxLength = appProperties.getEntity().getMaxEntityLength();
        Set<String> entities = new LinkedHashSet<>();
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String entity = matcher.group(1).trim();
                // 超长的多半是误捕获的整段文字
                if (!entity.isEmpty() && entity.length() <= maxLength) {
                    entities.add(entity);
                }
            }
        }

        int relationCount = estimateRelations(entities.size());
        log.debug("实体抽取完成: entities={}, relations={}", entities.size(), relationCount);
        return new EntityExtractionResult(Collections.unmodifiableSet(entities), relationCount);
    }

    int estimateRelations(int entityCount) {
        return (int) Math.floor(entityCount * appProperties.getEntity().getRelationFactor());
    }
}
