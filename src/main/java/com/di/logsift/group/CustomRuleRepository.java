package com.di.logsift.group;

import com.di.logsift.config.LogSiftProperties;
import com.di.logsift.signature.CustomPatternRule;
import com.di.logsift.store.DocumentStore;
import com.di.logsift.store.IndexDefinitions;
import com.di.logsift.store.ScanHit;
import com.di.logsift.store.StoreException;
import com.di.logsift.store.StoreQuery;
import com.di.logsift.util.ContentHash;
import com.di.logsift.util.Timestamps;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Custom grouping rules in the custom patterns index, one document per rule name.
 */
@Slf4j
@Component
public class CustomRuleRepository {

    private final DocumentStore store;
    private final ObjectMapper objectMapper;
    private final String index;
    private final int maxRules;

    public CustomRuleRepository(DocumentStore store, LogSiftProperties properties, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.index = properties.getIndices().getCustomPatterns();
        this.maxRules = properties.getGrouping().getMaxCustomRules();
    }

    /**
     * All stored rules, at most {@code logsift.grouping.max-custom-rules}. A missing index or a
     * failed read yields no rules.
     */
    public List<CustomPatternRule> loadRules() {
        try {
            if (!store.indexExists(index)) {
                return List.of();
            }
            List<CustomPatternRule> rules = new ArrayList<>();
            for (ScanHit hit : store.search(index, StoreQuery.matchAll(), maxRules)) {
                rules.add(objectMapper.convertValue(hit.source(), CustomPatternRule.class));
            }
            return rules;
        } catch (StoreException e) {
            log.warn("[GROUP] could not load custom rules from {}: {}", index, e.getMessage());
            return List.of();
        }
    }

    /**
     * Stores a rule, replacing any rule of the same name.
     *
     * @throws IllegalArgumentException when the name is blank or the pattern does not compile
     */
    public CustomPatternRule saveRule(String name, String pattern, String groupType) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Rule name must not be blank");
        }
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("Rule pattern must not be empty");
        }
        try {
            Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid pattern for rule '" + name + "': " + e.getDescription(), e);
        }
        CustomPatternRule rule = new CustomPatternRule(name, pattern,
                groupType == null || groupType.isBlank() ? CustomPatternRule.DEFAULT_GROUP_TYPE : groupType);

        IndexDefinitions.ensureIndex(store, index, IndexDefinitions.customPatterns());
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("name", rule.name());
        document.put("pattern", rule.pattern());
        document.put("group_type", rule.groupType());
        document.put("created_at", Timestamps.now());
        store.put(index, ContentHash.md5Hex(name), document);
        store.refresh(index);
        log.info("[GROUP] saved custom rule '{}' ({})", name, rule.groupType());
        return rule;
    }
}
