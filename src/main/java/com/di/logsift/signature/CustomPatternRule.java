package com.di.logsift.signature;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Operator-authored grouping rule as stored in the custom patterns index.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CustomPatternRule(@JsonProperty("name") String name,
                                @JsonProperty("pattern") String pattern,
                                @JsonProperty("group_type") String groupType) {

    public static final String DEFAULT_GROUP_TYPE = GroupType.CUSTOM_RULE.label();

    public String effectiveGroupType() {
        return groupType == null || groupType.isBlank() ? DEFAULT_GROUP_TYPE : groupType;
    }
}
