package io.github.cyfko.fuzzycast.spring.autoconfigure;

import io.github.cyfko.fuzzycast.core.config.EnumMatchMode;
import io.github.cyfko.fuzzycast.core.config.FuzzyCastConfig;
import io.github.cyfko.fuzzycast.core.config.GroupingMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized settings bound from {@code fuzzycast.*}.
 *
 * <pre>
 * fuzzycast.enum-match-mode=case-sensitive
 * fuzzycast.grouping-mode=or-into-last-group
 * </pre>
 */
@ConfigurationProperties(prefix = "fuzzycast")
public class FuzzyCastProperties {

    /**
     * How search terms are matched against enum constant names.
     */
    private EnumMatchMode enumMatchMode = EnumMatchMode.CASE_INSENSITIVE;

    /**
     * How a composition is merged into an expression that already has conditions.
     */
    private GroupingMode groupingMode = GroupingMode.AND_NEW_GROUP;

    public EnumMatchMode getEnumMatchMode() {
        return enumMatchMode;
    }

    public void setEnumMatchMode(EnumMatchMode enumMatchMode) {
        this.enumMatchMode = enumMatchMode;
    }

    public GroupingMode getGroupingMode() {
        return groupingMode;
    }

    public void setGroupingMode(GroupingMode groupingMode) {
        this.groupingMode = groupingMode;
    }

    public FuzzyCastConfig toConfig() {
        return FuzzyCastConfig.builder()
                .enumMatchMode(enumMatchMode)
                .groupingMode(groupingMode)
                .build();
    }
}
