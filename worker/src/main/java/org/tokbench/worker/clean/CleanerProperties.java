package org.tokbench.worker.clean;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "tokbench.cleaner")
@Data
public class CleanerProperties {

    private Map<String, List<Rule>> rules = new HashMap<>();

    @Data
    public static class Rule {
        private String name;
        private String pattern;
        private RuleAction action = RuleAction.SPACE;
    }
}
