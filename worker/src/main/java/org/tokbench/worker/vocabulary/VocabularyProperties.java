package org.tokbench.worker.vocabulary;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "tokbench.vocabulary")
@Data
public class VocabularyProperties {

    private Map<String, String> locations = new HashMap<>();
}
