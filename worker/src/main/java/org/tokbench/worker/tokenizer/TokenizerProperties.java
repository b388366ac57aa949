package org.tokbench.worker.tokenizer;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "tokbench.tokenizers")
@Data
public class TokenizerProperties {

    /** Drop tokens without a letter of the language's script before scoring. */
    private boolean scriptFilter = true;

    /** OpenNLP tokenizer model file per language code. */
    private Map<String, String> opennlpModel = new HashMap<>();
}
