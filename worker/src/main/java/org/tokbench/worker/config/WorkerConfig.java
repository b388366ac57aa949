package org.tokbench.worker.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.tokbench.worker.clean.CleanerProperties;
import org.tokbench.worker.tokenizer.TokenizerProperties;
import org.tokbench.worker.vocabulary.VocabularyProperties;

@Configuration
@EnableConfigurationProperties({
        CleanerProperties.class,
        TokenizerProperties.class,
        VocabularyProperties.class
})
public class WorkerConfig {
}
