package org.tokbench.runner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "tokbench.run")
@Data
public class BenchmarkProperties {

    private String language = "ur";

    private List<String> tokenizers = new ArrayList<>(List.of("whitespace"));

    private int batchSize = 1000;

    /** Continue from the stored checkpoints instead of resetting the namespace. */
    private boolean resume = true;

    private String storePath = "data/store";

    private Map<String, String> corpus = new HashMap<>();

    private String namespace = "default";

    private long shardSize = 250_000;

    private int workers = Runtime.getRuntime().availableProcessors();

    private boolean onStartup = false;

    private long logEvery = 100_000;
}
