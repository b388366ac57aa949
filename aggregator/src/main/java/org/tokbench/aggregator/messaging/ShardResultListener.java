package org.tokbench.aggregator.messaging;

import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.tokbench.aggregator.service.AggregationService;
import org.tokbench.common.ShardResult;

@Component
public class ShardResultListener {

    private final AggregationService aggregationService;

    public ShardResultListener(AggregationService aggregationService) {
        this.aggregationService = aggregationService;
    }

    @Async("aggregatorExecutor")
    @EventListener
    public void handleResult(ShardResult result) {
        aggregationService.handleShardResult(result);
    }
}
