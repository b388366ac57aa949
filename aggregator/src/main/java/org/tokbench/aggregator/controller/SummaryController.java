package org.tokbench.aggregator.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.tokbench.aggregator.model.AggregateResult;
import org.tokbench.aggregator.model.RunReport;
import org.tokbench.aggregator.service.AggregationService;
import org.tokbench.common.Language;

@RestController
@RequestMapping("/api")
public class SummaryController {

    private final AggregationService aggregationService;

    public SummaryController(AggregationService aggregationService) {
        this.aggregationService = aggregationService;
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<RunReport> getRun(@PathVariable String runId) {
        return aggregationService.getReport(runId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/aggregates/{language}/{tokenizer}")
    public AggregateResult getAggregate(@PathVariable String language,
                                        @PathVariable String tokenizer,
                                        @RequestParam(defaultValue = "${tokbench.run.namespace:default}") String namespace) {
        return aggregationService.aggregate(namespace, Language.fromCode(language), tokenizer);
    }
}
