package com.reviewmerge.interfaces.api.consolidation;

import com.fasterxml.jackson.databind.JsonNode;
import com.reviewmerge.application.consolidation.ConsolidationAppService;
import com.reviewmerge.domain.consolidation.model.ConsolidatedReport;
import com.reviewmerge.infrastructure.consolidation.pipeline.ConsolidationPipeline;
import com.reviewmerge.interfaces.api.dto.ConsolidationLimitsResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/consolidations")
@RequiredArgsConstructor
public class ConsolidationController {

    private final ConsolidationAppService consolidationAppService;

    @PostMapping
    public ResponseEntity<ConsolidatedReport> consolidate(@RequestBody JsonNode body) {
        return ResponseEntity.ok(consolidationAppService.consolidate(body));
    }

    @GetMapping("/limits")
    public ResponseEntity<ConsolidationLimitsResponse> getLimits() {
        return ResponseEntity.ok(new ConsolidationLimitsResponse(
                consolidationAppService.getMaxSources(), ConsolidationPipeline.REPORT_VERSION));
    }
}
