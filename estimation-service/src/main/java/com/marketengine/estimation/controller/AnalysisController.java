package com.marketengine.estimation.controller;

import com.marketengine.common.model.Tier1Snapshot;
import com.marketengine.estimation.dto.AnalyzeRequestDTO;
import com.marketengine.estimation.dto.RefinementDTO;
import com.marketengine.estimation.service.AnalysisService;
import com.marketengine.estimation.service.Tier2RefinementService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/analyze")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final AnalysisService analysisService;
    private final Tier2RefinementService refinementService;

    public AnalysisController(AnalysisService analysisService, Tier2RefinementService refinementService) {
        this.analysisService   = analysisService;
        this.refinementService = refinementService;
    }

    @PostMapping("/keyword")
    public Mono<ResponseEntity<Tier1Snapshot>> analyzeKeyword(@RequestBody AnalyzeRequestDTO request) {
        log.info("Keyword analysis requested. keyword={} marketplace={}", request.keyword(), request.marketplace());
        return analysisService.analyzeKeyword(request)
            .map(ResponseEntity::ok);
    }

    /** 404 until the detached refinement for the snapshot has been stored. */
    @GetMapping("/{snapshotId}/refinement")
    public Mono<ResponseEntity<RefinementDTO>> refinement(@PathVariable String snapshotId) {
        log.info("Refinement query received. snapshotId={}", snapshotId);
        return refinementService.findRefinement(snapshotId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }
}
