package com.marketengine.estimation.controller;

import com.marketengine.common.model.MarginRequest;
import com.marketengine.common.model.MarginSnapshot;
import com.marketengine.estimation.dto.MarginRefineRequestDTO;
import com.marketengine.estimation.service.MarginService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/margin")
public class MarginController {

    private static final Logger log = LoggerFactory.getLogger(MarginController.class);

    private final MarginService marginService;

    public MarginController(MarginService marginService) {
        this.marginService = marginService;
    }

    @PostMapping
    public Mono<ResponseEntity<MarginSnapshot>> build(@RequestBody MarginRequest request) {
        log.info("Margin snapshot requested. mode={} sourcing={}", request.mode(), request.sourcingModel());
        return marginService.build(request)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/refine")
    public Mono<ResponseEntity<MarginSnapshot>> refine(@RequestBody MarginRefineRequestDTO body) {
        log.info("Margin refinement requested. hasOverrides={} hasFeeQuote={}",
            body.overrides() != null, body.feeQuote() != null);
        return marginService.refine(body.previous(), body.overrides(), body.feeQuote())
            .map(ResponseEntity::ok);
    }
}
