package com.marketengine.estimation.controller;

import com.marketengine.common.model.BrandMoatVerdict;
import com.marketengine.common.moat.BrandMoatClassifier;
import com.marketengine.estimation.dto.MoatRequestDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/moat")
public class MoatController {

    private static final Logger log = LoggerFactory.getLogger(MoatController.class);

    @PostMapping
    public Mono<ResponseEntity<BrandMoatVerdict>> classify(@RequestBody MoatRequestDTO body) {
        return Mono.fromCallable(() -> BrandMoatClassifier.classify(body.listings()))
            .doOnSuccess(verdict -> log.info("BRAND_MOAT level={} dominantBrand={} sharePct={} listings={}",
                verdict.level(), verdict.dominantBrand(), verdict.revenueSharePct(),
                body.listings() != null ? body.listings().size() : 0))
            .map(ResponseEntity::ok);
    }
}
