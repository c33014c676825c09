package com.marketengine.estimation.controller;

import com.marketengine.common.model.EstimatorModel;
import com.marketengine.common.model.ModelType;
import com.marketengine.estimation.dto.RetrainResultDTO;
import com.marketengine.estimation.service.CalibrationService;
import com.marketengine.estimation.service.RetrainingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Locale;

@RestController
@RequestMapping("/api/v1/calibration")
public class CalibrationController {

    private static final Logger log = LoggerFactory.getLogger(CalibrationController.class);

    private final CalibrationService calibrationService;
    private final RetrainingService retrainingService;

    public CalibrationController(CalibrationService calibrationService, RetrainingService retrainingService) {
        this.calibrationService = calibrationService;
        this.retrainingService  = retrainingService;
    }

    @PostMapping("/{marketplace}/retrain")
    public Mono<ResponseEntity<RetrainResultDTO>> retrain(@PathVariable String marketplace) {
        String key = marketplace.toUpperCase(Locale.ROOT);
        log.info("Manual retrain requested. marketplace={}", key);
        return retrainingService.retrain(key)
            .map(activated -> ResponseEntity.ok(new RetrainResultDTO(key, activated)));
    }

    @GetMapping("/{marketplace}/{modelType}")
    public Mono<ResponseEntity<EstimatorModel>> activeModel(@PathVariable String marketplace,
                                                            @PathVariable String modelType) {
        return calibrationService.activeModel(marketplace.toUpperCase(Locale.ROOT), ModelType.fromKey(modelType))
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{marketplace}/{modelType}/versions")
    public Flux<EstimatorModel> versions(@PathVariable String marketplace,
                                         @PathVariable String modelType,
                                         @RequestParam(defaultValue = "20") int limit) {
        return calibrationService.versions(marketplace.toUpperCase(Locale.ROOT), ModelType.fromKey(modelType), limit);
    }
}
