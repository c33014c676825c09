package com.marketengine.estimation.controller;

import com.marketengine.common.exception.InvalidCostOverrideException;
import com.marketengine.common.exception.MarketEngineException;
import com.marketengine.estimation.dto.ErrorResponseDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps engine exceptions to JSON error bodies.
 *
 * <pre>
 *   InvalidCostOverrideException, IllegalArgumentException, bad input → 400
 *   MarketEngineException from ListingClient                          → 502
 *   any other MarketEngineException                                   → 500
 * </pre>
 */
@RestControllerAdvice
public class GlobalErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalErrorHandler.class);

    static final String LISTING_COMPONENT = "ListingClient";

    @ExceptionHandler(InvalidCostOverrideException.class)
    public ResponseEntity<ErrorResponseDTO> handleOverride(InvalidCostOverrideException ex) {
        log.info("Cost override rejected: {}", ex.getReason());
        return ResponseEntity.badRequest().body(new ErrorResponseDTO("invalid_cost_override", ex.getReason()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDTO> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponseDTO("bad_request", ex.getMessage()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponseDTO> handleInput(ServerWebInputException ex) {
        log.warn("Input error: {}", ex.getReason());
        return ResponseEntity.badRequest().body(new ErrorResponseDTO("bad_request", ex.getReason()));
    }

    @ExceptionHandler(MarketEngineException.class)
    public ResponseEntity<ErrorResponseDTO> handleEngine(MarketEngineException ex) {
        if (LISTING_COMPONENT.equals(ex.getComponent())) {
            log.warn("Upstream listing failure: {}", ex.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new ErrorResponseDTO("listing_unavailable", ex.getMessage()));
        }
        log.error("Engine error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponseDTO("engine_error", ex.getMessage()));
    }
}
