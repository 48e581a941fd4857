package com.lottoharvest.infrastructure.rest;

import com.lottoharvest.application.usecase.HarvestRoundsUseCase;
import com.lottoharvest.domain.exception.RoundResolutionException;
import com.lottoharvest.domain.model.HarvestSnapshot;
import com.lottoharvest.domain.model.RoundResolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for triggering harvest runs.
 */
@RestController
@RequestMapping("/harvest")
public class HarvestController {

    private static final Logger logger = LoggerFactory.getLogger(HarvestController.class);

    private final HarvestRoundsUseCase harvestRoundsUseCase;

    public HarvestController(HarvestRoundsUseCase harvestRoundsUseCase) {
        this.harvestRoundsUseCase = harvestRoundsUseCase;
    }

    /**
     * Runs one harvest over the configured window.
     *
     * POST /harvest/refresh
     *
     * @return the snapshot, with per-unit failures in its meta; 503 when the latest round
     *         could not be determined
     */
    @PostMapping("/refresh")
    public ResponseEntity<HarvestSnapshot> refresh() {
        logger.info("Received request to run a harvest");

        try {
            HarvestSnapshot snapshot = harvestRoundsUseCase.execute();
            logger.info("Harvest completed. Latest round {}, {} failures",
                snapshot.getMeta().getLatestRound(), snapshot.getMeta().getFailures().size());
            return ResponseEntity.ok(snapshot);
        } catch (RoundResolutionException e) {
            logger.error("Latest round could not be determined", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        } catch (Exception e) {
            logger.error("Error running harvest", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * GET /harvest/latest-round
     */
    @GetMapping("/latest-round")
    public ResponseEntity<RoundResolution> latestRound() {
        try {
            return ResponseEntity.ok(harvestRoundsUseCase.resolveLatestRound());
        } catch (RoundResolutionException e) {
            logger.error("Latest round could not be determined", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }
}
