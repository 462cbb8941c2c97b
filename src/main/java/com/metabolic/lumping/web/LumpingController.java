package com.metabolic.lumping.web;

import com.metabolic.lumping.domain.LumpingResult;
import com.metabolic.lumping.io.ModelLoadException;
import com.metabolic.lumping.problem.OptimizationFailedException;
import com.metabolic.lumping.service.LumpingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/lump")
@RequiredArgsConstructor
public class LumpingController {

    private final LumpingService lumpingService;

    @PostMapping
    public ResponseEntity<LumpingResult> lump(@RequestBody LumpingRequest request) {
        LumpingResult result = lumpingService.lumpModel(
                request.getModelPath(),
                request.getThermoDbPath(),
                request.getBiomassReactions(),
                request.getCoreSubsystems(),
                request.getParams()
        );
        return ResponseEntity.ok(result);
    }

    @ExceptionHandler({IllegalArgumentException.class, ModelLoadException.class})
    public ResponseEntity<Map<String, String>> badRequest(RuntimeException e) {
        log.warn("Rejected lumping request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", e.getMessage()));
    }

    // Raised before any biomass reaction is lumped, e.g. while estimating the growth rate
    @ExceptionHandler(OptimizationFailedException.class)
    public ResponseEntity<Map<String, String>> solveFailed(OptimizationFailedException e) {
        log.warn("Lumping request failed in the solver ({}): {}", e.getStatus(), e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(Map.of("error", e.getMessage(), "status", e.getStatus()));
    }
}
