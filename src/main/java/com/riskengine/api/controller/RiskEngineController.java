package com.riskengine.api.controller;

import com.riskengine.api.dto.response.EngineStatusResponse;
import com.riskengine.engine.EvaluationThrottle;
import com.riskengine.risk.RiskThresholds;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of the risk engine.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/risk-engine/status -- last admitted pass, tick counters and active thresholds</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/risk-engine")
public class RiskEngineController {

    private final EvaluationThrottle evaluationThrottle;
    private final RiskThresholds riskThresholds;

    public RiskEngineController(EvaluationThrottle evaluationThrottle, RiskThresholds riskThresholds) {
        this.evaluationThrottle = evaluationThrottle;
        this.riskThresholds = riskThresholds;
    }

    @GetMapping("/status")
    public ResponseEntity<EngineStatusResponse> getStatus() {
        EngineStatusResponse status = EngineStatusResponse.builder()
                .lastEvaluationAt(evaluationThrottle.getLastRun())
                .evaluationIntervalMillis(evaluationThrottle.getMinInterval().toMillis())
                .admittedTicks(evaluationThrottle.getAdmittedCount())
                .throttledTicks(evaluationThrottle.getRejectedCount())
                .thresholds(EngineStatusResponse.Thresholds.builder()
                        .feeRate(riskThresholds.getFeeRate())
                        .marginCallLevel(riskThresholds.getMarginCallLevel())
                        .stopOutLevel(riskThresholds.getStopOutLevel())
                        .maxDrawdownPct(riskThresholds.getMaxDrawdownPct())
                        .dailyDrawdownPct(riskThresholds.getDailyDrawdownPct())
                        .priceStaleAfterMillis(riskThresholds.getPriceStaleAfter().toMillis())
                        .build())
                .build();
        return ResponseEntity.ok(status);
    }
}
