package com.gymcoach.analysis.controller;

import com.gymcoach.analysis.dto.AdaptationRequest;
import com.gymcoach.analysis.dto.AnalysisReport;
import com.gymcoach.analysis.dto.AnalysisRequest;
import com.gymcoach.analysis.dto.BatchAnalysisRequest;
import com.gymcoach.analysis.service.AnalysisDispatchService;
import com.gymcoach.analysis.service.UserAnalysisService;
import com.gymcoach.common.adaptation.AdaptationStrategy;
import com.gymcoach.common.anomaly.AnomalyReport;
import com.gymcoach.common.monitor.ProgressReport;
import com.gymcoach.common.plateau.PlateauReport;
import com.gymcoach.common.result.Result;
import com.gymcoach.common.risk.RiskAssessment;
import com.gymcoach.common.trend.TrendReport;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/analyze")
public class AnalysisController {

    private final AnalysisDispatchService dispatchService;
    private final UserAnalysisService userAnalysisService;

    public AnalysisController(AnalysisDispatchService dispatchService,
                              UserAnalysisService userAnalysisService) {
        this.dispatchService = dispatchService;
        this.userAnalysisService = userAnalysisService;
    }

    @PostMapping
    public Mono<ResponseEntity<AnalysisReport>> analyze(@RequestBody AnalysisRequest request) {
        return dispatchService.analyze(request).map(ResponseEntity::ok);
    }

    @PostMapping("/trends")
    public Mono<ResponseEntity<Result<TrendReport>>> trends(@RequestBody AnalysisRequest request) {
        return dispatchService.trends(request).map(ResponseEntity::ok);
    }

    @PostMapping("/anomalies")
    public Mono<ResponseEntity<Result<AnomalyReport>>> anomalies(@RequestBody AnalysisRequest request) {
        return dispatchService.anomalies(request).map(ResponseEntity::ok);
    }

    @PostMapping("/plateaus")
    public Mono<ResponseEntity<Result<PlateauReport>>> plateaus(@RequestBody AnalysisRequest request) {
        return dispatchService.plateaus(request).map(ResponseEntity::ok);
    }

    @PostMapping("/risk")
    public Mono<ResponseEntity<Result<RiskAssessment>>> risk(@RequestBody AnalysisRequest request) {
        return dispatchService.risk(request).map(ResponseEntity::ok);
    }

    @PostMapping("/adaptation")
    public Mono<ResponseEntity<AdaptationStrategy>> adaptation(@RequestBody AdaptationRequest request) {
        return dispatchService.adaptation(request).map(ResponseEntity::ok);
    }

    @PostMapping("/progress")
    public Mono<ResponseEntity<Result<ProgressReport>>> progress(@RequestBody AnalysisRequest request) {
        return dispatchService.progress(request).map(ResponseEntity::ok);
    }

    @GetMapping("/users/{userId}")
    public Mono<ResponseEntity<AnalysisReport>> analyzeUser(
            @PathVariable String userId,
            @RequestParam(value = "windowDays", required = false) Integer windowDays) {
        return userAnalysisService.analyzeUser(userId, windowDays).map(ResponseEntity::ok);
    }

    @PostMapping(value = "/batch", produces = {MediaType.APPLICATION_NDJSON_VALUE, MediaType.APPLICATION_JSON_VALUE})
    public Flux<AnalysisReport> batch(@RequestBody BatchAnalysisRequest request) {
        return userAnalysisService.analyzeBatch(request.userIds(), request.windowDays());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
