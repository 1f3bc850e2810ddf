package com.work.miner.web;

import com.work.miner.domain.PhaseConfig;
import com.work.miner.domain.SaleEvent;
import com.work.miner.exception.MinerException;
import com.work.miner.service.liquidation.SaleEventLog;
import com.work.miner.service.phase.ControllerStatus;
import com.work.miner.service.phase.EstimatorReport;
import com.work.miner.service.phase.PhaseController;
import com.work.miner.web.dto.PhaseRequest;
import com.work.miner.web.dto.RoundView;
import com.work.miner.web.dto.RunRoundsRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * 运维入口：执行轮次、强制切换阶段、查看估算器/状态/出售记录。
 *
 * 阶段或所有权冲突返回 409，参数错误返回 400。
 */
@RestController
@RequestMapping("/api/v1/miner")
public class MinerController {

    private final PhaseController controller;
    private final SaleEventLog saleLog;

    public MinerController(PhaseController controller, SaleEventLog saleLog) {
        this.controller = controller;
        this.saleLog = saleLog;
    }

    @PostMapping("/rounds")
    public ResponseEntity<RoundView> runOne() {
        return ResponseEntity.ok(RoundView.of(controller.runOneRound()));
    }

    @PostMapping("/rounds/batch")
    public ResponseEntity<List<RoundView>> runMany(@Validated @RequestBody RunRoundsRequest req) {
        List<RoundView> views = new ArrayList<>();
        controller.runRounds(req.getRounds()).forEach(r -> views.add(RoundView.of(r)));
        return ResponseEntity.ok(views);
    }

    @PostMapping("/phase")
    public ResponseEntity<PhaseConfig> forcePhase(@Validated @RequestBody PhaseRequest req) {
        return ResponseEntity.ok(controller.forcePhase(req.getPhase()));
    }

    @GetMapping("/estimator")
    public ResponseEntity<EstimatorReport> estimator() {
        return ResponseEntity.ok(controller.reportEstimator());
    }

    @GetMapping("/status")
    public ResponseEntity<ControllerStatus> status() {
        return ResponseEntity.ok(controller.status());
    }

    @GetMapping("/sales")
    public ResponseEntity<List<SaleEvent>> sales() {
        return ResponseEntity.ok(saleLog.all());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<String> handleState(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getMessage());
    }

    @ExceptionHandler(MinerException.class)
    public ResponseEntity<String> handleMiner(MinerException e) {
        HttpStatus status = e.isRetryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleArgument(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(e.getMessage());
    }
}
