package com.lpzapper.api.controller;

import com.lpzapper.api.dto.PositionListResponse;
import com.lpzapper.api.dto.ZapOutRequest;
import com.lpzapper.config.AsyncConfig;
import com.lpzapper.ledger.Position;
import com.lpzapper.ledger.PositionLedger;
import com.lpzapper.session.NoPositionsException;
import com.lpzapper.valuation.PositionValuator;
import com.lpzapper.valuation.PositionView;
import com.lpzapper.zap.ZapOutResult;
import com.lpzapper.zap.ZapService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * GET /positions, GET /positions/{index} (index wraps, like prev/next navigation), POST /positions/{index}/zap-out.
 */
@RestController
@RequestMapping("/api/v1/positions")
public class PositionController {

    private final PositionLedger positionLedger;
    private final PositionValuator positionValuator;
    private final ZapService zapService;
    private final Scheduler commandScheduler;

    public PositionController(PositionLedger positionLedger, PositionValuator positionValuator, ZapService zapService,
                              @Qualifier(AsyncConfig.COMMAND_SCHEDULER) Scheduler commandScheduler) {
        this.positionLedger = positionLedger;
        this.positionValuator = positionValuator;
        this.zapService = zapService;
        this.commandScheduler = commandScheduler;
    }

    @GetMapping
    public Mono<PositionListResponse> list() {
        return Mono.fromCallable(() -> {
            List<Position> positions = positionLedger.list();
            return new PositionListResponse(positions.size(), positions);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{index}")
    public Mono<PositionView> view(@PathVariable int index) {
        return Mono.fromCallable(() -> {
            List<Position> positions = positionLedger.list();
            if (positions.isEmpty()) {
                throw new NoPositionsException();
            }
            int wrapped = PositionLedger.wrapIndex(index, positions.size());
            return positionValuator.value(positions.get(wrapped), wrapped, positions.size());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{index}/zap-out")
    public Mono<ZapOutResult> zapOut(@PathVariable int index, @RequestBody @Valid ZapOutRequest request) {
        return Mono.fromCallable(() -> zapService.zapOut(index, request.percent())).subscribeOn(commandScheduler);
    }
}
