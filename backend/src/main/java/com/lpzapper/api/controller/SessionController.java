package com.lpzapper.api.controller;

import com.lpzapper.api.dto.ErrorBody;
import com.lpzapper.api.dto.FlowInputRequest;
import com.lpzapper.api.dto.WatchRequest;
import com.lpzapper.api.dto.WatchResponse;
import com.lpzapper.config.AsyncConfig;
import com.lpzapper.session.PositionUpdate;
import com.lpzapper.session.SessionCoordinator;
import com.lpzapper.session.SessionUpdateHub;
import com.lpzapper.session.WatcherHandle;
import com.lpzapper.session.flow.ZapInFlow;
import com.lpzapper.session.flow.ZapInFlowService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Per-session endpoints: watch a position, stream its updates (SSE), and drive the zap-in conversation.
 * A session id is any client-chosen string.
 */
@RestController
@RequestMapping("/api/v1/sessions/{sessionId}")
public class SessionController {

    private final SessionCoordinator sessionCoordinator;
    private final SessionUpdateHub updateHub;
    private final ZapInFlowService flowService;
    private final Scheduler commandScheduler;

    public SessionController(SessionCoordinator sessionCoordinator, SessionUpdateHub updateHub,
                             ZapInFlowService flowService,
                             @Qualifier(AsyncConfig.COMMAND_SCHEDULER) Scheduler commandScheduler) {
        this.sessionCoordinator = sessionCoordinator;
        this.updateHub = updateHub;
        this.flowService = flowService;
        this.commandScheduler = commandScheduler;
    }

    @PostMapping("/watch")
    public Mono<WatchResponse> watch(@PathVariable String sessionId, @RequestBody(required = false) WatchRequest request) {
        int index = request == null || request.positionIndex() == null ? 0 : request.positionIndex();
        return Mono.fromCallable(() -> {
            WatcherHandle handle = sessionCoordinator.startWatcher(sessionId, index);
            return new WatchResponse(handle.sessionId(), handle.positionIndex(), handle.tokenAddress());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/watch")
    public ResponseEntity<Void> unwatch(@PathVariable String sessionId) {
        return sessionCoordinator.stopWatcher(sessionId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping(value = "/updates", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<PositionUpdate> updates(@PathVariable String sessionId) {
        return updateHub.updates(sessionId);
    }

    @PostMapping("/zap-in")
    public ZapInFlow startFlow(@PathVariable String sessionId) {
        return flowService.start(sessionId);
    }

    @PostMapping("/zap-in/input")
    public Mono<ZapInFlow> input(@PathVariable String sessionId, @RequestBody FlowInputRequest request) {
        return Mono.fromCallable(() -> flowService.input(sessionId, request.text()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/zap-in/confirm")
    public Mono<ZapInFlow> confirm(@PathVariable String sessionId) {
        return Mono.fromCallable(() -> flowService.confirm(sessionId)).subscribeOn(commandScheduler);
    }

    @DeleteMapping("/zap-in")
    public ZapInFlow cancel(@PathVariable String sessionId) {
        return flowService.cancel(sessionId);
    }

    @GetMapping("/zap-in")
    public ResponseEntity<?> current(@PathVariable String sessionId) {
        return flowService.get(sessionId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorBody.of("NO_FLOW", "No zap-in for this session")));
    }
}
