package com.lpzapper.session.flow;

import com.github.benmanes.caffeine.cache.Cache;
import com.lpzapper.balance.InsufficientFundsException;
import com.lpzapper.chain.RpcException;
import com.lpzapper.common.Addresses;
import com.lpzapper.common.EthUnits;
import com.lpzapper.config.CaffeineConfig;
import com.lpzapper.ledger.LedgerPersistenceException;
import com.lpzapper.session.SessionCoordinator;
import com.lpzapper.session.config.WatcherProperties;
import com.lpzapper.zap.ZapExecutionException;
import com.lpzapper.zap.ZapInPreview;
import com.lpzapper.zap.ZapInQuote;
import com.lpzapper.zap.ZapResult;
import com.lpzapper.zap.ZapService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Zap-in conversation: address → amount → confirmation → execution. Starting a flow stops the session's watcher
 * and marks the session in flight until the flow reaches a terminal state. Invalid address or amount input
 * cancels the flow. A completed zap-in starts watching the new position.
 * <p>
 * Every transition replaces the exact snapshot it started from, so a flow restarted meanwhile is never
 * overwritten. Flows idle past the session timeout are dropped; an unfinished one releases the session.
 * Methods block on chain I/O and are meant to run on the command executor.
 */
@Service
@Slf4j
public class ZapInFlowService {

    private final Cache<String, ZapInFlow> flows;

    private final SessionCoordinator sessionCoordinator;
    private final ZapService zapService;
    private final Clock clock;

    public ZapInFlowService(SessionCoordinator sessionCoordinator, ZapService zapService,
                            WatcherProperties watcherProperties, Clock clock) {
        this.sessionCoordinator = sessionCoordinator;
        this.zapService = zapService;
        this.clock = clock;
        this.flows = CaffeineConfig.sessionScoped(Duration.ofMillis(watcherProperties.getSessionIdleTimeoutMs()), clock,
                (sessionId, flow, cause) -> {
                    if (cause.wasEvicted() && flow != null && !flow.state().isTerminal()) {
                        log.info("Dropping idle zap-in of session {} in state {}", sessionId, flow.state());
                        sessionCoordinator.endFlow(sessionId);
                    }
                });
    }

    public ZapInFlow start(String sessionId) {
        ZapInFlow flow = flows.asMap().compute(sessionId, (id, current) -> {
            if (current != null && current.state() == ZapInFlowState.EXECUTING) {
                throw new FlowStateException("A zap-in is already executing for this session");
            }
            sessionCoordinator.beginFlow(id);
            return ZapInFlow.start(id, clock.instant());
        });
        log.info("Zap-in flow started for session {}", sessionId);
        return flow;
    }

    /**
     * Feeds user text to the flow: the token address in AWAITING_ADDRESS, the ETH amount in AWAITING_AMOUNT.
     */
    public ZapInFlow input(String sessionId, String text) {
        ZapInFlow flow = active(sessionId);
        return switch (flow.state()) {
            case AWAITING_ADDRESS -> onAddress(flow, text);
            case AWAITING_AMOUNT -> onAmount(flow, text);
            default -> throw new FlowStateException("No input expected in state " + flow.state());
        };
    }

    public ZapInFlow confirm(String sessionId) {
        ZapInFlow flow = active(sessionId);
        if (flow.state() != ZapInFlowState.CONFIRMING) {
            throw new FlowStateException("Nothing to confirm in state " + flow.state());
        }
        ZapInFlow executing = update(flow, flow.executing(clock.instant()));
        ZapInFlow outcome;
        try {
            ZapResult result = zapService.zapIn(executing.tokenAddress(), executing.amountEth());
            outcome = executing.completed(result, clock.instant());
        } catch (InsufficientFundsException | ZapExecutionException | RpcException | LedgerPersistenceException e) {
            log.error("Zap-in failed for session {}: {}", sessionId, e.getMessage());
            outcome = executing.failed("Zap In failed: " + e.getMessage(), clock.instant());
        } catch (RuntimeException e) {
            log.error("Zap-in for session {} failed unexpectedly", sessionId, e);
            outcome = executing.failed("Zap In failed: " + (e.getMessage() != null ? e.getMessage()
                    : e.getClass().getSimpleName()), clock.instant());
        }
        finish(executing, outcome);
        if (outcome.state() == ZapInFlowState.COMPLETED) {
            try {
                sessionCoordinator.startWatcher(sessionId, outcome.result().positionIndex());
            } catch (RuntimeException e) {
                log.warn("Zap-in done but watcher for session {} did not start: {}", sessionId, e.getMessage());
            }
        }
        return outcome;
    }

    public ZapInFlow cancel(String sessionId) {
        ZapInFlow flow = active(sessionId);
        if (flow.state() == ZapInFlowState.EXECUTING) {
            throw new FlowStateException("A zap-in that is executing cannot be cancelled");
        }
        return finishOrReject(flow, flow.cancelled("Zap-in cancelled.", clock.instant()));
    }

    public Optional<ZapInFlow> get(String sessionId) {
        return Optional.ofNullable(flows.getIfPresent(sessionId));
    }

    private ZapInFlow onAddress(ZapInFlow flow, String text) {
        String candidate = text == null ? "" : text.trim();
        if (!Addresses.isValid(candidate)) {
            return finishOrReject(flow,
                    flow.cancelled("Invalid address. The zap-in process has been cancelled.", clock.instant()));
        }
        String token = Addresses.checksum(candidate);
        try {
            ZapInPreview preview = zapService.previewZapIn(token);
            return update(flow, flow.awaitingAmount(token, preview, clock.instant()));
        } catch (ZapExecutionException | RpcException e) {
            return finishOrReject(flow, flow.failed("Could not load token " + token + ": " + e.getMessage(), clock.instant()));
        }
    }

    private ZapInFlow onAmount(ZapInFlow flow, String text) {
        Optional<BigDecimal> amount = EthUnits.parsePositiveEth(text);
        if (amount.isEmpty()) {
            return finishOrReject(flow,
                    flow.cancelled("Invalid input. The zap-in process has been cancelled.", clock.instant()));
        }
        try {
            ZapInQuote quote = zapService.quoteZapIn(flow.tokenAddress(), amount.get());
            return update(flow, flow.confirming(amount.get(), quote, clock.instant()));
        } catch (InsufficientFundsException | ZapExecutionException | RpcException e) {
            return finishOrReject(flow, flow.failed(e.getMessage(), clock.instant()));
        }
    }

    private ZapInFlow active(String sessionId) {
        ZapInFlow flow = flows.getIfPresent(sessionId);
        if (flow == null || flow.state().isTerminal()) {
            throw new FlowStateException("No zap-in in progress for this session");
        }
        return flow;
    }

    private ZapInFlow update(ZapInFlow expected, ZapInFlow next) {
        if (!replace(expected, next)) {
            throw restarted();
        }
        return next;
    }

    private ZapInFlow finishOrReject(ZapInFlow expected, ZapInFlow next) {
        if (!finish(expected, next)) {
            throw restarted();
        }
        return next;
    }

    /**
     * @return false when {@code expected} is no longer the session's flow; nothing is changed then
     */
    private boolean finish(ZapInFlow expected, ZapInFlow next) {
        if (!replace(expected, next)) {
            log.warn("Zap-in of session {} ended {} after it was replaced: {}", next.sessionId(), next.state(), next.message());
            return false;
        }
        sessionCoordinator.endFlow(next.sessionId());
        log.info("Zap-in flow for session {} ended {}: {}", next.sessionId(), next.state(), next.message());
        return true;
    }

    private boolean replace(ZapInFlow expected, ZapInFlow next) {
        AtomicBoolean replaced = new AtomicBoolean();
        flows.asMap().computeIfPresent(expected.sessionId(), (id, current) -> {
            if (current != expected) {
                return current;
            }
            replaced.set(true);
            return next;
        });
        return replaced.get();
    }

    private static FlowStateException restarted() {
        return new FlowStateException("The zap-in for this session was restarted");
    }
}
