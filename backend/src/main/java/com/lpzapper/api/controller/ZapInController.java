package com.lpzapper.api.controller;

import com.lpzapper.api.dto.ErrorBody;
import com.lpzapper.api.dto.ZapInRequest;
import com.lpzapper.api.validation.AddressValidator;
import com.lpzapper.common.EthUnits;
import com.lpzapper.config.AsyncConfig;
import com.lpzapper.zap.ZapService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * GET /zap-in/preview, GET /zap-in/quote, POST /zap-in. Execution runs on the command executor.
 */
@RestController
@RequestMapping("/api/v1/zap-in")
public class ZapInController {

    private final ZapService zapService;
    private final AddressValidator addressValidator;
    private final Scheduler commandScheduler;

    public ZapInController(ZapService zapService, AddressValidator addressValidator,
                           @Qualifier(AsyncConfig.COMMAND_SCHEDULER) Scheduler commandScheduler) {
        this.zapService = zapService;
        this.addressValidator = addressValidator;
        this.commandScheduler = commandScheduler;
    }

    @GetMapping("/preview")
    public Mono<ResponseEntity<?>> preview(@RequestParam(required = false) String token) {
        if (!addressValidator.isValidAddress(token)) {
            return Mono.just(ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", "Invalid token address")));
        }
        return Mono.<ResponseEntity<?>>fromCallable(() -> ResponseEntity.ok(zapService.previewZapIn(token.trim())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/quote")
    public Mono<ResponseEntity<?>> quote(@RequestParam(required = false) String token,
                                         @RequestParam(required = false) String amountEth) {
        if (!addressValidator.isValidAddress(token)) {
            return Mono.just(ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", "Invalid token address")));
        }
        Optional<BigDecimal> amount = EthUnits.parsePositiveEth(amountEth);
        if (amount.isEmpty()) {
            return Mono.just(ResponseEntity.badRequest().body(ErrorBody.of("INVALID_AMOUNT", "Amount must be a positive number of ETH")));
        }
        return Mono.<ResponseEntity<?>>fromCallable(() -> ResponseEntity.ok(zapService.quoteZapIn(token.trim(), amount.get())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping
    public Mono<ResponseEntity<?>> zapIn(@RequestBody @Valid ZapInRequest request) {
        return Mono.<ResponseEntity<?>>fromCallable(() -> ResponseEntity.ok(
                        zapService.zapIn(request.tokenAddress().trim(), request.amountEth())))
                .subscribeOn(commandScheduler);
    }
}
