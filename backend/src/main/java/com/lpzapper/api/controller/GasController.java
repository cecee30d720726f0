package com.lpzapper.api.controller;

import com.lpzapper.gas.GasPriceResolver;
import com.lpzapper.gas.GasQuote;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * GET /gas/quote: the fee quote the next transaction would use.
 */
@RestController
@RequestMapping("/api/v1/gas")
@RequiredArgsConstructor
public class GasController {

    private final GasPriceResolver gasPriceResolver;

    @GetMapping("/quote")
    public Mono<GasQuote> quote() {
        return Mono.fromCallable(gasPriceResolver::resolve).subscribeOn(Schedulers.boundedElastic());
    }
}
