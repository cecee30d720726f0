package com.lpzapper.market;

import com.lpzapper.chain.ChainGateway;
import com.lpzapper.chain.TokenMeta;
import com.lpzapper.config.CaffeineConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

/**
 * ERC-20 name/symbol/decimals, cached 24h. Tokens that do not answer the standard calls get
 * "Unknown Token" / "N/A" / 18, which is not cached so a transient failure is retried next time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TokenMetaResolver {

    private final ChainGateway chainGateway;

    @Cacheable(cacheNames = CaffeineConfig.TOKEN_META_CACHE, key = "#tokenAddress.toLowerCase()",
            unless = "#result.symbol() == 'N/A'")
    public TokenMeta getTokenMeta(String tokenAddress) {
        try {
            return chainGateway.getTokenMeta(tokenAddress);
        } catch (RuntimeException e) {
            log.warn("Token metadata unavailable for {}: {}", tokenAddress, e.getMessage());
            return TokenMeta.unknown();
        }
    }
}
