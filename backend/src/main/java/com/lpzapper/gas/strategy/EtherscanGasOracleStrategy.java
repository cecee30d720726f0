package com.lpzapper.gas.strategy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lpzapper.common.EthUnits;
import com.lpzapper.common.RateLimiter;
import com.lpzapper.gas.GasQuote;
import com.lpzapper.gas.GasQuoteResult;
import com.lpzapper.gas.GasQuoteSource;
import com.lpzapper.gas.GasQuoteStrategy;
import com.lpzapper.gas.SpeedTier;
import com.lpzapper.gas.config.GasProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;

/**
 * Primary tier: Etherscan-compatible gas oracle ({@code module=gastracker&action=gasoracle}).
 * Prices in the response are gwei strings.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class EtherscanGasOracleStrategy implements GasQuoteStrategy {

    static final BigDecimal INSTANT_FACTOR = new BigDecimal("1.2");

    private final GasProperties gasProperties;
    private final WebClient.Builder webClientBuilder;
    private final RateLimiter gasOracleRateLimiter;
    private final ObjectMapper objectMapper;

    @Override
    public GasQuoteSource source() {
        return GasQuoteSource.PRIMARY_ORACLE;
    }

    @Override
    public GasQuoteResult attempt() {
        GasProperties.Oracle oracle = gasProperties.getOracle();
        if (!oracle.isEnabled()) {
            return GasQuoteResult.failure("gas oracle disabled", null);
        }
        if (!gasOracleRateLimiter.tryAcquire()) {
            return GasQuoteResult.failure("gas oracle call budget exhausted", null);
        }
        String url = UriComponentsBuilder.fromHttpUrl(oracle.getUrl())
                .queryParam("module", "gastracker")
                .queryParam("action", "gasoracle")
                .queryParam("apikey", oracle.getApiKey())
                .toUriString();
        String body;
        try {
            body = webClientBuilder.build().get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(oracle.getTimeoutMs()))
                    .block();
        } catch (WebClientException e) {
            return GasQuoteResult.failure("gas oracle HTTP error: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // block() rethrows the TimeoutException wrapped in a RuntimeException
            return GasQuoteResult.failure("gas oracle unreachable: " + e.getMessage(), e);
        }
        return parse(body);
    }

    GasQuoteResult parse(String body) {
        if (body == null || body.isBlank()) {
            return GasQuoteResult.failure("gas oracle returned an empty body", null);
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (!"1".equals(root.path("status").asText())) {
                return GasQuoteResult.failure("gas oracle status " + root.path("status").asText()
                        + ": " + root.path("result").asText(root.path("message").asText()), null);
            }
            JsonNode result = root.path("result");
            BigDecimal safe = gwei(result, "SafeGasPrice");
            BigDecimal propose = gwei(result, "ProposeGasPrice");
            BigDecimal fast = gwei(result, "FastGasPrice");
            BigDecimal baseFeeGwei = gwei(result, "suggestBaseFee");
            return GasQuoteResult.success(toQuote(safe, propose, fast, baseFeeGwei));
        } catch (Exception e) {
            return GasQuoteResult.failure("gas oracle response malformed: " + e.getMessage(), e);
        }
    }

    private GasQuote toQuote(BigDecimal safe, BigDecimal propose, BigDecimal fast, BigDecimal baseFeeGwei) {
        SpeedTier tier = gasProperties.getSpeedTier();
        BigDecimal selectedGwei = switch (tier) {
            case SAFE -> safe;
            case STANDARD -> propose;
            case FAST -> fast;
            case INSTANT -> fast.multiply(INSTANT_FACTOR);
        };
        BigInteger selected = EthUnits.gweiToWei(selectedGwei.multiply(gasProperties.getMultiplier()));
        BigInteger baseFee = EthUnits.gweiToWei(baseFeeGwei);
        BigInteger minPriority = EthUnits.gweiToWei(gasProperties.getMinPriorityFeeGwei());
        BigInteger priority = selected.subtract(baseFee).max(minPriority);
        return GasQuote.capped(baseFee, priority, selected, EthUnits.gweiToWei(gasProperties.getCeilingGwei()),
                tier, GasQuoteSource.PRIMARY_ORACLE);
    }

    private static BigDecimal gwei(JsonNode result, String field) {
        String text = result.path(field).asText(null);
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("missing " + field);
        }
        BigDecimal value = new BigDecimal(text.trim());
        if (value.signum() < 0) {
            throw new IllegalArgumentException("negative " + field);
        }
        return value;
    }
}
