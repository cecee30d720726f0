package com.lpzapper.gas;

import lombok.Getter;

import java.util.Optional;

/**
 * Outcome of one tier attempt: a quote, or a failure reason with the underlying cause.
 */
@Getter
public class GasQuoteResult {

    private final GasQuote quote;
    private final String reason;
    private final Throwable cause;

    private GasQuoteResult(GasQuote quote, String reason, Throwable cause) {
        this.quote = quote;
        this.reason = reason;
        this.cause = cause;
    }

    public static GasQuoteResult success(GasQuote quote) {
        if (quote == null) {
            throw new IllegalArgumentException("quote is required");
        }
        return new GasQuoteResult(quote, null, null);
    }

    public static GasQuoteResult failure(String reason, Throwable cause) {
        return new GasQuoteResult(null, reason, cause);
    }

    public boolean isSuccess() {
        return quote != null;
    }

    public Optional<GasQuote> getQuote() {
        return Optional.ofNullable(quote);
    }

    /**
     * Returns the quote or throws {@link GasQuoteUnavailableException} carrying the failure reason.
     */
    public GasQuote orElseThrow() {
        if (quote != null) {
            return quote;
        }
        throw new GasQuoteUnavailableException(reason, cause);
    }
}
