package com.lpzapper.session.flow;

import com.lpzapper.zap.ZapInPreview;
import com.lpzapper.zap.ZapInQuote;
import com.lpzapper.zap.ZapResult;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Snapshot of a session's zap-in conversation. Each transition returns a new snapshot.
 */
public record ZapInFlow(
        String sessionId,
        ZapInFlowState state,
        String tokenAddress,
        BigDecimal amountEth,
        ZapInPreview preview,
        ZapInQuote quote,
        ZapResult result,
        String message,
        Instant updatedAt
) {

    static ZapInFlow start(String sessionId, Instant now) {
        return new ZapInFlow(sessionId, ZapInFlowState.AWAITING_ADDRESS, null, null, null, null, null,
                "Please send the token contract address you want to zap into.", now);
    }

    ZapInFlow awaitingAmount(String token, ZapInPreview preview, Instant now) {
        return new ZapInFlow(sessionId, ZapInFlowState.AWAITING_AMOUNT, token, null, preview, null, null,
                "How much ETH do you want to zap in?", now);
    }

    ZapInFlow confirming(BigDecimal amount, ZapInQuote quote, Instant now) {
        return new ZapInFlow(sessionId, ZapInFlowState.CONFIRMING, tokenAddress, amount, preview, quote, null,
                "Confirm zap-in of " + amount.toPlainString() + " ETH.", now);
    }

    ZapInFlow executing(Instant now) {
        return new ZapInFlow(sessionId, ZapInFlowState.EXECUTING, tokenAddress, amountEth, preview, quote, null,
                "Zapping " + amountEth.toPlainString() + " ETH, waiting for confirmation.", now);
    }

    ZapInFlow completed(ZapResult result, Instant now) {
        return new ZapInFlow(sessionId, ZapInFlowState.COMPLETED, tokenAddress, amountEth, preview, quote, result,
                "Zap In successful! Transaction: " + result.txHash(), now);
    }

    ZapInFlow cancelled(String reason, Instant now) {
        return new ZapInFlow(sessionId, ZapInFlowState.CANCELLED, tokenAddress, amountEth, preview, quote, null, reason, now);
    }

    ZapInFlow failed(String reason, Instant now) {
        return new ZapInFlow(sessionId, ZapInFlowState.FAILED, tokenAddress, amountEth, preview, quote, null, reason, now);
    }
}
