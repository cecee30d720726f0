package com.lpzapper.session.flow;

public enum ZapInFlowState {
    AWAITING_ADDRESS,
    AWAITING_AMOUNT,
    CONFIRMING,
    EXECUTING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
