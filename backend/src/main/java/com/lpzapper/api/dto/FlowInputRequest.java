package com.lpzapper.api.dto;

/**
 * Free text typed by the user: a token address or an ETH amount depending on the flow state.
 */
public record FlowInputRequest(String text) {
}
