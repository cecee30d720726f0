package com.lpzapper.api.dto;

public record WatchResponse(String sessionId, int positionIndex, String tokenAddress) {
}
