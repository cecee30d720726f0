package com.lpzapper.api.dto;

/**
 * Position to watch; any integer, wrapped into the ledger's range. Defaults to the first position.
 */
public record WatchRequest(Integer positionIndex) {
}
