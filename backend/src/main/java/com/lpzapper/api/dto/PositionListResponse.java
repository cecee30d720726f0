package com.lpzapper.api.dto;

import com.lpzapper.ledger.Position;

import java.util.List;

public record PositionListResponse(int total, List<Position> positions) {
}
