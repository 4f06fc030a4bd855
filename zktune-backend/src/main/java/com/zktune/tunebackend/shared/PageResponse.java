package com.zktune.tunebackend.shared;

import java.util.List;

public record PageResponse<T>(List<T> items, long totalItems, int totalPages, int page, int limit) {
}
