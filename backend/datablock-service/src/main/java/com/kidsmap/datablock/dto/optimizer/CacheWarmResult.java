package com.kidsmap.datablock.dto.optimizer;

public record CacheWarmResult(int cachedPlaces, int cachedContents) {
}
