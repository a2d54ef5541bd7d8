package com.adinsight.model;

public record TierStats(
    int keysCount,
    String type
) {}
