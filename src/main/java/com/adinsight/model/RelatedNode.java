package com.adinsight.model;

public record RelatedNode(
    String node,
    String type,
    double weight
) {}
