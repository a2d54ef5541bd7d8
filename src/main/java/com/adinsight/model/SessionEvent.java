package com.adinsight.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

public record SessionEvent(
    String eventId,
    Instant timestamp,
    JsonNode payload
) {}
