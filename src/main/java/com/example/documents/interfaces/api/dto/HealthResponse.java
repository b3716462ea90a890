package com.example.documents.interfaces.api.dto;

import java.time.Instant;

public record HealthResponse(String status, Instant timestamp) {
}
