package com.example.documents.interfaces.api.dto;

public record MessageResponse(String message) {
}
