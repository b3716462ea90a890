package com.example.documents.interfaces.api.dto;

import java.util.List;

public record DocumentListResponse(List<DocumentResponse> documents) {
}
