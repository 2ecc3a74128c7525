package com.example.workbookmerge.web;

public record ErrorResponse(
        String stage,
        String kind,
        String message
) {
}
