package com.example.workbookmerge.web;

public record YieldRequest(
        String inputPath,
        String outputPath
) {
}
