package com.example.workbookmerge.web;

public record MergeRequest(
        String basePath,
        String incomingPath,
        String targetPath,
        boolean save
) {
}
