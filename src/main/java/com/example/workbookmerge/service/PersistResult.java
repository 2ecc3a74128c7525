package com.example.workbookmerge.service;

import java.nio.file.Path;

public record PersistResult(Path target, Path backup) {
}
