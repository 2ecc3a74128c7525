package com.example.workbookmerge.service;

import java.util.List;

public record SheetResolution(
        List<String> common,
        List<String> baseOnly,
        List<String> incomingOnly
) {
    public SheetResolution {
        common = List.copyOf(common);
        baseOnly = List.copyOf(baseOnly);
        incomingOnly = List.copyOf(incomingOnly);
    }

    public boolean hasCommonSheets() {
        return !common.isEmpty();
    }
}
