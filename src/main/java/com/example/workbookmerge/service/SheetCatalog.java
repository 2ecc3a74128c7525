package com.example.workbookmerge.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Works out which sheets two workbooks share. Results follow base workbook order,
 * except {@code incomingOnly} which follows incoming order.
 */
@Component
public class SheetCatalog {

    private static final Logger logger = LoggerFactory.getLogger(SheetCatalog.class);

    public SheetResolution resolve(List<String> baseSheetNames, List<String> incomingSheetNames) {
        Set<String> base = new LinkedHashSet<>(baseSheetNames);
        Set<String> incoming = new LinkedHashSet<>(incomingSheetNames);

        List<String> common = new ArrayList<>();
        List<String> baseOnly = new ArrayList<>();
        for (String name : base) {
            if (incoming.contains(name)) {
                common.add(name);
            } else {
                baseOnly.add(name);
            }
        }
        List<String> incomingOnly = new ArrayList<>();
        for (String name : incoming) {
            if (!base.contains(name)) {
                incomingOnly.add(name);
            }
        }

        logger.info("Base sheets: {}", baseSheetNames);
        logger.info("Incoming sheets: {}", incomingSheetNames);
        logger.info("Common sheets: {}", common);
        return new SheetResolution(common, baseOnly, incomingOnly);
    }
}
