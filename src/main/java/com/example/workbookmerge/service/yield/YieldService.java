package com.example.workbookmerge.service.yield;

import com.example.workbookmerge.service.FailureKind;
import com.example.workbookmerge.service.MergeStage;
import com.example.workbookmerge.service.PersistResult;
import com.example.workbookmerge.service.PersistenceManager;
import com.example.workbookmerge.service.Table;
import com.example.workbookmerge.service.TableWorkbook;
import com.example.workbookmerge.service.WorkbookMergeException;
import com.example.workbookmerge.service.WorkbookReader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Adds yield columns to one sheet of a workbook file and saves the result, leaving the
 * other sheets as they were.
 */
@Service
public class YieldService {

    private static final Logger logger = LoggerFactory.getLogger(YieldService.class);
    private static final String CONFIG_RESOURCE = "yield-config.json";

    private final WorkbookReader workbookReader;
    private final PersistenceManager persistenceManager;
    private final YieldCalculator yieldCalculator;
    private final String backupSuffix;
    private final String outputSuffix;
    private final YieldSettings settings = loadSettings();

    public YieldService(WorkbookReader workbookReader,
                        PersistenceManager persistenceManager,
                        YieldCalculator yieldCalculator,
                        @Value("${workbook.yield.backup-suffix:.yield_backup}") String backupSuffix,
                        @Value("${workbook.yield.output-suffix:_with_yields}") String outputSuffix) {
        this.workbookReader = workbookReader;
        this.persistenceManager = persistenceManager;
        this.yieldCalculator = yieldCalculator;
        this.backupSuffix = backupSuffix;
        this.outputSuffix = outputSuffix;
    }

    public YieldSettings settings() {
        return settings;
    }

    public YieldReport addYieldColumns(Path inputPath, Path outputPath) {
        return addYieldColumns(inputPath, outputPath, settings);
    }

    /**
     * @param outputPath {@code null} writes {@code <stem><outputSuffix>.xlsx} next to the input
     */
    public YieldReport addYieldColumns(Path inputPath, Path outputPath, YieldSettings yieldSettings) {
        if (inputPath == null) {
            throw new IllegalArgumentException("An input workbook is required.");
        }
        TableWorkbook workbook = workbookReader.read(inputPath);
        String sheetName = resolveTargetSheet(workbook, yieldSettings.targetSheet());
        Table source = workbook.sheet(sheetName);

        Table processed = yieldCalculator.apply(source, yieldSettings.columns());
        logger.info("Added yield columns to '{}'. Final shape: {} rows, {} columns",
                sheetName, processed.rowCount(), processed.columns().size());

        Path target = outputPath == null ? defaultOutputPath(inputPath) : outputPath;
        PersistResult persisted = persistenceManager.persist(
                inputPath, workbook.withSheet(sheetName, processed), target, backupSuffix);

        List<String> added = new ArrayList<>();
        for (YieldColumnSpec spec : yieldSettings.columns()) {
            added.add(spec.column());
        }
        List<String> preserved = new ArrayList<>(workbook.sheetNames());
        preserved.remove(sheetName);
        return new YieldReport(sheetName, processed.rowCount(), added, preserved,
                persisted.target().toString(), persisted.backup().toString());
    }

    public Path defaultOutputPath(Path inputPath) {
        String fileName = inputPath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return inputPath.resolveSibling(stem + outputSuffix + ".xlsx");
    }

    private String resolveTargetSheet(TableWorkbook workbook, String targetSheet) {
        if (workbook.hasSheet(targetSheet)) {
            return targetSheet;
        }
        String first = workbook.firstSheetName().orElseThrow(() -> new WorkbookMergeException(
                MergeStage.YIELD, FailureKind.SOURCE_UNREADABLE, "Workbook has no sheets"));
        logger.warn("'{}' not found. Using first available sheet '{}' (available: {})",
                targetSheet, first, workbook.sheetNames());
        return first;
    }

    private YieldSettings loadSettings() {
        ClassPathResource resource = new ClassPathResource(CONFIG_RESOURCE);
        if (!resource.exists()) {
            return YieldSettings.defaults();
        }
        ObjectMapper mapper = new ObjectMapper();
        try (InputStream input = resource.getInputStream()) {
            YieldSettings loaded = mapper.readValue(input, YieldSettings.class);
            if (loaded == null || loaded.columns().isEmpty()) {
                return YieldSettings.defaults();
            }
            for (YieldColumnSpec spec : loaded.columns()) {
                if (spec.mode() == YieldMode.EXPRESSION) {
                    ExpressionParser.parse(spec.argument());
                }
            }
            return loaded;
        } catch (IOException e) {
            throw new IllegalStateException("Yield configuration could not be read: " + e.getMessage(), e);
        }
    }
}
