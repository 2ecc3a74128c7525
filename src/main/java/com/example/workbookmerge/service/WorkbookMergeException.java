package com.example.workbookmerge.service;

/**
 * Terminal failure of a merge, persist or yield operation. The message always starts
 * with the stage that failed.
 */
public class WorkbookMergeException extends IllegalStateException {

    private final MergeStage stage;
    private final FailureKind kind;

    public WorkbookMergeException(MergeStage stage, FailureKind kind, String message) {
        super(format(stage, message));
        this.stage = stage;
        this.kind = kind;
    }

    public WorkbookMergeException(MergeStage stage, FailureKind kind, String message, Throwable cause) {
        super(format(stage, message), cause);
        this.stage = stage;
        this.kind = kind;
    }

    public MergeStage stage() {
        return stage;
    }

    public FailureKind kind() {
        return kind;
    }

    private static String format(MergeStage stage, String message) {
        return "[" + stage.name().toLowerCase() + "] " + message;
    }
}
