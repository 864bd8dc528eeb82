package com.hubzone.designations.importer.error;

public class ActiveImportExecutionException extends RuntimeException {
    private final Long activeExecutionId;

    public ActiveImportExecutionException(Long activeExecutionId) {
        super("Import execution already running: " + activeExecutionId);
        this.activeExecutionId = activeExecutionId;
    }

    public Long activeExecutionId() {
        return activeExecutionId;
    }
}
