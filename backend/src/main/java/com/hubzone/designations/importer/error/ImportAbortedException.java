package com.hubzone.designations.importer.error;

import com.hubzone.designations.importer.model.ImportExecutionStatus;

public class ImportAbortedException extends ImportException {
    private final String code;
    private final ImportExecutionStatus terminalStatus;

    public ImportAbortedException(String code, ImportExecutionStatus terminalStatus, String message) {
        super(message, null, null);
        this.code = code;
        this.terminalStatus = terminalStatus;
    }

    @Override
    public String code() {
        return code;
    }

    public ImportExecutionStatus terminalStatus() {
        return terminalStatus;
    }
}
