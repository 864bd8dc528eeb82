package com.hubzone.designations.importer.error;

import com.hubzone.designations.importer.util.ImportErrorCodes;

public class EvaluationDataMissingException extends ImportException {
    public EvaluationDataMissingException(String geoid, String message) {
        super(message, geoid, null);
    }

    @Override
    public String code() {
        return ImportErrorCodes.EVALUATION_DATA_MISSING;
    }
}
