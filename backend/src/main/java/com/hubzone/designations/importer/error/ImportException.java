package com.hubzone.designations.importer.error;

public abstract class ImportException extends RuntimeException {
    private final String geoid;

    protected ImportException(String message, String geoid, Throwable cause) {
        super(message, cause);
        this.geoid = geoid;
    }

    public abstract String code();

    public String geoid() {
        return geoid;
    }
}
