package com.hubzone.designations.importer.model;

public record DatasetRequest(
    DatasetSource source,
    DatasetFormat format,
    String stateFips,
    String url,
    String checksumUrl,
    int vintageYear,
    String variant
) {
    public DatasetRequest(
        DatasetSource source,
        DatasetFormat format,
        String stateFips,
        String url,
        String checksumUrl,
        int vintageYear
    ) {
        this(source, format, stateFips, url, checksumUrl, vintageYear, null);
    }

    public boolean isStateScoped() {
        return stateFips != null && !stateFips.isBlank();
    }

    public boolean isFallback() {
        return variant != null;
    }

    public String cacheKey() {
        StringBuilder key = new StringBuilder(source.id());
        if (isFallback()) {
            key.append('-').append(variant);
        }
        if (isStateScoped()) {
            key.append('-').append(stateFips);
        }
        return key.append('-').append(vintageYear).toString();
    }

    public String describe() {
        String name = isFallback() ? source.id() + "/" + variant : source.id();
        return isStateScoped() ? name + "[" + stateFips + "]" : name;
    }
}
