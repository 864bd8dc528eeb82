package com.hubzone.designations.importer.source;

import com.hubzone.designations.config.ImportProperties;
import com.hubzone.designations.importer.model.DatasetFormat;
import com.hubzone.designations.importer.model.DatasetRequest;
import com.hubzone.designations.importer.model.DatasetSource;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Component
public class DatasetSourceCatalog {
    private static final String STATE_TOKEN = "{state}";
    private static final String VINTAGE_TOKEN = "{vintage}";
    private static final String API_KEY_TOKEN = "{apiKey}";

    private final ImportProperties properties;
    private final Clock clock;

    public DatasetSourceCatalog(ImportProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public int vintageYear() {
        int configured = properties.getSources().getVintageYear();
        if (configured > 0) {
            return configured;
        }
        return LocalDate.now(clock).getYear() - 1;
    }

    public boolean isConfigured(DatasetSource source) {
        String template = sourceConfig(source).getUrlTemplate();
        return template != null && !template.isBlank();
    }

    public boolean isStateScoped(DatasetSource source) {
        return isConfigured(source) && sourceConfig(source).getUrlTemplate().contains(STATE_TOKEN);
    }

    public List<DatasetRequest> requestsFor(DatasetSource source, List<String> states) {
        if (!isConfigured(source)) {
            return List.of();
        }
        if (!isStateScoped(source)) {
            return List.of(request(source, null));
        }
        List<DatasetRequest> requests = new ArrayList<>(states.size());
        for (String state : states) {
            requests.add(request(source, state));
        }
        return requests;
    }

    public DatasetRequest request(DatasetSource source, String stateFips) {
        ImportProperties.Source config = sourceConfig(source);
        int vintage = vintageYear();
        String url = resolve(config.getUrlTemplate(), stateFips, vintage);
        String checksumUrl = config.getChecksumUrlTemplate() == null || config.getChecksumUrlTemplate().isBlank()
            ? null
            : resolve(config.getChecksumUrlTemplate(), stateFips, vintage);
        DatasetFormat format = config.getFormat() == null ? defaultFormat(source) : config.getFormat();
        return new DatasetRequest(source, format, stateFips, url, checksumUrl, vintage);
    }

    public List<DatasetRequest> fallbackRequests(DatasetRequest failed) {
        ImportProperties.Source config = sourceConfig(failed.source());
        List<String> templates = config.getFallbackUrlTemplates();
        List<DatasetRequest> requests = new ArrayList<>(templates.size());
        for (int i = 0; i < templates.size(); i++) {
            requests.add(new DatasetRequest(
                failed.source(),
                failed.format(),
                failed.stateFips(),
                resolve(templates.get(i), failed.stateFips(), failed.vintageYear()),
                null,
                failed.vintageYear(),
                "fallback-" + (i + 1)
            ));
        }
        return requests;
    }

    private String resolve(String template, String stateFips, int vintage) {
        String apiKey = properties.getSources().getCensusApiKey();
        String value = template.trim()
            .replace(VINTAGE_TOKEN, String.valueOf(vintage))
            .replace(STATE_TOKEN, stateFips == null ? "" : stateFips);
        if (apiKey.isEmpty()) {
            value = value.replace("&key=" + API_KEY_TOKEN, "").replace("key=" + API_KEY_TOKEN, "");
        }
        return value.replace(API_KEY_TOKEN, URLEncoder.encode(apiKey, StandardCharsets.UTF_8));
    }

    private ImportProperties.Source sourceConfig(DatasetSource source) {
        return switch (source) {
            case BOUNDARIES -> properties.getSources().getBoundaries();
            case DESIGNATIONS -> properties.getSources().getDesignations();
            case ECONOMIC_PROFILES -> properties.getSources().getEconomicProfiles();
        };
    }

    private DatasetFormat defaultFormat(DatasetSource source) {
        return switch (source) {
            case BOUNDARIES -> DatasetFormat.GEOJSON;
            case DESIGNATIONS -> DatasetFormat.CSV;
            case ECONOMIC_PROFILES -> DatasetFormat.JSON_TABLE;
        };
    }
}
