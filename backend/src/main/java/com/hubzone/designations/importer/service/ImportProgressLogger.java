package com.hubzone.designations.importer.service;

import com.hubzone.designations.importer.model.ImportProgressEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class ImportProgressLogger {
    private static final Logger log = LoggerFactory.getLogger(ImportProgressLogger.class);

    @EventListener
    public void onProgress(ImportProgressEvent event) {
        if (event.stateFips() == null) {
            log.info("Import {} [{}] {}", event.executionId(), event.stage(), event.message());
        } else {
            log.info("Import {} [{} {}] {}", event.executionId(), event.stage(), event.stateFips(), event.message());
        }
    }
}
