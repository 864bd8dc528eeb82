package com.hubzone.designations.importer.service;

import com.hubzone.designations.config.ImportProperties;
import com.hubzone.designations.importer.model.ImportExecutionStatus;
import com.hubzone.designations.importer.model.ImportIssue;
import com.hubzone.designations.importer.model.ImportOptions;
import com.hubzone.designations.importer.model.ImportRunResult;
import com.hubzone.designations.importer.model.TriggerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
public class ImportCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ImportCliRunner.class);

    private final ImportProperties properties;
    private final ImportExecutionService executionService;
    private final ConfigurableApplicationContext applicationContext;

    public ImportCliRunner(
        ImportProperties properties,
        ImportExecutionService executionService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.executionService = executionService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        List<String> states = Arrays.stream(properties.getCli().getStates().split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
        ImportOptions options = new ImportOptions(
            properties.getCli().isDryRun(),
            properties.getCli().isSkipNotifications(),
            states
        );

        ImportRunResult result = executionService.runNow(TriggerType.MANUAL, "cli", options);
        log.info("Import {} completed with status {} (dryRun={})", result.executionId(), result.status(), result.dryRun());
        log.info("Statistics: {}", result.statistics());
        for (ImportIssue error : result.errors()) {
            log.info("Error {} {}: {}", error.code(), error.geoid() == null ? "" : error.geoid(), error.message());
        }
        log.info("Warnings: {}, notifications handed off: {}", result.warnings().size(), result.notificationsHandedOff());

        if (properties.getCli().isExitAfterRun()) {
            int status = result.status() == ImportExecutionStatus.COMPLETED ? 0 : 1;
            int exitCode = SpringApplication.exit(applicationContext, () -> status);
            System.exit(exitCode);
        }
    }
}
