package com.example.reconciliation.config;

import com.example.reconciliation.model.ColumnMapping;
import com.example.reconciliation.model.DisplayKeyPolicy;
import com.example.reconciliation.model.DuplicateKeyPolicy;
import com.example.reconciliation.model.ReconciliationOptions;
import com.example.reconciliation.model.ReportFormat;
import com.example.reconciliation.service.ReconciliationEngine;
import com.example.reconciliation.service.classification.StatusClassifier;
import com.example.reconciliation.service.loading.RecordLoader;
import com.example.reconciliation.service.merge.Reconciler;
import com.example.reconciliation.service.reporting.ReportEmitter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the reconciliation core and turns {@code app.reconciliation.*} properties into the
 * default {@link ReconciliationOptions}. The core classes themselves never see Spring.
 */
@Configuration
@Slf4j
public class ReconciliationConfig {

    @Value("${app.reconciliation.fba.identifier-column:sku}")
    private String fbaIdentifierColumn;

    @Value("${app.reconciliation.fba.quantity-column:quantity}")
    private String fbaQuantityColumn;

    @Value("${app.reconciliation.storefront.identifier-column:sku}")
    private String storefrontIdentifierColumn;

    @Value("${app.reconciliation.storefront.quantity-column:quantity}")
    private String storefrontQuantityColumn;

    @Value("${app.reconciliation.duplicate-key-policy:LAST_WRITE_WINS}")
    private DuplicateKeyPolicy duplicateKeyPolicy;

    @Value("${app.reconciliation.display-key-policy:PREFER_STOREFRONT}")
    private DisplayKeyPolicy displayKeyPolicy;

    @Value("${app.reconciliation.report-format:CSV}")
    private ReportFormat reportFormat;

    @Bean
    public ReconciliationOptions defaultReconciliationOptions() {
        ReconciliationOptions options = ReconciliationOptions.builder()
                .fbaColumns(new ColumnMapping(fbaIdentifierColumn, fbaQuantityColumn))
                .storefrontColumns(new ColumnMapping(storefrontIdentifierColumn, storefrontQuantityColumn))
                .duplicateKeyPolicy(duplicateKeyPolicy)
                .displayKeyPolicy(displayKeyPolicy)
                .reportFormat(reportFormat)
                .build();
        log.info("Default reconciliation options: {}", options);
        return options;
    }

    @Bean
    public RecordLoader recordLoader(CsvMapper csvMapper) {
        return new RecordLoader(csvMapper);
    }

    @Bean
    public Reconciler reconciler() {
        return new Reconciler();
    }

    @Bean
    public StatusClassifier statusClassifier() {
        return new StatusClassifier();
    }

    @Bean
    public ReportEmitter reportEmitter(CsvMapper csvMapper, ObjectMapper objectMapper) {
        return new ReportEmitter(csvMapper, objectMapper);
    }

    @Bean
    public ReconciliationEngine reconciliationEngine(RecordLoader recordLoader, Reconciler reconciler,
                                                     StatusClassifier statusClassifier, ReportEmitter reportEmitter) {
        return new ReconciliationEngine(recordLoader, reconciler, statusClassifier, reportEmitter);
    }
}
