package com.example.reconciliation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Inventory Ledger Reconciliation Application.
 *
 * Reconciles the FBA ledger against the storefront ledger and writes an audit report.
 * Runs are triggered over REST or by dropping a request file into the Camel inbox route.
 */
@SpringBootApplication
public class InventoryReconciliationApplication {

    public static void main(String[] args) {
        SpringApplication.run(InventoryReconciliationApplication.class, args);
    }
}
