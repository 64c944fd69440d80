package com.example.reconciliation.service.merge;

import com.example.reconciliation.exception.MalformedInputException;
import com.example.reconciliation.model.DisplayKeyPolicy;
import com.example.reconciliation.model.DuplicateKeyPolicy;
import com.example.reconciliation.model.InventoryRecord;
import com.example.reconciliation.model.LedgerSource;
import com.example.reconciliation.model.ReconciledRow;
import com.example.reconciliation.service.normalization.KeyNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Full outer join of the two ledgers on the normalized product key.
 *
 * <p>Every normalized key found in either ledger yields exactly one row; a ledger without the
 * key leaves its quantity null. Rows come out in ascending key order whatever the input order,
 * so repeated runs over the same ledgers produce identical reports.
 *
 * <p>Stateless: every call builds its own join table.
 */
public class Reconciler {

    /**
     * Joins the two ledgers into unclassified rows.
     *
     * @param fbaRecords        records of the FBA ledger, all with source {@link LedgerSource#FBA}
     * @param storefrontRecords records of the storefront ledger, all with source {@link LedgerSource#STOREFRONT}
     * @param duplicatePolicy   how a key recurring within one ledger is resolved
     * @param displayPolicy     which spelling of the key the row displays
     * @return one row per distinct normalized key, sorted by key
     * @throws MalformedInputException if the duplicate policy rejects a ledger
     */
    public List<ReconciledRow> reconcile(List<InventoryRecord> fbaRecords,
                                         List<InventoryRecord> storefrontRecords,
                                         DuplicateKeyPolicy duplicatePolicy,
                                         DisplayKeyPolicy displayPolicy) {
        Map<String, JoinSlot> joined = new TreeMap<>();
        fold(joined, fbaRecords, LedgerSource.FBA, duplicatePolicy);
        fold(joined, storefrontRecords, LedgerSource.STOREFRONT, duplicatePolicy);

        List<ReconciledRow> rows = new ArrayList<>(joined.size());
        for (Map.Entry<String, JoinSlot> entry : joined.entrySet()) {
            JoinSlot slot = entry.getValue();
            rows.add(ReconciledRow.unclassified(
                    entry.getKey(),
                    slot.displayKey(entry.getKey(), displayPolicy),
                    slot.fbaQuantity,
                    slot.storefrontQuantity));
        }
        return rows;
    }

    private void fold(Map<String, JoinSlot> joined, List<InventoryRecord> records,
                      LedgerSource source, DuplicateKeyPolicy duplicatePolicy) {
        for (InventoryRecord record : records) {
            if (record.source() != source) {
                throw new IllegalArgumentException(
                        "Record " + record.key() + " from " + record.source() + " passed as " + source + " ledger");
            }
            String key = KeyNormalizer.normalize(record.key());
            String spelling = record.key().strip();
            JoinSlot slot = joined.computeIfAbsent(key, k -> new JoinSlot());

            Integer existing = slot.quantity(source);
            if (existing == null) {
                slot.put(source, record.quantity(), spelling);
                continue;
            }
            switch (duplicatePolicy) {
                case LAST_WRITE_WINS -> slot.put(source, record.quantity(), spelling);
                case REJECT -> throw MalformedInputException.duplicateKey(source, key);
                case SUM -> {
                    try {
                        slot.put(source, Math.addExact(existing, record.quantity()), slot.spelling(source));
                    } catch (ArithmeticException e) {
                        throw MalformedInputException.quantityOverflow(source, key);
                    }
                }
            }
        }
    }

    /**
     * Both sides of one key while the join is being built.
     */
    private static final class JoinSlot {
        private Integer fbaQuantity;
        private Integer storefrontQuantity;
        private String fbaSpelling;
        private String storefrontSpelling;

        Integer quantity(LedgerSource source) {
            return source == LedgerSource.FBA ? fbaQuantity : storefrontQuantity;
        }

        String spelling(LedgerSource source) {
            return source == LedgerSource.FBA ? fbaSpelling : storefrontSpelling;
        }

        void put(LedgerSource source, int quantity, String spelling) {
            if (source == LedgerSource.FBA) {
                fbaQuantity = quantity;
                fbaSpelling = spelling;
            } else {
                storefrontQuantity = quantity;
                storefrontSpelling = spelling;
            }
        }

        String displayKey(String normalizedKey, DisplayKeyPolicy policy) {
            return switch (policy) {
                case NORMALIZED -> normalizedKey;
                case PREFER_STOREFRONT -> storefrontSpelling != null ? storefrontSpelling : fbaSpelling;
                case PREFER_FBA -> fbaSpelling != null ? fbaSpelling : storefrontSpelling;
            };
        }
    }
}
