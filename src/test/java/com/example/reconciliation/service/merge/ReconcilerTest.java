package com.example.reconciliation.service.merge;

import com.example.reconciliation.exception.MalformedInputException;
import com.example.reconciliation.model.DisplayKeyPolicy;
import com.example.reconciliation.model.DuplicateKeyPolicy;
import com.example.reconciliation.model.InventoryRecord;
import com.example.reconciliation.model.LedgerSource;
import com.example.reconciliation.model.ReconciledRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for Reconciler.
 *
 * Tests verify:
 * - Full outer join: one row per distinct normalized key
 * - Stable ascending key order
 * - Duplicate-key and display-key policies
 */
class ReconcilerTest {

    private final Reconciler reconciler = new Reconciler();

    @Test
    @DisplayName("Should join keys that differ only in case and whitespace")
    void shouldJoinNormalizedKeys() {
        // When
        List<ReconciledRow> rows = reconcile(List.of(fba("abc-1", 5)), List.of(storefront(" ABC-1 ", 5)));

        // Then
        assertThat(rows).containsExactly(ReconciledRow.unclassified("ABC-1", "ABC-1", 5, 5));
    }

    @Test
    @DisplayName("Key in only one ledger leaves the other quantity absent")
    void shouldLeaveMissingSideNull() {
        List<ReconciledRow> rows = reconcile(List.of(fba("Y", 2)), List.of(storefront("Z", 1)));

        assertThat(rows).containsExactly(
                ReconciledRow.unclassified("Y", "Y", 2, null),
                ReconciledRow.unclassified("Z", "Z", null, 1));
    }

    @Test
    @DisplayName("Both ledgers empty yields no rows")
    void shouldHandleEmptyLedgers() {
        assertThat(reconcile(List.of(), List.of())).isEmpty();
    }

    @Test
    @DisplayName("Row keys equal the union of normalized keys, sorted, without duplicates")
    void shouldCoverUnionOfKeys() {
        // Given
        Random random = new Random(42);
        List<InventoryRecord> fba = IntStream.range(0, 200)
                .mapToObj(i -> fba("sku-" + random.nextInt(150), random.nextInt(20)))
                .toList();
        List<InventoryRecord> storefront = IntStream.range(0, 200)
                .mapToObj(i -> storefront("SKU-" + random.nextInt(150), random.nextInt(20)))
                .toList();
        Set<String> expectedKeys = new TreeSet<>();
        fba.forEach(r -> expectedKeys.add(r.key().toUpperCase(Locale.ROOT)));
        storefront.forEach(r -> expectedKeys.add(r.key().toUpperCase(Locale.ROOT)));

        // When
        List<ReconciledRow> rows = reconcile(fba, storefront);

        // Then
        assertThat(rows).extracting(ReconciledRow::key).containsExactlyElementsOf(expectedKeys);
    }

    @Test
    @DisplayName("Output order does not depend on input order")
    void shouldBeIndependentOfInputOrder() {
        // Given
        List<InventoryRecord> fba = new ArrayList<>();
        List<InventoryRecord> storefront = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            fba.add(fba("P" + i, i));
            storefront.add(storefront("p" + (i + 25), i));
        }
        List<ReconciledRow> expected = reconcile(fba, storefront);

        // When
        Collections.shuffle(fba, new Random(7));
        Collections.shuffle(storefront, new Random(11));

        // Then
        assertThat(reconcile(fba, storefront)).isEqualTo(expected);
        assertThat(expected).extracting(ReconciledRow::key).isSorted();
    }

    @Test
    @DisplayName("Last write wins for a key repeated in one ledger")
    void shouldApplyLastWriteWins() {
        List<ReconciledRow> rows = reconcile(
                List.of(fba("X", 1), fba("x ", 4)),
                List.of(storefront("X", 4)));

        assertThat(rows).containsExactly(ReconciledRow.unclassified("X", "X", 4, 4));
    }

    @Test
    @DisplayName("REJECT policy fails on a repeated key, naming ledger and key")
    void shouldRejectDuplicates() {
        assertThatThrownBy(() -> reconciler.reconcile(
                List.of(fba("X", 1)),
                List.of(storefront("x", 1), storefront("X", 2)),
                DuplicateKeyPolicy.REJECT, DisplayKeyPolicy.NORMALIZED))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("Storefront")
                .hasMessageContaining("'X'")
                .extracting(e -> ((MalformedInputException) e).getSource())
                .isEqualTo(LedgerSource.STOREFRONT);
    }

    @Test
    @DisplayName("REJECT policy accepts the same key once per ledger")
    void shouldNotRejectKeyPresentInBothLedgers() {
        List<ReconciledRow> rows = reconciler.reconcile(
                List.of(fba("X", 1)), List.of(storefront("X", 2)),
                DuplicateKeyPolicy.REJECT, DisplayKeyPolicy.NORMALIZED);

        assertThat(rows).hasSize(1);
    }

    @Test
    @DisplayName("SUM policy adds repeated quantities")
    void shouldSumDuplicates() {
        List<ReconciledRow> rows = reconciler.reconcile(
                List.of(fba("X", 1), fba("x", 2), fba("X", 3)), List.of(),
                DuplicateKeyPolicy.SUM, DisplayKeyPolicy.NORMALIZED);

        assertThat(rows).containsExactly(ReconciledRow.unclassified("X", "X", 6, null));
    }

    @Test
    @DisplayName("SUM policy reports overflow as malformed input")
    void shouldFailOnSumOverflow() {
        assertThatThrownBy(() -> reconciler.reconcile(
                List.of(fba("X", Integer.MAX_VALUE), fba("X", 1)), List.of(),
                DuplicateKeyPolicy.SUM, DisplayKeyPolicy.NORMALIZED))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("overflows");
    }

    @Test
    @DisplayName("PREFER_STOREFRONT displays the storefront spelling when both ledgers have the key")
    void shouldPreferStorefrontSpelling() {
        List<ReconciledRow> rows = reconciler.reconcile(
                List.of(fba("abc-1", 5), fba("only-fba", 1)),
                List.of(storefront(" Abc-1 ", 5)),
                DuplicateKeyPolicy.LAST_WRITE_WINS, DisplayKeyPolicy.PREFER_STOREFRONT);

        assertThat(rows).extracting(ReconciledRow::displayKey).containsExactly("Abc-1", "only-fba");
        assertThat(rows).extracting(ReconciledRow::key).containsExactly("ABC-1", "ONLY-FBA");
    }

    @Test
    @DisplayName("PREFER_FBA displays the FBA spelling when both ledgers have the key")
    void shouldPreferFbaSpelling() {
        List<ReconciledRow> rows = reconciler.reconcile(
                List.of(fba("abc-1", 5)),
                List.of(storefront("ABC-1", 5), storefront("only-sf", 2)),
                DuplicateKeyPolicy.LAST_WRITE_WINS, DisplayKeyPolicy.PREFER_FBA);

        assertThat(rows).extracting(ReconciledRow::displayKey).containsExactly("abc-1", "only-sf");
    }

    @Test
    @DisplayName("Record passed in the wrong ledger list is rejected")
    void shouldRejectMisplacedRecord() {
        assertThatThrownBy(() -> reconcile(List.of(storefront("X", 1)), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Rows are unclassified after the join")
    void shouldLeaveStatusUnset() {
        List<ReconciledRow> rows = reconcile(List.of(fba("A", 1)), List.of(storefront("A", 1)));

        assertThat(rows).noneMatch(ReconciledRow::isClassified);
    }

    private List<ReconciledRow> reconcile(List<InventoryRecord> fba, List<InventoryRecord> storefront) {
        return reconciler.reconcile(fba, storefront, DuplicateKeyPolicy.LAST_WRITE_WINS, DisplayKeyPolicy.NORMALIZED);
    }

    private static InventoryRecord fba(String key, int quantity) {
        return new InventoryRecord(key, quantity, LedgerSource.FBA);
    }

    private static InventoryRecord storefront(String key, int quantity) {
        return new InventoryRecord(key, quantity, LedgerSource.STOREFRONT);
    }
}
