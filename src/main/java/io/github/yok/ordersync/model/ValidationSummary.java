package io.github.yok.ordersync.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Counts produced while reading and validating one CSV batch.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor
public final class ValidationSummary {

    private final int processed;
    private final int valid;
    private final int invalid;
    private final int duplicates;
    // Rows without order_id; they cannot be stored
    private final int unkeyed;

    /**
     * Counts the verdicts of a validated batch.
     *
     * @param records validated batch
     * @return summary
     */
    public static ValidationSummary of(List<ValidatedRecord> records) {
        int valid = 0;
        int duplicates = 0;
        int unkeyed = 0;
        for (ValidatedRecord r : records) {
            if (r.isValid()) {
                valid++;
            } else if (ValidatedRecord.DUPLICATE_MESSAGE.equals(r.getErrorMessage())) {
                duplicates++;
            }
            if (!r.hasOrderId()) {
                unkeyed++;
            }
        }
        return new ValidationSummary(records.size(), valid, records.size() - valid, duplicates,
                unkeyed);
    }
}
