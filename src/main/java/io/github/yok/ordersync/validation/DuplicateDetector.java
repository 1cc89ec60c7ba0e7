package io.github.yok.ordersync.validation;

import io.github.yok.ordersync.model.OrderKey;
import io.github.yok.ordersync.model.ValidatedRecord;
import java.util.HashSet;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Flags repeated {@code (order_id, item)} keys within one batch.
 *
 * <p>
 * Only valid records take part: the first valid occurrence of a key is canonical and every later
 * valid occurrence is marked invalid with {@link ValidatedRecord#DUPLICATE_MESSAGE}. Invalid
 * records pass through untouched and do not register their key. Records must be offered in file
 * order.
 * </p>
 *
 * <p>
 * One instance covers exactly one batch; it is not thread-safe.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DuplicateDetector {

    private final Set<OrderKey> seenKeys;

    /**
     * Creates a detector with an empty key set.
     */
    public DuplicateDetector() {
        this(new HashSet<>());
    }

    /**
     * Creates a detector that records keys into the given set.
     *
     * @param seenKeys keys already seen in the current batch (mutated)
     */
    public DuplicateDetector(Set<OrderKey> seenKeys) {
        this.seenKeys = seenKeys;
    }

    /**
     * Checks one record against the keys seen so far.
     *
     * @param record validated record
     * @return the record itself, or an invalid copy if its key was already seen
     */
    public ValidatedRecord check(ValidatedRecord record) {
        if (!record.isValid()) {
            return record;
        }
        OrderKey key = OrderKey.of(record);
        if (seenKeys.add(key)) {
            return record;
        }
        log.debug("Duplicate detected: key={}", key);
        return record.markDuplicate();
    }
}
