/**
 * Row validation package.
 *
 * <p>
 * Converts raw CSV values into typed {@link io.github.yok.ordersync.model.ValidatedRecord}s and
 * flags duplicate natural keys within a batch. Validation problems are recorded on the record and
 * never abort a run.
 * </p>
 */
package io.github.yok.ordersync.validation;
