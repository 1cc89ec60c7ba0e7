/**
 * CSV ingestion package.
 *
 * <p>
 * Parses ERP order exports with Apache Commons CSV and feeds each row through validation and
 * duplicate detection.
 * </p>
 */
package io.github.yok.ordersync.parser;
