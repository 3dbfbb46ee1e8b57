/**
 * Audit record sinks. The active sink is selected by {@code logging.logDir}
 * and swapped at runtime when that setting changes.
 */
package fr.lapetina.apiruntime.infrastructure.audit;
