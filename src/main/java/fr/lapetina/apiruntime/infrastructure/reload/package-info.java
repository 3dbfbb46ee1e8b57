/**
 * Periodic configuration reload and targeted hot-swap of runtime components.
 */
package fr.lapetina.apiruntime.infrastructure.reload;
