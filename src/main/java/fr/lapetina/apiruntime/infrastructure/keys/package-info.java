/**
 * Key material resolution for token verification.
 *
 * {@link fr.lapetina.apiruntime.infrastructure.keys.KeyMaterialResolver} is the
 * entry point; the DER and PEM helpers are package-private and only describe keys.
 */
package fr.lapetina.apiruntime.infrastructure.keys;
