/**
 * Immutable domain values shared by the runtime components.
 *
 * <ul>
 *   <li>{@link fr.lapetina.apiruntime.domain.model.KeyDescriptor} - audit metadata of the active signing key</li>
 *   <li>{@link fr.lapetina.apiruntime.domain.model.AuthContext} - result of verifying a bearer token</li>
 * </ul>
 */
package fr.lapetina.apiruntime.domain.model;
