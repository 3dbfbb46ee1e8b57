/**
 * Bearer token verification.
 *
 * <p>A {@link fr.lapetina.apiruntime.domain.auth.TokenVerifier} is one of the hot-swappable
 * runtime components: request handlers read the current instance from
 * {@link fr.lapetina.apiruntime.infrastructure.state.RuntimeState} for every request, and the
 * configuration reload loop replaces it when the configured key material changes.
 */
package fr.lapetina.apiruntime.domain.auth;
