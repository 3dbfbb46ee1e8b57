/**
 * Token bucket rate limiting.
 *
 * <p>{@link fr.lapetina.apiruntime.domain.ratelimit.RateLimiterManager} is
 * immutable apart from its bucket map and is replaced as a whole on reload,
 * through a {@link fr.lapetina.apiruntime.domain.swap.ComponentCell}.
 */
package fr.lapetina.apiruntime.domain.ratelimit;
