/**
 * Runtime reconfiguration layer for a multi-tenant API server.
 *
 * <p>{@link fr.lapetina.apiruntime.RuntimeFactory} wires the shared
 * {@link fr.lapetina.apiruntime.infrastructure.state.RuntimeState}, the rate
 * limiter cell and the reload loop;
 * {@link fr.lapetina.apiruntime.ApiRuntimeApplication} adds the HTTP surface.
 */
package fr.lapetina.apiruntime;
