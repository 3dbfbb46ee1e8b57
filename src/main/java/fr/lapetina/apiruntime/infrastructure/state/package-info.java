/**
 * Process-wide runtime state shared by request handlers and the reload loop.
 */
package fr.lapetina.apiruntime.infrastructure.state;
