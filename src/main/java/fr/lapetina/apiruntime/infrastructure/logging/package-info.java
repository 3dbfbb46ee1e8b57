/**
 * Runtime log level control.
 */
package fr.lapetina.apiruntime.infrastructure.logging;
