/**
 * Transport adapters exposing a router to clients.
 *
 * @see fr.lapetina.xplorer.transport.TransportAdapter
 */
package fr.lapetina.xplorer.transport;
