/**
 * Endpoint registration, mounting and request routing.
 *
 * <p>A {@link fr.lapetina.xplorer.routing.Router} holds direct registrations and
 * sub-routers mounted under prefixes. Matching is exact; when no direct path matches,
 * the longest mount prefix wins and the sub-router sees the path with the prefix removed.
 * Registration and mounting are rejected once the router is frozen.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.xplorer.routing.Router} - Endpoint tree and dispatch entry point</li>
 *   <li>{@link fr.lapetina.xplorer.routing.IndexEndpoint} - Self-describing JSON index served at {@code /}</li>
 *   <li>{@link fr.lapetina.xplorer.routing.RouterInfo} - Description tree rendered by the index</li>
 * </ul>
 *
 * @see fr.lapetina.xplorer.dispatch.HandlerDispatcher
 */
package fr.lapetina.xplorer.routing;
