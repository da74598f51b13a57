/**
 * Xplorer - in-process debugging agent exposing a self-describing endpoint tree.
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (XplorerServer server = XplorerServer.withHttpAndP2p(new ConfigLoader("xplorer.yaml").load())) {
 *     server.register("/echo", request -> Response.text(request.queryParam("name").orElse("")));
 *     server.start();
 * }
 * }</pre>
 *
 * @see fr.lapetina.xplorer.XplorerServer
 * @see fr.lapetina.xplorer.XplorerApplication
 */
package fr.lapetina.xplorer;
