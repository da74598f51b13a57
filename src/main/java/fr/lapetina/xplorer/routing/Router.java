package fr.lapetina.xplorer.routing;

import fr.lapetina.xplorer.dispatch.AffinityReentryException;
import fr.lapetina.xplorer.dispatch.DispatchTimeoutException;
import fr.lapetina.xplorer.dispatch.HandlerDispatcher;
import fr.lapetina.xplorer.dispatch.InlineDispatcher;
import fr.lapetina.xplorer.domain.model.ParameterInfo;
import fr.lapetina.xplorer.domain.model.Request;
import fr.lapetina.xplorer.domain.model.Response;
import fr.lapetina.xplorer.domain.model.ResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Endpoint tree: direct registrations plus sub-routers mounted under prefixes.
 *
 * MATCHING:
 *
 * Paths are matched verbatim, without wildcards or trailing-slash normalization.
 * Direct registrations win; otherwise the longest mount prefix {@code M} with
 * {@code path == M} or {@code path} starting with {@code M + "/"} receives the
 * request with the prefix stripped ({@code path == M} becomes {@code /}).
 *
 * THREADING:
 *
 * The registration table is mutated during setup only. {@link #freeze()} makes it
 * read-only before transports start, after which {@link #handle(Request)} is safe
 * to call from any number of transport threads.
 *
 * OWNERSHIP:
 *
 * A router is mounted under at most one parent, and never where it would create
 * a cycle, so the tree walked by {@link #routerInfo(boolean)} is always finite.
 */
public final class Router {

    private static final Logger log = LoggerFactory.getLogger(Router.class);

    static final String ROOT_PATH = "/";

    private final String description;
    private final HandlerDispatcher dispatcher;
    private final Map<String, RouteEntry> routes = new ConcurrentHashMap<>();
    private final Map<String, Router> mounts = new ConcurrentHashMap<>();

    private volatile RouteHandler notFoundHandler = request -> Response.notFound("Endpoint not found");
    private volatile Router parent;
    private volatile String basePath;
    private volatile boolean frozen;

    public Router(String description, HandlerDispatcher dispatcher) {
        this.description = description != null ? description : "";
        this.dispatcher = dispatcher;
    }

    public Router(String description) {
        this(description, null);
    }

    public Router() {
        this("", null);
    }

    /**
     * Creates a router that answers {@code /} with its own index, so a mount
     * prefix with or without trailing slash describes the sub-router.
     */
    public static Router withIndex(String description) {
        Router router = new Router(description);
        IndexEndpoint.register(router, true);
        return router;
    }

    // ==================== REGISTRATION ====================

    /**
     * Registers a handler at {@code path}.
     *
     * @throws RouterConfigurationException if the path is taken, collides with a mount, or the router is frozen
     */
    public synchronized void register(
            String path,
            String description,
            List<ParameterInfo> parameters,
            boolean runsOnAffinityThread,
            RouteHandler handler
    ) {
        Objects.requireNonNull(handler, "Handler is required");
        checkNotFrozen("register " + path);
        validatePath(path);

        if (routes.containsKey(path)) {
            throw new RouterConfigurationException("Path already registered: " + path);
        }
        for (String prefix : mounts.keySet()) {
            if (collides(path, prefix)) {
                throw new RouterConfigurationException(
                        "Path " + path + " collides with router mounted at " + prefix);
            }
        }

        routes.put(path, new RouteEntry(path, description, parameters, runsOnAffinityThread, handler));
        log.debug("Registered endpoint: path={}, affinity={}", path, runsOnAffinityThread);
    }

    public void register(String path, String description, RouteHandler handler) {
        register(path, description, List.of(), true, handler);
    }

    public void register(String path, RouteHandler handler) {
        register(path, "", List.of(), true, handler);
    }

    /**
     * Quick registration of a handler with default metadata.
     */
    public void put(String path, RouteHandler handler) {
        register(path, handler);
    }

    /**
     * Removes a direct registration.
     *
     * @return whether an endpoint was registered at {@code path}
     */
    public synchronized boolean unregister(String path) {
        checkNotFrozen("unregister " + path);
        boolean removed = routes.remove(path) != null;
        if (removed) {
            log.debug("Unregistered endpoint: path={}", path);
        }
        return removed;
    }

    // ==================== MOUNTING ====================

    /**
     * Mounts {@code subRouter} under {@code prefix}.
     *
     * @throws RouterConfigurationException on an invalid prefix, a collision, a cycle,
     *                                      a router that already has a parent, or a frozen router
     */
    public void mount(String prefix, Router subRouter) {
        Objects.requireNonNull(subRouter, "Sub-router is required");
        // Lock order: parent before child, consistent with the tree direction.
        synchronized (this) {
            checkNotFrozen("mount " + prefix);
            validatePrefix(prefix);

            if (mounts.containsKey(prefix)) {
                throw new RouterConfigurationException("A router is already mounted at " + prefix);
            }
            for (String path : routes.keySet()) {
                if (collides(path, prefix)) {
                    throw new RouterConfigurationException(
                            "Mount prefix " + prefix + " collides with registered path " + path);
                }
            }
            if (subRouter == this || reaches(subRouter)) {
                throw new RouterConfigurationException("Router is already reachable from this router");
            }
            if (subRouter.reaches(this)) {
                throw new RouterConfigurationException("Mounting at " + prefix + " would create a cycle");
            }

            synchronized (subRouter) {
                if (subRouter.parent != null) {
                    throw new RouterConfigurationException(
                            "Router is already mounted at " + subRouter.basePath);
                }
                subRouter.parent = this;
                subRouter.basePath = prefix;
            }
            mounts.put(prefix, subRouter);
        }
        log.debug("Mounted router: prefix={}, endpoints={}", prefix, subRouter.totalEndpointCount());
    }

    /**
     * Removes the router mounted at {@code prefix}. It may then be mounted elsewhere.
     *
     * @return whether a router was mounted at {@code prefix}
     */
    public synchronized boolean unmount(String prefix) {
        checkNotFrozen("unmount " + prefix);
        Router removed = mounts.remove(prefix);
        if (removed == null) {
            return false;
        }
        synchronized (removed) {
            removed.parent = null;
            removed.basePath = null;
        }
        log.debug("Unmounted router: prefix={}", prefix);
        return true;
    }

    /**
     * Replaces the handler answering unmatched paths.
     */
    public void setNotFoundHandler(RouteHandler handler) {
        Objects.requireNonNull(handler, "Handler is required");
        checkNotFrozen("set not-found handler");
        this.notFoundHandler = handler;
    }

    /**
     * Makes this router and every mounted router read-only.
     */
    public synchronized void freeze() {
        if (!frozen) {
            frozen = true;
            mounts.values().forEach(Router::freeze);
            log.debug("Router frozen: {} endpoints", totalEndpointCount());
        }
    }

    public boolean isFrozen() {
        return frozen;
    }

    // ==================== DISPATCH ====================

    /**
     * Resolves and runs the handler for {@code request}.
     * <p>
     * Never throws for a handler fault: exceptions and {@code null} responses become
     * {@link ResponseStatus#INTERNAL_ERROR} responses.
     */
    public Response handle(Request request) {
        String path = request.path();

        RouteEntry entry = routes.get(path);
        if (entry != null) {
            return invoke(entry, request);
        }

        String prefix = matchMount(path);
        if (prefix != null) {
            String subPath = path.length() == prefix.length() ? ROOT_PATH : path.substring(prefix.length());
            return mounts.get(prefix).handle(request.withPath(subPath));
        }

        log.debug("No endpoint for path: {}", path);
        return invoke(new RouteEntry(path, "", List.of(), false, notFoundHandler), request);
    }

    private Response invoke(RouteEntry entry, Request request) {
        try {
            Response response = effectiveDispatcher().dispatch(entry, request);
            if (response == null) {
                log.error("Handler returned no response: path={}", entry.path());
                return Response.error("Handler returned no response");
            }
            return response;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for handler: path={}", entry.path());
            return Response.error("Interrupted while waiting for handler");
        } catch (AffinityReentryException | DispatchTimeoutException e) {
            log.error("Dispatch failed: path={}: {}", entry.path(), e.getMessage());
            return Response.error(e.getMessage());
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            log.error("Handler failed: path={}", entry.path(), e);
            return Response.error("Handler failed: " + describe(e), ResponseStatus.INTERNAL_ERROR);
        }
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private String matchMount(String path) {
        String best = null;
        for (String prefix : mounts.keySet()) {
            if ((path.equals(prefix) || path.startsWith(prefix + "/"))
                    && (best == null || prefix.length() > best.length())) {
                best = prefix;
            }
        }
        return best;
    }

    /**
     * Dispatcher of this router, else of the nearest ancestor that has one, else inline.
     */
    HandlerDispatcher effectiveDispatcher() {
        for (Router r = this; r != null; r = r.parent) {
            if (r.dispatcher != null) {
                return r.dispatcher;
            }
        }
        return InlineDispatcher.INSTANCE;
    }

    // ==================== SELF DESCRIPTION ====================

    /**
     * Describes this router. Mounted routers are expanded recursively when {@code deep},
     * else summarized by path, description and endpoint count.
     */
    public RouterInfo routerInfo(boolean deep) {
        String absolute = absolutePrefix();

        List<EndpointInfo> endpoints = new ArrayList<>();
        for (String path : registeredPaths()) {
            endpoints.add(EndpointInfo.from(absolute + path, routes.get(path)));
        }

        List<RouterInfo> routers = null;
        if (!mounts.isEmpty()) {
            routers = new ArrayList<>();
            for (String prefix : mounts.keySet().stream().sorted().toList()) {
                Router sub = mounts.get(prefix);
                routers.add(deep
                        ? sub.routerInfo(true)
                        : RouterInfo.summary(absolute + prefix, sub.description, sub.totalEndpointCount()));
            }
        }

        String path = absolute.isEmpty() ? ROOT_PATH : absolute;
        return new RouterInfo(path, description, totalEndpointCount(), endpoints, routers);
    }

    /**
     * Direct endpoints plus, recursively, every mounted router's endpoints.
     */
    public int totalEndpointCount() {
        int count = routes.size();
        for (Router sub : mounts.values()) {
            count += sub.totalEndpointCount();
        }
        return count;
    }

    public List<String> registeredPaths() {
        return routes.keySet().stream().sorted(Comparator.naturalOrder()).toList();
    }

    public List<String> mountedPrefixes() {
        return mounts.keySet().stream().sorted().toList();
    }

    public String getDescription() {
        return description;
    }

    /**
     * Prefix this router is mounted at, {@code null} until mounted.
     */
    public String getBasePath() {
        return basePath;
    }

    public Router getParent() {
        return parent;
    }

    private String absolutePrefix() {
        StringBuilder sb = new StringBuilder();
        for (Router r = this; r.parent != null; r = r.parent) {
            sb.insert(0, r.basePath);
        }
        return sb.toString();
    }

    private boolean reaches(Router target) {
        for (Router sub : mounts.values()) {
            if (sub == target || sub.reaches(target)) {
                return true;
            }
        }
        return false;
    }

    // ==================== VALIDATION ====================

    private static boolean collides(String path, String prefix) {
        return path.equals(prefix) || path.startsWith(prefix + "/");
    }

    private static void validatePath(String path) {
        if (path == null || !path.startsWith("/")) {
            throw new RouterConfigurationException("Path must start with '/': " + path);
        }
    }

    private static void validatePrefix(String prefix) {
        validatePath(prefix);
        if (prefix.equals(ROOT_PATH) || prefix.endsWith("/")) {
            throw new RouterConfigurationException("Mount prefix must not be '/' or end with '/': " + prefix);
        }
    }

    private void checkNotFrozen(String operation) {
        if (frozen) {
            throw new RouterConfigurationException("Router is frozen, cannot " + operation);
        }
    }
}
