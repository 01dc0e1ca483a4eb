package com.textgraph.core.layout.routing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Looks up {@link EdgeRouter} implementations registered via {@link ServiceLoader}.
 */
public final class EdgeRouters {

    private static final Logger log = LoggerFactory.getLogger(EdgeRouters.class);

    private EdgeRouters() {
        // Utility class
    }

    /**
     * Returns every registered router in registration order.
     *
     * @return routers
     */
    public static List<EdgeRouter> all() {
        log.debug("Discovering edge routers via ServiceLoader");
        List<EdgeRouter> routers = new ArrayList<>();
        for (EdgeRouter router : ServiceLoader.load(EdgeRouter.class)) {
            routers.add(router);
        }
        return routers;
    }

    public static Optional<EdgeRouter> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String key = id.trim().toLowerCase(Locale.ROOT);
        return all().stream().filter(r -> r.getId().equals(key)).findFirst();
    }

    /**
     * Returns the router with the given id.
     *
     * @param id router id; null selects {@link GridEdgeRouter#ID}
     * @return router
     * @throws IllegalArgumentException if no router has that id
     */
    public static EdgeRouter byId(String id) {
        String key = id == null ? GridEdgeRouter.ID : id;
        return find(key).orElseThrow(() -> new IllegalArgumentException(
            "Unknown router '" + key + "'; available: "
                + all().stream().map(EdgeRouter::getId).collect(Collectors.joining(", "))));
    }
}
