package com.workflow.bsp.engine;

import com.workflow.bsp.api.EdgeRouter;
import com.workflow.bsp.api.NodeOutput;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Control edge. When its source completes in a superstep, the selected targets
 * are activated in the same superstep and run after the source.
 *
 * A direct edge selects its single target. A conditional edge asks its router,
 * which may only pick among the targets declared with the edge; declaring them
 * keeps cycle detection static.
 */
public final class ControlEdge {
    private final String source;
    private final Set<String> targets;
    private final EdgeRouter router;

    private ControlEdge(String source, Set<String> targets, EdgeRouter router) {
        this.source = source;
        this.targets = Collections.unmodifiableSet(new LinkedHashSet<>(targets));
        this.router = router;
    }

    public static ControlEdge direct(String source, String target) {
        return new ControlEdge(source, Set.of(target), null);
    }

    public static ControlEdge conditional(String source, Collection<String> targets, EdgeRouter router) {
        if (targets.isEmpty())
            throw new IllegalArgumentException("Conditional edge from " + source + " declares no targets");
        return new ControlEdge(source, new LinkedHashSet<>(targets), router);
    }

    public String source() {
        return source;
    }

    public Set<String> targets() {
        return targets;
    }

    public boolean isConditional() {
        return router != null;
    }

    /**
     * @throws IllegalStateException if the router picks an undeclared target
     */
    public Collection<String> select(NodeOutput output) {
        if (router == null)
            return targets;
        Collection<String> picked = router.route(output);
        if (picked == null)
            return List.of();
        for (String t : picked)
            if (!targets.contains(t))
                throw new IllegalStateException("Router of " + source + " picked undeclared target '" + t
                        + "', declared " + targets);
        return picked;
    }

    @Override
    public String toString() {
        return source + (router == null ? " -> " : " -?-> ") + targets;
    }
}
