package works.trellis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.pcollections.HashTreePSet;
import org.pcollections.PSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.trellis.MountEdge.DynamicEdge;
import works.trellis.MountEdge.StaticEdge;
import works.trellis.TreeSettings.StaticRouteOrder;
import works.trellis.conditions.Condition;
import works.trellis.conditions.RouteContext;
import works.trellis.conditions.Verdict;

/**
 * Lists the routes of a declared tree, without creating any resources.
 * <p>
 * The walk is depth-first, pre-order, expanding each node type's edges in
 * {@link MountTable#routeOrder route order}.
 * An edge whose guard or condition {@link Condition#decide decides} from the route alone
 * that it can never match there is left out, along with everything beneath it.
 * It keeps the set of node types on the current path; an edge leading back
 * to one of them (which only a bounded edge can do) yields one route ending
 * in that edge's segment, and is not expanded further.
 * The walk uses an explicit stack, so deep trees can't overflow the call stack.
 */
final class RouteEnumerator {
	private RouteEnumerator() { }

	static List<Route> routes(ResourceTree<?> tree) {
		StaticRouteOrder order = tree.settings().getStaticRouteOrder();
		List<Route> result = new ArrayList<>();
		Deque<Step> stack = new ArrayDeque<>();
		stack.push(new Step(Route.root(tree.rootType()), HashTreePSet.<NodeType<?>>singleton(tree.rootType()), false));
		while (!stack.isEmpty()) {
			Step step = stack.pop();
			result.add(step.route());
			if (step.collapsed()) {
				continue;
			}
			List<MountEdge> edges = tree.mountTable(step.route().target()).routeOrder(order);
			// Reversed, so they pop off the stack in order
			for (int i = edges.size() - 1; i >= 0; i--) {
				MountEdge edge = edges.get(i);
				if (neverMatches(step.route(), edge)) {
					LOGGER.debug("Edge {} can't be resolved under route {}; skipping", edge.segment(), step.route());
					continue;
				}
				Route next = step.route().then(edge);
				if (step.onPath().contains(edge.child())) {
					LOGGER.debug("Route {} recurses into {}; not expanding further", next, edge.child());
					stack.push(new Step(next, step.onPath(), true));
				} else {
					stack.push(new Step(next, step.onPath().plus(edge.child()), false));
				}
			}
		}
		return List.copyOf(result);
	}

	private static boolean neverMatches(Route parent, MountEdge edge) {
		Condition condition;
		String segment;
		if (edge instanceof StaticEdge s) {
			condition = s.guard();
			segment = s.name();
		} else {
			condition = ((DynamicEdge) edge).condition();
			segment = null;
		}
		if (condition == null) {
			return false;
		}
		return condition.decide(new RouteContext(parent, edge.child(), edge.metaname(), segment)) == Verdict.FAILS;
	}

	private record Step(Route route, PSet<NodeType<?>> onPath, boolean collapsed) { }

	private static final Logger LOGGER = LoggerFactory.getLogger(RouteEnumerator.class);
}
