package org.snomed.snowcap.fhir.services;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Parent / child graph of the codes of one code system version. Not thread safe while being built,
 * safe for concurrent reads once building has finished.
 */
public class FHIRGraphBuilder {

	private final Map<String, Vertex> vertices = new Object2ObjectOpenHashMap<>();

	private static final Logger LOGGER = LoggerFactory.getLogger(FHIRGraphBuilder.class);

	public void addNode(String code) {
		vertex(code);
	}

	public void addParent(String code, String parentCode) {
		LOGGER.trace("{} -> {}", code, parentCode);
		Vertex child = vertex(code);
		Vertex parent = vertex(parentCode);
		child.parents.add(parent);
		parent.children.add(child);
	}

	private Vertex vertex(String code) {
		return vertices.computeIfAbsent(code, Vertex::new);
	}

	/**
	 * All ancestors of the code, breadth first, not including the code itself unless it is part of a loop.
	 */
	public Set<String> getTransitiveClosure(String code) {
		Vertex start = vertices.get(code);
		return start != null ? collect(start, v -> v.parents) : null;
	}

	public Set<String> getDescendants(String code) {
		Vertex start = vertices.get(code);
		return start != null ? collect(start, v -> v.children) : null;
	}

	private static Set<String> collect(Vertex start, Function<Vertex, Set<Vertex>> edges) {
		Set<String> collected = new LinkedHashSet<>();
		Deque<Vertex> queue = new ArrayDeque<>(edges.apply(start));
		while (!queue.isEmpty()) {
			Vertex next = queue.poll();
			if (collected.add(next.code)) {
				queue.addAll(edges.apply(next));
			}
		}
		return collected;
	}

	public Collection<String> getParents(String code) {
		return codes(code, v -> v.parents);
	}

	public Collection<String> getChildren(String code) {
		return codes(code, v -> v.children);
	}

	private List<String> codes(String code, Function<Vertex, Set<Vertex>> edges) {
		Vertex vertex = vertices.get(code);
		if (vertex == null) {
			return Collections.emptyList();
		}
		return edges.apply(vertex).stream().map(v -> v.code).collect(Collectors.toList());
	}

	/**
	 * Depth first search for a loop in the parent links.
	 * @return the codes on the first loop found, starting and ending with the same code, or an empty list.
	 */
	public List<String> findLoop() {
		Set<Vertex> done = new HashSet<>();
		for (Vertex root : vertices.values()) {
			if (done.contains(root)) {
				continue;
			}
			// Vertices on the current path, each with the iterator over its remaining parents
			LinkedHashMap<Vertex, Iterator<Vertex>> path = new LinkedHashMap<>();
			path.put(root, root.parents.iterator());
			Deque<Vertex> stack = new ArrayDeque<>();
			stack.push(root);
			while (!stack.isEmpty()) {
				Vertex current = stack.peek();
				Iterator<Vertex> parents = path.get(current);
				if (parents.hasNext()) {
					Vertex parent = parents.next();
					if (path.containsKey(parent)) {
						List<String> loop = new ArrayList<>();
						boolean inLoop = false;
						for (Vertex onPath : path.keySet()) {
							inLoop = inLoop || onPath == parent;
							if (inLoop) {
								loop.add(onPath.code);
							}
						}
						loop.add(parent.code);
						return loop;
					}
					if (!done.contains(parent)) {
						path.put(parent, parent.parents.iterator());
						stack.push(parent);
					}
				} else {
					stack.pop();
					path.remove(current);
					done.add(current);
				}
			}
		}
		return Collections.emptyList();
	}

	public int size() {
		return vertices.size();
	}

	// Identity equality, there is one vertex per code
	private static final class Vertex {

		private final String code;
		private final Set<Vertex> parents = new LinkedHashSet<>();
		private final Set<Vertex> children = new LinkedHashSet<>();

		private Vertex(String code) {
			this.code = code;
		}
	}
}
