package org.snomed.snowcap.fhir.services;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FHIRGraphBuilderTest {

	@Test
	void testTransitiveClosure() {
		FHIRGraphBuilder graph = new FHIRGraphBuilder();
		graph.addParent("c", "b");
		graph.addParent("b", "a");
		graph.addParent("d", "a");
		graph.addNode("e");

		assertEquals(Set.of("b", "a"), graph.getTransitiveClosure("c"));
		assertEquals(Set.of(), graph.getTransitiveClosure("a"));
		assertEquals(Set.of("b", "c", "d"), graph.getDescendants("a"));
		assertEquals(Set.of(), graph.getDescendants("e"));
		assertNull(graph.getTransitiveClosure("unknown"));
		assertEquals(5, graph.size());
	}

	@Test
	void testMultipleParents() {
		FHIRGraphBuilder graph = new FHIRGraphBuilder();
		graph.addParent("child", "left");
		graph.addParent("child", "right");
		graph.addParent("left", "root");
		graph.addParent("right", "root");

		assertEquals(Set.of("left", "right", "root"), graph.getTransitiveClosure("child"));
		assertEquals(Set.of("left", "right"), Set.copyOf(graph.getParents("child")));
		assertEquals(Set.of("left", "right"), Set.copyOf(graph.getChildren("root")));
		assertTrue(graph.getParents("unknown").isEmpty());
	}

	@Test
	void testFindLoop() {
		FHIRGraphBuilder graph = new FHIRGraphBuilder();
		graph.addParent("a", "root");
		graph.addParent("b", "a");
		assertTrue(graph.findLoop().isEmpty());

		graph.addParent("c", "b");
		graph.addParent("a", "c");
		List<String> loop = graph.findLoop();
		assertFalse(loop.isEmpty());
		assertEquals(loop.get(0), loop.get(loop.size() - 1));
		assertEquals(Set.of("a", "b", "c"), Set.copyOf(loop));
	}

	@Test
	void testSelfLoop() {
		FHIRGraphBuilder graph = new FHIRGraphBuilder();
		graph.addParent("a", "a");
		assertEquals(List.of("a", "a"), graph.findLoop());
	}

}
