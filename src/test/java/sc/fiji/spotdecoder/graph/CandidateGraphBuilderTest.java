/*-
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2026 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package sc.fiji.spotdecoder.graph;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.Before;
import org.junit.Test;

import sc.fiji.spotdecoder.spots.Spot;
import sc.fiji.spotdecoder.spots.SpotTable;

/**
 * Tests for {@link CandidateGraphBuilder} and {@link CandidateGraph}
 */
public class CandidateGraphBuilderTest {

	private List<Spot> spots;

	private static Spot spot(final int round, final double x, final double y) {
		return new Spot(round, new double[] { x, y }, new double[] { 1 });
	}

	@Before
	public void setUp() {
		spots = new ArrayList<>();
		// first cluster
		spots.add(spot(0, 0, 0));
		spots.add(spot(0, 1, 0)); // same round: never linked to (0, 0)
		spots.add(spot(1, 3, 0));
		spots.add(spot(2, 3, 2));
		// second cluster, far away
		spots.add(spot(0, 50, 50));
		spots.add(spot(1, 52, 50));
		// isolated
		spots.add(spot(2, 100, 0));
	}

	@Test
	public void testEdges() {
		final CandidateGraph graph = new CandidateGraphBuilder(3).build(new SpotTable(spots));
		for (final SpotEdge edge : graph.edgeSet()) {
			assertNotEquals(graph.getRound(edge.getSource()), graph.getRound(edge.getTarget()));
			assertTrue(edge.getDistance() <= 3);
			assertFalse(edge.isRepaired());
			assertEquals(graph.getSpot(edge.getSource()).distanceTo(graph.getSpot(edge.getTarget())),
					edge.getWeight(), 0);
		}
		// (0,0)-(3,0) lies exactly at the search radius
		assertEquals(5, graph.edgeSet().size());
		assertEquals(7, graph.vertexSet().size());
	}

	@Test
	public void testConnectedComponents() {
		final CandidateGraph graph = new CandidateGraphBuilder(3).build(new SpotTable(spots));
		final List<SpotComponent> components = graph.getConnectedComponents();
		assertEquals(3, components.size());
		for (int i = 0; i < components.size(); i++)
			assertEquals(i, components.get(i).getId());
		final int total = components.stream().mapToInt(SpotComponent::size).sum();
		assertEquals(spots.size(), total);
		assertEquals(4, components.get(0).size());
		assertEquals(2, components.get(1).size());
		assertEquals(1, components.get(2).size());
		assertTrue(components.get(2).getEdges().isEmpty());
	}

	@Test
	public void testComponentsIndependentOfInputOrder() {
		final CandidateGraphBuilder builder = new CandidateGraphBuilder(3);
		final List<List<Integer>> expected = vertices(builder.build(new SpotTable(spots)).getConnectedComponents());
		final Random random = new Random(7);
		for (int i = 0; i < 10; i++) {
			final List<Spot> shuffled = new ArrayList<>(spots);
			Collections.shuffle(shuffled, random);
			assertEquals(expected, vertices(builder.build(new SpotTable(shuffled)).getConnectedComponents()));
		}
	}

	@Test
	public void testEmptyGraph() {
		final CandidateGraph graph = new CandidateGraphBuilder(3).build(new SpotTable(Collections.emptyList()));
		assertTrue(graph.vertexSet().isEmpty());
		assertTrue(graph.getConnectedComponents().isEmpty());
	}

	@Test
	public void testVerticesByRound() {
		final CandidateGraph graph = new CandidateGraphBuilder(3).build(new SpotTable(spots));
		final SpotComponent component = graph.getConnectedComponents().get(0);
		assertEquals(Arrays.asList(0, 1, 2), new ArrayList<>(component.getVerticesByRound().keySet()));
		assertEquals(2, component.getVerticesByRound().get(0).size());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testTooFewRounds() {
		new CandidateGraphBuilder(3).build(new SpotTable(spots), 2);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidRadius() {
		new CandidateGraphBuilder(0);
	}

	private static List<List<Integer>> vertices(final List<SpotComponent> components) {
		final List<List<Integer>> vertices = new ArrayList<>();
		components.forEach(c -> vertices.add(c.getVertices()));
		return vertices;
	}

}
