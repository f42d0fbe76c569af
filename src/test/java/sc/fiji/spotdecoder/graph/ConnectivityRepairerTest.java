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
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

import sc.fiji.spotdecoder.spots.Spot;
import sc.fiji.spotdecoder.spots.SpotTable;

/**
 * Tests for {@link ConnectivityRepairer}
 */
public class ConnectivityRepairerTest {

	private SpotTable table;

	private static Spot spot(final int round, final double x, final double y) {
		return new Spot(round, new double[] { x, y }, new double[] { 1 });
	}

	@Before
	public void setUp() {
		final List<Spot> spots = new ArrayList<>();
		// round 0 and round 1 are too far apart to be linked directly, but both
		// reach the round 2 spot lying between them
		spots.add(spot(0, 0, 0));
		spots.add(spot(1, 6, 0));
		spots.add(spot(2, 3, 0));
		// an unrelated spot within repair distance of the component
		spots.add(spot(1, -6, 0));
		table = new SpotTable(spots);
	}

	@Test
	public void testRepairLinksConsecutiveRounds() {
		final CandidateGraph graph = new CandidateGraphBuilder(3.5).build(table);
		final List<SpotComponent> before = graph.getConnectedComponents();
		assertEquals(2, before.size());
		assertEquals(2, graph.edgeSet().size());

		final int added = new ConnectivityRepairer(7).repair(graph, before);
		assertEquals(1, added);
		assertEquals(1, graph.countRepairedEdges());
		final SpotEdge repaired = graph.edgeSet().stream().filter(SpotEdge::isRepaired).findFirst().get();
		assertEquals(6d, repaired.getDistance(), 0);
		assertEquals(1, Math.abs(graph.getRound(repaired.getSource()) - graph.getRound(repaired.getTarget())));

		// the (-6, 0) spot is within 7 of (0, 0) but in another component
		assertEquals(vertexSets(before), vertexSets(graph.getConnectedComponents()));
	}

	@Test
	public void testRepairIsMonotonic() {
		final Random random = new Random(3);
		final List<Spot> spots = new ArrayList<>();
		for (int i = 0; i < 60; i++)
			spots.add(spot(random.nextInt(4), random.nextDouble() * 40, random.nextDouble() * 40));
		final SpotTable randomTable = new SpotTable(spots);
		Set<String> previous = new HashSet<>();
		for (final double max : new double[] { 3, 4, 5, 6, 8 }) {
			final CandidateGraph graph = new CandidateGraphBuilder(3).build(randomTable);
			final List<SpotComponent> components = graph.getConnectedComponents();
			new ConnectivityRepairer(max).repair(graph, components);
			final Set<String> edges = new HashSet<>();
			graph.edgeSet().forEach(e -> edges.add(Math.min(e.getSource(), e.getTarget()) + "-"
					+ Math.max(e.getSource(), e.getTarget())));
			assertTrue(edges.containsAll(previous));
			assertEquals(vertexSets(components), vertexSets(graph.getConnectedComponents()));
			previous = edges;
		}
	}

	@Test
	public void testEqualRadiiAddNothing() {
		final CandidateGraph graph = new CandidateGraphBuilder(3.5).build(table);
		assertEquals(0, new ConnectivityRepairer(3.5).repair(graph, graph.getConnectedComponents()));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMaxRadiusBelowSearchRadius() {
		final CandidateGraph graph = new CandidateGraphBuilder(3.5).build(table);
		new ConnectivityRepairer(2).repair(graph, graph.getConnectedComponents());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testForeignComponent() {
		final CandidateGraph graph = new CandidateGraphBuilder(3.5).build(table);
		final CandidateGraph other = new CandidateGraphBuilder(3.5).build(table);
		new ConnectivityRepairer(7).repair(graph, other.getConnectedComponents());
	}

	private static Set<List<Integer>> vertexSets(final List<SpotComponent> components) {
		final Set<List<Integer>> sets = new HashSet<>();
		components.forEach(c -> sets.add(c.getVertices()));
		return sets;
	}

}
