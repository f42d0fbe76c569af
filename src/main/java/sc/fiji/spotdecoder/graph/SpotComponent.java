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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * A connected component of a {@link CandidateGraph}: a maximal cluster of
 * linked spots that is decoded independently of all others.
 * <p>
 * The edges of the component are captured when the component is computed, so
 * that it can be decoded from any thread without touching the parent graph.
 * Edges added to the graph afterwards (e.g., by {@link ConnectivityRepairer})
 * are only visible to components computed later.
 * </p>
 */
public class SpotComponent {

	private final CandidateGraph graph;
	private final int id;
	private final List<Integer> vertices;
	private final List<SpotEdge> edges;

	protected SpotComponent(final CandidateGraph graph, final int id, final List<Integer> vertices) {
		this.graph = graph;
		this.id = id;
		this.vertices = Collections.unmodifiableList(vertices);
		final Set<SpotEdge> edgeSet = new LinkedHashSet<>();
		for (final int v : vertices)
			edgeSet.addAll(graph.edgesOf(v));
		this.edges = Collections.unmodifiableList(new ArrayList<>(edgeSet));
	}

	public int getId() {
		return id;
	}

	/** @return the (ascending) spot indices of this component */
	public List<Integer> getVertices() {
		return vertices;
	}

	/** @return the edges linking the spots of this component */
	public List<SpotEdge> getEdges() {
		return edges;
	}

	public int size() {
		return vertices.size();
	}

	public CandidateGraph getGraph() {
		return graph;
	}

	/**
	 * Groups the vertices of this component by round.
	 *
	 * @return a map of round to (ascending) spot indices, sorted by round
	 */
	public Map<Integer, List<Integer>> getVerticesByRound() {
		final Map<Integer, List<Integer>> byRound = new TreeMap<>();
		for (final int v : vertices)
			byRound.computeIfAbsent(graph.getRound(v), r -> new ArrayList<>()).add(v);
		return byRound;
	}

	@Override
	public String toString() {
		return "Component #" + id + " (" + vertices.size() + " spots, " + edges.size() + " edges)";
	}

}
