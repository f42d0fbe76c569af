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

package sc.fiji.spotdecoder.decode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.jgrapht.Graph;
import org.jgrapht.alg.flow.EdmondsKarpMFImpl;
import org.jgrapht.alg.flow.mincost.CapacityScalingMinimumCostFlow;
import org.jgrapht.alg.flow.mincost.MinimumCostFlowProblem;
import org.jgrapht.alg.interfaces.MinimumCostFlowAlgorithm;
import org.jgrapht.graph.AsWeightedGraph;
import org.jgrapht.graph.DefaultDirectedWeightedGraph;
import org.jgrapht.graph.DefaultWeightedEdge;

/**
 * Unit-capacity flow network in which every spot is split into an "in" and an
 * "out" vertex joined by a single arc, so that each spot carries at most one
 * unit of flow. Arc weights are costs. Vertices are integers: spot {@code k}
 * (a local index) maps to {@code 2k} (in) and {@code 2k+1} (out); the source
 * and sink follow the last spot.
 */
public class FlowNetwork {

	private static final double FLOW_EPSILON = 0.5;

	private final DefaultDirectedWeightedGraph<Integer, DefaultWeightedEdge> network;
	private final int nSpots;
	private final int source;
	private final int sink;

	/**
	 * @param nSpots the number of spots in the network
	 */
	public FlowNetwork(final int nSpots) {
		this.nSpots = nSpots;
		this.source = 2 * nSpots;
		this.sink = 2 * nSpots + 1;
		network = new DefaultDirectedWeightedGraph<>(DefaultWeightedEdge.class);
		for (int v = 0; v <= sink; v++)
			network.addVertex(v);
		for (int k = 0; k < nSpots; k++)
			addArc(in(k), out(k), 0d);
	}

	private static int in(final int k) {
		return 2 * k;
	}

	private static int out(final int k) {
		return 2 * k + 1;
	}

	private void addArc(final int from, final int to, final double cost) {
		final DefaultWeightedEdge arc = network.addEdge(from, to);
		if (arc == null) throw new IllegalStateException("Duplicated arc " + from + " -> " + to);
		network.setEdgeWeight(arc, cost);
	}

	/** Connects the source to spot {@code k} (a spot of the first round). */
	public void addSourceArc(final int k) {
		addArc(source, in(k), 0d);
	}

	/** Connects spot {@code k} (a spot of the last round) to the sink. */
	public void addSinkArc(final int k) {
		addArc(out(k), sink, 0d);
	}

	/**
	 * Connects spot {@code from} (round r) to spot {@code to} (round r+1).
	 *
	 * @param from the local index of the earlier spot
	 * @param to   the local index of the later spot
	 * @param cost the non-negative cost of the transition
	 */
	public void addTransitionArc(final int from, final int to, final double cost) {
		if (cost < 0 || Double.isNaN(cost))
			throw new IllegalArgumentException("Transition costs must be non-negative (got " + cost + ")");
		addArc(out(from), in(to), cost);
	}

	/**
	 * Computes a maximum flow of minimum cost from the source to the sink and
	 * decomposes it into unit paths.
	 *
	 * @return the spot sequences (local indices, source to sink order) carried by
	 *         the flow. Empty if the sink cannot be reached
	 */
	public List<List<Integer>> solve() {
		// all arcs have unit capacity: the weighted view replaces costs by capacities
		final Graph<Integer, DefaultWeightedEdge> capacities = new AsWeightedGraph<>(network, e -> 1d, false,
				false);
		final double maxFlow = new EdmondsKarpMFImpl<>(capacities).getMaximumFlow(source, sink).getValue();
		final int flowValue = (int) Math.round(maxFlow);
		if (flowValue == 0) return Collections.emptyList();

		final MinimumCostFlowProblem<Integer, DefaultWeightedEdge> problem = new MinimumCostFlowProblem.MinimumCostFlowProblemImpl<>(
				network, v -> (v == source) ? flowValue : (v == sink) ? -flowValue : 0, e -> 1);
		final MinimumCostFlowAlgorithm.MinimumCostFlow<DefaultWeightedEdge> flow = new CapacityScalingMinimumCostFlow<Integer, DefaultWeightedEdge>()
				.getMinimumCostFlow(problem);
		return decompose(flow, flowValue);
	}

	private List<List<Integer>> decompose(final MinimumCostFlowAlgorithm.MinimumCostFlow<DefaultWeightedEdge> flow,
			final int flowValue) {
		final Map<Integer, DefaultWeightedEdge> usedArcFrom = new HashMap<>();
		for (final DefaultWeightedEdge arc : network.edgeSet()) {
			if (flow.getFlow(arc) > FLOW_EPSILON && network.getEdgeSource(arc) != source)
				usedArcFrom.put(network.getEdgeSource(arc), arc);
		}
		final List<List<Integer>> paths = new ArrayList<>(flowValue);
		for (final DefaultWeightedEdge start : network.outgoingEdgesOf(source)) {
			if (flow.getFlow(start) <= FLOW_EPSILON) continue;
			final List<Integer> path = new ArrayList<>();
			int vertex = network.getEdgeTarget(start);
			while (vertex != sink) {
				if (vertex % 2 == 0) path.add(vertex / 2);
				final DefaultWeightedEdge next = usedArcFrom.get(vertex);
				if (next == null)
					throw new IllegalStateException("Flow is not conserved at vertex " + vertex);
				vertex = network.getEdgeTarget(next);
			}
			paths.add(path);
		}
		if (paths.size() != flowValue)
			throw new IllegalStateException("Expected " + flowValue + " unit paths but found " + paths.size());
		return paths;
	}

	public int getNumSpots() {
		return nSpots;
	}

	/** @return the number of arcs of the network */
	public int getNumArcs() {
		return network.edgeSet().size();
	}

}
