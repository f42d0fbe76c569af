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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import sc.fiji.spotdecoder.SpotDecoderUtils;
import sc.fiji.spotdecoder.graph.CandidateGraph;
import sc.fiji.spotdecoder.graph.SpotComponent;
import sc.fiji.spotdecoder.graph.SpotEdge;
import sc.fiji.spotdecoder.spots.Spot;

/**
 * Selects the best set of vertex-disjoint sequences of a connected component.
 * <p>
 * Edges linking non-consecutive rounds are ignored. The remaining edges, from
 * the earlier to the later round, form a flow network from the spots of the
 * first round to those of the last round of the experiment, in which each spot
 * can be used once. The maximum flow of minimum cost through this network
 * yields the largest number of disjoint sequences and, among those, the set
 * with the lowest summed transition cost.
 * </p>
 * <p>
 * Sequences whose spots are spread over more than the maximum spread (i.e.,
 * some pair of spots is farther apart than it) are discarded.
 * </p>
 */
public class SequenceSelector {

	private final TransitionCost costFunction;
	private final double maxSpread;

	/**
	 * @param costFunction the transition cost
	 * @param maxSpread    the maximum distance allowed between any two spots of a
	 *                     decoded sequence. Use {@link Double#POSITIVE_INFINITY}
	 *                     to keep all sequences
	 */
	public SequenceSelector(final TransitionCost costFunction, final double maxSpread) {
		if (costFunction == null) throw new IllegalArgumentException("Transition cost cannot be null");
		if (!(maxSpread > 0)) throw new IllegalArgumentException("Maximum spread must be positive");
		this.costFunction = costFunction;
		this.maxSpread = maxSpread;
	}

	/**
	 * Decodes a connected component.
	 *
	 * @param component the component, after connectivity repair
	 * @return the decoded sequences, ordered by the first-round spot index.
	 *         Empty if no sequence spans all rounds
	 */
	public List<DecodedSequence> select(final SpotComponent component) {
		final CandidateGraph graph = component.getGraph();
		final int nRounds = graph.getNumRounds();
		final Map<Integer, List<Integer>> byRound = component.getVerticesByRound();
		for (int r = 0; r < nRounds; r++) {
			// a round without spots breaks every source-to-sink path
			if (!byRound.containsKey(r)) return new ArrayList<>();
		}

		final List<Integer> vertices = component.getVertices();
		final Map<Integer, Integer> localIndex = new HashMap<>();
		for (int k = 0; k < vertices.size(); k++)
			localIndex.put(vertices.get(k), k);

		// prune: keep only edges between consecutive rounds, oriented forward
		final List<int[]> transitions = new ArrayList<>();
		final Map<Long, Double> costOf = new HashMap<>();
		double minCost = 0;
		for (final SpotEdge edge : component.getEdges()) {
			int from = edge.getSource();
			int to = edge.getTarget();
			if (graph.getRound(from) > graph.getRound(to)) {
				final int tmp = from;
				from = to;
				to = tmp;
			}
			if (graph.getRound(to) - graph.getRound(from) != 1) continue;
			final double cost = costFunction.costOf(graph.getSpot(from), graph.getSpot(to), edge.getDistance());
			if (Double.isNaN(cost)) throw new IllegalStateException("NaN transition cost for " + edge);
			final int[] transition = new int[] { localIndex.get(from), localIndex.get(to) };
			transitions.add(transition);
			costOf.put(key(transition[0], transition[1]), cost);
			minCost = Math.min(minCost, cost);
		}
		transitions.sort((t1, t2) -> (t1[0] != t2[0]) ? Integer.compare(t1[0], t2[0]) : Integer.compare(t1[1], t2[1]));

		final FlowNetwork network = new FlowNetwork(vertices.size());
		for (final int v : byRound.get(0))
			network.addSourceArc(localIndex.get(v));
		for (final int v : byRound.get(nRounds - 1))
			network.addSinkArc(localIndex.get(v));
		// every source-to-sink path has nRounds - 1 transitions, so a constant
		// shift keeps the optimum while making all costs non-negative
		for (final int[] t : transitions)
			network.addTransitionArc(t[0], t[1], costOf.get(key(t[0], t[1])) - minCost);

		final List<DecodedSequence> sequences = new ArrayList<>();
		for (final List<Integer> path : network.solve()) {
			final List<Integer> indices = new ArrayList<>(path.size());
			final List<Spot> spots = new ArrayList<>(path.size());
			double cost = 0;
			for (int i = 0; i < path.size(); i++) {
				final int v = vertices.get(path.get(i));
				indices.add(v);
				spots.add(graph.getSpot(v));
				if (i > 0) cost += costOf.get(key(path.get(i - 1), path.get(i)));
			}
			final DecodedSequence sequence = new DecodedSequence(component.getId(), indices, spots, cost);
			if (sequence.getMaxPairwiseDistance() <= maxSpread) {
				sequences.add(sequence);
			} else {
				SpotDecoderUtils.log("Discarding " + sequence + ": spread "
						+ SpotDecoderUtils.formatDouble(sequence.getMaxPairwiseDistance(), 2) + " > " + maxSpread);
			}
		}
		return sequences;
	}

	private static long key(final int from, final int to) {
		return ((long) from << 32) | (to & 0xffffffffL);
	}

	public TransitionCost getCostFunction() {
		return costFunction;
	}

	public double getMaxSpread() {
		return maxSpread;
	}

}
