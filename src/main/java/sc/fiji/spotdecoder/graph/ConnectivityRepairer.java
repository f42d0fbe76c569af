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

import java.util.List;
import java.util.Map;

import sc.fiji.spotdecoder.SpotDecoderUtils;

/**
 * Heals connected components fragmented by spatial jitter. Within each
 * component, spots of consecutive rounds that are not yet linked but lie
 * within the maximum search radius are connected. Pairs belonging to different
 * components are never examined, so component membership is preserved.
 */
public class ConnectivityRepairer {

	private final double searchRadiusMax;

	/**
	 * @param searchRadiusMax the maximum distance between spots of consecutive
	 *                        rounds linked by repair
	 */
	public ConnectivityRepairer(final double searchRadiusMax) {
		if (!(searchRadiusMax > 0) || Double.isInfinite(searchRadiusMax))
			throw new IllegalArgumentException("Maximum search radius must be a finite, positive number");
		this.searchRadiusMax = searchRadiusMax;
	}

	/**
	 * Adds repair edges to the graph.
	 *
	 * @param graph      the candidate graph
	 * @param components the connected components of {@code graph}
	 * @return the number of edges added
	 * @throws IllegalArgumentException if the maximum radius is smaller than the
	 *                                  radius used to build {@code graph}
	 */
	public int repair(final CandidateGraph graph, final List<SpotComponent> components) {
		if (searchRadiusMax < graph.getSearchRadius())
			throw new IllegalArgumentException("Maximum search radius (" + searchRadiusMax
					+ ") is smaller than search radius (" + graph.getSearchRadius() + ")");
		if (searchRadiusMax == graph.getSearchRadius()) return 0;
		int added = 0;
		for (final SpotComponent component : components) {
			if (component.getGraph() != graph)
				throw new IllegalArgumentException(component + " does not belong to this graph");
			added += repair(graph, component);
		}
		SpotDecoderUtils.log("Connectivity repair: " + added + " edge(s) added across " + components.size()
				+ " component(s)");
		return added;
	}

	private int repair(final CandidateGraph graph, final SpotComponent component) {
		if (component.size() < 2) return 0;
		int added = 0;
		final Map<Integer, List<Integer>> byRound = component.getVerticesByRound();
		for (final Map.Entry<Integer, List<Integer>> entry : byRound.entrySet()) {
			final List<Integer> next = byRound.get(entry.getKey() + 1);
			if (next == null) continue;
			for (final int a : entry.getValue()) {
				for (final int b : next) {
					if (graph.containsEdge(a, b)) continue;
					if (graph.getSpotTable().distance(a, b) <= searchRadiusMax && graph.link(a, b, true) != null)
						added++;
				}
			}
		}
		return added;
	}

	public double getSearchRadiusMax() {
		return searchRadiusMax;
	}

}
