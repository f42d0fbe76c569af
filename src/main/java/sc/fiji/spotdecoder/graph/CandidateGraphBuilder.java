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

import sc.fiji.spotdecoder.SpotDecoderUtils;
import sc.fiji.spotdecoder.spots.SpotTable;
import sc.fiji.spotdecoder.util.RadiusSearch;

/**
 * Builds a {@link CandidateGraph} by linking every pair of spots from
 * different rounds that lie within the search radius of each other. Spots of
 * the same round are never linked, since a decoded sequence uses exactly one
 * spot per round.
 */
public class CandidateGraphBuilder {

	private final double searchRadius;

	/**
	 * @param searchRadius the maximum distance between linked spots. Must be
	 *                     positive
	 */
	public CandidateGraphBuilder(final double searchRadius) {
		if (!(searchRadius > 0) || Double.isInfinite(searchRadius))
			throw new IllegalArgumentException("Search radius must be a finite, positive number");
		this.searchRadius = searchRadius;
	}

	/**
	 * Builds the graph, assuming the experiment has as many rounds as spanned by
	 * {@code spots}.
	 *
	 * @param spots the consolidated spots
	 * @return the candidate graph
	 */
	public CandidateGraph build(final SpotTable spots) {
		return build(spots, spots.getNumRounds());
	}

	/**
	 * Builds the graph.
	 *
	 * @param spots     the consolidated spots
	 * @param numRounds the number of rounds of the experiment
	 * @return the candidate graph. Empty if {@code spots} is empty
	 */
	public CandidateGraph build(final SpotTable spots, final int numRounds) {
		final CandidateGraph graph = new CandidateGraph(spots, numRounds, searchRadius);
		final RadiusSearch search = new RadiusSearch(spots.getCoordinates());
		for (int i = 0; i < spots.size(); i++) {
			for (final int j : search.neighbors(i, searchRadius)) {
				if (j <= i || spots.getRound(i) == spots.getRound(j)) continue;
				if (spots.distance(i, j) <= searchRadius) graph.link(i, j, false);
			}
		}
		SpotDecoderUtils.log("Candidate graph: " + graph.vertexSet().size() + " spots, " + graph.edgeSet().size()
				+ " edges (search radius: " + searchRadius + ")");
		return graph;
	}

	public double getSearchRadius() {
		return searchRadius;
	}

}
