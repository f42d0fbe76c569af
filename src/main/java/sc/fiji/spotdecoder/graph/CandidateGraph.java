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
import java.util.Comparator;
import java.util.List;
import java.util.Set;

import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.graph.AbstractBaseGraph;
import org.jgrapht.graph.DefaultGraphType;
import org.jgrapht.util.SupplierUtil;

import sc.fiji.spotdecoder.spots.Spot;
import sc.fiji.spotdecoder.spots.SpotTable;

/**
 * Undirected graph of spots detected across imaging rounds. Vertices are the
 * indices of spots in the underlying {@link SpotTable}; edges only ever link
 * spots from different rounds.
 */
public class CandidateGraph extends AbstractBaseGraph<Integer, SpotEdge> {

	private static final long serialVersionUID = 1L;

	private final SpotTable spots;
	private final int numRounds;
	private final double searchRadius;

	/**
	 * Creates a graph holding every spot of the table as an isolated vertex.
	 *
	 * @param spots        the spot arena
	 * @param numRounds    the number of rounds of the experiment
	 * @param searchRadius the radius used to link spots
	 */
	protected CandidateGraph(final SpotTable spots, final int numRounds, final double searchRadius) {
		super(null, SupplierUtil.createSupplier(SpotEdge.class), new DefaultGraphType.Builder()
				.undirected().allowMultipleEdges(false).allowSelfLoops(false).weighted(true)
				.modifiable(true)
				.build());
		if (numRounds < spots.getNumRounds())
			throw new IllegalArgumentException("Spots span " + spots.getNumRounds() + " rounds but only "
					+ numRounds + " were specified");
		this.spots = spots;
		this.numRounds = numRounds;
		this.searchRadius = searchRadius;
		for (int i = 0; i < spots.size(); i++)
			addVertex(i);
	}

	/**
	 * Links two spots.
	 *
	 * @param v1       the index of the first spot
	 * @param v2       the index of the second spot
	 * @param repaired whether the edge is a repair edge
	 * @return the new edge, or null if the two spots were already linked
	 * @throws IllegalArgumentException if the spots belong to the same round
	 */
	protected SpotEdge link(final int v1, final int v2, final boolean repaired) {
		if (spots.getRound(v1) == spots.getRound(v2))
			throw new IllegalArgumentException("Spots " + v1 + " and " + v2 + " belong to the same round");
		final SpotEdge edge = addEdge(v1, v2);
		if (edge == null) return null;
		setEdgeWeight(edge, spots.distance(v1, v2));
		edge.setRepaired(repaired);
		return edge;
	}

	/**
	 * Computes the connected components of this graph.
	 *
	 * @return the components, sorted by their smallest spot index. Component ids
	 *         match list positions
	 */
	public List<SpotComponent> getConnectedComponents() {
		final List<Set<Integer>> sets = new ConnectivityInspector<>(this).connectedSets();
		final List<List<Integer>> memberLists = new ArrayList<>(sets.size());
		for (final Set<Integer> set : sets) {
			final List<Integer> members = new ArrayList<>(set);
			Collections.sort(members);
			memberLists.add(members);
		}
		memberLists.sort(Comparator.comparing(members -> members.get(0)));
		final List<SpotComponent> components = new ArrayList<>(memberLists.size());
		for (final List<Integer> members : memberLists)
			components.add(new SpotComponent(this, components.size(), members));
		return components;
	}

	public Spot getSpot(final int vertex) {
		return spots.get(vertex);
	}

	public int getRound(final int vertex) {
		return spots.getRound(vertex);
	}

	public SpotTable getSpotTable() {
		return spots;
	}

	/** @return the number of rounds of the experiment */
	public int getNumRounds() {
		return numRounds;
	}

	/** @return the radius used to create initial edges */
	public double getSearchRadius() {
		return searchRadius;
	}

	/** @return the number of edges added by connectivity repair */
	public long countRepairedEdges() {
		return edgeSet().stream().filter(SpotEdge::isRepaired).count();
	}

}
