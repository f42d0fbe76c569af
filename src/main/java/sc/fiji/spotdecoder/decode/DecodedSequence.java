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
import java.util.List;

import sc.fiji.spotdecoder.spots.Spot;

/**
 * A candidate barcode readout: one spot per round, over consecutive rounds,
 * selected from a single connected component.
 */
public class DecodedSequence {

	private final int componentId;
	private final int firstRound;
	private final List<Integer> spotIndices;
	private final List<Spot> spots;
	private final double cost;

	/**
	 * @param componentId the id of the originating component
	 * @param spotIndices the arena indices of the selected spots, in round order
	 * @param spots       the selected spots, in round order
	 * @param cost        the summed transition cost of the sequence
	 * @throws IllegalArgumentException if spots do not span consecutive rounds
	 */
	public DecodedSequence(final int componentId, final List<Integer> spotIndices, final List<Spot> spots,
			final double cost) {
		if (spots.isEmpty() || spots.size() != spotIndices.size())
			throw new IllegalArgumentException("Sequence requires one index per spot");
		for (int i = 1; i < spots.size(); i++) {
			if (spots.get(i).getRound() != spots.get(i - 1).getRound() + 1)
				throw new IllegalArgumentException("Sequence spots are not in consecutive rounds");
		}
		this.componentId = componentId;
		this.firstRound = spots.get(0).getRound();
		this.spotIndices = Collections.unmodifiableList(new ArrayList<>(spotIndices));
		this.spots = Collections.unmodifiableList(new ArrayList<>(spots));
		this.cost = cost;
	}

	public int getComponentId() {
		return componentId;
	}

	public int getFirstRound() {
		return firstRound;
	}

	public int getLastRound() {
		return firstRound + spots.size() - 1;
	}

	/** @return the number of rounds spanned by this sequence */
	public int size() {
		return spots.size();
	}

	/** @return the selected spots, in round order */
	public List<Spot> getSpots() {
		return spots;
	}

	/** @return the arena indices of the selected spots, in round order */
	public List<Integer> getSpotIndices() {
		return spotIndices;
	}

	/**
	 * @param round the round
	 * @return the spot selected for {@code round}, or null if the sequence does
	 *         not span it
	 */
	public Spot getSpot(final int round) {
		final int idx = round - firstRound;
		return (idx < 0 || idx >= spots.size()) ? null : spots.get(idx);
	}

	public double getCost() {
		return cost;
	}

	/**
	 * Returns the brightest channel of each spanned round, i.e., the code to be
	 * looked up in a one-hot codebook.
	 *
	 * @return the per-round channel indices, in round order
	 */
	public int[] getChannelCode() {
		final int[] code = new int[spots.size()];
		for (int i = 0; i < code.length; i++)
			code[i] = spots.get(i).getChannel();
		return code;
	}

	/** @return the largest distance between any two spots of this sequence */
	public double getMaxPairwiseDistance() {
		double max = 0;
		for (int i = 0; i < spots.size(); i++) {
			for (int j = i + 1; j < spots.size(); j++)
				max = Math.max(max, spots.get(i).distanceTo(spots.get(j)));
		}
		return max;
	}

	public double getMeanQuality() {
		return spots.stream().mapToDouble(Spot::getQuality).average().orElse(Spot.FALLBACK_QUALITY);
	}

	/** @return the mean position of the spots of this sequence */
	public double[] getCentroid() {
		final double[] centroid = new double[spots.get(0).numDimensions()];
		for (final Spot s : spots) {
			for (int d = 0; d < centroid.length; d++)
				centroid[d] += s.getCoordinate(d) / spots.size();
		}
		return centroid;
	}

	@Override
	public String toString() {
		return "DecodedSequence[component=" + componentId + ", rounds=" + firstRound + "-" + getLastRound()
				+ ", spots=" + spotIndices + "]";
	}

}
