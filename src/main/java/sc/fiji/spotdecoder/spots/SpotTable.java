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

package sc.fiji.spotdecoder.spots;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Arena of consolidated spots. Spots are addressed by their integer index,
 * which is what graph vertices refer to. Spots are stored in a canonical order
 * (round, coordinates, channel) so that indices do not depend on the order in
 * which detections were supplied.
 */
public class SpotTable {

	/**
	 * Canonical ordering of spots: round, then coordinates, then channel, then
	 * quality (descending), then intensity profile
	 */
	public static final Comparator<Spot> CANONICAL_ORDER = (s1, s2) -> {
		int cmp = Integer.compare(s1.getRound(), s2.getRound());
		if (cmp != 0) return cmp;
		final int n = Math.min(s1.numDimensions(), s2.numDimensions());
		for (int d = 0; d < n; d++) {
			cmp = Double.compare(s1.getCoordinate(d), s2.getCoordinate(d));
			if (cmp != 0) return cmp;
		}
		cmp = Integer.compare(s1.getChannel(), s2.getChannel());
		if (cmp != 0) return cmp;
		cmp = Double.compare(s2.getQuality(), s1.getQuality());
		if (cmp != 0) return cmp;
		return Arrays.compare(s1.intensities(), s2.intensities());
	};

	private final List<Spot> spots;
	private final int numDimensions;
	private final int numRounds;
	private final int[] roundStarts;

	/**
	 * @param spots the spots to be stored
	 * @throws IllegalArgumentException if spots do not share the same
	 *                                  dimensionality
	 */
	public SpotTable(final Collection<Spot> spots) {
		final List<Spot> sorted = new ArrayList<>(spots);
		int nDims = -1;
		for (final Spot s : sorted) {
			if (s == null) throw new IllegalArgumentException("Null spot");
			if (nDims < 0) nDims = s.numDimensions();
			else if (nDims != s.numDimensions())
				throw new IllegalArgumentException("Spots with mixed dimensionality: " + nDims + "D and "
						+ s.numDimensions() + "D");
		}
		sorted.sort(CANONICAL_ORDER);
		this.spots = Collections.unmodifiableList(sorted);
		this.numDimensions = Math.max(0, nDims);
		this.numRounds = sorted.isEmpty() ? 0 : sorted.get(sorted.size() - 1).getRound() + 1;
		roundStarts = new int[numRounds + 1];
		int idx = 0;
		for (int r = 0; r <= numRounds; r++) {
			while (idx < sorted.size() && sorted.get(idx).getRound() < r)
				idx++;
			roundStarts[r] = idx;
		}
	}

	/**
	 * @param index the spot index
	 * @return the spot stored at {@code index}
	 */
	public Spot get(final int index) {
		return spots.get(index);
	}

	public int getRound(final int index) {
		return spots.get(index).getRound();
	}

	public int size() {
		return spots.size();
	}

	public boolean isEmpty() {
		return spots.isEmpty();
	}

	/** @return the number of rounds spanned by the table, i.e., highest round + 1 */
	public int getNumRounds() {
		return numRounds;
	}

	/** @return the dimensionality of stored spots (0 if the table is empty) */
	public int getNumDimensions() {
		return numDimensions;
	}

	/**
	 * Returns the indices of the spots detected in a given round.
	 *
	 * @param round the round
	 * @return the (ascending) indices of spots in {@code round}. Empty if the
	 *         round has no spots
	 */
	public List<Integer> indicesInRound(final int round) {
		if (round < 0 || round >= numRounds) return Collections.emptyList();
		final List<Integer> indices = new ArrayList<>(roundStarts[round + 1] - roundStarts[round]);
		for (int i = roundStarts[round]; i < roundStarts[round + 1]; i++)
			indices.add(i);
		return indices;
	}

	/** @return the stored spots, in index order */
	public List<Spot> getSpots() {
		return spots;
	}

	/**
	 * Computes the Euclidean distance between two stored spots.
	 *
	 * @param i the index of the first spot
	 * @param j the index of the second spot
	 * @return the distance between spots {@code i} and {@code j}
	 */
	public double distance(final int i, final int j) {
		return spots.get(i).distanceTo(spots.get(j));
	}

	/** @return the coordinates of all spots, indexed by spot index */
	public double[][] getCoordinates() {
		final double[][] coords = new double[spots.size()][];
		for (int i = 0; i < coords.length; i++)
			coords[i] = spots.get(i).getPosition();
		return coords;
	}

}
