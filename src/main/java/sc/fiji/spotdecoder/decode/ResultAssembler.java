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
import java.util.Arrays;
import java.util.List;

import sc.fiji.spotdecoder.spots.Spot;

/**
 * Converts decoded sequences into an {@link IntensityTable} suitable for
 * codebook lookup.
 */
public class ResultAssembler {

	private ResultAssembler() {
	}

	/**
	 * Assembles the intensity table of a set of sequences.
	 *
	 * @param sequences   the decoded sequences
	 * @param numRounds   the number of rounds of the experiment
	 * @param numChannels the number of channels per round
	 * @return the table, with one feature per sequence in the given order
	 */
	public static IntensityTable assemble(final List<DecodedSequence> sequences, final int numRounds,
			final int numChannels) {
		final List<IntensityTable.Feature> features = new ArrayList<>(sequences.size());
		for (final DecodedSequence sequence : sequences) {
			if (sequence.getLastRound() >= numRounds)
				throw new IllegalArgumentException(sequence + " spans more than " + numRounds + " rounds");
			final int nDims = sequence.getSpots().get(0).numDimensions();
			final double[][] positions = new double[numRounds][];
			final double[][] intensities = new double[numRounds][];
			for (int r = 0; r < numRounds; r++) {
				final Spot spot = sequence.getSpot(r);
				if (spot == null) {
					positions[r] = nanArray(nDims);
					intensities[r] = nanArray(numChannels);
				} else {
					positions[r] = spot.getPosition();
					intensities[r] = Arrays.copyOf(spot.getIntensities(), numChannels);
				}
			}
			features.add(new IntensityTable.Feature(sequence.getComponentId(), positions, intensities,
					sequence.getCentroid(), sequence.getMeanQuality()));
		}
		return new IntensityTable(numRounds, numChannels, features);
	}

	private static double[] nanArray(final int length) {
		final double[] array = new double[length];
		Arrays.fill(array, Double.NaN);
		return array;
	}

}
