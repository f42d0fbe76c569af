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
import java.util.Collections;
import java.util.List;

/**
 * Tabular view of decoded sequences: one feature (row) per sequence holding,
 * for every round, the position and channel intensities of its selected spot.
 * Rounds not spanned by a feature hold NaN values.
 */
public class IntensityTable {

	/** A decoded feature, i.e., one row of the table */
	public static class Feature {

		private final int componentId;
		private final double[][] positions;
		private final double[][] intensities;
		private final double[] centroid;
		private final double meanQuality;

		Feature(final int componentId, final double[][] positions, final double[][] intensities,
				final double[] centroid, final double meanQuality) {
			this.componentId = componentId;
			this.positions = positions;
			this.intensities = intensities;
			this.centroid = centroid;
			this.meanQuality = meanQuality;
		}

		public int getComponentId() {
			return componentId;
		}

		/**
		 * @param round the round
		 * @return the intensities of the spot selected in {@code round}. NaN
		 *         filled if the feature does not span the round
		 */
		public double[] getIntensities(final int round) {
			return intensities[round].clone();
		}

		/**
		 * @param round the round
		 * @return the position of the spot selected in {@code round}. NaN filled
		 *         if the feature does not span the round
		 */
		public double[] getPosition(final int round) {
			return positions[round].clone();
		}

		/** @return the mean position of the feature's spots */
		public double[] getCentroid() {
			return centroid.clone();
		}

		public double getMeanQuality() {
			return meanQuality;
		}

		/**
		 * Picks the brightest channel of every round.
		 *
		 * @return the per-round channel code. -1 for rounds not spanned by the
		 *         feature
		 */
		public int[] perRoundMaxChannel() {
			final int[] code = new int[intensities.length];
			for (int r = 0; r < intensities.length; r++) {
				code[r] = -1;
				for (int c = 0; c < intensities[r].length; c++) {
					if (Double.isNaN(intensities[r][c])) break;
					if (code[r] < 0 || intensities[r][c] > intensities[r][code[r]]) code[r] = c;
				}
			}
			return code;
		}

		@Override
		public String toString() {
			return "Feature[component=" + componentId + ", code=" + Arrays.toString(perRoundMaxChannel()) + "]";
		}
	}

	private final int numRounds;
	private final int numChannels;
	private final List<Feature> features;

	IntensityTable(final int numRounds, final int numChannels, final List<Feature> features) {
		this.numRounds = numRounds;
		this.numChannels = numChannels;
		this.features = Collections.unmodifiableList(new ArrayList<>(features));
	}

	public int getNumRounds() {
		return numRounds;
	}

	public int getNumChannels() {
		return numChannels;
	}

	public List<Feature> getFeatures() {
		return features;
	}

	public Feature getFeature(final int index) {
		return features.get(index);
	}

	public int size() {
		return features.size();
	}

	public boolean isEmpty() {
		return features.isEmpty();
	}

}
