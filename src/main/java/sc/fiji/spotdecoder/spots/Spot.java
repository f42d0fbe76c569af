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

import java.util.Arrays;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.util.MathArrays;

import sc.fiji.spotdecoder.SpotDecoderUtils;

/**
 * A consolidated point detection: one physical signal location in one round,
 * with its intensity profile across the channels of that round and a quality
 * score. Instances are immutable.
 */
public class Spot {

	/**
	 * Quality assigned to spots with an all-zero (or non-positive) intensity
	 * profile. Such spots get no quality bonus when scoring transitions.
	 */
	public static final double FALLBACK_QUALITY = 0d;

	private final int round;
	private final int channel;
	private final double[] position;
	private final double[] intensities;
	private final double quality;

	/**
	 * @param round       the imaging round (0-based)
	 * @param position    the spot coordinates
	 * @param intensities the intensity profile across the channels of the round
	 */
	public Spot(final int round, final double[] position, final double[] intensities) {
		if (round < 0) throw new IllegalArgumentException("Round must be >= 0");
		if (position == null || position.length == 0) throw new IllegalArgumentException("Spot has no coordinates");
		if (intensities == null) throw new IllegalArgumentException("Spot has no intensity profile");
		this.round = round;
		this.position = position.clone();
		this.intensities = intensities.clone();
		this.channel = argMax(intensities);
		this.quality = quality(intensities);
	}

	/**
	 * Computes the quality score of an intensity profile, i.e., the ratio
	 * between its maximum and its L2 norm. Values close to 1 indicate an
	 * unambiguous channel assignment.
	 *
	 * @param intensities the per-channel intensities
	 * @return the quality score in (0, 1], or {@link #FALLBACK_QUALITY} if the
	 *         profile is empty, all-zero or has no positive entry
	 */
	public static double quality(final double[] intensities) {
		if (intensities == null || intensities.length == 0) return FALLBACK_QUALITY;
		final ArrayRealVector vector = new ArrayRealVector(intensities, false);
		final double norm = vector.getNorm();
		final double max = vector.getMaxValue();
		if (!(norm > 0) || !(max > 0)) return FALLBACK_QUALITY;
		return Math.min(1d, max / norm);
	}

	private static int argMax(final double[] values) {
		int idx = 0;
		for (int i = 1; i < values.length; i++) {
			if (values[i] > values[idx]) idx = i;
		}
		return idx;
	}

	public int getRound() {
		return round;
	}

	/** @return the brightest channel of this spot. Ties resolve to the lowest channel */
	public int getChannel() {
		return channel;
	}

	public int numDimensions() {
		return position.length;
	}

	/** @return a copy of the coordinates of this spot */
	public double[] getPosition() {
		return position.clone();
	}

	public double getCoordinate(final int d) {
		return position[d];
	}

	/** @return a copy of the per-channel intensities of this spot */
	public double[] getIntensities() {
		return intensities.clone();
	}

	/** @return the intensity profile of this spot, without copying it */
	double[] intensities() {
		return intensities;
	}

	public double getIntensity() {
		return (intensities.length == 0) ? 0d : intensities[channel];
	}

	public int numChannels() {
		return intensities.length;
	}

	public double getQuality() {
		return quality;
	}

	/**
	 * Gets the Euclidean distance to another spot.
	 *
	 * @param other the other spot
	 * @return the distance between the two spots
	 */
	public double distanceTo(final Spot other) {
		return MathArrays.distance(position, other.position);
	}

	@Override
	public String toString() {
		return "Spot[r=" + round + ", c=" + channel + ", pos=" + Arrays.toString(position) + ", q="
				+ SpotDecoderUtils.formatDouble(quality, 3) + "]";
	}

}
