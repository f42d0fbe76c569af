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

package sc.fiji.spotdecoder;

import sc.fiji.spotdecoder.decode.DistanceQualityCost;
import sc.fiji.spotdecoder.spots.PositionMode;

/**
 * Parameters of {@link GraphDecoder}. Setters return the instance itself so
 * that calls can be chained:
 * <pre>{@code
 * GraphDecoderParameters params = new GraphDecoderParameters(5).setSearchRadiusMax(10).setThreads(4);
 * }</pre>
 * Values are checked by {@link #validate()}, never clamped.
 */
public class GraphDecoderParameters {

	public static final double DEFAULT_MERGE_RADIUS = 1d;

	private double searchRadius;
	private Double searchRadiusMax;
	private double lambda = DistanceQualityCost.DEFAULT_LAMBDA;
	private double mergeRadius = DEFAULT_MERGE_RADIUS;
	private PositionMode positionMode = PositionMode.BRIGHTEST;
	private int threads = Runtime.getRuntime().availableProcessors();
	private int numRounds = -1;
	private int numChannels = -1;

	/**
	 * @param searchRadius the maximum distance between spots of different rounds
	 *                     to be linked
	 */
	public GraphDecoderParameters(final double searchRadius) {
		this.searchRadius = searchRadius;
	}

	public GraphDecoderParameters setSearchRadius(final double searchRadius) {
		this.searchRadius = searchRadius;
		return this;
	}

	/**
	 * @param searchRadiusMax the maximum distance for repair edges between
	 *                        consecutive rounds, and the maximum distance between
	 *                        any two spots of a decoded sequence. Null reverts to
	 *                        the default (the search radius)
	 */
	public GraphDecoderParameters setSearchRadiusMax(final Double searchRadiusMax) {
		this.searchRadiusMax = searchRadiusMax;
		return this;
	}

	/** @param searchRadiusMax the maximum linking radius used to repair components */
	public GraphDecoderParameters setSearchRadiusMax(final double searchRadiusMax) {
		return setSearchRadiusMax(Double.valueOf(searchRadiusMax));
	}

	/** @param lambda the weight of spot quality relative to distance in transition costs */
	public GraphDecoderParameters setLambda(final double lambda) {
		this.lambda = lambda;
		return this;
	}

	/** @param mergeRadius the radius within which detections of different channels are merged. 0 disables merging */
	public GraphDecoderParameters setMergeRadius(final double mergeRadius) {
		this.mergeRadius = mergeRadius;
		return this;
	}

	public GraphDecoderParameters setPositionMode(final PositionMode positionMode) {
		this.positionMode = positionMode;
		return this;
	}

	/** @param threads the number of threads decoding components in parallel */
	public GraphDecoderParameters setThreads(final int threads) {
		this.threads = threads;
		return this;
	}

	/**
	 * @param numRounds the number of rounds of the experiment. If unset, the
	 *                  highest round holding spots defines the last round
	 */
	public GraphDecoderParameters setNumRounds(final int numRounds) {
		this.numRounds = numRounds;
		return this;
	}

	/**
	 * @param numChannels the number of channels per round. If unset, it is
	 *                    inferred from detections
	 */
	public GraphDecoderParameters setNumChannels(final int numChannels) {
		this.numChannels = numChannels;
		return this;
	}

	public double getSearchRadius() {
		return searchRadius;
	}

	public double getSearchRadiusMax() {
		return (searchRadiusMax == null) ? searchRadius : searchRadiusMax;
	}

	public double getLambda() {
		return lambda;
	}

	public double getMergeRadius() {
		return mergeRadius;
	}

	public PositionMode getPositionMode() {
		return positionMode;
	}

	public int getThreads() {
		return threads;
	}

	/** @return the number of rounds, or -1 if unset */
	public int getNumRounds() {
		return numRounds;
	}

	/** @return the number of channels, or -1 if unset */
	public int getNumChannels() {
		return numChannels;
	}

	/**
	 * Checks all parameters.
	 *
	 * @throws DecodingConfigurationException if any parameter is invalid
	 */
	public void validate() throws DecodingConfigurationException {
		if (!(searchRadius > 0) || Double.isInfinite(searchRadius))
			throw new DecodingConfigurationException("search_radius must be a finite, positive number (got "
					+ searchRadius + ")");
		final double max = getSearchRadiusMax();
		if (Double.isNaN(max) || Double.isInfinite(max) || max < searchRadius)
			throw new DecodingConfigurationException("search_radius_max (" + max
					+ ") must be finite and >= search_radius (" + searchRadius + ")");
		if (!(lambda >= 0) || Double.isInfinite(lambda))
			throw new DecodingConfigurationException("lambda must be a finite, non-negative number (got " + lambda
					+ ")");
		if (!(mergeRadius >= 0) || Double.isInfinite(mergeRadius))
			throw new DecodingConfigurationException("merge radius must be a finite, non-negative number (got "
					+ mergeRadius + ")");
		if (positionMode == null)
			throw new DecodingConfigurationException("position mode cannot be null");
		if (threads < 1)
			throw new DecodingConfigurationException("threads must be >= 1 (got " + threads + ")");
		if (numRounds == 0 || numRounds < -1)
			throw new DecodingConfigurationException("number of rounds must be > 0 (got " + numRounds + ")");
		if (numChannels == 0 || numChannels < -1)
			throw new DecodingConfigurationException("number of channels must be > 0 (got " + numChannels + ")");
	}

	@Override
	public String toString() {
		return "search_radius=" + searchRadius + ", search_radius_max=" + getSearchRadiusMax() + ", lambda="
				+ lambda + ", merge_radius=" + mergeRadius + ", position=" + positionMode + ", threads=" + threads;
	}

}
