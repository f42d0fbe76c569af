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

/**
 * A raw detection produced by a spot detector for a given (round, channel)
 * pair, prior to any consolidation across channels.
 * <p>
 * A detector may record the intensity of every channel of the round at the
 * detected position, or only the intensity of the channel in which the spot
 * was found. In the latter case the remaining channels are assumed to be dark.
 * </p>
 */
public class CandidateSpot {

	private final int round;
	private final int channel;
	private final double[] position;
	private final double[] intensities;
	private final boolean fullProfile;

	/**
	 * Creates a candidate for which only the intensity of its own channel is
	 * known.
	 *
	 * @param round     the imaging round (0-based)
	 * @param channel   the detection channel (0-based)
	 * @param position  the spot coordinates (2D or 3D, in consistent units)
	 * @param intensity the intensity measured in {@code channel}
	 */
	public CandidateSpot(final int round, final int channel, final double[] position, final double intensity) {
		this(round, channel, position, new double[] { intensity }, false);
	}

	/**
	 * Creates a candidate carrying the intensity of every channel of its round,
	 * sampled at the detected position.
	 *
	 * @param round       the imaging round (0-based)
	 * @param channel     the detection channel (0-based)
	 * @param position    the spot coordinates (2D or 3D, in consistent units)
	 * @param intensities the intensity profile across channels, indexed by
	 *                    channel
	 * @throws IllegalArgumentException if the profile does not cover
	 *                                  {@code channel}
	 */
	public CandidateSpot(final int round, final int channel, final double[] position, final double[] intensities) {
		this(round, channel, position, intensities, true);
	}

	private CandidateSpot(final int round, final int channel, final double[] position, final double[] intensities,
			final boolean fullProfile) {
		if (round < 0 || channel < 0)
			throw new IllegalArgumentException("Round and channel must be >= 0 (got r=" + round + ", c=" + channel + ")");
		if (position == null || position.length == 0)
			throw new IllegalArgumentException("Candidate spot has no coordinates");
		for (final double v : position) {
			if (!Double.isFinite(v))
				throw new IllegalArgumentException("Non-finite coordinate in " + Arrays.toString(position));
		}
		if (intensities == null || (fullProfile && intensities.length <= channel))
			throw new IllegalArgumentException("Intensity profile does not include channel " + channel);
		this.round = round;
		this.channel = channel;
		this.position = position.clone();
		this.intensities = intensities.clone();
		this.fullProfile = fullProfile;
	}

	public int getRound() {
		return round;
	}

	public int getChannel() {
		return channel;
	}

	public int numDimensions() {
		return position.length;
	}

	/** @return a copy of the coordinates of this candidate */
	public double[] getPosition() {
		return position.clone();
	}

	double getCoordinate(final int d) {
		return position[d];
	}

	/** @return the intensity measured in the detection channel */
	public double getPeakIntensity() {
		return (fullProfile) ? intensities[channel] : intensities[0];
	}

	/**
	 * Returns the channel intensity profile of this candidate.
	 *
	 * @param nChannels the number of channels in the round
	 * @return the per-channel intensities. Channels not measured by the
	 *         detector are set to zero
	 */
	public double[] getIntensities(final int nChannels) {
		final double[] profile = new double[nChannels];
		if (fullProfile) {
			System.arraycopy(intensities, 0, profile, 0, Math.min(nChannels, intensities.length));
		} else if (channel < nChannels) {
			profile[channel] = intensities[0];
		}
		return profile;
	}

	/** @return the measured intensities, without copying them */
	double[] intensities() {
		return intensities;
	}

	boolean hasFullProfile() {
		return fullProfile;
	}

	/** @return the number of channels this candidate knows about */
	int getProfileLength() {
		return (fullProfile) ? intensities.length : channel + 1;
	}

	@Override
	public String toString() {
		return "CandidateSpot[r=" + round + ", c=" + channel + ", pos=" + Arrays.toString(position) + ", I="
				+ getPeakIntensity() + "]";
	}

}
