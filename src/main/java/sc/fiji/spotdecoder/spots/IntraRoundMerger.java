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
import java.util.BitSet;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.apache.commons.math3.util.MathArrays;
import org.jgrapht.alg.util.UnionFind;

import sc.fiji.spotdecoder.SpotDecoderUtils;
import sc.fiji.spotdecoder.util.RadiusSearch;

/**
 * Consolidates the candidate spots of a round into one {@link Spot} per
 * physical location. Candidates detected in different channels that lie
 * within the merge radius of each other are considered to be the same emitter
 * seen through fluorescence bleed-through: their intensity profiles are
 * combined (element-wise maximum) and a single spot is created. Clusters grow
 * from the closest pairs and never hold two detections of the same channel,
 * so that a bleed-through spot cannot chain two distinct emitters. Candidates
 * without partners pass through unchanged.
 */
public class IntraRoundMerger {

	private static final Comparator<CandidateSpot> CANDIDATE_ORDER = (c1, c2) -> {
		int cmp = Integer.compare(c1.getRound(), c2.getRound());
		if (cmp != 0) return cmp;
		final int n = Math.min(c1.numDimensions(), c2.numDimensions());
		for (int d = 0; d < n; d++) {
			cmp = Double.compare(c1.getCoordinate(d), c2.getCoordinate(d));
			if (cmp != 0) return cmp;
		}
		cmp = Integer.compare(c1.getChannel(), c2.getChannel());
		if (cmp != 0) return cmp;
		cmp = Double.compare(c2.getPeakIntensity(), c1.getPeakIntensity());
		if (cmp != 0) return cmp;
		cmp = Boolean.compare(c1.hasFullProfile(), c2.hasFullProfile());
		if (cmp != 0) return cmp;
		return Arrays.compare(c1.intensities(), c2.intensities());
	};

	private final double mergeRadius;
	private final PositionMode positionMode;
	private int nChannels;

	/**
	 * @param mergeRadius  the maximum distance between detections of different
	 *                     channels to be merged. 0 disables merging
	 * @param positionMode how merged spots are positioned
	 */
	public IntraRoundMerger(final double mergeRadius, final PositionMode positionMode) {
		if (!(mergeRadius >= 0) || Double.isInfinite(mergeRadius))
			throw new IllegalArgumentException("Merge radius must be a finite, non-negative number");
		this.mergeRadius = mergeRadius;
		this.positionMode = (positionMode == null) ? PositionMode.BRIGHTEST : positionMode;
		this.nChannels = -1;
	}

	/**
	 * Sets the number of channels per round. If not set, it is inferred from the
	 * candidates being merged.
	 *
	 * @param nChannels the number of channels
	 */
	public void setNumChannels(final int nChannels) {
		if (nChannels < 1) throw new IllegalArgumentException("Number of channels must be > 0");
		this.nChannels = nChannels;
	}

	/**
	 * Merges the candidates of all rounds.
	 *
	 * @param candidates the candidates of any round and channel
	 * @return the consolidated spots, grouped by ascending round
	 */
	public List<Spot> mergeAll(final Collection<CandidateSpot> candidates) {
		final int channels = (nChannels > 0) ? nChannels : inferChannels(candidates);
		final Map<Integer, List<CandidateSpot>> byRound = new TreeMap<>();
		for (final CandidateSpot c : candidates) {
			if (c == null) throw new IllegalArgumentException("Null candidate spot");
			byRound.computeIfAbsent(c.getRound(), r -> new ArrayList<>()).add(c);
		}
		final List<Spot> spots = new ArrayList<>();
		byRound.forEach((round, roundCandidates) -> spots.addAll(merge(roundCandidates, channels)));
		SpotDecoderUtils.log("Merged " + candidates.size() + " candidates into " + spots.size() + " spots across "
				+ byRound.size() + " round(s)");
		return spots;
	}

	/**
	 * Merges the candidates of a single round.
	 *
	 * @param roundCandidates the candidates of one round
	 * @return the consolidated spots. Empty if there were no candidates
	 * @throws IllegalArgumentException if candidates belong to different rounds
	 *                                  or have different dimensionality
	 */
	public List<Spot> merge(final Collection<CandidateSpot> roundCandidates) {
		return merge(roundCandidates, (nChannels > 0) ? nChannels : inferChannels(roundCandidates));
	}

	private List<Spot> merge(final Collection<CandidateSpot> roundCandidates, final int channels) {
		final List<CandidateSpot> candidates = new ArrayList<>(roundCandidates);
		if (candidates.isEmpty()) return new ArrayList<>();
		final int round = candidates.get(0).getRound();
		final int nDims = candidates.get(0).numDimensions();
		for (final CandidateSpot c : candidates) {
			if (c.getRound() != round)
				throw new IllegalArgumentException("Candidates from rounds " + round + " and " + c.getRound()
						+ " cannot be merged");
			if (c.numDimensions() != nDims)
				throw new IllegalArgumentException("Candidates with mixed dimensionality in round " + round);
		}
		candidates.sort(CANDIDATE_ORDER);

		final Set<Integer> ids = new HashSet<>();
		final Map<Integer, BitSet> clusterChannels = new HashMap<>();
		for (int i = 0; i < candidates.size(); i++) {
			ids.add(i);
			final BitSet channel = new BitSet();
			channel.set(candidates.get(i).getChannel());
			clusterChannels.put(i, channel);
		}
		final UnionFind<Integer> clusters = new UnionFind<>(ids);
		if (mergeRadius > 0 && candidates.size() > 1) {
			final double[][] coords = new double[candidates.size()][];
			for (int i = 0; i < coords.length; i++)
				coords[i] = candidates.get(i).getPosition();
			final RadiusSearch search = new RadiusSearch(coords);
			final List<int[]> pairs = new ArrayList<>();
			for (int i = 0; i < coords.length; i++) {
				for (final int j : search.neighbors(i, mergeRadius)) {
					if (j > i && candidates.get(i).getChannel() != candidates.get(j).getChannel())
						pairs.add(new int[] { i, j });
				}
			}
			// closest pairs first; a cluster never holds two detections of the same channel
			pairs.sort(Comparator.<int[]>comparingDouble(p -> MathArrays.distance(coords[p[0]], coords[p[1]]))
					.thenComparingInt(p -> p[0]).thenComparingInt(p -> p[1]));
			for (final int[] pair : pairs) {
				final int root1 = clusters.find(pair[0]);
				final int root2 = clusters.find(pair[1]);
				if (root1 == root2 || clusterChannels.get(root1).intersects(clusterChannels.get(root2))) continue;
				final BitSet merged = (BitSet) clusterChannels.get(root1).clone();
				merged.or(clusterChannels.get(root2));
				clusters.union(root1, root2);
				clusterChannels.put(clusters.find(root1), merged);
			}
		}

		final Map<Integer, List<CandidateSpot>> groups = new LinkedHashMap<>();
		for (int i = 0; i < candidates.size(); i++)
			groups.computeIfAbsent(clusters.find(i), k -> new ArrayList<>()).add(candidates.get(i));
		final List<Spot> spots = new ArrayList<>(groups.size());
		for (final List<CandidateSpot> members : groups.values())
			spots.add(consolidate(round, members, channels));
		return spots;
	}

	private Spot consolidate(final int round, final List<CandidateSpot> members, final int channels) {
		final double[] intensities = new double[channels];
		Arrays.fill(intensities, Double.NEGATIVE_INFINITY);
		CandidateSpot brightest = members.get(0);
		final double[] centroid = new double[brightest.numDimensions()];
		for (final CandidateSpot member : members) {
			final double[] profile = member.getIntensities(channels);
			for (int c = 0; c < channels; c++)
				intensities[c] = Math.max(intensities[c], profile[c]);
			if (member.getPeakIntensity() > brightest.getPeakIntensity()) brightest = member;
			for (int d = 0; d < centroid.length; d++)
				centroid[d] += member.getCoordinate(d) / members.size();
		}
		final double[] position = (positionMode == PositionMode.CENTROID) ? centroid : brightest.getPosition();
		return new Spot(round, position, intensities);
	}

	private static int inferChannels(final Collection<CandidateSpot> candidates) {
		int channels = 1;
		for (final CandidateSpot c : candidates) {
			if (c != null) channels = Math.max(channels, c.getProfileLength());
		}
		return channels;
	}

	public double getMergeRadius() {
		return mergeRadius;
	}

	public PositionMode getPositionMode() {
		return positionMode;
	}

}
