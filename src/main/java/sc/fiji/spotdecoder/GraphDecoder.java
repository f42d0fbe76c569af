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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import sc.fiji.spotdecoder.decode.DecodedSequence;
import sc.fiji.spotdecoder.decode.DistanceQualityCost;
import sc.fiji.spotdecoder.decode.IntensityTable;
import sc.fiji.spotdecoder.decode.ResultAssembler;
import sc.fiji.spotdecoder.decode.SequenceSelector;
import sc.fiji.spotdecoder.decode.TransitionCost;
import sc.fiji.spotdecoder.detect.SpotDetector;
import sc.fiji.spotdecoder.graph.CandidateGraph;
import sc.fiji.spotdecoder.graph.CandidateGraphBuilder;
import sc.fiji.spotdecoder.graph.ConnectivityRepairer;
import sc.fiji.spotdecoder.graph.SpotComponent;
import sc.fiji.spotdecoder.spots.CandidateSpot;
import sc.fiji.spotdecoder.spots.IntraRoundMerger;
import sc.fiji.spotdecoder.spots.Spot;
import sc.fiji.spotdecoder.spots.SpotTable;
import sc.fiji.spotdecoder.util.Logger;

/**
 * Graph-based decoding of barcoded spots.
 * <p>
 * Candidate spots detected in each round and channel are first merged across
 * channels within each round. Spots of different rounds closer than the search
 * radius are then linked in a graph, whose connected components are repaired
 * by linking spots of consecutive rounds up to the maximum search radius.
 * Finally, each component is decoded independently by a minimum-cost maximum
 * flow, favoring short links between high-quality spots.
 * </p>
 * Usage:
 * <pre>{@code
 * GraphDecoder decoder = new GraphDecoder(new GraphDecoderParameters(5).setSearchRadiusMax(10));
 * List<DecodedSequence> sequences = decoder.decode(candidates);
 * IntensityTable table = decoder.toIntensityTable(sequences);
 * }</pre>
 *
 * @see <a href="https://doi.org/10.1101/765842">Partel, G. et al. (2019)</a>
 */
public class GraphDecoder {

	private final GraphDecoderParameters params;
	private final IntraRoundMerger merger;
	private final CandidateGraphBuilder graphBuilder;
	private final ConnectivityRepairer repairer;
	private final SequenceSelector selector;
	private final Logger logger;

	/* shared by concurrent calls; only ever replaced, never mutated */
	private volatile DecodingRun lastRun = new DecodingRun(0, 0, null, new ArrayList<>());

	/**
	 * @param params the decoding parameters
	 * @throws DecodingConfigurationException if parameters are invalid
	 */
	public GraphDecoder(final GraphDecoderParameters params) throws DecodingConfigurationException {
		this(params, new DistanceQualityCost(validated(params).getLambda()));
	}

	/**
	 * @param params       the decoding parameters
	 * @param costFunction a custom transition cost. The lambda parameter is
	 *                     ignored
	 * @throws DecodingConfigurationException if parameters are invalid
	 */
	public GraphDecoder(final GraphDecoderParameters params, final TransitionCost costFunction)
			throws DecodingConfigurationException {
		this.params = validated(params);
		merger = new IntraRoundMerger(params.getMergeRadius(), params.getPositionMode());
		if (params.getNumChannels() > 0) merger.setNumChannels(params.getNumChannels());
		graphBuilder = new CandidateGraphBuilder(params.getSearchRadius());
		repairer = new ConnectivityRepairer(params.getSearchRadiusMax());
		selector = new SequenceSelector(costFunction, params.getSearchRadiusMax());
		logger = new Logger(GraphDecoder.class);
	}

	private static GraphDecoderParameters validated(final GraphDecoderParameters params) {
		if (params == null) throw new DecodingConfigurationException("Parameters cannot be null");
		params.validate();
		return params;
	}

	/**
	 * Decodes raw detections.
	 *
	 * @param candidates the candidate spots of all rounds and channels
	 * @return the decoded sequences, grouped by component
	 */
	public List<DecodedSequence> decode(final Collection<CandidateSpot> candidates) {
		return decodeRun(merger.mergeAll(candidates), params.getNumRounds()).sequences;
	}

	/**
	 * Detects spots in each round and decodes them.
	 *
	 * @param images   the images to be decoded, indexed by round, then channel
	 * @param detector the spot detector
	 * @return the decoded sequences, grouped by component
	 */
	public <T extends RealType<T>> List<DecodedSequence> decode(
			final List<? extends List<? extends RandomAccessibleInterval<T>>> images, final SpotDetector detector) {
		final List<CandidateSpot> candidates = new ArrayList<>();
		for (int round = 0; round < images.size(); round++)
			candidates.addAll(detector.detect(round, images.get(round)));
		logger.debug(detector.getMethod() + ": " + candidates.size() + " candidates in " + images.size()
				+ " round(s)");
		// images define the rounds, even if some of them have no spots
		final int nRounds = (params.getNumRounds() > 0) ? params.getNumRounds() : images.size();
		return decodeRun(merger.mergeAll(candidates), nRounds).sequences;
	}

	/**
	 * Decodes spots already consolidated across channels.
	 *
	 * @param spots the spots of all rounds
	 * @return the decoded sequences, grouped by component. Empty if there are no
	 *         spots
	 */
	public List<DecodedSequence> decodeSpots(final Collection<Spot> spots) {
		return decodeRun(spots, params.getNumRounds()).sequences;
	}

	private DecodingRun decodeRun(final Collection<Spot> spots, final int numRounds) {
		final SpotTable table = new SpotTable(spots);
		final int nRounds = (numRounds > 0) ? numRounds : table.getNumRounds();
		final int nChannels = (params.getNumChannels() > 0) ? params.getNumChannels()
				: table.getSpots().stream().mapToInt(Spot::numChannels).max().orElse(0);
		if (table.isEmpty()) {
			logger.debug("No spots to decode");
			return lastRun = new DecodingRun(nRounds, nChannels, null, new ArrayList<>());
		}
		final CandidateGraph graph = graphBuilder.build(table, nRounds);
		repairer.repair(graph, graph.getConnectedComponents());
		// components are unchanged by repair, but now capture the repair edges
		final List<SpotComponent> components = graph.getConnectedComponents();
		if (logger.isDebug()) logComponentStats(graph, components);
		final List<DecodedSequence> sequences = decodeComponents(components);
		logger.debug(sequences.size() + " sequence(s) decoded from " + table.size() + " spots");
		return lastRun = new DecodingRun(nRounds, nChannels, graph, sequences);
	}

	/**
	 * Decodes a set of connected components, in parallel if more than one thread
	 * is allowed.
	 *
	 * @param components the components to be decoded
	 * @return the concatenated sequences, in component order
	 */
	public List<DecodedSequence> decodeComponents(final List<SpotComponent> components) {
		final int nThreads = Math.min(params.getThreads(), components.size());
		if (nThreads <= 1) {
			final List<DecodedSequence> sequences = new ArrayList<>();
			for (final SpotComponent component : components)
				sequences.addAll(selector.select(component));
			return sequences;
		}
		final ExecutorService pool = Executors.newFixedThreadPool(nThreads);
		try {
			final List<Future<List<DecodedSequence>>> futures = new ArrayList<>(components.size());
			for (final SpotComponent component : components)
				futures.add(pool.submit(() -> selector.select(component)));
			final List<DecodedSequence> sequences = new ArrayList<>();
			for (final Future<List<DecodedSequence>> future : futures)
				sequences.addAll(future.get());
			return sequences;
		} catch (final InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Decoding interrupted", ex);
		} catch (final ExecutionException ex) {
			logger.error("Failed to decode component", ex.getCause());
			throw new IllegalStateException("Failed to decode component: " + ex.getCause().getMessage(),
					ex.getCause());
		} finally {
			pool.shutdownNow();
		}
	}

	private void logComponentStats(final CandidateGraph graph, final List<SpotComponent> components) {
		final SummaryStatistics stats = new SummaryStatistics();
		components.forEach(c -> stats.addValue(c.size()));
		logger.debug(String.format("%d component(s); size: mean=%s, max=%d; %d edge(s), %d from repair",
				components.size(), SpotDecoderUtils.formatDouble(stats.getMean(), 2), (int) stats.getMax(),
				graph.edgeSet().size(), graph.countRepairedEdges()));
	}

	/**
	 * Assembles the intensity table of decoded sequences, using the number of
	 * rounds and channels of the last decoding run. When the same decoder is
	 * shared across threads, the last run may belong to another thread: use
	 * {@link #run(Collection)} instead.
	 *
	 * @param sequences the decoded sequences
	 * @return the intensity table
	 */
	public IntensityTable toIntensityTable(final List<DecodedSequence> sequences) {
		final DecodingRun last = lastRun;
		return toIntensityTable(sequences, last.numRounds, last.numChannels);
	}

	private static IntensityTable toIntensityTable(final List<DecodedSequence> sequences, final int numRounds,
			final int numChannels) {
		int nChannels = numChannels;
		int nRounds = numRounds;
		for (final DecodedSequence sequence : sequences) {
			nRounds = Math.max(nRounds, sequence.getLastRound() + 1);
			for (final Spot spot : sequence.getSpots())
				nChannels = Math.max(nChannels, spot.numChannels());
		}
		return ResultAssembler.assemble(sequences, nRounds, nChannels);
	}

	/**
	 * Convenience method that decodes raw detections into an intensity table.
	 * Safe to call concurrently on the same decoder.
	 *
	 * @param candidates the candidate spots of all rounds and channels
	 * @return the intensity table of decoded sequences
	 */
	public IntensityTable run(final Collection<CandidateSpot> candidates) {
		final DecodingRun run = decodeRun(merger.mergeAll(candidates), params.getNumRounds());
		return toIntensityTable(run.sequences, run.numRounds, run.numChannels);
	}

	/** @return the candidate graph of the last decoding run, or null if it had no spots */
	public CandidateGraph getLastGraph() {
		return lastRun.graph;
	}

	public GraphDecoderParameters getParameters() {
		return params;
	}

	/** @return the number of rounds considered in the last decoding run */
	public int getLastNumRounds() {
		return lastRun.numRounds;
	}

	@Override
	public String toString() {
		return "GraphDecoder[" + params + "]";
	}

	private static class DecodingRun {

		final int numRounds;
		final int numChannels;
		final CandidateGraph graph;
		final List<DecodedSequence> sequences;

		DecodingRun(final int numRounds, final int numChannels, final CandidateGraph graph,
				final List<DecodedSequence> sequences) {
			this.numRounds = numRounds;
			this.numChannels = numChannels;
			this.graph = graph;
			this.sequences = sequences;
		}
	}

}
