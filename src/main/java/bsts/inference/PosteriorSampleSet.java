package bsts.inference;

import bsts.global.ImmutableEnumMap;
import bsts.global.ImmutableMap;
import bsts.global.ModelComponent;
import bsts.global.ModelException;
import bsts.global.SampleEnsemble;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The trace produced by an inference run: for each declared {@link ModelComponent} an ensemble of draws. All the ensembles of a set share
 * the same number of draws, so the d-th draw of every component together forms one joint posterior sample.
 */
public final class PosteriorSampleSet {
	public static final PosteriorSampleSet EMPTY = new PosteriorSampleSet(ImmutableEnumMap.of(), 0);

	private final ImmutableEnumMap<ModelComponent, SampleEnsemble> ensembles;
	private final int draws;

	private PosteriorSampleSet(final ImmutableEnumMap<ModelComponent, SampleEnsemble> ensembles, final int draws) {
		this.ensembles = ensembles;
		this.draws = draws;
	}

	public static PosteriorSampleSet of(final ImmutableEnumMap<ModelComponent, SampleEnsemble> ensembles) {
		final var drawCounts = ensembles.toStream(ModelComponent.values())
				.mapToInt(entry -> entry.value().draws())
				.distinct()
				.toArray();
		if (drawCounts.length > 1) {
			throw new ModelException(ModelException.Reason.INVALID_ARGUMENT, "the ensembles of a posterior sample set differ in draw count");
		}
		return new PosteriorSampleSet(ensembles, drawCounts.length == 0 ? 0 : drawCounts[0]);
	}

	/**
	 * Builds a set from an engine that reports its trace by external parameter name ({@code <prefix>_<modelName>}). Names that belong to
	 * other models or to deterministic aggregates are ignored.
	 */
	public static PosteriorSampleSet fromNamedTrace(final Map<String, double[][]> trace, final String modelName) {
		var ensembles = ImmutableEnumMap.<ModelComponent, SampleEnsemble>of();
		for (var entry : trace.entrySet()) {
			final var component = ModelComponent.fromParameterName(entry.getKey(), modelName);
			if (component.isPresent()) {
				ensembles = ensembles.put(component.get(), SampleEnsemble.of(entry.getValue()));
			}
		}
		return of(ensembles);
	}

	public static Builder builder() {
		return new Builder();
	}

	public boolean isEmpty() {
		return ensembles.isEmpty();
	}

	public int draws() {
		return draws;
	}

	public boolean contains(final ModelComponent component) {
		return ensembles.containsKey(component);
	}

	public Optional<SampleEnsemble> get(final ModelComponent component) {
		return ensembles.getSome(component);
	}

	public SampleEnsemble require(final ModelComponent component) {
		return get(component).orElseThrow(() -> new ModelException(
				ModelException.Reason.NOT_FITTED,
				"the posterior sample set has no draws for " + component
		));
	}

	/** The joint assignment of the d-th draw. */
	public ParameterValues draw(final int draw) {
		return new ParameterValues(ensembles.mapValues(ensemble -> ensemble.draw(draw)));
	}

	/** The trace keyed by external parameter name. */
	public Map<String, double[][]> toNamedTrace(final String modelName) {
		final var named = new LinkedHashMap<String, double[][]>();
		ensembles.toStream(ModelComponent.values())
				.forEach(entry -> named.put(entry.key().parameterName(modelName), entry.value().toMatrix()));
		return named;
	}

	@Override
	public String toString() {
		return "PosteriorSampleSet(draws=" + draws + ", components="
				+ ensembles.toStream(ModelComponent.values()).map(ImmutableMap.Entry::key).toList() + ")";
	}

	public static final class Builder {
		private ImmutableEnumMap<ModelComponent, SampleEnsemble> ensembles = ImmutableEnumMap.of();

		private Builder() {}

		public Builder add(final ModelComponent component, final SampleEnsemble ensemble) {
			this.ensembles = this.ensembles.put(component, ensemble);
			return this;
		}

		public Builder scalars(final ModelComponent component, final double... draws) {
			return add(component, SampleEnsemble.ofScalars(draws));
		}

		public Builder vectors(final ModelComponent component, final double[][] drawsByElement) {
			return add(component, SampleEnsemble.of(drawsByElement));
		}

		public PosteriorSampleSet build() {
			return PosteriorSampleSet.of(ensembles);
		}
	}
}
