package bsts.testutil;

import bsts.global.ModelComponent;
import bsts.global.SampleEnsemble;
import bsts.inference.InferenceConfig;
import bsts.inference.InferenceEngine;
import bsts.inference.LatentExpression;
import bsts.inference.PosteriorSampleSet;
import bsts.inference.PriorDeclaration;
import bsts.inference.PriorHandle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;

/**
 * An engine that records what the model declares and answers {@link #runInference} with samples computed from the declarations instead
 * of sampling a posterior.
 */
public class CannedInferenceEngine implements InferenceEngine {
	public final List<PriorDeclaration> declarations = new ArrayList<>();
	public final Map<String, LatentExpression> deterministics = new LinkedHashMap<>();
	public final List<InferenceConfig> runs = new ArrayList<>();
	public LatentExpression likelihoodMean;
	public PriorHandle likelihoodNoise;
	public double[] likelihoodObserved;
	public int likelihoodBindings = 0;

	private final Function<List<PriorDeclaration>, PosteriorSampleSet> answer;

	public CannedInferenceEngine(final Function<List<PriorDeclaration>, PosteriorSampleSet> answer) {
		this.answer = answer;
	}

	/** Answers with the specified samples whatever was declared. */
	public static CannedInferenceEngine returning(final PosteriorSampleSet posterior) {
		return new CannedInferenceEngine(declarations -> posterior);
	}

	/**
	 * Answers with {@code draws} pseudo random draws per declared element: normal around zero with the specified spread, absolute for
	 * the noise scale.
	 */
	public static CannedInferenceEngine drawing(final long seed, final int draws, final double spread) {
		return new CannedInferenceEngine(declarations -> {
			final var random = new Random(seed);
			final var builder = PosteriorSampleSet.builder();
			for (var declaration : declarations) {
				final var matrix = new double[draws][declaration.width()];
				for (var d = 0; d < draws; ++d) {
					for (var j = 0; j < declaration.width(); ++j) {
						final var value = random.nextGaussian() * spread;
						matrix[d][j] = declaration.component() == ModelComponent.NOISE_SCALE ? Math.abs(value) : value;
					}
				}
				builder.add(declaration.component(), SampleEnsemble.of(matrix));
			}
			return builder.build();
		});
	}

	@Override
	public PriorHandle declarePrior(final PriorDeclaration declaration) {
		declarations.add(declaration);
		return new PriorHandle(declaration.component(), declaration.parameterName(), declaration.width());
	}

	@Override
	public void declareDeterministic(final String name, final LatentExpression expression) {
		deterministics.put(name, expression);
	}

	@Override
	public void bindLikelihood(final LatentExpression mean, final PriorHandle noise, final double[] observed) {
		likelihoodMean = mean;
		likelihoodNoise = noise;
		likelihoodObserved = observed;
		likelihoodBindings += 1;
	}

	@Override
	public PosteriorSampleSet runInference(final InferenceConfig config) {
		runs.add(config);
		return answer.apply(List.copyOf(declarations));
	}
}
