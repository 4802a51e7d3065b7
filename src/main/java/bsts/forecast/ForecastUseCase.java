package bsts.forecast;

import bsts.inference.InferenceConfig;
import bsts.inference.InferenceEngine;
import bsts.model.ModelConfiguration;
import bsts.model.ObservationSeries;
import bsts.model.StructuralModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Fits a structural model to a series and forecasts it in one call. Each execution builds its own model and engine, so executions share
 * no state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastUseCase {

	private final Supplier<InferenceEngine> engineSupplier;
	private final Supplier<RandomGenerator> randomSupplier;

	/**
	 * @param features adds the seasonalities, holidays and regressors to the freshly configured model.
	 */
	public ForecastFrame execute(
			final ObservationSeries series,
			final ModelConfiguration configuration,
			final UnaryOperator<StructuralModel> features,
			final InferenceConfig inferenceConfig,
			final ForecastRequest request
	) {
		final var model = features.apply(new StructuralModel(series, configuration, engineSupplier.get()))
				.fit(inferenceConfig);
		return forecast(model, request);
	}

	/** Forecasts an already fitted model. */
	public ForecastFrame forecast(final StructuralModel model, final ForecastRequest request) {
		final var frame = ForecastSynthesizer.synthesize(model.definition(), model.requirePosterior(), request, randomSupplier.get());
		log.info("forecast {} steps of model {} ({} rows)", request.horizon(), model.getName(), frame.size());
		return frame;
	}
}
