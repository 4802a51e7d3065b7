package bsts.global;

import java.util.Arrays;

/**
 * The posterior draws of one parameter group, laid out as a {@code draws × width} matrix. Scalar parameters have width one.
 */
public final class SampleEnsemble {
	private final double[][] values;
	private final int width;

	private SampleEnsemble(final double[][] values, final int width) {
		this.values = values;
		this.width = width;
	}

	public static SampleEnsemble of(final double[][] drawsByElement) {
		if (drawsByElement.length == 0) {
			throw new ModelException(ModelException.Reason.INVALID_ARGUMENT, "a sample ensemble needs at least one draw");
		}
		final var width = drawsByElement[0].length;
		final var copy = new double[drawsByElement.length][];
		for (var d = 0; d < drawsByElement.length; ++d) {
			if (drawsByElement[d].length != width) {
				throw new ModelException(
						ModelException.Reason.INVALID_ARGUMENT,
						"draw " + d + " has " + drawsByElement[d].length + " elements but draw 0 has " + width
				);
			}
			copy[d] = drawsByElement[d].clone();
		}
		return new SampleEnsemble(copy, width);
	}

	public static SampleEnsemble ofScalars(final double... draws) {
		final var matrix = new double[draws.length][];
		for (var d = 0; d < draws.length; ++d) {
			matrix[d] = new double[]{draws[d]};
		}
		return of(matrix);
	}

	public int draws() {
		return values.length;
	}

	public int width() {
		return width;
	}

	public double get(final int draw, final int element) {
		return values[draw][element];
	}

	/** All the elements of a single draw. */
	public double[] draw(final int draw) {
		return values[draw].clone();
	}

	/** All the draws of a single element. */
	public double[] element(final int element) {
		final var column = new double[values.length];
		for (var d = 0; d < values.length; ++d) {
			column[d] = values[d][element];
		}
		return column;
	}

	/** The draws of a scalar parameter. */
	public double[] scalars() {
		return element(0);
	}

	public double[][] toMatrix() {
		final var copy = new double[values.length][];
		for (var d = 0; d < values.length; ++d) {
			copy[d] = values[d].clone();
		}
		return copy;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof SampleEnsemble other && Arrays.deepEquals(values, other.values);
	}

	@Override
	public int hashCode() {
		return Arrays.deepHashCode(values);
	}

	@Override
	public String toString() {
		return "SampleEnsemble(draws=" + draws() + ", width=" + width + ")";
	}
}
