package bsts.global;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when a structural model cannot be configured, assembled or forecast.
 *
 * <p>Messages are prefixed with the reason code, e.g. {@code [NOT_FITTED] ...}.</p>
 */
@Getter
@Accessors(fluent = true)
public final class ModelException extends RuntimeException {

	public enum Reason {
		CHANGEPOINT_CONFLICT,
		MISSING_FIELD,
		MISSING_NAME,
		NOT_FITTED,
		UNPARSEABLE_FEATURE_NAME,
		DEGENERATE_SERIES,
		INVALID_ARGUMENT,
		ALREADY_FINALIZED
	}

	private final Reason reason;

	public ModelException(Reason reason, String message) {
		super(formatMessage(reason, message));
		this.reason = reason;
	}

	public ModelException(Reason reason, String message, Throwable cause) {
		super(formatMessage(reason, message), cause);
		this.reason = reason;
	}

	private static String formatMessage(Reason reason, String message) {
		return "[" + Objects.requireNonNull(reason, "reason") + "] " + Objects.requireNonNull(message, "message");
	}
}
