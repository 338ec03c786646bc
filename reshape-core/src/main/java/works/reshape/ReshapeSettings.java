package works.reshape;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import lombok.experimental.Accessors;
import works.reshape.exceptions.DepthExceededException;
import works.reshape.exceptions.MissingFieldException;

import static java.util.Objects.requireNonNull;

@Value
@Accessors(fluent = true)
@Builder(toBuilder = true)
public class ReshapeSettings {
	/**
	 * The deepest nesting the engine will follow, counted separately
	 * for the template and for the source arrays a single path fans out over.
	 * Deeper input raises {@link DepthExceededException} rather than exhausting the stack.
	 * <p>
	 * Templates are usually authored by hand and rarely nest more than a dozen levels,
	 * so the default is generous.
	 */
	@Default int maxDepth = 256;

	/**
	 * @see MissingFieldMode
	 */
	@Default MissingFieldMode missingFieldMode = MissingFieldMode.FAIL;

	public enum MissingFieldMode {
		/**
		 * A path naming an absent field throws {@link MissingFieldException}.
		 */
		FAIL,

		/**
		 * A path naming an absent field produces {@code null}.
		 * <p>
		 * This only matters outside arrays: under an array,
		 * an element lacking the field contributes nothing in either mode.
		 */
		NULL,
	}

	public void validate() {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
		}
		requireNonNull(missingFieldMode, "missingFieldMode");
	}

	public static ReshapeSettings defaults() {
		return DEFAULTS;
	}

	private static final ReshapeSettings DEFAULTS = ReshapeSettings.builder().build();
}
