package works.bosk.json4web.codec;

/**
 * Options that apply to every {@link Parser} and {@link Generator} built by a {@link Codec}.
 *
 * @param maxDepth the deepest nesting of sequences, maps, and variants that will be
 *                 decoded or encoded. Protects the call stack from adversarial input
 *                 and from cyclic object graphs.
 * @param allowTrailingCharacters if false, text after the top-level value
 *                                (other than whitespace) is an error.
 */
public record Settings(
	int maxDepth,
	boolean allowTrailingCharacters
) {
	public static final Settings DEFAULT = new Settings(128, false);

	public Settings {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
		}
	}

	public Settings withMaxDepth(int maxDepth) {
		return new Settings(maxDepth, allowTrailingCharacters);
	}

	public Settings withAllowTrailingCharacters(boolean allowTrailingCharacters) {
		return new Settings(maxDepth, allowTrailingCharacters);
	}
}
