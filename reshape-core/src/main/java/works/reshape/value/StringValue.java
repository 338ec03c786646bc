package works.reshape.value;

import static java.util.Objects.requireNonNull;

public record StringValue(String value) implements Value {
	public StringValue {
		requireNonNull(value);
	}

	@Override
	public String typeName() {
		return "string";
	}

	@Override
	public String toString() {
		return quote(value);
	}

	/**
	 * @return {@code s} as a JSON string literal, including the surrounding quotes
	 */
	static String quote(String s) {
		StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
				case '"' -> sb.append("\\\"");
				case '\\' -> sb.append("\\\\");
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				case '\b' -> sb.append("\\b");
				case '\f' -> sb.append("\\f");
				default -> {
					if (c < 0x20) {
						sb.append(String.format("\\u%04x", (int) c));
					} else {
						sb.append(c);
					}
				}
			}
		}
		return sb.append('"').toString();
	}
}
