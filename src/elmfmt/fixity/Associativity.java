package elmfmt.fixity;

import java.util.Locale;

public enum Associativity {
	LEFT("left"),
	RIGHT("right"),
	NONE("non");

	private final String keyword;

	Associativity(String keyword) {
		this.keyword = keyword;
	}

	/**
	 * @return the spelling used in {@code infix} declarations
	 */
	public String getKeyword() {
		return keyword;
	}

	public static Associativity fromKeyword(String keyword) {
		String lower = keyword.toLowerCase(Locale.ROOT);
		for (Associativity a : values()) {
			if (a.keyword.equals(lower) || a.name().toLowerCase(Locale.ROOT).equals(lower)) {
				return a;
			}
		}
		throw new IllegalArgumentException("unknown associativity " + keyword);
	}
}
