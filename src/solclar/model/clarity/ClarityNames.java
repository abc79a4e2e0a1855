package solclar.model.clarity;

/**
 * Identifier spelling conventions of generated Clarity code.
 */
public final class ClarityNames {
	private ClarityNames() {}

	/**
	 * Converts a camel-case identifier to kebab case, so {@code tokenApprovals} becomes {@code token-approvals}.
	 * A name made only of upper-case letters, digits and underscores (a constant-style name) is returned as is.
	 * A leading upper-case letter is lowered without a hyphen.
	 */
	public static String toKebabCase(String name) {
		boolean constantStyle = true;
		for(int i = 0; i < name.length(); ++i) {
			char c = name.charAt(i);
			if(!(Character.isUpperCase(c) || Character.isDigit(c) || c == '_')) {
				constantStyle = false;
				break;
			}
		}
		if(constantStyle) {
			return name;
		}
		StringBuilder result = new StringBuilder();
		for(int i = 0; i < name.length(); ++i) {
			char c = name.charAt(i);
			if(Character.isUpperCase(c)) {
				if(i != 0) {
					result.append('-');
				}
				result.append(Character.toLowerCase(c));
			}else {
				result.append(c);
			}
		}
		return result.toString();
	}

	public static String getterName(String name) {
		return "get-" + name;
	}
}
