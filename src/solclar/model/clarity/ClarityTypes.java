package solclar.model.clarity;

/**
 * Clarity type names and the special values the lowering refers to.
 */
public final class ClarityTypes {
	private ClarityTypes() {}

	public static final String UINT = "uint";
	public static final String BOOL = "bool";
	public static final String PRINCIPAL = "principal";
	public static final String STRING_ASCII = "string-ascii";

	public static final String TX_SENDER = "tx-sender";
	public static final String FALSE = "false";
	public static final String TRUE = "true";
	public static final String UINT_ZERO = "u0";
	public static final String EMPTY_STRING = "\"\"";

	public static final String OWNER_FIELD = "owner";
	public static final String TOKEN_ID_FIELD = "token-id";

	/**
	 * @return the record type {@code {owner: ownerType, token-id: tokenIdType}}
	 */
	public static String compositeKey(String ownerType, String tokenIdType) {
		return "{" + OWNER_FIELD + ": " + ownerType + ", " + TOKEN_ID_FIELD + ": " + tokenIdType + "}";
	}
}
