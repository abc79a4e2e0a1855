package solclar.model.solidity;

import solclar.Unreachable;
import solclar.formatters.SolidityExpressionFormattingVisitor;
import solclar.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

public abstract class SolidityExpression extends SolidityNode {
	public SolidityExpression(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(SolidityExpressionVisitor<T, E> v) throws E;

	/**
	 * @return the expression printed back in Solidity syntax, with every binary operation parenthesized
	 */
	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		try {
			accept(new SolidityExpressionFormattingVisitor(w));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}
}
