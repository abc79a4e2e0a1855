package solclar.model.clarity;

import solclar.Unreachable;
import solclar.formatters.ClarityExpressionFormattingVisitor;
import solclar.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;

public abstract class ClarityExpression extends ClarityNode {

	public abstract <T, E extends Throwable> T accept(ClarityExpressionVisitor<T, E> v) throws E;

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			accept(new ClarityExpressionFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

}
