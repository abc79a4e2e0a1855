package solclar.formatters;

import solclar.model.clarity.*;

import java.io.IOException;
import java.util.List;

/**
 * Prints IR expressions in Clarity's prefix syntax, {@code (head arg arg ...)}.
 */
public class ClarityExpressionFormattingVisitor extends ClarityExpressionVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ClarityExpressionFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeForm(String head, List<ClarityExpression> arguments) throws IOException {
		out.write("(");
		out.write(head);
		for(ClarityExpression argument : arguments) {
			out.write(" ");
			argument.accept(this);
		}
		out.write(")");
	}

	@Override
	public Void visit(ClarityLiteral literal) throws IOException {
		out.write(literal.getValue());
		return null;
	}

	@Override
	public Void visit(ClarityVariable variable) throws IOException {
		out.write(variable.getName());
		return null;
	}

	@Override
	public Void visit(ClarityFunctionCall functionCall) throws IOException {
		writeForm(functionCall.getName(), functionCall.getArguments());
		return null;
	}

	@Override
	public Void visit(ClarityMapGet mapGet) throws IOException {
		writeForm("map-get? " + mapGet.getMapName(), mapGet.getKeys());
		return null;
	}

	@Override
	public Void visit(ClarityMapSet mapSet) throws IOException {
		out.write("(map-set ");
		out.write(mapSet.getMapName());
		for(ClarityExpression key : mapSet.getKeys()) {
			out.write(" ");
			key.accept(this);
		}
		out.write(" ");
		mapSet.getValue().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ClarityPrint print) throws IOException {
		writeForm("print", print.getArguments());
		return null;
	}
}
