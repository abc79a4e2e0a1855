package solclar.formatters;

import solclar.model.solidity.*;

import java.io.IOException;
import java.io.Writer;

public class SolidityExpressionFormattingVisitor extends SolidityExpressionVisitor<Void, IOException> {

	private final Writer out;

	public SolidityExpressionFormattingVisitor(Writer out) {
		this.out = out;
	}

	@Override
	public Void visit(SolidityLiteral literal) throws IOException {
		out.write(literal.getValue());
		return null;
	}

	@Override
	public Void visit(SolidityIdentifier identifier) throws IOException {
		out.write(identifier.getName());
		return null;
	}

	@Override
	public Void visit(SolidityBinop binop) throws IOException {
		out.write("(");
		binop.getLHS().accept(this);
		out.write(" ");
		out.write(binop.getOperator());
		out.write(" ");
		binop.getRHS().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(SolidityMapAccess mapAccess) throws IOException {
		out.write(mapAccess.getMapName());
		out.write("[");
		mapAccess.getKey().accept(this);
		out.write("]");
		return null;
	}

	@Override
	public Void visit(SolidityMemberAccess memberAccess) throws IOException {
		memberAccess.getBase().accept(this);
		out.write(".");
		out.write(memberAccess.getMember());
		return null;
	}

	@Override
	public Void visit(SolidityFunctionCall functionCall) throws IOException {
		out.write(functionCall.getName());
		out.write("(");
		FormattingTools.writeCommaSeparated(out, functionCall.getArguments(), arg -> arg.accept(this));
		out.write(")");
		return null;
	}
}
