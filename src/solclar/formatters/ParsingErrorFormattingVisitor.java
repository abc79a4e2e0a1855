package solclar.formatters;

import solclar.parser.*;

import java.io.IOException;

public class ParsingErrorFormattingVisitor extends ParsingErrorVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ParsingErrorFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void write(String kind, ParsingError error) throws IOException {
		out.write(kind);
		out.write(": ");
		out.write(error.getDescription());
		out.write(" ");
		error.getLocation().writePretty(out);
	}

	@Override
	public Void visit(SyntaxError syntaxError) throws IOException {
		write("syntax error", syntaxError);
		return null;
	}

	@Override
	public Void visit(EmptySourceError emptySourceError) throws IOException {
		write("empty source", emptySourceError);
		return null;
	}

	@Override
	public Void visit(MissingNameError missingNameError) throws IOException {
		write("missing name", missingNameError);
		return null;
	}

	@Override
	public Void visit(InvalidAssignmentTargetError invalidAssignmentTargetError) throws IOException {
		write("invalid assignment target", invalidAssignmentTargetError);
		return null;
	}

	@Override
	public Void visit(MissingSubexpressionError missingSubexpressionError) throws IOException {
		write("missing subexpression", missingSubexpressionError);
		return null;
	}
}
