package solclar.formatters;

import solclar.errors.ContextVisitor;
import solclar.trans.intermediate.WhileReadingFile;
import solclar.trans.intermediate.WhileWritingContract;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileReadingFile whileReadingFile) throws IOException {
		out.write("while reading file ");
		out.write(whileReadingFile.getFile().toString());
		return null;
	}

	@Override
	public Void visit(WhileWritingContract whileWritingContract) throws IOException {
		out.write("while writing contract ");
		out.write(whileWritingContract.getContractName());
		out.write(" to ");
		out.write(whileWritingContract.getDestination().toString());
		return null;
	}

}
