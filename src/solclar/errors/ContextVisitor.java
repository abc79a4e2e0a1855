package solclar.errors;

import solclar.trans.intermediate.WhileReadingFile;
import solclar.trans.intermediate.WhileWritingContract;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileReadingFile whileReadingFile) throws E;
	public abstract T visit(WhileWritingContract whileWritingContract) throws E;

}
