package solclar.trans.intermediate;

import solclar.errors.Context;
import solclar.errors.ContextVisitor;

import java.nio.file.Path;

public class WhileWritingContract extends Context {

	private final String contractName;
	private final Path destination;

	public WhileWritingContract(String contractName, Path destination) {
		this.contractName = contractName;
		this.destination = destination;
	}

	public String getContractName() {
		return contractName;
	}

	public Path getDestination() {
		return destination;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}

}
