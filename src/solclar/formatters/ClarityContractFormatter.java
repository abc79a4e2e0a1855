package solclar.formatters;

import solclar.model.clarity.*;

import java.io.IOException;
import java.util.List;

/**
 * Writes a whole {@link ClarityContract} as Clarity source. Sections always come in the same order: header,
 * constants, maps with their getters, mutable data variables, getters of public variables, event documentation
 * and finally functions.
 */
public class ClarityContractFormatter {

	private final IndentingWriter out;

	public ClarityContractFormatter(IndentingWriter out) {
		this.out = out;
	}

	public void format(ClarityContract contract) throws IOException {
		writeHeader(contract);
		for(ClarityDataVar dataVar : contract.getDataVars()) {
			if(dataVar.isConstant()) {
				writeConstant(dataVar);
			}
		}
		out.newLine();
		for(ClarityMap map : contract.getMaps()) {
			writeMap(map);
		}
		for(ClarityDataVar dataVar : contract.getDataVars()) {
			if(!dataVar.isConstant()) {
				writeDataVar(dataVar);
			}
		}
		for(ClarityDataVar dataVar : contract.getDataVars()) {
			if(!dataVar.isConstant() && dataVar.isPublic()) {
				writeGetter(dataVar);
			}
		}
		out.newLine();
		for(ClarityEvent event : contract.getEvents()) {
			writeEvent(event);
		}
		for(ClarityFunction function : contract.getFunctions()) {
			writeFunction(function);
			out.newLine();
		}
	}

	private void writeComment(String text) throws IOException {
		out.write(";; ");
		out.write(text);
		out.newLine();
	}

	private void writeHeader(ClarityContract contract) throws IOException {
		writeComment("Contract: " + contract.getName());
		writeComment("Auto-generated Clarity contract from Solidity source");
		out.newLine();
	}

	private void writeConstant(ClarityDataVar constant) throws IOException {
		writeComment("@desc Constant value for " + constant.getName());
		out.write("(define-constant " + constant.getName() + " " + constant.getInitialValue() + ")");
		out.newLine();
	}

	private void writeMap(ClarityMap map) throws IOException {
		String mapName = ClarityNames.toKebabCase(map.getName());
		writeComment("@desc Map storing " + map.getName() + " values");
		out.write("(define-map " + mapName + " " + map.getKeyType() + " " + map.getValueType() + ")");
		out.newLine();
		writeComment("@desc Getter for map " + map.getName());
		out.write("(define-read-only (" + ClarityNames.getterName(mapName) + " (key " + map.getKeyType() + "))");
		out.newLine();
		try(IndentingWriter.Indent ignored = out.indent()) {
			out.write("(ok (map-get? " + mapName + " key)))");
			out.newLine();
		}
		out.newLine();
	}

	private void writeDataVar(ClarityDataVar dataVar) throws IOException {
		writeComment("@desc Stores the " + dataVar.getName() + " value");
		if(dataVar.isPublic()) {
			writeComment("@access public");
		}
		out.write("(define-data-var " + dataVar.getName() + " " + dataVar.getType() + " " +
				dataVar.getInitialValue() + ")");
		out.newLine();
	}

	private void writeGetter(ClarityDataVar dataVar) throws IOException {
		writeComment("@desc Getter for public variable " + dataVar.getName());
		out.write("(define-read-only (" + ClarityNames.getterName(dataVar.getName()) + ")");
		out.newLine();
		try(IndentingWriter.Indent ignored = out.indent()) {
			out.write("(ok (var-get " + dataVar.getName() + ")))");
			out.newLine();
		}
		out.newLine();
	}

	private void writeEvent(ClarityEvent event) throws IOException {
		writeComment("@desc Event: " + event.getName());
		out.write(";; @fields ");
		FormattingTools.writeCommaSeparated(out, event.getFields(), field -> {
			if(field.isIndexed()) {
				out.write("(indexed) ");
			}
			out.write(field.getName());
			out.write(": ");
			out.write(field.getType());
		});
		out.newLine();
		out.newLine();
	}

	private void writeFunction(ClarityFunction function) throws IOException {
		writeComment("Function: " + function.getName());
		if(function.isReadOnly()) {
			writeComment("@access read-only");
		}
		out.write(function.isPublic() ? "(define-public (" : "(define-private (");
		out.write(function.getName());
		for(ClarityParameter parameter : function.getParameters()) {
			out.write(" (" + parameter.getName() + " " + parameter.getType() + ")");
		}
		out.write(")");
		out.newLine();
		try(IndentingWriter.Indent ignored = out.indent()) {
			writeBody(function.getBody());
		}
		out.write(")");
		out.newLine();
	}

	private void writeBody(List<ClarityExpression> body) throws IOException {
		ClarityExpressionFormattingVisitor expressions = new ClarityExpressionFormattingVisitor(out);
		if(body.isEmpty()) {
			out.write("(ok " + ClarityTypes.TRUE + ")");
			return;
		}
		if(body.size() == 1) {
			out.write("(ok ");
			body.get(0).accept(expressions);
			out.write(")");
			return;
		}
		out.write("(begin");
		out.newLine();
		try(IndentingWriter.Indent ignored = out.indent()) {
			for(ClarityExpression expression : body.subList(0, body.size() - 1)) {
				expression.accept(expressions);
				out.newLine();
			}
			out.write("(ok ");
			body.get(body.size() - 1).accept(expressions);
			out.write("))");
		}
	}
}
