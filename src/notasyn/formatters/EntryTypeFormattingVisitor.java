package notasyn.formatters;

import notasyn.model.notation.*;

import java.io.IOException;

/**
 * Writes entry types the way they are declared, e.g. {@code constr at next level} or {@code closed binder}.
 */
public class EntryTypeFormattingVisitor extends EntryTypeVisitor<Void, IOException> {

	private final IndentingWriter out;

	public EntryTypeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(SubExpressionEntryType subExpressionEntryType) throws IOException {
		out.write(subExpressionEntryType.getEntry().toString());
		ProductionLevel level = subExpressionEntryType.getLevel();
		switch (level.getKind()) {
			case NUMERIC:
				out.write(" at level ");
				out.write(Integer.toString(level.getLevel()));
				break;
			case NEXT:
				out.write(" at next level");
				break;
			default:
				break;
		}
		return null;
	}

	@Override
	public Void visit(IdentEntryType identEntryType) throws IOException {
		out.write("ident");
		return null;
	}

	@Override
	public Void visit(NameEntryType nameEntryType) throws IOException {
		out.write("name");
		return null;
	}

	@Override
	public Void visit(BinderEntryType binderEntryType) throws IOException {
		out.write(binderEntryType.isOpen() ? "binder" : "closed binder");
		return null;
	}

	@Override
	public Void visit(PatternEntryType patternEntryType) throws IOException {
		out.write(patternEntryType.isStrict() ? "strict pattern" : "pattern");
		if (patternEntryType.getLevel() != null) {
			out.write(" at level ");
			out.write(patternEntryType.getLevel().toString());
		}
		return null;
	}

	@Override
	public Void visit(GlobalReferenceEntryType globalReferenceEntryType) throws IOException {
		out.write("global");
		return null;
	}

	@Override
	public Void visit(LiteralEntryType literalEntryType) throws IOException {
		out.write("bigint");
		return null;
	}
}
