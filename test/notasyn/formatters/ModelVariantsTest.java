package notasyn.formatters;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.Test;

import notasyn.model.notation.*;
import notasyn.model.unparsing.*;
import notasyn.util.SourceLocation;

public class ModelVariantsTest {

	private static final List<NotationSymbol> SYMBOLS = Arrays.asList(
			new NotationTerminal(SourceLocation.unknown(), "+"),
			new NotationVariable(SourceLocation.unknown(), "x"),
			new NotationBreak(SourceLocation.unknown(), 2),
			new NotationRecursiveList(SourceLocation.unknown(), "x",
					Collections.singletonList(new NotationTerminal(SourceLocation.unknown(), ";"))));

	private static final List<EntryType> ENTRY_TYPES = Arrays.asList(
			new SubExpressionEntryType(NotationEntry.constr(), ProductionLevel.numeric(10), ProductionPosition.internal()),
			new IdentEntryType(),
			new NameEntryType(),
			new BinderEntryType(true),
			new PatternEntryType(true, 1),
			new GlobalReferenceEntryType(),
			new LiteralEntryType());

	private static final List<UnparsingInstruction> INSTRUCTIONS = Arrays.asList(
			new UnparsingLiteral("+"),
			UnparsingCut.breakable(1, 0),
			new UnparsingBox(UnparsingBox.Kind.HOV, 0, Collections.singletonList(new UnparsingLiteral("a"))),
			new UnparsingMetaVariable("x", PrecedenceConstraint.atMost(50)),
			new UnparsingListMetaVariable("x", PrecedenceConstraint.unconstrained(),
					Collections.singletonList(new UnparsingLiteral(";"))),
			new UnparsingBinderMetaVariable("b", false),
			new UnparsingBinderListMetaVariable("b", true, Collections.emptyList()));

	@Test
	public void everySymbolIsVisited() {
		Set<String> seen = new HashSet<>();
		for (NotationSymbol symbol : SYMBOLS) {
			seen.add(symbol.accept(new NotationSymbolVisitor<String, RuntimeException>() {
				@Override
				public String visit(NotationTerminal notationTerminal) {
					return "terminal";
				}

				@Override
				public String visit(NotationVariable notationVariable) {
					return "variable";
				}

				@Override
				public String visit(NotationBreak notationBreak) {
					return "break";
				}

				@Override
				public String visit(NotationRecursiveList notationRecursiveList) {
					return "list";
				}
			}));
			assertFalse(symbol.toString().isEmpty());
		}
		assertThat(seen.size(), is(SYMBOLS.size()));
	}

	@Test
	public void everyEntryTypeIsVisited() {
		Set<String> seen = new HashSet<>();
		Set<String> printed = new HashSet<>();
		for (EntryType type : ENTRY_TYPES) {
			seen.add(type.accept(new EntryTypeVisitor<String, RuntimeException>() {
				@Override
				public String visit(SubExpressionEntryType subExpressionEntryType) {
					return "sub";
				}

				@Override
				public String visit(IdentEntryType identEntryType) {
					return "ident";
				}

				@Override
				public String visit(NameEntryType nameEntryType) {
					return "name";
				}

				@Override
				public String visit(BinderEntryType binderEntryType) {
					return "binder";
				}

				@Override
				public String visit(PatternEntryType patternEntryType) {
					return "pattern";
				}

				@Override
				public String visit(GlobalReferenceEntryType globalReferenceEntryType) {
					return "global";
				}

				@Override
				public String visit(LiteralEntryType literalEntryType) {
					return "literal";
				}
			}));
			printed.add(type.toString());
		}
		assertThat(seen.size(), is(ENTRY_TYPES.size()));
		assertThat(printed.size(), is(ENTRY_TYPES.size()));
	}

	@Test
	public void everyInstructionIsVisited() {
		Set<String> seen = new HashSet<>();
		Set<String> printed = new HashSet<>();
		for (UnparsingInstruction instruction : INSTRUCTIONS) {
			seen.add(instruction.accept(new UnparsingInstructionVisitor<String, RuntimeException>() {
				@Override
				public String visit(UnparsingLiteral unparsingLiteral) {
					return "literal";
				}

				@Override
				public String visit(UnparsingCut unparsingCut) {
					return "cut";
				}

				@Override
				public String visit(UnparsingBox unparsingBox) {
					return "box";
				}

				@Override
				public String visit(UnparsingMetaVariable unparsingMetaVariable) {
					return "meta";
				}

				@Override
				public String visit(UnparsingListMetaVariable unparsingListMetaVariable) {
					return "list";
				}

				@Override
				public String visit(UnparsingBinderMetaVariable unparsingBinderMetaVariable) {
					return "binder";
				}

				@Override
				public String visit(UnparsingBinderListMetaVariable unparsingBinderListMetaVariable) {
					return "binders";
				}
			}));
			printed.add(instruction.toString());
		}
		assertThat(seen.size(), is(INSTRUCTIONS.size()));
		assertThat(printed.size(), is(INSTRUCTIONS.size()));
	}
}
