package notasyn.model.command;

import notasyn.model.notation.Deprecation;
import notasyn.model.term.NotationTerm;

import java.util.Collections;
import java.util.List;

public class AbbreviationCommand extends Command {

	private final String name;
	private final List<String> parameters;
	private final NotationTerm body;
	private final boolean onlyParsing;
	private final Deprecation deprecation;
	private final boolean local;

	public AbbreviationCommand(String name, List<String> parameters, NotationTerm body, boolean onlyParsing,
							   Deprecation deprecation, boolean local) {
		this.name = name;
		this.parameters = Collections.unmodifiableList(parameters);
		this.body = body;
		this.onlyParsing = onlyParsing;
		this.deprecation = deprecation;
		this.local = local;
	}

	public String getName() {
		return name;
	}

	public List<String> getParameters() {
		return parameters;
	}

	public NotationTerm getBody() {
		return body;
	}

	public boolean isOnlyParsing() {
		return onlyParsing;
	}

	public Deprecation getDeprecation() {
		return deprecation;
	}

	public boolean isLocal() {
		return local;
	}

	@Override
	public <T, E extends Throwable> T accept(CommandVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
