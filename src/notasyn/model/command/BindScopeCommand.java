package notasyn.model.command;

import java.util.Collections;
import java.util.List;

public class BindScopeCommand extends Command {

	private final String scope;
	private final List<String> classes;
	private final boolean local;

	public BindScopeCommand(String scope, List<String> classes, boolean local) {
		this.scope = scope;
		this.classes = Collections.unmodifiableList(classes);
		this.local = local;
	}

	public String getScope() {
		return scope;
	}

	public List<String> getClasses() {
		return classes;
	}

	public boolean isLocal() {
		return local;
	}

	@Override
	public <T, E extends Throwable> T accept(CommandVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
