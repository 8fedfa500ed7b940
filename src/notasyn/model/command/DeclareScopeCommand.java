package notasyn.model.command;

public class DeclareScopeCommand extends Command {

	private final String scope;
	private final boolean local;

	public DeclareScopeCommand(String scope, boolean local) {
		this.scope = scope;
		this.local = local;
	}

	public String getScope() {
		return scope;
	}

	public boolean isLocal() {
		return local;
	}

	@Override
	public <T, E extends Throwable> T accept(CommandVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
