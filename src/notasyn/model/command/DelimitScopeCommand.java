package notasyn.model.command;

/**
 * Gives a scope its delimiting key, or takes it away when the key is null.
 */
public class DelimitScopeCommand extends Command {

	private final String scope;
	private final String key;
	private final boolean local;

	public DelimitScopeCommand(String scope, String key, boolean local) {
		this.scope = scope;
		this.key = key;
		this.local = local;
	}

	public String getScope() {
		return scope;
	}

	public String getKey() {
		return key;
	}

	public boolean isLocal() {
		return local;
	}

	@Override
	public <T, E extends Throwable> T accept(CommandVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
