package notasyn.model.command;

public class DeclareCustomEntryCommand extends Command {

	private final String name;
	private final boolean local;

	public DeclareCustomEntryCommand(String name, boolean local) {
		this.name = name;
		this.local = local;
	}

	public String getName() {
		return name;
	}

	public boolean isLocal() {
		return local;
	}

	@Override
	public <T, E extends Throwable> T accept(CommandVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
