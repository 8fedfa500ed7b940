package notasyn.state;

public class StateProtection implements AutoCloseable {

	private final GrammarState state;
	private final GrammarState.Snapshot snapshot;
	private boolean committed;

	StateProtection(GrammarState state, GrammarState.Snapshot snapshot) {
		this.state = state;
		this.snapshot = snapshot;
		this.committed = false;
	}

	public void commit() {
		committed = true;
	}

	public boolean isCommitted() {
		return committed;
	}

	@Override
	public void close() {
		if (!committed) {
			state.restore(snapshot);
		}
	}
}
