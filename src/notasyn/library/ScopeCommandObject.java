package notasyn.library;

import notasyn.errors.IssueContext;
import notasyn.state.GrammarState;
import notasyn.state.ScopeTable;
import notasyn.trans.passes.compat.CompatibilityCheckPass;
import notasyn.trans.passes.compat.ScopeDelimiterIssue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Declares a scope, changes its delimiting key, or binds classes to it. A command on a scope that
 * was never declared declares it, with a warning.
 */
public class ScopeCommandObject implements LibraryObject<ScopeCommandObject.Declaration> {

	private static final Logger logger = Logger.getLogger("notasyn.library");

	public enum Kind {
		DECLARE,
		ADD_DELIMITER,
		REMOVE_DELIMITER,
		BIND_CLASSES,
	}

	public static final class Declaration {
		private final boolean local;
		private final String scope;
		private final Kind kind;
		private final String delimiter;
		private final List<String> classes;

		private Declaration(boolean local, String scope, Kind kind, String delimiter, List<String> classes) {
			this.local = local;
			this.scope = scope;
			this.kind = kind;
			this.delimiter = delimiter;
			this.classes = Collections.unmodifiableList(classes);
		}

		public static Declaration declare(boolean local, String scope) {
			return new Declaration(local, scope, Kind.DECLARE, null, Collections.emptyList());
		}

		public static Declaration addDelimiter(boolean local, String scope, String key) {
			return new Declaration(local, scope, Kind.ADD_DELIMITER, key, Collections.emptyList());
		}

		public static Declaration removeDelimiter(boolean local, String scope) {
			return new Declaration(local, scope, Kind.REMOVE_DELIMITER, null, Collections.emptyList());
		}

		public static Declaration bindClasses(boolean local, String scope, List<String> classes) {
			return new Declaration(local, scope, Kind.BIND_CLASSES, null, new ArrayList<>(classes));
		}

		public boolean isLocal() {
			return local;
		}

		public String getScope() {
			return scope;
		}

		public Kind getKind() {
			return kind;
		}

		/**
		 * @return the key an {@link Kind#ADD_DELIMITER} command gives the scope
		 */
		public String getDelimiter() {
			return delimiter;
		}

		public List<String> getClasses() {
			return classes;
		}

		@Override
		public String toString() {
			switch (kind) {
				case ADD_DELIMITER:
					return scope + " with " + delimiter;
				case REMOVE_DELIMITER:
					return scope + " without key";
				case BIND_CLASSES:
					return scope + " bound to " + String.join(" ", classes);
				default:
					return scope;
			}
		}
	}

	private final GrammarState state;
	private final IssueContext ctx;

	public ScopeCommandObject(GrammarState state, IssueContext ctx) {
		this.state = state;
		this.ctx = ctx;
	}

	@Override
	public String getName() {
		return "SCOPE";
	}

	@Override
	public void declare(Declaration artifact) {
		if (artifact.getKind() == Kind.DECLARE) {
			state.getScopes().declareScope(artifact.getScope());
		} else {
			CompatibilityCheckPass.ensureScope(ctx, state.getScopes(), artifact.getScope());
		}
	}

	@Override
	public void cache(Declaration artifact) {
		// applied when opened
	}

	@Override
	public void open(int phase, Declaration artifact) {
		if (phase != 1) {
			return;
		}
		ScopeTable scopes = state.getScopes();
		String scope = artifact.getScope();
		switch (artifact.getKind()) {
			case ADD_DELIMITER:
				addDelimiter(scopes, scope, artifact.getDelimiter());
				break;
			case REMOVE_DELIMITER:
				if (scopes.removeDelimiter(scope) == null) {
					ctx.error(new ScopeDelimiterIssue(ScopeDelimiterIssue.Reason.NO_KEY, scope, null, null));
				}
				break;
			case BIND_CLASSES:
				for (String className : artifact.getClasses()) {
					scopes.bindClass(scope, className);
				}
				break;
			default:
				break;
		}
	}

	private void addDelimiter(ScopeTable scopes, String scope, String key) {
		String oldKey = scopes.getDelimiter(scope);
		if (oldKey != null && !oldKey.equals(key)) {
			ctx.warning(new ScopeDelimiterIssue(ScopeDelimiterIssue.Reason.OVERWRITTEN_KEY, scope, key, oldKey));
		}
		String oldScope = scopes.getDelimitedScope(key);
		if (oldScope != null && !oldScope.equals(scope)) {
			ctx.warning(new ScopeDelimiterIssue(ScopeDelimiterIssue.Reason.HIDDEN_BINDING, scope, key, oldScope));
		}
		logger.fine("Delimiting scope " + scope + " with " + key);
		scopes.declareDelimiter(scope, key);
	}

	@Override
	public Declaration substitute(Substitution substitution, Declaration artifact) {
		if (artifact.getKind() != Kind.BIND_CLASSES || substitution.isIdentity()) {
			return artifact;
		}
		List<String> classes = new ArrayList<>();
		for (String className : artifact.getClasses()) {
			classes.add(substitution.apply(className));
		}
		return Declaration.bindClasses(artifact.isLocal(), artifact.getScope(), classes);
	}

	@Override
	public Classification classify(Declaration artifact) {
		return artifact.isLocal() ? Classification.DISPOSE : Classification.KEEP;
	}
}
