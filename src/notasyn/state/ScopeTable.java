package notasyn.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The notation scopes declared so far, their delimiting keys, and the classes bound to them.
 */
public class ScopeTable {

	private final Set<String> scopes;
	// scope to its key
	private final Map<String, String> delimiters;
	// key to the scope it opens; a key may outlive the scope dropping it for another one
	private final Map<String, String> delimitedScopes;
	private final Map<String, String> classScopes;

	public ScopeTable() {
		this(new LinkedHashSet<>(), new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>());
	}

	private ScopeTable(Set<String> scopes, Map<String, String> delimiters, Map<String, String> delimitedScopes,
					   Map<String, String> classScopes) {
		this.scopes = scopes;
		this.delimiters = delimiters;
		this.delimitedScopes = delimitedScopes;
		this.classScopes = classScopes;
	}

	public void declareScope(String scope) {
		scopes.add(scope);
	}

	/**
	 * Declares the scope if it does not exist yet.
	 *
	 * @return whether the scope was already declared
	 */
	public boolean ensureScope(String scope) {
		return !scopes.add(scope);
	}

	public boolean isDeclared(String scope) {
		return scopes.contains(scope);
	}

	public Set<String> getScopes() {
		return Collections.unmodifiableSet(scopes);
	}

	/**
	 * @return the key delimiting the scope, or null
	 */
	public String getDelimiter(String scope) {
		return delimiters.get(scope);
	}

	/**
	 * @return the scope a key delimits, or null
	 */
	public String getDelimitedScope(String key) {
		return delimitedScopes.get(key);
	}

	public void declareDelimiter(String scope, String key) {
		delimiters.put(scope, key);
		delimitedScopes.put(key, scope);
	}

	/**
	 * @return the key the scope had, or null if it had none
	 */
	public String removeDelimiter(String scope) {
		String key = delimiters.remove(scope);
		if (key != null && scope.equals(delimitedScopes.get(key))) {
			delimitedScopes.remove(key);
		}
		return key;
	}

	/**
	 * Makes the scope the one arguments of the class are interpreted in; a class has one scope.
	 */
	public void bindClass(String scope, String className) {
		classScopes.put(className, scope);
	}

	/**
	 * @return the scope bound to the class, or null
	 */
	public String getClassScope(String className) {
		return classScopes.get(className);
	}

	public Map<String, String> getClassScopes() {
		return Collections.unmodifiableMap(classScopes);
	}

	public ScopeTable copy() {
		return new ScopeTable(new LinkedHashSet<>(scopes), new LinkedHashMap<>(delimiters),
				new LinkedHashMap<>(delimitedScopes), new LinkedHashMap<>(classScopes));
	}
}
