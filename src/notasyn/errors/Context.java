package notasyn.errors;

/**
 * What was being done when an issue was reported, such as loading one declaration of a file.
 */
public abstract class Context {

	public abstract <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E;
}
