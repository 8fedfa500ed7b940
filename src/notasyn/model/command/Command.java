package notasyn.model.command;

/**
 * One entry of a declaration file.
 */
public abstract class Command {

	public abstract <T, E extends Throwable> T accept(CommandVisitor<T, E> v) throws E;
}
