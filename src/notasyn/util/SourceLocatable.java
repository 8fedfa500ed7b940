package notasyn.util;

/**
 * 
 * A common abstract base for anything that should be traced back to the
 * span of declaration text it was read from, so that issues can point at it.
 *
 */
public abstract class SourceLocatable {
	
	public abstract SourceLocation getLocation();

}
