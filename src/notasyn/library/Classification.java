package notasyn.library;

/**
 * What becomes of a library object once its declaration is over: kept in the library, so that
 * it is replayed where the library is loaded, or disposed of after the current session.
 */
public enum Classification {
	KEEP,
	DISPOSE,
}
