package notasyn.model.notation;

public enum NotationUse {
	PARSING_AND_PRINTING,
	ONLY_PARSING,
	ONLY_PRINTING;

	public boolean isParsing() {
		return this != ONLY_PRINTING;
	}

	public boolean isPrinting() {
		return this != ONLY_PARSING;
	}
}
