package notasyn.model.notation;

public enum Associativity {
	LEFT("left associativity"),
	RIGHT("right associativity"),
	NON("no associativity");

	private final String description;

	Associativity(String description) {
		this.description = description;
	}

	public String getDescription() {
		return description;
	}
}
