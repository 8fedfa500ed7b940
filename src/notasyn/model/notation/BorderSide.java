package notasyn.model.notation;

public enum BorderSide {
	LEFT,
	RIGHT,
}
