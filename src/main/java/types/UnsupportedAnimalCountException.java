package types;

public class UnsupportedAnimalCountException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public UnsupportedAnimalCountException(int nAnimals) {
		super("Identity swap requires exactly 2 animals, session has " + nAnimals);
	}

}
