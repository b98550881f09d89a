package umms.core.exception;

/**
 * Thrown when a correlation is requested for a pair of columns sharing fewer than
 * three complete observations.
 */
public class InsufficientSamplesException extends CoexpressionException {

	private static final long serialVersionUID = 7731249095661823L;

	private final String column1;
	private final String column2;
	private final int observations;

	public InsufficientSamplesException(String column1, String column2, int observations) {
		super("Only " + observations + " complete observations for (" + column1 + ", " + column2 + "), at least 3 are needed");
		this.column1 = column1;
		this.column2 = column2;
		this.observations = observations;
	}

	public String getColumn1() {
		return column1;
	}

	public String getColumn2() {
		return column2;
	}

	public int getObservations() {
		return observations;
	}
}
