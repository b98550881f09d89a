package umms.core.exception;

/**
 * Zero-variance columns or non-finite values reaching a stage that cannot handle them.
 * The stage and the matrix are part of the message.
 */
public class DegenerateInputException extends CoexpressionException {

	private static final long serialVersionUID = 2290017746519034L;

	private final String stage;
	private final String matrix;

	public DegenerateInputException(String stage, String matrix, String message) {
		super("[" + stage + "] " + matrix + ": " + message);
		this.stage = stage;
		this.matrix = matrix;
	}

	public String getStage() {
		return stage;
	}

	public String getMatrix() {
		return matrix;
	}
}
