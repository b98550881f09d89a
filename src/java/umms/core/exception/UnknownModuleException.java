package umms.core.exception;

/**
 * Requested module label resolves to no genes, usually a typo or a module absorbed while merging.
 */
public class UnknownModuleException extends CoexpressionException {

	private static final long serialVersionUID = 5560021734409281L;

	private final String label;

	public UnknownModuleException(String label) {
		super("Module " + label + " has no genes after detection and merging");
		this.label = label;
	}

	public String getLabel() {
		return label;
	}
}
