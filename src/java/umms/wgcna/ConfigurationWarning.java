package umms.wgcna;

/**
 * A non-fatal advisory produced while building the network. Warnings are collected in the
 * {@link AnalysisResult} and logged, they never stop a run.
 */
public class ConfigurationWarning {

	public enum Kind {
		/* no candidate power reaches the target scale-free fit */
		SCALE_FREE_FIT_NOT_REACHED,
		/* the configured power fits worse than the target */
		POWER_BELOW_TARGET_FIT,
		/* the configured power was not among the evaluated candidates */
		POWER_NOT_EVALUATED,
		/* every gene ended up unassigned */
		NO_MODULES_DETECTED,
		/* a module of interest has no gene passing the hub thresholds */
		NO_HUB_GENES
	}

	private final Kind kind;
	private final String message;

	public ConfigurationWarning(Kind kind, String message) {
		this.kind = kind;
		this.message = message;
	}

	public Kind getKind() {
		return kind;
	}

	public String getMessage() {
		return message;
	}

	public String toString() {
		return kind + ": " + message;
	}
}
