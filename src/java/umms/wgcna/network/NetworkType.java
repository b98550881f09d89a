package umms.wgcna.network;

/**
 * How correlations are turned into connection strengths.
 */
public enum NetworkType {
	/** ((1 + r) / 2)^power, anti-correlated genes get adjacency near 0 */
	SIGNED,
	/** |r|^power */
	UNSIGNED,
	/** r^power for positive r, 0 otherwise */
	SIGNED_HYBRID;

	public double adjacency(double r, double power) {
		switch(this) {
			case SIGNED:
				return Math.pow((1 + r) / 2, power);
			case UNSIGNED:
				return Math.pow(Math.abs(r), power);
			case SIGNED_HYBRID:
				return r > 0 ? Math.pow(r, power) : 0;
			default:
				throw new IllegalStateException("Unhandled network type " + this);
		}
	}

	/**
	 * Accepts "signed", "unsigned" and "signed hybrid" (also with '_' or '-').
	 */
	public static NetworkType fromString(String name) {
		String key = name.trim().toUpperCase().replace(' ', '_').replace('-', '_');
		if("SIGNEDHYBRID".equals(key)) {
			return SIGNED_HYBRID;
		}
		try {
			return valueOf(key);
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Network type was " + name + " but it must be one of signed, unsigned or signed hybrid");
		}
	}
}
