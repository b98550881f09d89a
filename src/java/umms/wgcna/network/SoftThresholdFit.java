package umms.wgcna.network;

/**
 * Scale-free topology fit and connectivity summary of the network built with one power.
 */
public class SoftThresholdFit {

	private final int power;
	private final double scaleFreeRSquared;
	private final double slope;
	private final double truncatedRSquared;
	private final double meanConnectivity;
	private final double medianConnectivity;
	private final double maxConnectivity;

	public SoftThresholdFit(int power, double scaleFreeRSquared, double slope, double truncatedRSquared,
			double meanConnectivity, double medianConnectivity, double maxConnectivity) {
		this.power = power;
		this.scaleFreeRSquared = scaleFreeRSquared;
		this.slope = slope;
		this.truncatedRSquared = truncatedRSquared;
		this.meanConnectivity = meanConnectivity;
		this.medianConnectivity = medianConnectivity;
		this.maxConnectivity = maxConnectivity;
	}

	public int getPower() {
		return power;
	}

	/**
	 * Signed fit index, -sign(slope) * R^2 of log10 p(k) against log10 k.
	 * Positive only for the decreasing degree distributions of scale-free networks.
	 */
	public double getScaleFreeRSquared() {
		return scaleFreeRSquared;
	}

	public double getSlope() {
		return slope;
	}

	/**
	 * Adjusted R^2 of the truncated exponential model log10 p(k) ~ log10 k + k.
	 */
	public double getTruncatedRSquared() {
		return truncatedRSquared;
	}

	public double getMeanConnectivity() {
		return meanConnectivity;
	}

	public double getMedianConnectivity() {
		return medianConnectivity;
	}

	public double getMaxConnectivity() {
		return maxConnectivity;
	}

	public String toString() {
		return power + "\t" + scaleFreeRSquared + "\t" + slope + "\t" + truncatedRSquared + "\t" +
				meanConnectivity + "\t" + medianConnectivity + "\t" + maxConnectivity;
	}
}
