package umms.wgcna.hub;

/**
 * A module member passing the membership thresholds, with its statistics against its own module.
 */
public class HubGene {

	private final String gene;
	private final int module;
	private final double kME;
	private final double kMEPValue;
	private final double gs;
	private final double gsPValue;

	public HubGene(String gene, int module, double kME, double kMEPValue, double gs, double gsPValue) {
		this.gene = gene;
		this.module = module;
		this.kME = kME;
		this.kMEPValue = kMEPValue;
		this.gs = gs;
		this.gsPValue = gsPValue;
	}

	public String getGene() {
		return gene;
	}

	public int getModule() {
		return module;
	}

	public double getKME() {
		return kME;
	}

	public double getKMEPValue() {
		return kMEPValue;
	}

	public double getGS() {
		return gs;
	}

	public double getGSPValue() {
		return gsPValue;
	}

	public String toString() {
		return gene + "\t" + module + "\t" + kME + "\t" + kMEPValue + "\t" + gs + "\t" + gsPValue;
	}
}
