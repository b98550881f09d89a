package umms.wgcna.trait;

import umms.core.datastructures.MatrixWithHeaders;

/**
 * Module x trait correlations of the eigengenes and their Student t p-values.
 * Rows are named ME&lt;colour&gt;, columns by trait.
 */
public class ModuleTraitStats {

	private final MatrixWithHeaders correlations;
	private final MatrixWithHeaders pValues;

	public ModuleTraitStats(MatrixWithHeaders correlations, MatrixWithHeaders pValues) {
		this.correlations = correlations;
		this.pValues = pValues;
	}

	public MatrixWithHeaders getCorrelations() {
		return correlations;
	}

	public MatrixWithHeaders getPValues() {
		return pValues;
	}

	public double getCorrelation(String eigengene, String trait) {
		return correlations.get(eigengene, trait);
	}

	public double getPValue(String eigengene, String trait) {
		return pValues.get(eigengene, trait);
	}
}
