package umms.wgcna.trait;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Gene significance (GS): correlation of each gene with one trait column, with p-values.
 */
public class GeneSignificance {

	private final String trait;
	private final List<String> genes;
	private final Map<String, Integer> geneIndex;
	private final double[] gs;
	private final double[] pValues;

	public GeneSignificance(String trait, List<String> genes, double[] gs, double[] pValues) {
		if(genes.size() != gs.length || gs.length != pValues.length) {
			throw new IllegalArgumentException("Got " + genes.size() + " genes for " + gs.length + " significance values");
		}
		this.trait = trait;
		this.genes = genes;
		this.geneIndex = new HashMap<String, Integer>(genes.size() * 2);
		for(int i = 0; i < genes.size(); i++) {
			geneIndex.put(genes.get(i), i);
		}
		this.gs = gs;
		this.pValues = pValues;
	}

	public String getTrait() {
		return trait;
	}

	public List<String> getGenes() {
		return genes;
	}

	public double getGS(String gene) {
		return gs[indexOf(gene)];
	}

	public double getPValue(String gene) {
		return pValues[indexOf(gene)];
	}

	public double getGS(int geneIdx) {
		return gs[geneIdx];
	}

	public double getPValue(int geneIdx) {
		return pValues[geneIdx];
	}

	private int indexOf(String gene) {
		Integer idx = geneIndex.get(gene);
		if(idx == null) {
			throw new IllegalArgumentException("No gene significance for " + gene);
		}
		return idx;
	}
}
