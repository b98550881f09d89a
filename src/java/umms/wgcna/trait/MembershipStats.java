package umms.wgcna.trait;

import java.util.List;

import umms.core.datastructures.MatrixWithHeaders;
import umms.wgcna.module.ModuleColors;
import umms.wgcna.module.ModuleEigengenes;

/**
 * Module membership (kME): correlation of every gene with every module eigengene, whatever
 * module the gene was assigned to. Genes are rows, eigengenes (ME&lt;colour&gt;) columns.
 */
public class MembershipStats {

	private final MatrixWithHeaders kME;
	private final MatrixWithHeaders pValues;
	private final List<Integer> modules;

	public MembershipStats(MatrixWithHeaders kME, MatrixWithHeaders pValues, ModuleEigengenes eigengenes) {
		this.kME = kME;
		this.pValues = pValues;
		this.modules = eigengenes.getModules();
	}

	public MatrixWithHeaders getKME() {
		return kME;
	}

	public MatrixWithHeaders getPValues() {
		return pValues;
	}

	/**
	 * Module ids in column order.
	 */
	public List<Integer> getModules() {
		return modules;
	}

	public boolean hasModule(int module) {
		return modules.contains(module);
	}

	public double getKME(String gene, int module) {
		return kME.get(gene, ModuleColors.eigengeneName(module));
	}

	public double getPValue(String gene, int module) {
		return pValues.get(gene, ModuleColors.eigengeneName(module));
	}
}
