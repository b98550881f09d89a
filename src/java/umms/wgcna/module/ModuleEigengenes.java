package umms.wgcna.module;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import umms.core.datastructures.MatrixWithHeaders;

/**
 * Samples x modules eigengene matrix. Columns are named ME&lt;colour&gt; and follow the
 * order of {@link #getModules()}.
 */
public class ModuleEigengenes {

	private final MatrixWithHeaders eigengenes;
	private final int[] modules;
	private final double[] varianceExplained;

	public ModuleEigengenes(MatrixWithHeaders eigengenes, int[] modules, double[] varianceExplained) {
		if(eigengenes.columnDimension() != modules.length || modules.length != varianceExplained.length) {
			throw new IllegalArgumentException("Eigengene matrix has " + eigengenes.columnDimension() + " columns for " + modules.length + " modules");
		}
		this.eigengenes = eigengenes;
		this.modules = Arrays.copyOf(modules, modules.length);
		this.varianceExplained = Arrays.copyOf(varianceExplained, varianceExplained.length);
	}

	public MatrixWithHeaders getEigengenes() {
		return eigengenes;
	}

	public List<Integer> getModules() {
		List<Integer> rtrn = new ArrayList<Integer>(modules.length);
		for(int m : modules) {
			rtrn.add(m);
		}
		return rtrn;
	}

	public int size() {
		return modules.length;
	}

	public boolean hasModule(int module) {
		return columnOf(module) >= 0;
	}

	public double[] getEigengene(int module) {
		int col = columnOf(module);
		if(col < 0) {
			throw new IllegalArgumentException("No eigengene for module " + module);
		}
		return eigengenes.getColumn(col);
	}

	/**
	 * Fraction of the module's standardised expression variance captured by its eigengene.
	 */
	public double getVarianceExplained(int module) {
		int col = columnOf(module);
		if(col < 0) {
			throw new IllegalArgumentException("No eigengene for module " + module);
		}
		return varianceExplained[col];
	}

	private int columnOf(int module) {
		for(int i = 0; i < modules.length; i++) {
			if(modules[i] == module) {
				return i;
			}
		}
		return -1;
	}
}
