package umms.wgcna.module;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import org.apache.log4j.Logger;

import Jama.Matrix;
import Jama.SingularValueDecomposition;
import umms.core.datastructures.MatrixWithHeaders;
import umms.core.exception.DegenerateInputException;
import umms.core.math.Statistics;

/**
 * Module eigengenes: the first principal component of each module's standardised genes,
 * oriented to correlate positively with the module's average standardised expression and
 * scaled to zero mean and unit variance.
 */
public class EigengeneCalculator {

	static Logger logger = Logger.getLogger(EigengeneCalculator.class.getName());

	private static final String STAGE = "eigengene";

	public ModuleEigengenes calculate(MatrixWithHeaders expression, ModuleAssignment assignment, boolean includeUnassigned) {
		return calculate(expression, assignment.getMergedLabels(), includeUnassigned);
	}

	/**
	 * @param labels module id per expression column
	 */
	public ModuleEigengenes calculate(MatrixWithHeaders expression, int[] labels, boolean includeUnassigned) {
		if(labels.length != expression.columnDimension()) {
			throw new IllegalArgumentException("Got " + labels.length + " module labels for " + expression.columnDimension() + " genes");
		}
		double[][] columns = expression.toColumnArrays();
		List<String> genes = expression.getColumnNames();

		List<Integer> modules = new ArrayList<Integer>();
		TreeSet<Integer> distinct = new TreeSet<Integer>();
		for(int label : labels) {
			distinct.add(label);
		}
		for(int m : distinct) {
			if(m != ModuleAssignment.UNASSIGNED || includeUnassigned) {
				modules.add(m);
			}
		}

		logger.debug("Computing eigengenes of " + modules.size() + " modules over " + expression.rowDimension() + " samples");
		List<String> names = new ArrayList<String>(modules.size());
		int[] ids = new int[modules.size()];
		double[] varianceExplained = new double[modules.size()];
		double[][] values = new double[modules.size()][];
		double[] var = new double[1];
		for(int i = 0; i < modules.size(); i++) {
			int m = modules.get(i);
			ids[i] = m;
			names.add(ModuleColors.eigengeneName(m));
			values[i] = eigengene(columns, genes, members(labels, m), var);
			varianceExplained[i] = var[0];
		}
		MatrixWithHeaders matrix = MatrixWithHeaders.fromColumns(values, expression.getRowNames(), names);
		return new ModuleEigengenes(matrix, ids, varianceExplained);
	}

	static int[] members(int[] labels, int module) {
		int n = 0;
		for(int label : labels) {
			if(label == module) {
				n++;
			}
		}
		int[] rtrn = new int[n];
		int k = 0;
		for(int i = 0; i < labels.length; i++) {
			if(labels[i] == module) {
				rtrn[k++] = i;
			}
		}
		return rtrn;
	}

	/**
	 * Eigengene of the genes at the given column indices.
	 * @param varianceExplained receives the variance fraction in position 0
	 */
	public double[] eigengene(double[][] columns, List<String> genes, int[] members, double[] varianceExplained) {
		if(members.length == 0) {
			throw new IllegalArgumentException("Cannot compute the eigengene of an empty module");
		}
		int samples = columns[members[0]].length;
		double[][] x = new double[samples][members.length];
		double[] average = new double[samples];
		for(int g = 0; g < members.length; g++) {
			double[] col = columns[members[g]];
			if(!Statistics.allFinite(col)) {
				throw new DegenerateInputException(STAGE, "expression", "non-finite values for gene " + genes.get(members[g]));
			}
			double[] z = Statistics.standardize(col);
			if(z == null) {
				throw new DegenerateInputException(STAGE, "expression", "zero variance for gene " + genes.get(members[g]));
			}
			for(int s = 0; s < samples; s++) {
				x[s][g] = z[s];
				average[s] += z[s] / members.length;
			}
		}

		Matrix data = new Matrix(x, samples, members.length);
		double[] pc = new double[samples];
		double[] singular;
		if(samples >= members.length) {
			SingularValueDecomposition svd = data.svd();
			Matrix u = svd.getU();
			for(int s = 0; s < samples; s++) {
				pc[s] = u.get(s, 0);
			}
			singular = svd.getSingularValues();
		} else {
			//Jama needs rows >= columns; the left vectors of X are the right vectors of X^T
			SingularValueDecomposition svd = data.transpose().svd();
			Matrix v = svd.getV();
			for(int s = 0; s < samples; s++) {
				pc[s] = v.get(s, 0);
			}
			singular = svd.getSingularValues();
		}

		double total = 0;
		for(double sv : singular) {
			total += sv * sv;
		}
		varianceExplained[0] = total > 0 ? singular[0] * singular[0] / total : Double.NaN;

		double orientation = Statistics.pearsonCorrelation(pc, average);
		if(orientation < 0) {
			for(int s = 0; s < samples; s++) {
				pc[s] = -pc[s];
			}
		}
		double[] rtrn = Statistics.standardize(pc);
		if(rtrn == null || !Statistics.allFinite(rtrn)) {
			throw new DegenerateInputException(STAGE, "eigengene", "degenerate first principal component for a module of " + members.length + " genes starting with " + genes.get(members[0]));
		}
		return rtrn;
	}
}
