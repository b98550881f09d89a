package umms.wgcna.module;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import org.apache.log4j.Logger;

import umms.core.datastructures.MatrixWithHeaders;
import umms.core.exception.DegenerateInputException;
import umms.wgcna.ConfigurationWarning;
import umms.wgcna.clustering.Dendrogram;
import umms.wgcna.clustering.DynamicTreeCut;
import umms.wgcna.clustering.HierarchicalClustering;
import umms.wgcna.correlation.CorrelationFunction;
import umms.wgcna.correlation.PearsonCorrelation;
import umms.wgcna.network.TOMComputer;

/**
 * Turns a topological overlap matrix into modules: clusters 1 - TOM, cuts the tree with
 * {@link DynamicTreeCut} and merges modules whose eigengenes are highly correlated.
 */
public class ModuleDetector {

	static Logger logger = Logger.getLogger(ModuleDetector.class.getName());

	public static final double DEFAULT_MERGE_CUT_HEIGHT = 0.25;

	private final HierarchicalClustering clustering;
	private final DynamicTreeCut treeCut;
	private final EigengeneCalculator eigengenes;
	private final CorrelationFunction correlation;
	private final double mergeCutHeight;

	/**
	 * @param correlation compares eigengenes when merging, normally the function the network was built with
	 */
	public ModuleDetector(HierarchicalClustering clustering, DynamicTreeCut treeCut, EigengeneCalculator eigengenes,
			CorrelationFunction correlation, double mergeCutHeight) {
		if(mergeCutHeight < 0 || mergeCutHeight > 2) {
			throw new IllegalArgumentException("Merge cut height must lie in [0,2], got " + mergeCutHeight);
		}
		this.clustering = clustering;
		this.treeCut = treeCut;
		this.eigengenes = eigengenes;
		this.correlation = correlation;
		this.mergeCutHeight = mergeCutHeight;
	}

	public ModuleDetector(int minModuleSize, int deepSplit, double cutHeight, double mergeCutHeight) {
		this(new HierarchicalClustering(), new DynamicTreeCut(minModuleSize, deepSplit, cutHeight), new EigengeneCalculator(), new PearsonCorrelation(), mergeCutHeight);
	}

	public HierarchicalClustering getClustering() {
		return clustering;
	}

	public DynamicTreeCut getTreeCut() {
		return treeCut;
	}

	public EigengeneCalculator getEigengeneCalculator() {
		return eigengenes;
	}

	public CorrelationFunction getCorrelation() {
		return correlation;
	}

	public double getMergeCutHeight() {
		return mergeCutHeight;
	}

	/**
	 * Clusters the genes on 1 - TOM.
	 */
	public Dendrogram cluster(double[][] tom, List<String> genes) {
		return clustering.cluster(TOMComputer.dissimilarity(tom), genes);
	}

	public int[] cutModules(Dendrogram dendrogram) {
		return treeCut.cut(dendrogram);
	}

	/**
	 * Single block detection on a full genes x genes TOM.
	 * @param expression samples x genes, columns in the same order as the TOM
	 */
	public ModuleDetectionResult detect(MatrixWithHeaders tom, MatrixWithHeaders expression) {
		if(!tom.getColumnNames().equals(expression.getColumnNames()) || !tom.getRowNames().equals(tom.getColumnNames())) {
			throw new IllegalArgumentException("TOM rows and columns must match the expression gene columns");
		}
		List<String> genes = expression.getColumnNames();
		Dendrogram dendrogram = cluster(tom.getData().getArray(), genes);
		int[] labels = cutModules(dendrogram);
		logger.info("Dynamic tree cut found " + countModules(labels) + " modules among " + genes.size() + " genes");

		ModuleAssignment assignment = mergeCloseModules(expression, labels);
		ModuleEigengenes me = eigengenes.calculate(expression, assignment, false);

		List<Dendrogram> dendrograms = new ArrayList<Dendrogram>();
		dendrograms.add(dendrogram);
		int[] all = new int[genes.size()];
		for(int i = 0; i < all.length; i++) {
			all[i] = i;
		}
		List<int[]> blocks = new ArrayList<int[]>();
		blocks.add(all);
		return new ModuleDetectionResult(dendrograms, blocks, assignment, me, warnings(assignment));
	}

	/**
	 * Repeatedly merges the pair of modules with the most correlated eigengenes while their
	 * dissimilarity 1 - cor is at most the merge cut height. Eigengenes are compared with
	 * the detector's correlation function. The merged module keeps the id
	 * of its larger constituent, the smaller id on equal sizes.
	 * @param unmergedLabels module id per expression column, 0 for unassigned genes
	 */
	public ModuleAssignment mergeCloseModules(MatrixWithHeaders expression, int[] unmergedLabels) {
		List<String> genes = expression.getColumnNames();
		int[] labels = unmergedLabels.clone();
		Map<Integer, Integer> history = new LinkedHashMap<Integer, Integer>();

		double[][] columns = expression.toColumnArrays();
		TreeMap<Integer, double[]> current = new TreeMap<Integer, double[]>();
		double[] var = new double[1];
		for(int module : ModuleAssignment.unmerged(genes, labels).getModules()) {
			current.put(module, eigengenes.eigengene(columns, genes, EigengeneCalculator.members(labels, module), var));
		}

		while(current.size() > 1) {
			int bestA = -1;
			int bestB = -1;
			double best = Double.POSITIVE_INFINITY;
			List<Integer> ids = new ArrayList<Integer>(current.keySet());
			for(int i = 0; i < ids.size(); i++) {
				double[] ei = current.get(ids.get(i));
				for(int j = i + 1; j < ids.size(); j++) {
					double r = correlation.measure(ei, current.get(ids.get(j)));
					if(Double.isNaN(r)) {
						throw new DegenerateInputException("merge", "eigengenes", "undefined correlation between modules " + ids.get(i) + " and " + ids.get(j));
					}
					double d = 1 - r;
					if(d < best) {
						best = d;
						bestA = ids.get(i);
						bestB = ids.get(j);
					}
				}
			}
			if(best > mergeCutHeight) {
				break;
			}

			int sizeA = count(labels, bestA);
			int sizeB = count(labels, bestB);
			int target = sizeA > sizeB || (sizeA == sizeB && bestA < bestB) ? bestA : bestB;
			int absorbed = target == bestA ? bestB : bestA;
			for(int g = 0; g < labels.length; g++) {
				if(labels[g] == absorbed) {
					labels[g] = target;
				}
			}
			history.put(absorbed, target);
			current.remove(absorbed);
			current.put(target, eigengenes.eigengene(columns, genes, EigengeneCalculator.members(labels, target), var));
			logger.info("Merged module " + ModuleColors.colorOf(absorbed) + " (" + absorbed + ") into " + ModuleColors.colorOf(target)
					+ " (" + target + "), eigengene dissimilarity " + best);
		}

		logger.info(history.size() + " merges left " + current.size() + " modules");
		return new ModuleAssignment(genes, unmergedLabels, labels, history);
	}

	/**
	 * Advisories for an assignment: nothing detected, or too few genes to form a module.
	 */
	List<ConfigurationWarning> warnings(ModuleAssignment assignment) {
		List<ConfigurationWarning> rtrn = new ArrayList<ConfigurationWarning>();
		if(assignment.getModules().isEmpty()) {
			String reason = assignment.size() < treeCut.getMinModuleSize()
					? assignment.size() + " genes is fewer than the minimum module size " + treeCut.getMinModuleSize()
					: "no branch of at least " + treeCut.getMinModuleSize() + " genes below the cut height";
			rtrn.add(new ConfigurationWarning(ConfigurationWarning.Kind.NO_MODULES_DETECTED, "All genes unassigned: " + reason));
		}
		return rtrn;
	}

	static int countModules(int[] labels) {
		TreeSet<Integer> modules = new TreeSet<Integer>();
		for(int label : labels) {
			if(label != ModuleAssignment.UNASSIGNED) {
				modules.add(label);
			}
		}
		return modules.size();
	}

	private static int count(int[] labels, int module) {
		int n = 0;
		for(int label : labels) {
			if(label == module) {
				n++;
			}
		}
		return n;
	}
}
