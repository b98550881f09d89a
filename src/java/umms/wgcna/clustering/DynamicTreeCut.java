package umms.wgcna.clustering;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * Adaptive branch cut of a dendrogram into modules.
 * <p>
 * The tree is first cut at a fixed height; branches with fewer than minModuleSize leaves
 * are left unassigned (label 0). Each remaining branch is then split again at
 * mean + (top - mean) * (1 - deepSplit / 4) of its own merge heights, recursively, as long
 * as a split yields at least two branches of minModuleSize leaves. Fragments of an accepted
 * split are unassigned. Modules are labelled 1..k by decreasing size.
 */
public class DynamicTreeCut {

	static Logger logger = Logger.getLogger(DynamicTreeCut.class.getName());

	public static final int MAX_DEEP_SPLIT = 4;

	private final int minModuleSize;
	private final int deepSplit;
	private final double cutHeight;

	public DynamicTreeCut(int minModuleSize, int deepSplit, double cutHeight) {
		if(minModuleSize < 1) {
			throw new IllegalArgumentException("Minimum module size must be at least 1, got " + minModuleSize);
		}
		if(deepSplit < 0 || deepSplit > MAX_DEEP_SPLIT) {
			throw new IllegalArgumentException("deepSplit must be between 0 and " + MAX_DEEP_SPLIT + ", got " + deepSplit);
		}
		this.minModuleSize = minModuleSize;
		this.deepSplit = deepSplit;
		this.cutHeight = cutHeight;
	}

	public int getMinModuleSize() {
		return minModuleSize;
	}

	public int getDeepSplit() {
		return deepSplit;
	}

	public double getCutHeight() {
		return cutHeight;
	}

	/**
	 * @return a label per leaf, 0 for unassigned leaves
	 */
	public int[] cut(Dendrogram dendrogram) {
		int[] labels = new int[dendrogram.size()];
		if(dendrogram.getRoot() == null) {
			return labels;
		}
		double maxHeight = dendrogram.getMaxHeight();
		double staticHeight = cutHeight < maxHeight ? cutHeight : 0.99 * maxHeight;
		logger.debug("Static cut at height " + staticHeight + " (tree height " + maxHeight + ")");

		List<Cluster> modules = new ArrayList<Cluster>();
		for(Cluster branch : branchesBelow(dendrogram.getRoot(), staticHeight)) {
			if(branch.size() >= minModuleSize) {
				split(branch, modules);
			}
		}

		Collections.sort(modules, new Comparator<Cluster>() {
			public int compare(Cluster o1, Cluster o2) {
				if(o1.size() != o2.size()) {
					return Integer.compare(o2.size(), o1.size());
				}
				return Integer.compare(o1.getMinLeaf(), o2.getMinLeaf());
			}
		});
		for(int m = 0; m < modules.size(); m++) {
			for(int leaf : modules.get(m).getMembers()) {
				labels[leaf] = m + 1;
			}
		}
		logger.debug("Dynamic cut found " + modules.size() + " modules among " + labels.length + " leaves");
		return labels;
	}

	private void split(Cluster branch, List<Cluster> modules) {
		if(branch.isLeaf() || branch.size() < 2 * minModuleSize) {
			modules.add(branch);
			return;
		}
		List<Double> heights = branch.getMergeHeights();
		double mean = 0;
		for(double h : heights) {
			mean += h;
		}
		mean /= heights.size();
		double splitHeight = mean + (branch.getScore() - mean) * (1 - deepSplit / (double) MAX_DEEP_SPLIT);

		List<Cluster> qualifying = new ArrayList<Cluster>();
		for(Cluster sub : branchesBelow(branch, splitHeight)) {
			if(sub.size() >= minModuleSize) {
				qualifying.add(sub);
			}
		}
		if(qualifying.size() < 2) {
			modules.add(branch);
			return;
		}
		for(Cluster sub : qualifying) {
			split(sub, modules);
		}
	}

	/**
	 * The subtrees left after removing every merge above the given height.
	 */
	static List<Cluster> branchesBelow(Cluster top, double height) {
		List<Cluster> rtrn = new ArrayList<Cluster>();
		Deque<Cluster> stack = new ArrayDeque<Cluster>();
		stack.push(top);
		while(!stack.isEmpty()) {
			Cluster c = stack.pop();
			if(!c.isLeaf() && c.getScore() > height) {
				stack.push(c.getSubcluster2());
				stack.push(c.getSubcluster1());
			} else {
				rtrn.add(c);
			}
		}
		return rtrn;
	}
}
