package umms.wgcna.module;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Gene to module mapping, before and after merging close modules.
 * Module 0 holds the unassigned genes. Instances are immutable.
 */
public class ModuleAssignment {

	public static final int UNASSIGNED = 0;

	private final List<String> genes;
	private final Map<String, Integer> geneIndex;
	private final int[] unmergedLabels;
	private final int[] mergedLabels;
	private final Map<Integer, Integer> mergeHistory;

	/**
	 * @param mergeHistory absorbed module id to the id of the module it was merged into, in merge order
	 */
	public ModuleAssignment(List<String> genes, int[] unmergedLabels, int[] mergedLabels, Map<Integer, Integer> mergeHistory) {
		if(genes.size() != unmergedLabels.length || genes.size() != mergedLabels.length) {
			throw new IllegalArgumentException("Got " + genes.size() + " genes but " + unmergedLabels.length + " unmerged and " + mergedLabels.length + " merged labels");
		}
		for(int i = 0; i < unmergedLabels.length; i++) {
			if((unmergedLabels[i] == UNASSIGNED) != (mergedLabels[i] == UNASSIGNED)) {
				throw new IllegalArgumentException("Gene " + genes.get(i) + " changed its unassigned status while merging");
			}
		}
		this.genes = Collections.unmodifiableList(new ArrayList<String>(genes));
		this.geneIndex = new LinkedHashMap<String, Integer>(genes.size() * 2);
		for(int i = 0; i < genes.size(); i++) {
			geneIndex.put(genes.get(i), i);
		}
		this.unmergedLabels = Arrays.copyOf(unmergedLabels, unmergedLabels.length);
		this.mergedLabels = Arrays.copyOf(mergedLabels, mergedLabels.length);
		this.mergeHistory = Collections.unmodifiableMap(new LinkedHashMap<Integer, Integer>(mergeHistory));
	}

	/**
	 * Assignment straight from the tree cut, nothing merged.
	 */
	public static ModuleAssignment unmerged(List<String> genes, int[] labels) {
		return new ModuleAssignment(genes, labels, labels, new LinkedHashMap<Integer, Integer>());
	}

	public List<String> getGenes() {
		return genes;
	}

	public int size() {
		return genes.size();
	}

	public int getModule(int geneIdx) {
		return mergedLabels[geneIdx];
	}

	public int getModule(String gene) {
		return mergedLabels[indexOf(gene)];
	}

	public int getUnmergedModule(int geneIdx) {
		return unmergedLabels[geneIdx];
	}

	public int getUnmergedModule(String gene) {
		return unmergedLabels[indexOf(gene)];
	}

	public int[] getMergedLabels() {
		return Arrays.copyOf(mergedLabels, mergedLabels.length);
	}

	public int[] getUnmergedLabels() {
		return Arrays.copyOf(unmergedLabels, unmergedLabels.length);
	}

	public Map<Integer, Integer> getMergeHistory() {
		return mergeHistory;
	}

	/**
	 * @return merged module ids, ascending, without the unassigned module
	 */
	public List<Integer> getModules() {
		return distinctAssigned(mergedLabels);
	}

	public List<Integer> getUnmergedModules() {
		return distinctAssigned(unmergedLabels);
	}

	public List<Integer> getGeneIndices(int module) {
		List<Integer> rtrn = new ArrayList<Integer>();
		for(int i = 0; i < mergedLabels.length; i++) {
			if(mergedLabels[i] == module) {
				rtrn.add(i);
			}
		}
		return rtrn;
	}

	public List<String> getGenes(int module) {
		List<String> rtrn = new ArrayList<String>();
		for(int i : getGeneIndices(module)) {
			rtrn.add(genes.get(i));
		}
		return rtrn;
	}

	public int moduleSize(int module) {
		int n = 0;
		for(int label : mergedLabels) {
			if(label == module) {
				n++;
			}
		}
		return n;
	}

	public int unassignedCount() {
		return moduleSize(UNASSIGNED);
	}

	/**
	 * Follows the merge history of an unmerged module to the module it ended up in.
	 */
	public int finalModuleOf(int unmergedModule) {
		int module = unmergedModule;
		while(mergeHistory.containsKey(module)) {
			module = mergeHistory.get(module);
		}
		return module;
	}

	public String getColor(int module) {
		return ModuleColors.colorOf(module);
	}

	private int indexOf(String gene) {
		Integer idx = geneIndex.get(gene);
		if(idx == null) {
			throw new IllegalArgumentException("Gene " + gene + " is not part of the module assignment");
		}
		return idx;
	}

	private static List<Integer> distinctAssigned(int[] labels) {
		TreeSet<Integer> set = new TreeSet<Integer>();
		for(int label : labels) {
			if(label != UNASSIGNED) {
				set.add(label);
			}
		}
		return new ArrayList<Integer>(set);
	}
}
