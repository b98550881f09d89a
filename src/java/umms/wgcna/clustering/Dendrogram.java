package umms.wgcna.clustering;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Binary merge tree over a set of labelled leaves. Merges are kept in order of
 * non-decreasing height.
 */
public class Dendrogram {

	private final Cluster root;
	private final List<String> labels;
	private final List<Cluster> merges;

	public Dendrogram(Cluster root, List<String> labels, List<Cluster> merges) {
		this.root = root;
		this.labels = new ArrayList<String>(labels);
		this.merges = new ArrayList<Cluster>(merges);
	}

	public Cluster getRoot() {
		return root;
	}

	public List<String> getLabels() {
		return Collections.unmodifiableList(labels);
	}

	public int size() {
		return labels.size();
	}

	public List<Cluster> getMerges() {
		return Collections.unmodifiableList(merges);
	}

	public double[] getHeights() {
		double[] rtrn = new double[merges.size()];
		for(int i = 0; i < rtrn.length; i++) {
			rtrn[i] = merges.get(i).getScore();
		}
		return rtrn;
	}

	public double getMaxHeight() {
		return root == null || root.isLeaf() ? 0 : root.getScore();
	}

	/**
	 * Leaf indices in display order.
	 */
	public List<Integer> getOrder() {
		return root == null ? new ArrayList<Integer>() : root.getMembers();
	}

	public List<String> getOrderedLabels() {
		List<String> rtrn = new ArrayList<String>(labels.size());
		for(int idx : getOrder()) {
			rtrn.add(labels.get(idx));
		}
		return rtrn;
	}

	/**
	 * Writes the merge table: one line per merge with both children and the height.
	 * Leaves are written as their label, merge nodes as "step:N".
	 */
	public void write(String fileName) throws IOException {
		BufferedWriter bw = new BufferedWriter(new FileWriter(fileName));
		try {
			bw.write("step\tchild1\tchild2\theight\tsize");
			bw.newLine();
			for(Cluster merge : merges) {
				bw.write(merge.getStep() + "\t" + name(merge.getSubcluster1()) + "\t" + name(merge.getSubcluster2()) + "\t" + merge.getScore() + "\t" + merge.size());
				bw.newLine();
			}
		} finally {
			bw.close();
		}
	}

	private String name(Cluster c) {
		return c.isLeaf() ? labels.get(c.getLeaf()) : "step:" + c.getStep();
	}
}
