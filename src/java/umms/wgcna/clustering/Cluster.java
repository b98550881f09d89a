package umms.wgcna.clustering;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

//A node of the dendrogram: either a single gene or the merge of two clusters
public class Cluster {

	private final int leaf;
	private final Cluster subcluster1;
	private final Cluster subcluster2;
	private final double score;
	private final int size;
	private final int minLeaf;
	private final int step;

	public Cluster(int leaf) {
		this.leaf = leaf;
		this.subcluster1 = null;
		this.subcluster2 = null;
		this.score = 0;
		this.size = 1;
		this.minLeaf = leaf;
		this.step = 0;
	}

	/**
	 * Merge node. The subcluster holding the smaller gene index comes first.
	 */
	public Cluster(Cluster cluster1, Cluster cluster2, double height, int step) {
		boolean firstIsLower = cluster1.minLeaf <= cluster2.minLeaf;
		this.leaf = -1;
		this.subcluster1 = firstIsLower ? cluster1 : cluster2;
		this.subcluster2 = firstIsLower ? cluster2 : cluster1;
		this.score = height;
		this.size = cluster1.size + cluster2.size;
		this.minLeaf = Math.min(cluster1.minLeaf, cluster2.minLeaf);
		this.step = step;
	}

	public boolean isLeaf() {return leaf >= 0;}

	/**
	 * @return the gene index of a leaf, -1 for merge nodes
	 */
	public int getLeaf() {return leaf;}

	/**
	 * @return the merge height, 0 for leaves
	 */
	public double getScore() {return score;}

	public int size() {return size;}
	public int getMinLeaf() {return minLeaf;}

	/**
	 * @return 1-based merge step in order of increasing height, 0 for leaves
	 */
	public int getStep() {return step;}

	public Cluster getSubcluster1() {return subcluster1;}
	public Cluster getSubcluster2() {return subcluster2;}

	//Subcluster with smaller distance
	public Cluster getLeft() {
		if(subcluster1.getScore() <= subcluster2.getScore()){return subcluster1;}
		return subcluster2;
	}

	//Subcluster with larger distance
	public Cluster getRight() {
		if(subcluster1.getScore() <= subcluster2.getScore()){return subcluster2;}
		return subcluster1;
	}

	/**
	 * Gene indices under this node, tighter subtree first.
	 */
	public List<Integer> getMembers() {
		List<Integer> rtrn = new ArrayList<Integer>(size);
		Deque<Cluster> stack = new ArrayDeque<Cluster>();
		stack.push(this);
		while(!stack.isEmpty()) {
			Cluster c = stack.pop();
			if(c.isLeaf()) {
				rtrn.add(c.leaf);
			} else {
				stack.push(c.getRight());
				stack.push(c.getLeft());
			}
		}
		return rtrn;
	}

	/**
	 * Merge heights of all internal nodes of this subtree, this node included.
	 */
	public List<Double> getMergeHeights() {
		List<Double> rtrn = new ArrayList<Double>(Math.max(0, size - 1));
		Deque<Cluster> stack = new ArrayDeque<Cluster>();
		stack.push(this);
		while(!stack.isEmpty()) {
			Cluster c = stack.pop();
			if(!c.isLeaf()) {
				rtrn.add(c.score);
				stack.push(c.subcluster1);
				stack.push(c.subcluster2);
			}
		}
		return rtrn;
	}

	public String toString(){
		return isLeaf() ? "leaf " + leaf : "cluster of " + size + " at " + score;
	}
}
