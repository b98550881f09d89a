package umms.wgcna.clustering;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import org.apache.log4j.Logger;

import umms.core.exception.DegenerateInputException;

//Agglomerative clustering of a precomputed distance matrix.
//Uses the nearest-neighbour chain with Lance-Williams updates, valid for the reducible
//single, complete and average linkages. Ties go to the previous chain element, then the
//lowest index, so repeated runs give the same tree.
public class HierarchicalClustering {

	static Logger logger = Logger.getLogger(HierarchicalClustering.class.getName());

	private static final String STAGE = "clustering";

	String metric="average";

	public HierarchicalClustering() {
	}

	public HierarchicalClustering(String linkage) {
		setLinkage(linkage);
	}

	public void setLinkage(String linkage) throws IllegalArgumentException {
		if("complete".equalsIgnoreCase(linkage) || "single".equalsIgnoreCase(linkage) || "average".equalsIgnoreCase(linkage)) {
			this.metric = linkage.toLowerCase();
		} else {
			throw new IllegalArgumentException("linkage was " + linkage +" but it must be one of complete, single or average");
		}
	}

	public String getLinkage() {
		return metric;
	}

	/**
	 * @param distances symmetric n x n dissimilarities, not modified
	 * @param labels leaf names
	 */
	public Dendrogram cluster(double[][] distances, List<String> labels) {
		final int n = distances.length;
		if(labels.size() != n) {
			throw new IllegalArgumentException("Got " + labels.size() + " labels for a " + n + " x " + n + " distance matrix");
		}
		double[][] d = new double[n][];
		for(int i = 0; i < n; i++) {
			if(distances[i].length != n) {
				throw new IllegalArgumentException("Distance matrix is not square, row " + i + " has " + distances[i].length + " entries");
			}
			for(int j = 0; j < n; j++) {
				double v = distances[i][j];
				if(Double.isNaN(v) || Double.isInfinite(v)) {
					throw new DegenerateInputException(STAGE, "dissimilarity", "non-finite value at (" + labels.get(i) + ", " + labels.get(j) + ")");
				}
			}
			d[i] = Arrays.copyOf(distances[i], n);
		}
		if(n == 0) {
			return new Dendrogram(null, labels, new ArrayList<Cluster>());
		}

		logger.debug("Clustering " + n + " leaves with " + metric + " linkage");
		boolean[] active = new boolean[n];
		int[] size = new int[n];
		double[] height = new double[n];
		Arrays.fill(active, true);
		Arrays.fill(size, 1);

		final int[] mergeLo = new int[n - 1];
		final int[] mergeHi = new int[n - 1];
		final double[] mergeHeight = new double[n - 1];
		int[] chain = new int[n];
		int chainLength = 0;
		int step = 0;

		while(step < n - 1) {
			if(chainLength == 0) {
				chain[chainLength++] = firstActive(active);
			}
			int a;
			int b;
			while(true) {
				a = chain[chainLength - 1];
				int prev = chainLength > 1 ? chain[chainLength - 2] : -1;
				int best = prev;
				double bestDistance = prev >= 0 ? d[a][prev] : Double.POSITIVE_INFINITY;
				for(int c = 0; c < n; c++) {
					if(active[c] && c != a && d[a][c] < bestDistance) {
						bestDistance = d[a][c];
						best = c;
					}
				}
				if(best == prev) {
					b = prev;
					break;
				}
				chain[chainLength++] = best;
			}
			chainLength -= 2;

			int lo = Math.min(a, b);
			int hi = Math.max(a, b);
			//keep heights monotone under rounding
			double h = Math.max(d[a][b], Math.max(height[lo], height[hi]));
			mergeLo[step] = lo;
			mergeHi[step] = hi;
			mergeHeight[step] = h;
			step++;

			for(int c = 0; c < n; c++) {
				if(active[c] && c != lo && c != hi) {
					double updated = update(d[lo][c], d[hi][c], size[lo], size[hi]);
					d[lo][c] = updated;
					d[c][lo] = updated;
				}
			}
			size[lo] += size[hi];
			height[lo] = h;
			active[hi] = false;
		}

		return buildTree(n, mergeLo, mergeHi, mergeHeight, labels);
	}

	private double update(double dik, double djk, int ni, int nj) {
		if("single".equals(metric)) {
			return Math.min(dik, djk);
		} else if("complete".equals(metric)) {
			return Math.max(dik, djk);
		}
		return (ni * dik + nj * djk) / (double) (ni + nj);
	}

	private static int firstActive(boolean[] active) {
		for(int i = 0; i < active.length; i++) {
			if(active[i]) {
				return i;
			}
		}
		throw new IllegalStateException("No active cluster left");
	}

	/*
	 * The chain finds merges out of height order. Sorting them (stable) and replaying them
	 * with union-find over leaf representatives gives the same tree in height order; the
	 * slot a merged cluster lives in is always one of its own leaves.
	 */
	private static Dendrogram buildTree(int n, final int[] mergeLo, final int[] mergeHi, final double[] mergeHeight, List<String> labels) {
		Integer[] order = new Integer[n - 1];
		for(int i = 0; i < order.length; i++) {
			order[i] = i;
		}
		Arrays.sort(order, new Comparator<Integer>() {
			public int compare(Integer o1, Integer o2) {
				return Double.compare(mergeHeight[o1], mergeHeight[o2]);
			}
		});

		int[] parent = new int[n];
		Cluster[] clusterOf = new Cluster[n];
		for(int i = 0; i < n; i++) {
			parent[i] = i;
			clusterOf[i] = new Cluster(i);
		}
		List<Cluster> merges = new ArrayList<Cluster>(n - 1);
		for(int s = 0; s < order.length; s++) {
			int m = order[s];
			int ra = find(parent, mergeLo[m]);
			int rb = find(parent, mergeHi[m]);
			Cluster merged = new Cluster(clusterOf[ra], clusterOf[rb], mergeHeight[m], s + 1);
			parent[rb] = ra;
			clusterOf[ra] = merged;
			clusterOf[rb] = null;
			merges.add(merged);
		}
		Cluster root = clusterOf[find(parent, 0)];
		return new Dendrogram(root, labels, merges);
	}

	private static int find(int[] parent, int i) {
		int root = i;
		while(parent[root] != root) {
			root = parent[root];
		}
		while(parent[i] != root) {
			int next = parent[i];
			parent[i] = root;
			i = next;
		}
		return root;
	}
}
