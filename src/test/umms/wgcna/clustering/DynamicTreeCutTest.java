package umms.wgcna.clustering;

import java.util.ArrayList;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.Test;

public class DynamicTreeCutTest {

	private static Dendrogram tree(double... points) {
		double[][] d = new double[points.length][points.length];
		List<String> labels = new ArrayList<String>();
		for(int i = 0; i < points.length; i++) {
			labels.add("x" + i);
			for(int j = 0; j < points.length; j++) {
				d[i][j] = Math.abs(points[i] - points[j]);
			}
		}
		return new HierarchicalClustering("average").cluster(d, labels);
	}

	//three points near 0, four near 10 and an outlier at 30
	private static final double[] POINTS = {0, 0.1, 0.2, 10, 10.1, 10.2, 10.3, 30};

	@Test
	public void testStaticCutLabelsBySize() {
		int[] labels = new DynamicTreeCut(3, 2, 0.995).cut(tree(POINTS));
		Assert.assertEquals(labels, new int[] {2, 2, 2, 1, 1, 1, 1, 0});
	}

	@Test
	public void testCutHeightAboveTreeSplitsBranches() {
		int[] labels = new DynamicTreeCut(3, 2, 100).cut(tree(POINTS));
		Assert.assertEquals(labels, new int[] {2, 2, 2, 1, 1, 1, 1, 0});
	}

	@Test
	public void testSmallBranchesStayUnassigned() {
		int[] labels = new DynamicTreeCut(5, 2, 0.995).cut(tree(POINTS));
		Assert.assertEquals(labels, new int[] {0, 0, 0, 0, 0, 0, 0, 0});
	}

	@Test
	public void testBranchTooSmallToSplit() {
		int[] labels = new DynamicTreeCut(5, 2, 100).cut(tree(POINTS));
		Assert.assertEquals(labels, new int[] {1, 1, 1, 1, 1, 1, 1, 0});
	}

	@Test
	public void testEqualSizesOrderedByFirstGene() {
		int[] labels = new DynamicTreeCut(3, 2, 0.995).cut(tree(10, 10.1, 10.2, 0, 0.1, 0.2));
		Assert.assertEquals(labels, new int[] {1, 1, 1, 2, 2, 2});
	}

	@Test
	public void testEmptyTree() {
		Dendrogram empty = new HierarchicalClustering().cluster(new double[0][0], new ArrayList<String>());
		Assert.assertEquals(new DynamicTreeCut(3, 2, 0.995).cut(empty).length, 0);
	}

	@Test
	public void testBranchesBelow() {
		Dendrogram tree = tree(POINTS);
		Assert.assertEquals(DynamicTreeCut.branchesBelow(tree.getRoot(), 1).size(), 3);
		Assert.assertEquals(DynamicTreeCut.branchesBelow(tree.getRoot(), 100).size(), 1);
		Assert.assertEquals(DynamicTreeCut.branchesBelow(tree.getRoot(), 0).size(), POINTS.length);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testDeepSplitRange() {
		new DynamicTreeCut(3, 5, 0.995);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testMinModuleSizeRange() {
		new DynamicTreeCut(0, 2, 0.995);
	}
}
