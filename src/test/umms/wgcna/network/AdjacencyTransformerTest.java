package umms.wgcna.network;

import java.util.Arrays;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import umms.core.datastructures.MatrixWithHeaders;
import umms.core.exception.DegenerateInputException;

public class AdjacencyTransformerTest {

	@Test(dataProvider = "adjacencies")
	public void testAdjacency(final NetworkType type, final double power, final double r, final double expected) {
		Assert.assertEquals(new AdjacencyTransformer(type, power).adjacency(r), expected, 1e-12);
	}

	@DataProvider(name = "adjacencies")
	public Object[][] adjacencies() {
		return new Object[][] {
			new Object[] {NetworkType.SIGNED, 1d, 0d, 0.5},
			new Object[] {NetworkType.SIGNED, 2d, 0d, 0.25},
			new Object[] {NetworkType.SIGNED, 6d, -1d, 0d},
			new Object[] {NetworkType.SIGNED, 6d, 1d, 1d},
			new Object[] {NetworkType.UNSIGNED, 2d, -0.5, 0.25},
			new Object[] {NetworkType.UNSIGNED, 3d, 0.5, 0.125},
			new Object[] {NetworkType.SIGNED_HYBRID, 2d, -0.5, 0d},
			new Object[] {NetworkType.SIGNED_HYBRID, 2d, 0.5, 0.25},
		};
	}

	@Test
	public void testNetworkTypeNames() {
		Assert.assertEquals(NetworkType.fromString("signed"), NetworkType.SIGNED);
		Assert.assertEquals(NetworkType.fromString("Unsigned"), NetworkType.UNSIGNED);
		Assert.assertEquals(NetworkType.fromString("signed hybrid"), NetworkType.SIGNED_HYBRID);
		Assert.assertEquals(NetworkType.fromString("signed-hybrid"), NetworkType.SIGNED_HYBRID);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testUnknownNetworkType() {
		NetworkType.fromString("distance");
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testPowerMustBePositive() {
		new AdjacencyTransformer(NetworkType.SIGNED, 0);
	}

	@Test
	public void testTransformIsSymmetricWithZeroDiagonal() {
		List<String> genes = Arrays.asList("a", "b", "c");
		MatrixWithHeaders cor = new MatrixWithHeaders(new double[][] {{1, 0.2, -0.4}, {0.2, 1, 0.9}, {-0.4, 0.9, 1}}, genes, genes);
		MatrixWithHeaders adj = new AdjacencyTransformer(NetworkType.SIGNED, 4).transform(cor);
		for(int i = 0; i < 3; i++) {
			Assert.assertEquals(adj.get(i, i), 0d);
			for(int j = 0; j < 3; j++) {
				Assert.assertEquals(adj.get(i, j), adj.get(j, i));
				Assert.assertTrue(adj.get(i, j) >= 0 && adj.get(i, j) <= 1);
			}
		}
		Assert.assertEquals(adj.get("b", "c"), Math.pow(0.95, 4), 1e-12);
	}

	@Test
	public void testTransformRowsZeroesOwnEntry() {
		double[][] rows = {{0.5, 1, 0}, {1, -0.5, 0.2}};
		new AdjacencyTransformer(NetworkType.UNSIGNED, 1).transformRows(rows, new int[] {1, 0});
		Assert.assertEquals(rows[0], new double[] {0.5, 0, 0}, 1e-12);
		Assert.assertEquals(rows[1], new double[] {0, 0.5, 0.2}, 1e-12);
	}

	@Test(expectedExceptions = DegenerateInputException.class)
	public void testNaNCorrelation() {
		List<String> genes = Arrays.asList("a", "b");
		MatrixWithHeaders cor = new MatrixWithHeaders(new double[][] {{1, Double.NaN}, {Double.NaN, 1}}, genes, genes);
		new AdjacencyTransformer(NetworkType.SIGNED, 6).transform(cor);
	}
}
