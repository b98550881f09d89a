package umms.wgcna.trait;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import umms.core.datastructures.MatrixWithHeaders;
import umms.core.exception.DegenerateInputException;
import umms.wgcna.SyntheticExpression;
import umms.wgcna.correlation.CorrelationEngine;
import umms.wgcna.module.EigengeneCalculator;
import umms.wgcna.module.ModuleColors;
import umms.wgcna.module.ModuleEigengenes;

public class MembershipAnalyzerTest {

	private MatrixWithHeaders expression;
	private MatrixWithHeaders traits;
	private ModuleEigengenes eigengenes;
	private CorrelationEngine engine;

	@BeforeClass
	public void setUp() {
		SyntheticExpression data = new SyntheticExpression(11, 15, new int[] {5, 5}, 0.2);
		expression = data.getExpression();
		traits = data.traits(12, 0.1);
		eigengenes = new EigengeneCalculator().calculate(expression, new int[] {1, 1, 1, 1, 1, 2, 2, 2, 2, 2}, false);
		engine = new CorrelationEngine();
	}

	@Test
	public void testModuleMembership() {
		MembershipStats membership = new MembershipAnalyzer(engine).moduleMembership(expression, eigengenes);
		Assert.assertEquals(membership.getKME().rowDimension(), 10);
		Assert.assertEquals(membership.getKME().columnDimension(), 2);
		Assert.assertEquals(membership.getModules().size(), 2);
		Assert.assertTrue(membership.hasModule(2));
		Assert.assertFalse(membership.hasModule(3));
		for(int i = 1; i <= 5; i++) {
			Assert.assertTrue(membership.getKME("A" + i, 1) > 0.8, "A" + i);
			Assert.assertTrue(membership.getKME("B" + i, 2) > 0.8, "B" + i);
			Assert.assertTrue(Math.abs(membership.getKME("A" + i, 2)) < 0.6, "A" + i);
			Assert.assertTrue(membership.getPValue("A" + i, 1) < 0.001);
		}
	}

	@Test
	public void testKMEIsCorrelationWithEigengene() {
		MembershipStats membership = new MembershipAnalyzer(engine).moduleMembership(expression, eigengenes);
		double r = engine.correlate("B3", expression.getColumn("B3"), ModuleColors.eigengeneName(1), eigengenes.getEigengene(1));
		Assert.assertEquals(membership.getKME("B3", 1), r, 1e-12);
	}

	@Test
	public void testGeneSignificance() {
		GeneSignificance gs = new MembershipAnalyzer(engine).geneSignificance(expression, traits, "traitB");
		Assert.assertEquals(gs.getTrait(), "traitB");
		Assert.assertEquals(gs.getGenes(), expression.getColumnNames());
		for(int i = 1; i <= 5; i++) {
			Assert.assertTrue(gs.getGS("B" + i) > 0.8);
			Assert.assertTrue(Math.abs(gs.getGS("A" + i)) < 0.6);
		}
		double r = engine.correlate("A1", expression.getColumn("A1"), "traitB", traits.getColumn("traitB"));
		Assert.assertEquals(gs.getGS(0), r, 1e-12);
		Assert.assertTrue(gs.getPValue("B1") < 0.001);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testUnknownTrait() {
		new MembershipAnalyzer(engine).geneSignificance(expression, traits, "weight");
	}

	@Test(expectedExceptions = DegenerateInputException.class)
	public void testConstantTrait() {
		List<String> names = new ArrayList<String>();
		names.add("batch");
		double[][] constant = new double[1][expression.rowDimension()];
		Arrays.fill(constant[0], 2.0);
		MatrixWithHeaders batch = MatrixWithHeaders.fromColumns(constant, expression.getRowNames(), names);
		new MembershipAnalyzer(engine).geneSignificance(expression, batch, "batch");
	}
}
