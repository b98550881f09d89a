package umms.wgcna.trait;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import umms.core.datastructures.MatrixWithHeaders;
import umms.core.math.Statistics;
import umms.wgcna.SyntheticExpression;
import umms.wgcna.correlation.CorrelationEngine;
import umms.wgcna.module.EigengeneCalculator;
import umms.wgcna.module.ModuleColors;
import umms.wgcna.module.ModuleEigengenes;

public class TraitCorrelatorTest {

	private CorrelationEngine engine;
	private ModuleEigengenes eigengenes;
	private MatrixWithHeaders traits;

	@BeforeClass
	public void setUp() {
		SyntheticExpression data = new SyntheticExpression(7, 15, new int[] {5, 5}, 0.2);
		eigengenes = new EigengeneCalculator().calculate(data.getExpression(), new int[] {1, 1, 1, 1, 1, 2, 2, 2, 2, 2}, false);
		traits = data.traits(8, 0.1);
		engine = new CorrelationEngine();
	}

	@Test
	public void testEigengeneFollowsItsTrait() {
		ModuleTraitStats stats = new TraitCorrelator(engine).correlate(eigengenes, traits);
		Assert.assertEquals(stats.getCorrelations().rowDimension(), 2);
		Assert.assertEquals(stats.getCorrelations().columnDimension(), 2);
		String me1 = ModuleColors.eigengeneName(1);
		String me2 = ModuleColors.eigengeneName(2);
		Assert.assertTrue(stats.getCorrelation(me1, "traitA") > 0.9);
		Assert.assertTrue(stats.getCorrelation(me2, "traitB") > 0.9);
		Assert.assertTrue(Math.abs(stats.getCorrelation(me1, "traitB")) < 0.5);
		Assert.assertTrue(stats.getPValue(me1, "traitA") < 1e-3);
	}

	@Test
	public void testMatchesPairwiseCorrelation() {
		ModuleTraitStats stats = new TraitCorrelator(engine).correlate(eigengenes, traits);
		String me2 = ModuleColors.eigengeneName(2);
		double r = engine.correlate(me2, eigengenes.getEigengene(2), "traitA", traits.getColumn("traitA"));
		Assert.assertEquals(stats.getCorrelation(me2, "traitA"), r, 1e-12);
		Assert.assertEquals(stats.getPValue(me2, "traitA"), Statistics.correlationPValue(r, 15), 1e-12);
	}

	@Test
	public void testMissingTraitValuesUsePairwiseObservations() {
		MatrixWithHeaders withMissing = traits.copy();
		withMissing.set("s1", "traitA", Double.NaN);
		ModuleTraitStats stats = new TraitCorrelator(engine).correlate(eigengenes, withMissing);
		double p = stats.getPValue(ModuleColors.eigengeneName(1), "traitA");
		double r = stats.getCorrelation(ModuleColors.eigengeneName(1), "traitA");
		Assert.assertEquals(p, Statistics.correlationPValue(r, 14), 1e-12);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testMisalignedSamples() {
		List<String> reversed = new ArrayList<String>(traits.getRowNames());
		Collections.reverse(reversed);
		new TraitCorrelator(engine).correlate(eigengenes, traits.submatrixByRowNames(reversed));
	}
}
