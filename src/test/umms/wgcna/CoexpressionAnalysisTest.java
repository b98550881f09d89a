package umms.wgcna;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.Test;

import umms.core.datastructures.MatrixWithHeaders;
import umms.core.exception.DegenerateInputException;
import umms.core.exception.InsufficientSamplesException;
import umms.wgcna.hub.ModuleGeneReport;
import umms.wgcna.module.ModuleAssignment;
import umms.wgcna.module.ModuleColors;

public class CoexpressionAnalysisTest {

	private static AnalysisConfig config() {
		AnalysisConfig config = new AnalysisConfig();
		config.setAnalysisId("test");
		config.setCandidatePowers(new int[] {1, 2, 4, 6, 8});
		config.setMinModuleSize(5);
		config.setThreads(2);
		return config;
	}

	private static SyntheticExpression data() {
		return new SyntheticExpression(5, 12, new int[] {10, 10}, 0.1);
	}

	@Test
	public void testPlantedModulesAreRecovered() {
		SyntheticExpression data = data();
		AnalysisResult result = new CoexpressionAnalysis(config()).run(data.getExpression(), data.traits(6, 0.1));

		ModuleAssignment assignment = result.getModules().getAssignment();
		int a = assignment.getModule("A1");
		int b = assignment.getModule("B1");
		Assert.assertNotEquals(a, ModuleAssignment.UNASSIGNED);
		Assert.assertNotEquals(b, ModuleAssignment.UNASSIGNED);
		Assert.assertNotEquals(a, b);
		for(int i = 1; i <= 10; i++) {
			Assert.assertEquals(assignment.getModule("A" + i), a);
			Assert.assertEquals(assignment.getModule("B" + i), b);
		}

		Assert.assertEquals(result.getSoftThreshold().getFits().size(), 5);
		Assert.assertEquals(result.getModules().getEigengenes().size(), 2);
		Assert.assertTrue(result.getModuleTraitStats().getCorrelation(ModuleColors.eigengeneName(a), "traitA") > 0.9);
		Assert.assertTrue(result.getMembership().getKME("A3", a) > 0.9);
		Assert.assertEquals(result.getGeneSignificance().getTrait(), "traitA");

		List<ModuleGeneReport> reports = result.getReports();
		Assert.assertEquals(reports.size(), 2);
		for(ModuleGeneReport report : reports) {
			Assert.assertEquals(report.getAllGenes().size(), 10);
			Assert.assertEquals(report.getHubs().size(), 10);
		}
	}

	@Test
	public void testTraitsAreReorderedToExpressionSamples() {
		SyntheticExpression data = data();
		MatrixWithHeaders traits = data.traits(6, 0.1);
		List<String> reversed = new ArrayList<String>(traits.getRowNames());
		Collections.reverse(reversed);

		AnalysisConfig config = config();
		config.setGeneSignificanceTrait("traitB");
		AnalysisResult ordered = new CoexpressionAnalysis(config).run(data.getExpression(), traits);
		AnalysisResult shuffled = new CoexpressionAnalysis(config).run(data.getExpression(), traits.submatrixByRowNames(reversed));

		Assert.assertEquals(shuffled.getTraits().getRowNames(), data.getExpression().getRowNames());
		Assert.assertEquals(shuffled.getGeneSignificance().getGS("B2"), ordered.getGeneSignificance().getGS("B2"), 1e-12);
		Assert.assertEquals(shuffled.getModules().getAssignment().getMergedLabels(), ordered.getModules().getAssignment().getMergedLabels());
	}

	@Test
	public void testModulesOfInterest() {
		SyntheticExpression data = data();
		AnalysisConfig config = config();
		List<String> modules = new ArrayList<String>();
		modules.add("turquoise");
		config.setModulesOfInterest(modules);
		AnalysisResult result = new CoexpressionAnalysis(config).run(data.getExpression(), data.traits(6, 0.1));
		Assert.assertEquals(result.getReports().size(), 1);
		Assert.assertEquals(result.getReports().get(0).getName(), "test_turquoise");
	}

	@Test
	public void testPowerNotEvaluated() {
		SyntheticExpression data = data();
		AnalysisConfig config = config();
		config.setPower(12);
		AnalysisResult result = new CoexpressionAnalysis(config).run(data.getExpression(), data.traits(6, 0.1));
		boolean found = false;
		for(ConfigurationWarning warning : result.getWarnings()) {
			found |= warning.getKind() == ConfigurationWarning.Kind.POWER_NOT_EVALUATED;
		}
		Assert.assertTrue(found);
	}

	@Test
	public void testNoModulesWarning() {
		SyntheticExpression data = data();
		AnalysisConfig config = config();
		config.setMinModuleSize(30);
		AnalysisResult result = new CoexpressionAnalysis(config).run(data.getExpression(), data.traits(6, 0.1));
		Assert.assertEquals(result.getModules().getAssignment().unassignedCount(), 20);
		Assert.assertTrue(result.getReports().isEmpty());
		boolean found = false;
		for(ConfigurationWarning warning : result.getWarnings()) {
			found |= warning.getKind() == ConfigurationWarning.Kind.NO_MODULES_DETECTED;
		}
		Assert.assertTrue(found);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testMissingTraitSample() {
		SyntheticExpression data = data();
		MatrixWithHeaders traits = data.traits(6, 0.1);
		List<String> rows = traits.getRowNames();
		rows.remove("s4");
		new CoexpressionAnalysis(config()).run(data.getExpression(), traits.submatrixByRowNames(rows));
	}

	@Test(expectedExceptions = DegenerateInputException.class)
	public void testMissingExpressionValue() {
		SyntheticExpression data = data();
		MatrixWithHeaders expression = data.getExpression().copy();
		expression.set("s2", "A4", Double.NaN);
		new CoexpressionAnalysis(config()).run(expression, data.traits(6, 0.1));
	}

	@Test(expectedExceptions = DegenerateInputException.class)
	public void testConstantGene() {
		SyntheticExpression data = data();
		MatrixWithHeaders expression = data.getExpression().copy();
		double[] constant = new double[expression.rowDimension()];
		expression.setColumn(constant, "B7");
		new CoexpressionAnalysis(config()).run(expression, data.traits(6, 0.1));
	}

	@Test(expectedExceptions = InsufficientSamplesException.class)
	public void testTooFewSamples() {
		SyntheticExpression data = new SyntheticExpression(5, 2, new int[] {3}, 0.1);
		MatrixWithHeaders expression = data.getExpression();
		new CoexpressionAnalysis(config()).run(expression, expression);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testInvalidConfig() {
		AnalysisConfig config = config();
		config.setDeepSplit(7);
		new CoexpressionAnalysis(config);
	}
}
