package umms.wgcna;

import java.io.File;
import java.io.IOException;
import java.text.ParseException;

import org.testng.Assert;
import org.testng.annotations.Test;

import umms.core.utils.CLUtil;
import umms.wgcna.network.NetworkType;

public class CoexpressionNetworkTest {

	@Test
	public void testConfigure() {
		String[] args = {"-id", "brain", "-power", "8", "-powers", "1-4,6", "-networkType", "unsigned", "-minModuleSize", "12",
				"-modules", "blue,turquoise", "-kME", "0.8", "-threads", "3"};
		AnalysisConfig config = CoexpressionNetwork.configure(CLUtil.getParameters(args, CoexpressionNetwork.usage));
		Assert.assertEquals(config.getAnalysisId(), "brain");
		Assert.assertEquals(config.getPower(), 8);
		Assert.assertEquals(config.getCandidatePowers(), new int[] {1, 2, 3, 4, 6});
		Assert.assertEquals(config.getNetworkType(), NetworkType.UNSIGNED);
		Assert.assertEquals(config.getMinModuleSize(), 12);
		Assert.assertEquals(config.getModulesOfInterest().size(), 2);
		Assert.assertEquals(config.getKmeThreshold(), 0.8, 0);
		Assert.assertEquals(config.getThreads(), 3);
		Assert.assertEquals(config.getDeepSplit(), AnalysisConfig.DEFAULT_DEEP_SPLIT);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testConfigureRejectsBadValue() {
		String[] args = {"-id", "brain", "-mergeCutHeight", "3"};
		CoexpressionNetwork.configure(CLUtil.getParameters(args, CoexpressionNetwork.usage));
	}

	@Test
	public void testRunFromFiles() throws IOException, ParseException {
		SyntheticExpression data = new SyntheticExpression(41, 12, new int[] {6, 6}, 0.1);
		File dir = new File(System.getProperty("java.io.tmpdir"), "coexpression-cli-" + System.nanoTime());
		Assert.assertTrue(dir.mkdirs());
		File in = new File(dir, "expression.txt");
		data.getExpression().transpose().write(in.getAbsolutePath(), "gene");
		File traits = new File(dir, "traits.txt");
		data.traits(42, 0.1).write(traits.getAbsolutePath(), "sample");
		File out = new File(dir, "out");

		String[] args = {"-in", in.getAbsolutePath(), "-genesInRows", "-traits", traits.getAbsolutePath(), "-outdir", out.getAbsolutePath(),
				"-id", "cli", "-powers", "1-6", "-minModuleSize", "3", "-threads", "1"};
		AnalysisResult result = CoexpressionNetwork.run(args);
		Assert.assertEquals(result.getExpression().columnDimension(), 12);
		Assert.assertEquals(result.getExpression().getRowNames(), data.getExpression().getRowNames());
		Assert.assertTrue(new File(out, "cli_moduleAssignment.txt").isFile());
		Assert.assertTrue(new File(out, "cli_softThreshold.txt").isFile());
		Assert.assertEquals(result.getTraits().getColumnNames().size(), 2);
	}
}
