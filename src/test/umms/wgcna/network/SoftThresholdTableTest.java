package umms.wgcna.network;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.util.ArrayList;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.Test;

import umms.wgcna.ConfigurationWarning;

public class SoftThresholdTableTest {

	private static SoftThresholdTable table() {
		List<SoftThresholdFit> fits = new ArrayList<SoftThresholdFit>();
		fits.add(new SoftThresholdFit(3, 0.82, -1.9, 0.9, 8, 7, 15));
		fits.add(new SoftThresholdFit(1, 0.40, -0.8, 0.6, 50, 48, 70));
		fits.add(new SoftThresholdFit(2, 0.75, -1.4, 0.8, 20, 19, 35));
		return new SoftThresholdTable(fits);
	}

	@Test
	public void testSortedByPower() {
		List<SoftThresholdFit> fits = table().getFits();
		Assert.assertEquals(fits.get(0).getPower(), 1);
		Assert.assertEquals(fits.get(2).getPower(), 3);
		Assert.assertNull(table().getFit(4));
	}

	@Test
	public void testFirstPowerAboveTarget() {
		SoftThresholdTable table = table();
		Assert.assertEquals(table.firstPowerAbove(0.80), 3);
		Assert.assertEquals(table.firstPowerAbove(0.5), 2);
		Assert.assertEquals(table.firstPowerAbove(0.5, 10), 3);
		Assert.assertEquals(table.firstPowerAbove(0.82), -1);
		Assert.assertEquals(table.firstPowerAbove(0.9), -1);
	}

	@Test
	public void testPowerReachingTargetHasNoWarning() {
		Assert.assertTrue(table().checkPower(3, 0.8).isEmpty());
	}

	@Test
	public void testPowerBelowTarget() {
		List<ConfigurationWarning> warnings = table().checkPower(2, 0.8);
		Assert.assertEquals(warnings.size(), 1);
		Assert.assertEquals(warnings.get(0).getKind(), ConfigurationWarning.Kind.POWER_BELOW_TARGET_FIT);
		Assert.assertTrue(warnings.get(0).getMessage().contains("3"));
	}

	@Test
	public void testTargetNeverReached() {
		List<ConfigurationWarning> warnings = table().checkPower(3, 0.9);
		Assert.assertEquals(warnings.size(), 2);
		Assert.assertEquals(warnings.get(0).getKind(), ConfigurationWarning.Kind.SCALE_FREE_FIT_NOT_REACHED);
		Assert.assertEquals(warnings.get(1).getKind(), ConfigurationWarning.Kind.POWER_BELOW_TARGET_FIT);
	}

	@Test
	public void testPowerNotEvaluated() {
		List<ConfigurationWarning> warnings = table().checkPower(6, 0.8);
		Assert.assertEquals(warnings.size(), 1);
		Assert.assertEquals(warnings.get(0).getKind(), ConfigurationWarning.Kind.POWER_NOT_EVALUATED);
	}

	@Test
	public void testWrite() throws Exception {
		File file = File.createTempFile("softThreshold", ".txt");
		file.deleteOnExit();
		table().write(file.getAbsolutePath());
		BufferedReader br = new BufferedReader(new FileReader(file));
		try {
			Assert.assertEquals(br.readLine(), SoftThresholdTable.HEADER);
			Assert.assertTrue(br.readLine().startsWith("1\t0.4\t"));
			Assert.assertNotNull(br.readLine());
			Assert.assertNotNull(br.readLine());
			Assert.assertNull(br.readLine());
		} finally {
			br.close();
		}
	}
}
