package umms.core.utils;

import java.util.Arrays;

import org.testng.Assert;
import org.testng.annotations.Test;

import umms.core.utils.CLUtil.ArgumentMap;

public class CLUtilTest {

	private static final String USAGE = "Usage: test -in <file>";

	@Test
	public void testKeysValuesAndFlags() {
		ArgumentMap map = CLUtil.getParameters(new String[] {"-in", "expr.txt", "-genesInRows", "-power", "8", "-cutHeight", "-0.5", "id=run1"}, USAGE);
		Assert.assertEquals(map.getMandatory("in"), "expr.txt");
		Assert.assertTrue(map.isPresent("genesInRows"));
		Assert.assertEquals(map.getInteger("power", 6), 8);
		Assert.assertEquals(map.getDouble("cutHeight", 0.995), -0.5);
		Assert.assertEquals(map.get("id", null), "run1");
		Assert.assertEquals(map.getInteger("minModuleSize", 30), 30);
		Assert.assertNull(map.get("gsTrait", null));
	}

	@Test
	public void testListsAndRanges() {
		ArgumentMap map = CLUtil.getParameters(new String[] {"-modules", "blue,turquoise", "-powers", "1-4,6,8"}, USAGE);
		Assert.assertEquals(map.getAll("modules"), Arrays.asList("blue", "turquoise"));
		Assert.assertEquals(map.getIntegerRanges("powers"), Arrays.asList(1, 2, 3, 4, 6, 8));
		Assert.assertTrue(map.getAll("missing").isEmpty());
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testMissingMandatoryArgument() {
		CLUtil.getParameters(new String[] {"-out", "x"}, USAGE).getMandatory("in");
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testFlagIsNotAValue() {
		CLUtil.getParameters(new String[] {"-in", "-out", "x"}, USAGE).getMandatory("in");
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testStrayArgument() {
		CLUtil.getParameters(new String[] {"stray"}, USAGE);
	}
}
