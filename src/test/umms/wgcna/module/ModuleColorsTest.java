package umms.wgcna.module;

import org.testng.Assert;
import org.testng.annotations.Test;

public class ModuleColorsTest {

	@Test
	public void testColors() {
		Assert.assertEquals(ModuleColors.colorOf(0), "grey");
		Assert.assertEquals(ModuleColors.colorOf(1), "turquoise");
		Assert.assertEquals(ModuleColors.colorOf(2), "blue");
		Assert.assertEquals(ModuleColors.colorOf(3), "brown");
		Assert.assertEquals(ModuleColors.colorOf(100), "module100");
		Assert.assertEquals(ModuleColors.eigengeneName(2), "MEblue");
	}

	@Test
	public void testIdOf() {
		Assert.assertEquals(ModuleColors.idOf("blue"), 2);
		Assert.assertEquals(ModuleColors.idOf("MEturquoise"), 1);
		Assert.assertEquals(ModuleColors.idOf("grey"), 0);
		Assert.assertEquals(ModuleColors.idOf("module100"), 100);
		Assert.assertEquals(ModuleColors.idOf("7"), 7);
		Assert.assertEquals(ModuleColors.idOf("Blue "), 2);
		Assert.assertEquals(ModuleColors.idOf("chartreuse"), -1);
		Assert.assertEquals(ModuleColors.idOf("-3"), -1);
	}

	@Test
	public void testRoundTripThroughColor() {
		for(int id = 0; id < 60; id++) {
			Assert.assertEquals(ModuleColors.idOf(ModuleColors.colorOf(id)), id);
		}
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testNegativeId() {
		ModuleColors.colorOf(-1);
	}
}
