package umms.wgcna.network;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import umms.wgcna.ConfigurationWarning;

/**
 * Scale-free fit per candidate power, sorted by power. Choosing the power stays a decision
 * of the caller; this table only answers which powers reach a target fit and warns when
 * a choice does not.
 */
public class SoftThresholdTable {

	public static final String HEADER = "Power\tSFT.R.sq\tslope\ttruncated.R.sq\tmean.k\tmedian.k\tmax.k";

	private final List<SoftThresholdFit> fits;

	public SoftThresholdTable(List<SoftThresholdFit> fits) {
		this.fits = new ArrayList<SoftThresholdFit>(fits);
		Collections.sort(this.fits, new Comparator<SoftThresholdFit>() {
			public int compare(SoftThresholdFit o1, SoftThresholdFit o2) {
				return Integer.compare(o1.getPower(), o2.getPower());
			}
		});
	}

	public List<SoftThresholdFit> getFits() {
		return Collections.unmodifiableList(fits);
	}

	public SoftThresholdFit getFit(int power) {
		for(SoftThresholdFit fit : fits) {
			if(fit.getPower() == power) {
				return fit;
			}
		}
		return null;
	}

	/**
	 * @return the smallest power whose signed fit exceeds the target, -1 if none does
	 */
	public int firstPowerAbove(double targetRSquared) {
		return firstPowerAbove(targetRSquared, Double.POSITIVE_INFINITY);
	}

	/**
	 * Same as {@link #firstPowerAbove(double)} but also requires the mean connectivity
	 * to have dropped to at most maxMeanConnectivity.
	 */
	public int firstPowerAbove(double targetRSquared, double maxMeanConnectivity) {
		for(SoftThresholdFit fit : fits) {
			if(fit.getScaleFreeRSquared() > targetRSquared && fit.getMeanConnectivity() <= maxMeanConnectivity) {
				return fit.getPower();
			}
		}
		return -1;
	}

	/**
	 * Checks a chosen power against the table.
	 * @return the advisories for this choice, empty when the power reaches the target
	 */
	public List<ConfigurationWarning> checkPower(int power, double targetRSquared) {
		List<ConfigurationWarning> rtrn = new ArrayList<ConfigurationWarning>();
		int first = firstPowerAbove(targetRSquared);
		if(first < 0) {
			rtrn.add(new ConfigurationWarning(ConfigurationWarning.Kind.SCALE_FREE_FIT_NOT_REACHED,
					"No candidate power reaches a scale-free fit R^2 above " + targetRSquared +
					(fits.isEmpty() ? "" : " (evaluated " + fits.get(0).getPower() + " to " + fits.get(fits.size() - 1).getPower() + ")")));
		}
		SoftThresholdFit chosen = getFit(power);
		if(chosen == null) {
			rtrn.add(new ConfigurationWarning(ConfigurationWarning.Kind.POWER_NOT_EVALUATED,
					"Power " + power + " was not among the evaluated candidates"));
		} else if(!(chosen.getScaleFreeRSquared() > targetRSquared)) {
			rtrn.add(new ConfigurationWarning(ConfigurationWarning.Kind.POWER_BELOW_TARGET_FIT,
					"Power " + power + " has scale-free fit R^2 " + chosen.getScaleFreeRSquared() + ", below the target " + targetRSquared +
					(first < 0 ? "" : "; first power above the target is " + first)));
		}
		return rtrn;
	}

	public void write(String fileName) throws IOException {
		BufferedWriter bw = new BufferedWriter(new FileWriter(fileName));
		try {
			bw.write(HEADER);
			bw.newLine();
			for(SoftThresholdFit fit : fits) {
				bw.write(fit.toString());
				bw.newLine();
			}
		} finally {
			bw.close();
		}
	}
}
