package umms.wgcna;

import java.io.File;
import java.io.IOException;
import java.text.ParseException;
import java.util.List;

import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;

import umms.core.datastructures.MatrixWithHeaders;
import umms.core.exception.CoexpressionException;
import umms.core.utils.CLUtil;
import umms.core.utils.CLUtil.ArgumentMap;
import umms.wgcna.io.CoexpressionWriter;
import umms.wgcna.network.NetworkType;

/**
 * Command line entry point: reads the expression and trait tables, runs a
 * {@link CoexpressionAnalysis} and writes the result tables.
 */
public class CoexpressionNetwork {

	static final String usage = "Usage: CoexpressionNetwork -in <expression table [samples x genes]>"+
			"\n\t-traits <trait table [samples x traits]>"+
			"\n\t-outdir <output directory>"+
			"\n\t-id <analysis id, prefix of every output file>"+
			"\n\t**************************************************************"+
			"\n\t\tOPTIONAL arguments"+
			"\n\t**************************************************************"+
			"\n\t-genesInRows [default: genes are columns]"+
			"\n\tNetwork:"+
			"\n\t\t-power <soft-threshold power [default: 6]>"+
			"\n\t\t-powers <candidate powers, e.g. 1-10,12,14 [default: 1-10 and 12 to 50 by 2]>"+
			"\n\t\t-targetR2 <scale-free fit target [default: 0.8]>"+
			"\n\t\t-networkType <signed | unsigned | signed hybrid [default: signed]>"+
			"\n\t\t-correlation <pearson | spearman [default: pearson]>"+
			"\n\tModules:"+
			"\n\t\t-linkage <average | single | complete [default: average]>"+
			"\n\t\t-minModuleSize <[default: 30]>"+
			"\n\t\t-deepSplit <0-4 [default: 2]>"+
			"\n\t\t-cutHeight <[default: 0.995]>"+
			"\n\t\t-mergeCutHeight <[default: 0.25]>"+
			"\n\t\t-maxBlockSize <genes per block [default: 5000]>"+
			"\n\tHub genes:"+
			"\n\t\t-gsTrait <trait column for gene significance [default: first trait]>"+
			"\n\t\t-modules <comma separated module colours or ids [default: all modules]>"+
			"\n\t\t-kME <minimum |kME| [default: 0.7]>"+
			"\n\t\t-kMEp <maximum kME p-value [default: 0.05]>"+
			"\n\t-threads <[default: available processors]>";

	static final Logger logger = LogManager.getLogger(CoexpressionNetwork.class.getName());

	private CoexpressionNetwork() {
	}

	/**
	 * Builds the analysis configuration from parsed arguments.
	 */
	static AnalysisConfig configure(ArgumentMap argMap) {
		AnalysisConfig config = new AnalysisConfig();
		config.setAnalysisId(argMap.getMandatory("id"));
		config.setPower(argMap.getInteger("power", AnalysisConfig.DEFAULT_POWER));
		if(argMap.isPresent("powers")) {
			List<Integer> powers = argMap.getIntegerRanges("powers");
			int[] candidates = new int[powers.size()];
			for(int i = 0; i < candidates.length; i++) {
				candidates[i] = powers.get(i);
			}
			config.setCandidatePowers(candidates);
		}
		config.setTargetRSquared(argMap.getDouble("targetR2", AnalysisConfig.DEFAULT_TARGET_R_SQUARED));
		config.setNetworkType(NetworkType.fromString(argMap.get("networkType", "signed")));
		config.setCorrelation(argMap.get("correlation", "pearson"));
		config.setLinkage(argMap.get("linkage", "average"));
		config.setMinModuleSize(argMap.getInteger("minModuleSize", AnalysisConfig.DEFAULT_MIN_MODULE_SIZE));
		config.setDeepSplit(argMap.getInteger("deepSplit", AnalysisConfig.DEFAULT_DEEP_SPLIT));
		config.setCutHeight(argMap.getDouble("cutHeight", AnalysisConfig.DEFAULT_CUT_HEIGHT));
		config.setMergeCutHeight(argMap.getDouble("mergeCutHeight", config.getMergeCutHeight()));
		config.setMaxBlockSize(argMap.getInteger("maxBlockSize", config.getMaxBlockSize()));
		config.setThreads(argMap.getInteger("threads", config.getThreads()));
		config.setKmeThreshold(argMap.getDouble("kME", config.getKmeThreshold()));
		config.setKmePValueThreshold(argMap.getDouble("kMEp", config.getKmePValueThreshold()));
		config.setGeneSignificanceTrait(argMap.get("gsTrait", null));
		if(argMap.isPresent("modules")) {
			config.setModulesOfInterest(argMap.getAll("modules"));
		}
		config.validate();
		return config;
	}

	static AnalysisResult run(String[] args) throws IOException, ParseException {
		ArgumentMap argMap = CLUtil.getParameters(args, usage);
		AnalysisConfig config = configure(argMap);
		File outDir = new File(argMap.getMandatory("outdir"));

		logger.info("Reading expression from " + argMap.getMandatory("in"));
		MatrixWithHeaders expression = new MatrixWithHeaders(argMap.getMandatory("in"));
		if(argMap.isPresent("genesInRows")) {
			expression = expression.transpose();
		}
		logger.info("Reading traits from " + argMap.getMandatory("traits"));
		MatrixWithHeaders traits = new MatrixWithHeaders(argMap.getMandatory("traits"));

		AnalysisResult result = new CoexpressionAnalysis(config).run(expression, traits);
		new CoexpressionWriter(outDir).write(result);
		return result;
	}

	public static void main(String[] args) {
		try {
			run(args);
		} catch (IllegalArgumentException e) {
			logger.error(e.getMessage());
			System.exit(1);
		} catch (CoexpressionException e) {
			logger.error("Analysis failed: " + e.getMessage(), e);
			System.exit(2);
		} catch (ParseException e) {
			logger.error("Malformed input at line " + e.getErrorOffset() + ": " + e.getMessage());
			System.exit(3);
		} catch (IOException e) {
			logger.error("I/O error: " + e.getMessage(), e);
			System.exit(4);
		}
	}
}
