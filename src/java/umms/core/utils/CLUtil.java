package umms.core.utils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unix style "-key value" command line parsing. A key followed directly by another key
 * (or by nothing) is a flag with an empty value. Repeated keys accumulate values.
 */
public class CLUtil {

	private CLUtil() {
	}

	public static ArgumentMap getParameters(String [] args, String usage) {
		ArgumentMap argMap = new ArgumentMap(usage);
		for(int i = 0; i < args.length; i++) {
			if(args[i].startsWith("-") && args[i].length() > 1 && !isNumber(args[i])) {
				String key = args[i].substring(1);
				String val = "";
				if(i + 1 < args.length && (!args[i + 1].startsWith("-") || isNumber(args[i + 1]))) {
					val = args[i + 1];
					i++;
				}
				argMap.put(key, val);
			} else {
				//key=value form
				String[] arg = args[i].split("=", 2);
				if(arg.length != 2){
					throw new IllegalArgumentException("Unexpected argument " + args[i] + "\n" + usage);
				}
				argMap.put(arg[0], arg[1]);
			}
		}
		return argMap;
	}

	private static boolean isNumber(String s) {
		try {
			Double.parseDouble(s);
			return true;
		} catch (NumberFormatException e) {
			return false;
		}
	}

	public static class ArgumentMap {
		private final String usage;
		private final Map<String, List<String>> values = new LinkedHashMap<String, List<String>>();

		public ArgumentMap(String usage) {
			this.usage = usage;
		}

		public void put(String key, String value) {
			List<String> vals = values.get(key);
			if(vals == null) {
				vals = new ArrayList<String>();
				values.put(key, vals);
			}
			vals.add(value);
		}

		public boolean isPresent(String key) {
			return values.containsKey(key);
		}

		public String get(String key, String defaultValue) {
			return isPresent(key) ? getMandatory(key) : defaultValue;
		}

		public String getMandatory(String key) throws IllegalArgumentException {
			List<String> parameter = values.get(key);
			if(parameter == null || parameter.size() == 0 || parameter.get(0).length() == 0) {
				throw new IllegalArgumentException("Argument "+key+" is mandatory\n"+usage);
			}
			return parameter.get(0);
		}

		/**
		 * All values of a key, comma separated values split into separate entries.
		 */
		public List<String> getAll(String key) {
			List<String> rtrn = new ArrayList<String>();
			List<String> vals = values.get(key);
			if(vals == null) {
				return rtrn;
			}
			for(String v : vals) {
				for(String part : v.split(",")) {
					if(part.trim().length() > 0) {
						rtrn.add(part.trim());
					}
				}
			}
			return rtrn;
		}

		public int getInteger(String key, int defaultValue) throws NumberFormatException {
			return isPresent(key) ? Integer.parseInt(getMandatory(key)) : defaultValue;
		}

		public double getDouble(String key, double defaultValue) throws NumberFormatException {
			return isPresent(key) ? Double.parseDouble(getMandatory(key)) : defaultValue;
		}

		/**
		 * Parses lists such as "1-10,12,14" into integers.
		 */
		public List<Integer> getIntegerRanges(String key) throws NumberFormatException {
			List<Integer> rtrn = new ArrayList<Integer>();
			for(String part : getAll(key)) {
				int dash = part.indexOf('-', 1);
				if(dash > 0) {
					int from = Integer.parseInt(part.substring(0, dash));
					int to = Integer.parseInt(part.substring(dash + 1));
					for(int i = from; i <= to; i++) {
						rtrn.add(i);
					}
				} else {
					rtrn.add(Integer.parseInt(part));
				}
			}
			return rtrn;
		}

		public String getUsage() {
			return usage;
		}
	}
}
