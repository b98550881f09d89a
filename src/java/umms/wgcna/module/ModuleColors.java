package umms.wgcna.module;

/**
 * Display names of module ids. Module 0 (unassigned) is "grey"; modules 1, 2, ... take the
 * usual co-expression colour sequence and fall back to "module&lt;id&gt;" when it runs out.
 * Colours are for display and file names only, modules are identified by their id.
 */
public class ModuleColors {

	public static final String UNASSIGNED_COLOR = "grey";
	public static final String EIGENGENE_PREFIX = "ME";

	private static final String[] COLORS = {"turquoise", "blue", "brown", "yellow", "green", "red", "black",
		"pink", "magenta", "purple", "greenyellow", "tan", "salmon", "cyan", "midnightblue", "lightcyan",
		"grey60", "lightgreen", "lightyellow", "royalblue", "darkred", "darkgreen", "darkturquoise",
		"darkgrey", "orange", "darkorange", "white", "skyblue", "saddlebrown", "steelblue",
		"paleturquoise", "violet", "darkolivegreen", "darkmagenta"};

	private ModuleColors() {
	}

	public static String colorOf(int module) {
		if(module < 0) {
			throw new IllegalArgumentException("Module ids are not negative, got " + module);
		}
		if(module == 0) {
			return UNASSIGNED_COLOR;
		}
		if(module <= COLORS.length) {
			return COLORS[module - 1];
		}
		return "module" + module;
	}

	public static String eigengeneName(int module) {
		return EIGENGENE_PREFIX + colorOf(module);
	}

	/**
	 * Resolves a colour, an eigengene name (ME&lt;colour&gt;), "module&lt;id&gt;" or a plain id.
	 * @return the module id, -1 when the label is not recognised
	 */
	public static int idOf(String label) {
		String l = label.trim();
		if(l.startsWith(EIGENGENE_PREFIX) && l.length() > EIGENGENE_PREFIX.length()) {
			l = l.substring(EIGENGENE_PREFIX.length());
		}
		if(UNASSIGNED_COLOR.equalsIgnoreCase(l)) {
			return 0;
		}
		for(int i = 0; i < COLORS.length; i++) {
			if(COLORS[i].equalsIgnoreCase(l)) {
				return i + 1;
			}
		}
		String number = l.toLowerCase().startsWith("module") ? l.substring("module".length()) : l;
		try {
			int id = Integer.parseInt(number);
			return id >= 0 ? id : -1;
		} catch (NumberFormatException e) {
			return -1;
		}
	}
}
