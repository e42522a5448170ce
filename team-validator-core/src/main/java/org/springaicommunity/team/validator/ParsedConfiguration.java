package org.springaicommunity.team.validator;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	public String dataFile;

	public boolean strict;

	public Set<String> skip = new LinkedHashSet<>();

	public boolean listChecks = false;

	public boolean verbose;

	public boolean helpRequested = false;

	public ParsedConfiguration(ValidatorProperties defaultProperties) {
		this.dataFile = defaultProperties.getDataFile();
		this.strict = defaultProperties.isStrict();
		this.skip.addAll(defaultProperties.getSkip());
		this.verbose = defaultProperties.isVerbose();
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "dataFile='" + dataFile + '\'' + ", strict=" + strict + ", skip=" + skip
				+ ", listChecks=" + listChecks + ", verbose=" + verbose + ", helpRequested=" + helpRequested + '}';
	}

}
