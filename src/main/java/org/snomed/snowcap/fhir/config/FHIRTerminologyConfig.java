package org.snomed.snowcap.fhir.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snomed.snowcap.fhir.pojo.TranslationChain;

import java.util.ArrayList;
import java.util.List;

/**
 * Limits and options of the terminology operations, bound from the <code>fhir.terminology</code> properties.
 */
public class FHIRTerminologyConfig {

	private final Expansion expansion = new Expansion();

	private final Translate translate = new Translate();

	private final Closure closure = new Closure();

	private final Operation operation = new Operation();

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public Expansion getExpansion() {
		return expansion;
	}

	public Translate getTranslate() {
		return translate;
	}

	public Closure getClosure() {
		return closure;
	}

	public Operation getOperation() {
		return operation;
	}

	public List<TranslationChain> getTranslationChains() {
		List<TranslationChain> chains = new ArrayList<>();
		for (String chainConfig : translate.getChains()) {
			String[] split = chainConfig.split(FHIRConstants.PIPE);
			if (split.length != 3) {
				logger.error("Value of configuration item 'fhir.terminology.translate.chains' has an incorrect format. " +
						"Expected three systems separated by pipes, got '{}'.", chainConfig);
				continue;
			}
			chains.add(new TranslationChain(split[0], split[1], split[2]));
		}
		logger.info("{} concept map translation chains configured.", chains.size());
		return chains;
	}

	public static class Expansion {

		private int maxEntries = 10_000;
		private int defaultCount = 1_000;
		private int maxDepth = 10;
		private boolean cacheEnabled = false;
		private int cacheSize = 200;

		public int getMaxEntries() {
			return maxEntries;
		}

		public void setMaxEntries(int maxEntries) {
			this.maxEntries = maxEntries;
		}

		public int getDefaultCount() {
			return defaultCount;
		}

		public void setDefaultCount(int defaultCount) {
			this.defaultCount = defaultCount;
		}

		public int getMaxDepth() {
			return maxDepth;
		}

		public void setMaxDepth(int maxDepth) {
			this.maxDepth = maxDepth;
		}

		public boolean isCacheEnabled() {
			return cacheEnabled;
		}

		public void setCacheEnabled(boolean cacheEnabled) {
			this.cacheEnabled = cacheEnabled;
		}

		public int getCacheSize() {
			return cacheSize;
		}

		public void setCacheSize(int cacheSize) {
			this.cacheSize = cacheSize;
		}
	}

	public static class Translate {

		// Format: sourceSystem|intermediateSystem|targetSystem
		private List<String> chains = new ArrayList<>();

		public List<String> getChains() {
			return chains;
		}

		public void setChains(List<String> chains) {
			this.chains = chains;
		}
	}

	public static class Closure {

		private int maxConceptsPerCall = 1_000;

		public int getMaxConceptsPerCall() {
			return maxConceptsPerCall;
		}

		public void setMaxConceptsPerCall(int maxConceptsPerCall) {
			this.maxConceptsPerCall = maxConceptsPerCall;
		}
	}

	public static class Operation {

		private int timeoutSeconds = 0;

		public int getTimeoutSeconds() {
			return timeoutSeconds;
		}

		public void setTimeoutSeconds(int timeoutSeconds) {
			this.timeoutSeconds = timeoutSeconds;
		}
	}
}
