package org.snomed.snowcap.core.util;

import com.google.common.base.Stopwatch;
import org.slf4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Times the stages of a single terminology operation.
 * The summary is logged at debug level, or at info level when the operation ran longer than the slow threshold.
 */
public class OperationTimer {

	private final Logger logger;
	private final String operation;
	private final long slowThresholdMillis;
	private final Stopwatch stopwatch = Stopwatch.createStarted();
	private final Map<String, Long> stageMillis = new LinkedHashMap<>();
	private long stageStart;

	public OperationTimer(Logger logger, String operation, long slowThresholdMillis) {
		this.logger = logger;
		this.operation = operation;
		this.slowThresholdMillis = slowThresholdMillis;
	}

	public void stage(String stageName) {
		long now = stopwatch.elapsed(TimeUnit.MILLISECONDS);
		stageMillis.merge(stageName, now - stageStart, Long::sum);
		stageStart = now;
	}

	/**
	 * @return total elapsed milliseconds
	 */
	public long finish() {
		stopwatch.stop();
		long total = stopwatch.elapsed(TimeUnit.MILLISECONDS);
		if (total >= slowThresholdMillis) {
			logger.info("{} took {} ms, stages {}", operation, total, stageMillis);
		} else if (logger.isDebugEnabled()) {
			logger.debug("{} took {} ms, stages {}", operation, total, stageMillis);
		}
		return total;
	}

	public Map<String, Long> getStageMillis() {
		return stageMillis;
	}
}
