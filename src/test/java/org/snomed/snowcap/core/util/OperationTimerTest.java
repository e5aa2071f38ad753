package org.snomed.snowcap.core.util;

import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OperationTimerTest {

	@Test
	void testStagesAccumulate() {
		OperationTimer timer = new OperationTimer(LoggerFactory.getLogger(getClass()), "Test operation", Long.MAX_VALUE);
		timer.stage("load");
		timer.stage("evaluate");
		timer.stage("load");
		assertEquals(List.of("load", "evaluate"), List.copyOf(timer.getStageMillis().keySet()));
		long total = timer.finish();
		assertTrue(total >= 0);
		assertTrue(timer.getStageMillis().values().stream().mapToLong(Long::longValue).sum() <= total);
	}
}
