package com.quakesentinel.collectors.support;

import com.quakesentinel.collectors.api.Collector;
import com.quakesentinel.collectors.api.CollectorContext;
import com.quakesentinel.collectors.api.CollectorResult;
import com.quakesentinel.core.events.CollectorTickCompleted;
import com.quakesentinel.core.events.CollectorTickStarted;
import com.quakesentinel.core.events.Event;
import org.junit.jupiter.api.Assertions;

import java.time.Duration;
import java.util.List;

public final class CollectorContractAssertions {
    private CollectorContractAssertions() {
    }

    public static CollectorResult assertContract(
            Collector collector,
            CollectorContext ctx,
            EventCapture capture,
            Duration budget
    ) {
        int startedBefore = capture.byType(CollectorTickStarted.class).size();
        int completedBefore = capture.byType(CollectorTickCompleted.class).size();

        CollectorResult result = Assertions.assertTimeoutPreemptively(budget, () -> collector.poll(ctx).join());

        Assertions.assertEquals(startedBefore + 1, capture.byType(CollectorTickStarted.class).size(),
                "collector should emit one start event");
        Assertions.assertEquals(completedBefore + 1, capture.byType(CollectorTickCompleted.class).size(),
                "collector should emit one completion event");

        List<Event> events = capture.all();
        Assertions.assertTrue(events.get(0) instanceof CollectorTickStarted, "tick start must come first");
        Assertions.assertTrue(events.get(events.size() - 1) instanceof CollectorTickCompleted,
                "tick completion must come last");
        CollectorTickCompleted completed = (CollectorTickCompleted) events.get(events.size() - 1);
        Assertions.assertEquals(collector.name(), completed.collectorName());
        Assertions.assertEquals(result.success(), completed.success());
        return result;
    }
}
