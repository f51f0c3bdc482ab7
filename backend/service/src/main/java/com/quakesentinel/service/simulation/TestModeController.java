package com.quakesentinel.service.simulation;

import com.quakesentinel.core.classify.EventNormalizer;
import com.quakesentinel.core.model.EewEvent;
import com.quakesentinel.core.model.EewIssueKind;
import com.quakesentinel.core.model.NormalizedEew;
import com.quakesentinel.service.monitor.AlertArbitrator;
import com.quakesentinel.service.runtime.PollerService;

import java.time.Clock;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Drill mode: live polling pauses and a synthetic EEW warning is announced through the normal
 * arbitration path. Leaving drill mode puts the live EEW state back and re-polls immediately.
 */
public class TestModeController {
    private static final Logger LOGGER = Logger.getLogger(TestModeController.class.getName());

    static final String SIMULATED_EPICENTER = "福島県中通り近海 中南部";

    private final AlertArbitrator arbitrator;
    private final PollerService poller;
    private final EventNormalizer normalizer;
    private final Clock clock;

    public TestModeController(AlertArbitrator arbitrator, PollerService poller, EventNormalizer normalizer, Clock clock) {
        this.arbitrator = Objects.requireNonNull(arbitrator, "arbitrator is required");
        this.poller = Objects.requireNonNull(poller, "poller is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public synchronized void enterTest() {
        if (arbitrator.isTestModeActive()) {
            LOGGER.fine("Test mode already active");
            return;
        }
        poller.suspend();
        arbitrator.beginTestMode();
        NormalizedEew simulated = normalizer.normalizeEew(
                new EewEvent(clock.instant(), SIMULATED_EPICENTER, false, EewIssueKind.WARNING)
        ).asSynthetic();
        arbitrator.acceptSimulated(simulated);
        LOGGER.info("Test mode entered: simulated EEW at " + simulated.placeName());
    }

    public synchronized void exitTest() {
        if (!arbitrator.isTestModeActive()) {
            LOGGER.fine("Test mode not active");
            return;
        }
        arbitrator.endTestMode();
        poller.resume();
        LOGGER.info("Test mode exited; resynchronising with live feeds");
        poller.runOnceAllCollectors();
    }

    public boolean isActive() {
        return arbitrator.isTestModeActive();
    }
}
