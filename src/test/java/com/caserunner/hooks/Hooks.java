package com.caserunner.hooks;

import com.caserunner.context.ScenarioContext;
import com.caserunner.util.CaseResults;
import io.cucumber.java.After;
import io.cucumber.java.Before;
import io.cucumber.java.Scenario;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Per-scenario Cucumber hooks.
 *
 * A failed scenario gets the case result and its transcript attached to the
 * report.
 */
public class Hooks {

    private static final Logger log = LoggerFactory.getLogger(Hooks.class);

    private final ScenarioContext ctx;

    public Hooks(ScenarioContext ctx) {
        this.ctx = ctx;
    }

    @Before
    public void setUpScenario(Scenario scenario) {
        log.info("--- Scenario START: {} ---", scenario.getName());
    }

    @After
    public void tearDownScenario(Scenario scenario) {
        if (scenario.isFailed() && ctx.hasRun()) {
            scenario.attach(CaseResults.toJson(ctx.getTestCase().getResult()).getBytes(StandardCharsets.UTF_8),
                "application/json", "Case result");
            scenario.attach(ctx.getTestCase().getOutput().getBytes(StandardCharsets.UTF_8),
                "text/plain", "Case transcript");
        }
        log.info("--- Scenario END: {} -- {} ---",
            scenario.getName(), scenario.isFailed() ? "FAILED" : "PASSED");
    }
}
