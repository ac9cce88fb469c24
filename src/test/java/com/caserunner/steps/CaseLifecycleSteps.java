package com.caserunner.steps;

import com.caserunner.context.ScenarioContext;
import com.caserunner.core.TestCase;
import com.caserunner.model.CaseStatus;
import com.caserunner.model.Problem;
import com.caserunner.util.CaseResults;
import io.cucumber.java.en.And;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Step definitions that build a case from a JSON definition, run it against a
 * scenario-local environment and inspect the outcome.
 *
 * Steps covered:
 *   Given a target "NAME" that runs "COMMAND"
 *   And a symbol "NAME" with value "VALUE"
 *   And an environment variable "NAME" set to "VALUE"
 *   And the case:  (doc string)
 *   When the case runs
 *   Then the case status is STATUS
 *   Then the transcript contains / does not contain "TEXT"
 *   Then the symbol "NAME" is "VALUE"
 *   Then a failure reads "MESSAGE"
 *   Then an error is recorded in category "CATEGORY"
 */
public class CaseLifecycleSteps {

    private static final Logger log = LoggerFactory.getLogger(CaseLifecycleSteps.class);

    private final ScenarioContext ctx;

    public CaseLifecycleSteps(ScenarioContext ctx) {
        this.ctx = ctx;
    }

    // ── Environment ───────────────────────────────────────────────────────────

    @Given("a target {string} that runs {string}")
    public void aTargetThatRuns(String name, String command) {
        ctx.getEnvironment().target(name, command);
    }

    @And("a symbol {string} with value {string}")
    public void aSymbolWithValue(String name, String value) {
        ctx.getEnvironment().symbol(name, value);
    }

    @And("an environment variable {string} set to {string}")
    public void anEnvironmentVariableSetTo(String name, String value) {
        ctx.getEnvironment().variable(name, value);
    }

    // ── Case ──────────────────────────────────────────────────────────────────

    @And("the case:")
    public void theCase(String json) {
        ctx.setDefinition(CaseResults.readDefinition(json));
        log.info("CaseLifecycleSteps: loaded {}", ctx.getDefinition());
    }

    @When("the case runs")
    public void theCaseRuns() {
        assertThat(ctx.getDefinition()).as("a case must be declared before it runs").isNotNull();
        TestCase testCase = new TestCase(ctx.getEnvironment().build(), ctx.getDefinition());
        ctx.setTestCase(testCase);
        ctx.setProblemCount(testCase.run());
    }

    // ── Outcome ───────────────────────────────────────────────────────────────

    @Then("the case status is {word}")
    public void theCaseStatusIs(String status) {
        assertThat(ctx.getTestCase().getStatus()).isEqualTo(CaseStatus.valueOf(status));
    }

    @And("the case reported {int} problem(s)")
    public void theCaseReportedProblems(int count) {
        assertThat(ctx.getProblemCount()).isEqualTo(count);
    }

    @And("the transcript contains {string}")
    public void theTranscriptContains(String text) {
        assertThat(ctx.getTestCase().getOutput()).contains(text);
    }

    @And("the transcript does not contain {string}")
    public void theTranscriptDoesNotContain(String text) {
        assertThat(ctx.getTestCase().getOutput()).doesNotContain(text);
    }

    @And("the symbol {string} is {string}")
    public void theSymbolIs(String name, String value) {
        assertThat(String.valueOf(ctx.getTestCase().getSymbols().get(name))).isEqualTo(value);
    }

    @And("a failure reads {string}")
    public void aFailureReads(String message) {
        assertThat(ctx.getTestCase().getFailures()).extracting(Problem::getMessage).contains(message);
    }

    @And("an error is recorded in category {string}")
    public void anErrorIsRecordedInCategory(String category) {
        assertThat(ctx.getTestCase().getErrors()).extracting(Problem::getCategory).contains(category);
    }

    @And("the case cannot be run again")
    public void theCaseCannotBeRunAgain() {
        assertThatThrownBy(() -> ctx.getTestCase().run()).isInstanceOf(IllegalStateException.class);
    }
}
