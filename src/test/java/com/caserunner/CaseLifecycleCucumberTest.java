package com.caserunner;

import io.cucumber.testng.AbstractTestNGCucumberTests;
import io.cucumber.testng.CucumberOptions;
import org.testng.annotations.DataProvider;

/**
 * TestNG entry point for the Cucumber scenarios that drive whole cases.
 *
 *   All scenarios:
 *     mvn test
 *
 *   Teardown behaviour only:
 *     mvn test -Dcucumber.filter.tags="@teardown"
 *
 * Reports land in target/cucumber-reports/.
 */
@CucumberOptions(
    features = "src/test/resources/features",
    glue     = { "com.caserunner.steps", "com.caserunner.hooks" },
    plugin   = {
        "pretty",
        "html:target/cucumber-reports/cucumber-pretty.html",
        "json:target/cucumber-reports/CucumberTestReport.json"
    },
    monochrome = false,
    publish    = false
)
public class CaseLifecycleCucumberTest extends AbstractTestNGCucumberTests {

    /** Scenarios start real processes; keep them sequential. */
    @Override
    @DataProvider(parallel = false)
    public Object[][] scenarios() {
        return super.scenarios();
    }
}
