package com.caserunner.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A parsed case definition, as handed over by the suite loader.
 *
 * Each stage is an ordered list of single-key maps: the key names the
 * directive and the value is its declared argument block. The loader owns the
 * source format; this class only has to be bindable from whatever tree the
 * loader produced:
 *
 * <pre>
 *   {
 *     "index": 3,
 *     "label": "lists buckets",
 *     "setup":    [ { "uuid": "bucket" } ],
 *     "test":     [ { "call": { "target": "list_buckets" } },
 *                   { "assert_contains": [ { "variable": "bucket" } ] } ],
 *     "teardown": [ { "log": [ "done with {}", "bucket" ] } ]
 *   }
 * </pre>
 *
 * The test stage is also accepted under the key {@code "case"}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CaseDefinition {

    private int index;
    private String label;
    private List<Map<String, Object>> setup = new ArrayList<>();
    @JsonAlias("case")
    private List<Map<String, Object>> test = new ArrayList<>();
    private List<Map<String, Object>> teardown = new ArrayList<>();

    public CaseDefinition() {}

    public CaseDefinition(int index, String label,
                          List<Map<String, Object>> setup,
                          List<Map<String, Object>> test,
                          List<Map<String, Object>> teardown) {
        this.index = index;
        this.label = label;
        setSetup(setup);
        setTest(test);
        setTeardown(teardown);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public int getIndex() { return index; }
    public String getLabel() { return label; }
    public List<Map<String, Object>> getSetup() { return setup; }
    public List<Map<String, Object>> getTest() { return test; }
    public List<Map<String, Object>> getTeardown() { return teardown; }

    // ── Setters ───────────────────────────────────────────────────────────────

    public void setIndex(int index) { this.index = index; }
    public void setLabel(String label) { this.label = label; }
    public void setSetup(List<Map<String, Object>> setup) { this.setup = orEmpty(setup); }
    public void setTest(List<Map<String, Object>> test) { this.test = orEmpty(test); }
    public void setTeardown(List<Map<String, Object>> teardown) { this.teardown = orEmpty(teardown); }

    private static List<Map<String, Object>> orEmpty(List<Map<String, Object>> stage) {
        return stage != null ? stage : new ArrayList<>();
    }

    @Override
    public String toString() {
        return String.format("CaseDefinition{index=%d, label='%s', setup=%d, test=%d, teardown=%d}",
            index, label, setup.size(), test.size(), teardown.size());
    }
}
