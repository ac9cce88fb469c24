package com.caserunner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One recorded failure or error of a case.
 *
 * Keeps the original message template and arguments next to the message as it
 * was formatted when the problem was recorded, so reports can show either.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Problem {

    private final String       category;
    private final String       template;
    private final List<Object> args;
    private final String       message;

    public Problem(String category, String template, Object[] args, String message) {
        this.category = category;
        this.template = template;
        this.args     = args != null
            ? Collections.unmodifiableList(Arrays.asList(args.clone()))
            : Collections.emptyList();
        this.message  = message;
    }

    public String getCategory() { return category; }
    public String getMessage()  { return message; }

    @JsonIgnore
    public String getTemplate() { return template; }

    @JsonIgnore
    public List<Object> getArgs() { return args; }

    @Override
    public String toString() {
        return category + ": " + message;
    }
}
