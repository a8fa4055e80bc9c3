package com.tenantmeter.core.naming;

import java.util.regex.Pattern;

/**
 * Naming conventions tying runtime instance names back to their owning project.
 * <p>
 * Every grammar captures exactly two groups: the logical resource name and the numeric project id.
 * </p>
 */
public enum NameGrammar {
    /**
     * {@code <deployment>-<projectId>-<hash>-<suffix>}, the name of a pod generated by a deployment.
     */
    POD(Pattern.compile("^(.+)-(\\d+)-[^-]+-[^-]+$")),

    /**
     * {@code <deployment>-<projectId>}.
     */
    SERVICE(Pattern.compile("^(.+)-(\\d+)$")),

    /**
     * {@code <disk>-<projectId>}, the name of a persistent volume claim.
     */
    VOLUME(Pattern.compile("^(.+)-(\\d+)$"));

    private final Pattern pattern;

    NameGrammar(Pattern pattern) {
        this.pattern = pattern;
    }

    Pattern pattern() {
        return pattern;
    }
}
