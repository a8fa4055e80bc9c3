package com.tenantmeter.core.naming;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Attributes pod, service and volume names to the project that owns them.
 * <p>
 * A name is attributed only when its grammar matches the whole name with exactly two captured groups
 * and the captured project id is a positive number. Anything else is a miss, which is routine for
 * instances this system does not own (system pods, foreign volumes) and therefore not an error.
 * </p>
 */
public final class EntityAttributor {
    private static final Logger log = LoggerFactory.getLogger(EntityAttributor.class);

    private EntityAttributor() {
    }

    /**
     * Attributes an instance name under the given grammar.
     *
     * @param instanceName pod, service or volume claim name
     * @param grammar      naming convention the name is expected to follow
     * @return the owner, or empty when the name does not follow the grammar
     */
    public static Optional<Attribution> attribute(String instanceName, NameGrammar grammar) {
        if (instanceName == null || instanceName.isEmpty()) {
            return Optional.empty();
        }

        Matcher matcher = grammar.pattern().matcher(instanceName);
        if (!matcher.matches() || matcher.groupCount() != 2) {
            log.debug("Name '{}' does not follow {} grammar", instanceName, grammar);
            return Optional.empty();
        }

        long projectId;
        try {
            projectId = Long.parseLong(matcher.group(2));
        } catch (NumberFormatException e) {
            log.debug("Name '{}' carries an unparseable project id", instanceName);
            return Optional.empty();
        }
        if (projectId == 0) {
            return Optional.empty();
        }

        return Optional.of(new Attribution(matcher.group(1), projectId));
    }
}
