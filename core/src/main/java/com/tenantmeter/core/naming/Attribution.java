package com.tenantmeter.core.naming;

import lombok.Value;

/**
 * Owner of a runtime instance: the logical resource name and the project it belongs to.
 */
@Value
public class Attribution {
    String name;
    long projectId;
}
