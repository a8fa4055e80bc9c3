package com.tenantmeter.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.util.List;

@Value
public class DeploymentUsageReport {
    String location;
    List<DeploymentUsageItem> list;

    @JsonIgnore
    public boolean isEmpty() {
        return list.isEmpty();
    }
}
