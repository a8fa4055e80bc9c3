package com.tenantmeter.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.util.List;

@Value
public class DiskUsageReport {
    String location;
    List<DiskUsageItem> list;

    @JsonIgnore
    public boolean isEmpty() {
        return list.isEmpty();
    }
}
