package com.di.snapdiff.dq;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One check entry of the DQ rule YAML, before validation.
 */
@Data
public class DqCheckSpec {
    private String name;
    private String type;
    private List<String> columns = new ArrayList<>();
    private String severity;
    private String reference;
    private Double threshold;
}
