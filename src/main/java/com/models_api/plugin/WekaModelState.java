package com.models_api.plugin;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import weka.classifiers.Classifier;
import weka.core.Instances;

import java.io.Serial;
import java.io.Serializable;

@Data
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
public class WekaModelState implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private String algorithm;
    private String options;
    private String target;

    // null until the first successful input
    private Classifier classifier;
    private Instances header;
}
