package com.synos.anomaly.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrainingResult {

    // "trained" 또는 "skipped"
    private String status;

    private int trainingSamples;

    private List<ModelSummary> models;
}
