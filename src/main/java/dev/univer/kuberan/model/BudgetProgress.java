package dev.univer.kuberan.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class BudgetProgress {
    private long spent;
    private long remaining;
    private double percentage;
}
