package dev.univer.kuberan.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class MonthlySummary {
    private String month;
    private long income;
    private long expenses;

    public long net() {
        return income - expenses;
    }
}
