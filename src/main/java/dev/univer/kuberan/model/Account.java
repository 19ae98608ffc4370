package dev.univer.kuberan.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Account {
    private String id;
    private String name;
    private AccountType type;
    private long balance;          // minor units
    private String currency;

    @JsonProperty("is_active")
    private Boolean active;        // absent means active

    private Long creditLimit;

    public boolean isActive() {
        return active == null || active;
    }

    public boolean isEligible() {
        return type != null && type.isTransactionTarget();
    }
}
