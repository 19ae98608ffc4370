package dev.univer.kuberan.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Category {
    private String id;
    private String name;
    private TransactionType type;
    private String parentId;
    private String icon;
    private String description;

    public boolean isTopLevel() {
        return parentId == null || parentId.isBlank();
    }

    public boolean hasIcon() {
        return icon != null && !icon.isBlank();
    }
}
