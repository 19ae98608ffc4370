package dev.univer.kuberan.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.univer.kuberan.model.Account;
import dev.univer.kuberan.model.BudgetProgress;
import dev.univer.kuberan.model.Category;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/** Response wrappers used by the Kuberan API. */
final class Envelopes {

    private Envelopes() {}

    @Getter @Setter @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DataList<T> {
        private List<T> data;
    }

    @Getter @Setter @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CategoryBody {
        private Category category;
    }

    @Getter @Setter @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class AccountBody {
        private Account account;
    }

    @Getter @Setter @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ProgressBody {
        private BudgetProgress progress;
    }
}
