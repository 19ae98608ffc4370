package dev.univer.kuberan.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.univer.kuberan.model.*;
import dev.univer.kuberan.service.BackendProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

@Service
@Slf4j
public class RestBackendGateway implements BackendGateway {

    static final String INTERNAL_SECRET_HEADER = "X-Internal-Secret";
    private static final int CATEGORY_PAGE_SIZE = 100;

    private final RestTemplate restTemplate;
    private final RestTemplate activityRestTemplate;
    private final BackendProperties props;
    private final ObjectMapper objectMapper;

    public RestBackendGateway(@Qualifier("backendRestTemplate") RestTemplate restTemplate,
                              @Qualifier("activityRestTemplate") RestTemplate activityRestTemplate,
                              BackendProperties props,
                              ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.activityRestTemplate = activityRestTemplate;
        this.props = props;
        this.objectMapper = objectMapper;
    }

    // ===================== bot principal =====================

    @Override
    public Optional<LinkedUser> resolve(long telegramUserId) {
        try {
            LinkedUser user = restTemplate.exchange("/api/v1/internal/telegram/resolve/{id}", HttpMethod.GET,
                    new HttpEntity<>(internalHeaders()), LinkedUser.class, telegramUserId).getBody();
            return Optional.ofNullable(user);
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        } catch (RestClientException e) {
            log.error("Failed to resolve user {}: {}", telegramUserId, e.getMessage());
            throw new BackendException("Failed to resolve user " + telegramUserId, e);
        }
    }

    @Override
    public void recordActivity(long telegramUserId) {
        try {
            activityRestTemplate.exchange("/api/v1/internal/telegram/activity/{id}", HttpMethod.POST,
                    new HttpEntity<>(internalHeaders()), Void.class, telegramUserId);
        } catch (RuntimeException e) {
            log.warn("Failed to record activity for {}: {}", telegramUserId, e.getMessage());
        }
    }

    @Override
    public void completeLink(LinkRequest request) {
        try {
            restTemplate.exchange("/api/v1/internal/telegram/complete-link", HttpMethod.POST,
                    new HttpEntity<>(request, internalHeaders()), JsonNode.class);
        } catch (HttpClientErrorException e) {
            log.warn("Link code rejected for user {}: {}", request.getTelegramUserId(), e.getStatusCode());
            throw new LinkFailedException("Invalid or expired link code", e);
        } catch (RestClientException e) {
            log.error("Failed to complete link for user {}: {}", request.getTelegramUserId(), e.getMessage());
            throw new BackendException("Failed to complete link", e);
        }
    }

    // ===================== user principal =====================

    @Override
    public List<Account> listAccounts(String authToken) {
        Envelopes.DataList<Account> body = call("list accounts", () -> restTemplate.exchange("/api/v1/accounts",
                HttpMethod.GET, new HttpEntity<>(userHeaders(authToken)),
                new ParameterizedTypeReference<Envelopes.DataList<Account>>() {}).getBody());
        return body == null || body.getData() == null ? List.of() : body.getData();
    }

    @Override
    public List<Category> listCategories(String authToken) {
        Envelopes.DataList<Category> body = call("list categories", () -> restTemplate.exchange(
                "/api/v1/categories?page_size={size}", HttpMethod.GET, new HttpEntity<>(userHeaders(authToken)),
                new ParameterizedTypeReference<Envelopes.DataList<Category>>() {}, CATEGORY_PAGE_SIZE).getBody());
        return body == null || body.getData() == null ? List.of() : body.getData();
    }

    @Override
    public Category createCategory(String authToken, NewCategory category) {
        Envelopes.CategoryBody body = call("create category", () -> restTemplate.exchange("/api/v1/categories",
                HttpMethod.POST, new HttpEntity<>(category, userHeaders(authToken)),
                Envelopes.CategoryBody.class).getBody());
        if (body == null || body.getCategory() == null) {
            throw new BackendException("Empty response when creating category " + category.getName());
        }
        return body.getCategory();
    }

    @Override
    public Account createCashAccount(String authToken, NewCashAccount account) {
        Envelopes.AccountBody body = call("create cash account", () -> restTemplate.exchange("/api/v1/accounts/cash",
                HttpMethod.POST, new HttpEntity<>(account, userHeaders(authToken)),
                Envelopes.AccountBody.class).getBody());
        if (body == null || body.getAccount() == null) {
            throw new BackendException("Empty response when creating account " + account.getName());
        }
        return body.getAccount();
    }

    @Override
    public void createTransaction(String authToken, NewTransaction transaction) {
        call("create transaction", () -> restTemplate.exchange("/api/v1/transactions", HttpMethod.POST,
                new HttpEntity<>(transaction, userHeaders(authToken)), JsonNode.class));
    }

    @Override
    public List<Budget> listBudgets(String authToken) {
        Envelopes.DataList<Budget> body = call("list budgets", () -> restTemplate.exchange("/api/v1/budgets",
                HttpMethod.GET, new HttpEntity<>(userHeaders(authToken)),
                new ParameterizedTypeReference<Envelopes.DataList<Budget>>() {}).getBody());
        return body == null || body.getData() == null ? List.of() : body.getData();
    }

    @Override
    public BudgetProgress getBudgetProgress(String authToken, String budgetId) {
        Envelopes.ProgressBody body = call("get budget progress", () -> restTemplate.exchange(
                "/api/v1/budgets/{id}/progress", HttpMethod.GET, new HttpEntity<>(userHeaders(authToken)),
                Envelopes.ProgressBody.class, budgetId).getBody());
        return body == null || body.getProgress() == null ? new BudgetProgress() : body.getProgress();
    }

    @Override
    public List<MonthlySummary> getMonthlySummary(String authToken, int months) {
        JsonNode body = call("get monthly summary", () -> restTemplate.exchange(
                "/api/v1/transactions/monthly-summary?months={months}", HttpMethod.GET,
                new HttpEntity<>(userHeaders(authToken)), JsonNode.class, months).getBody());
        JsonNode data = body == null ? null : body.get("data");
        if (data == null || data.isNull()) return List.of();

        // the endpoint has answered with both a list of months and a single object
        List<MonthlySummary> result = new ArrayList<>();
        try {
            if (data.isArray()) {
                for (JsonNode n : data) result.add(objectMapper.treeToValue(n, MonthlySummary.class));
            } else if (data.isObject()) {
                result.add(objectMapper.treeToValue(data, MonthlySummary.class));
            }
        } catch (JsonProcessingException e) {
            throw new BackendException("Unreadable monthly summary", e);
        }
        return result;
    }

    // ===================== helpers =====================

    private <T> T call(String what, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientException e) {
            log.error("Backend call failed ({}): {}", what, e.getMessage());
            throw new BackendException("Failed to " + what, e);
        }
    }

    private HttpHeaders internalHeaders() {
        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_JSON);
        if (props.getInternalSecret() != null) h.set(INTERNAL_SECRET_HEADER, props.getInternalSecret());
        return h;
    }

    private static HttpHeaders userHeaders(String authToken) {
        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_JSON);
        h.setBearerAuth(authToken);
        return h;
    }
}
