package dev.univer.kuberan.conversation;

import dev.univer.kuberan.gateway.BackendException;
import dev.univer.kuberan.gateway.BackendGateway;
import dev.univer.kuberan.model.*;
import dev.univer.kuberan.service.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static dev.univer.kuberan.conversation.Events.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("Expense and income flow")
class TransactionFlowTest {

    private static final String EXPIRED = "Session expired. Please start over with /expense or /income.";

    @Mock
    private BackendGateway gateway;

    @Mock
    private ApplicationEventPublisher publisher;

    private MutableClock clock;
    private SessionStore store;
    private RecordingTransport transport;
    private TransactionFlow flow;
    private LinkFlow linkFlow;
    private ConversationEngine engine;

    private LinkedUser alice;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
        store = new SessionStore(clock, publisher);
        transport = new RecordingTransport();
        BotProperties props = new BotProperties();
        flow = new TransactionFlow(store, transport, gateway, props);
        linkFlow = new LinkFlow(store, transport, gateway, props);
        engine = new ConversationEngine(store, transport, flow, linkFlow);

        alice = LinkedUser.builder().userId("u1").authToken("tok").defaultCurrency("MYR").build();
        when(gateway.resolve(USER)).thenReturn(Optional.of(alice));
        when(gateway.listAccounts("tok")).thenReturn(List.of(
                account("a1", "Cash", AccountType.CASH),
                account("a2", "Wallet", AccountType.CASH),
                account("a3", "Visa", AccountType.CREDIT_CARD),
                account("a4", "Stocks", AccountType.INVESTMENT)));
        when(gateway.listCategories("tok")).thenReturn(List.of(
                category("c1", "Food", TransactionType.EXPENSE),
                category("c2", "Transport", TransactionType.EXPENSE),
                category("c3", "Salary", TransactionType.INCOME)));
    }

    private static Account account(String id, String name, AccountType type) {
        return Account.builder().id(id).name(name).type(type).currency("MYR").build();
    }

    private static Category category(String id, String name, TransactionType type) {
        return Category.builder().id(id).name(name).type(type).build();
    }

    private void expense(String args) {
        flow.start(command("expense", args), TransactionType.EXPENSE);
    }

    private void press(String payload) {
        engine.onButton(button(payload, 100));
    }

    private Optional<TransactionSession> session() {
        return store.find(new SessionKey(CHAT, USER, FlowFamily.TRANSACTION)).map(TransactionSession.class::cast);
    }

    private TransactionSession live() {
        return session().orElseThrow();
    }

    @Nested
    @DisplayName("entry")
    class Entry {

        @Test
        void quickPathWithoutMatchesAsksForCategory() {
            expense("50 Coffee");

            assertThat(transport.last().text()).isEqualTo("Expense: RM50.00\nCoffee\n\nSelect a category:");
            assertThat(transport.last().payloads()).contains("cat:c1", "cat:c2", "cat:new", "cat:none");
            assertThat(live().getState()).isEqualTo(ConversationState.AWAITING_CATEGORY);
            assertThat(live().getAmount()).isEqualTo(5000L);
            assertThat(live().getDescription()).isEqualTo("Coffee");
            assertThat(live().getAccount().getId()).isEqualTo("a1");
        }

        @Test
        void trailingAccountNameSelectsIt() {
            expense("50 Coffee Wallet");

            assertThat(live().getAccount().getName()).isEqualTo("Wallet");
            assertThat(live().getDescription()).isEqualTo("Coffee");
            assertThat(live().getState()).isEqualTo(ConversationState.AWAITING_CATEGORY);
        }

        @Test
        void trailingCategoryGoesStraightToConfirm() {
            expense("50 Coffee Food");

            assertThat(live().getState()).isEqualTo(ConversationState.CONFIRM);
            assertThat(transport.last().text())
                    .isEqualTo("Expense: RM50.00\nCoffee\n\nCategory: Food\nAccount: Cash\nCurrency: MYR");
            assertThat(transport.last().payloads())
                    .containsExactly("txn:chg_cat", "txn:chg_acc", "txn:chg_ccy", "txn:confirm", "txn:cancel");
        }

        @Test
        void guidedAndQuickPathsShowTheSameCard() {
            expense("");
            assertThat(transport.last().text())
                    .isEqualTo("How much was the expense?\nType the amount, or amount and description (e.g. 50 Coffee)");
            assertThat(live().getState()).isEqualTo(ConversationState.AWAITING_AMOUNT);

            engine.onText(text("fifty"));
            assertThat(transport.last().text()).isEqualTo("Please enter a valid amount (e.g. 50 or 50 Coffee)");
            assertThat(live().getState()).isEqualTo(ConversationState.AWAITING_AMOUNT);
            assertThat(live().getAmount()).isNull();

            engine.onText(text("50 Coffee Food"));
            String guided = transport.last().text();

            engine.cancel(command("cancel", ""));
            expense("50 Coffee Food");

            assertThat(transport.last().text()).isEqualTo(guided);
        }

        @Test
        void unparsableTrailingTextFallsBackToGuidedPrompt() {
            expense("Coffee");

            assertThat(live().getState()).isEqualTo(ConversationState.AWAITING_AMOUNT);
        }

        @Test
        void incomeWithoutDescriptionUsesTitle() {
            flow.start(command("income", "3000 Salary"), TransactionType.INCOME);

            assertThat(transport.last().text())
                    .isEqualTo("Income: RM3,000.00\nIncome\n\nCategory: Salary\nAccount: Cash\nCurrency: MYR");
        }

        @Test
        void withoutCategoriesConfirmsRightAway() {
            when(gateway.listCategories("tok")).thenReturn(List.of());

            expense("12");

            assertThat(live().getState()).isEqualTo(ConversationState.CONFIRM);
            assertThat(transport.last().text()).contains("Category: None");
        }

        @Test
        void unlinkedUserGetsLinkPrompt() {
            when(gateway.resolve(USER)).thenReturn(Optional.empty());

            expense("50 Coffee");

            assertThat(transport.last().text())
                    .isEqualTo("Your Telegram account is not linked.\nUse /start to link your account.");
            assertThat(store.size()).isZero();
            verify(gateway, never()).listAccounts(any());
        }

        @Test
        void noEligibleAccountEndsBeforeLoadingCategories() {
            when(gateway.listAccounts("tok")).thenReturn(List.of(account("a4", "Stocks", AccountType.INVESTMENT)));

            expense("50 Coffee");

            assertThat(transport.last().text())
                    .isEqualTo("No active accounts found. Please create an account in the web app first.");
            assertThat(store.size()).isZero();
            verify(gateway, never()).listCategories(any());
        }

        @Test
        void defaultAccountPrefersActive() {
            Account closed = Account.builder().id("x").name("Old").type(AccountType.CASH).active(false).build();
            Account open = Account.builder().id("y").name("New").type(AccountType.CASH).build();

            assertThat(TransactionFlow.defaultAccount(List.of(closed, open))).isSameAs(open);
            assertThat(TransactionFlow.defaultAccount(List.of(closed))).isSameAs(closed);
            assertThat(TransactionFlow.defaultAccount(List.of())).isNull();
        }
    }

    @Nested
    @DisplayName("confirm")
    class Confirm {

        @Test
        void commitsExactlyOnce() {
            expense("50 Coffee Food");

            press("txn:confirm");

            ArgumentCaptor<NewTransaction> txn = ArgumentCaptor.forClass(NewTransaction.class);
            verify(gateway).createTransaction(eq("tok"), txn.capture());
            assertThat(txn.getValue().getType()).isEqualTo(TransactionType.EXPENSE);
            assertThat(txn.getValue().getAccountId()).isEqualTo("a1");
            assertThat(txn.getValue().getAmount()).isEqualTo(5000L);
            assertThat(txn.getValue().getDescription()).isEqualTo("Coffee");
            assertThat(txn.getValue().getCategoryId()).isEqualTo("c1");
            assertThat(transport.last().edit()).isTrue();
            assertThat(transport.last().text()).isEqualTo(
                    "Expense Recorded\n\nAmount: RM50.00\nDescription: Coffee\nCategory: Food\nAccount: Cash");

            press("txn:confirm");

            assertThat(transport.last().text()).isEqualTo(EXPIRED);
            verify(gateway, times(1)).createTransaction(any(), any());
        }

        @Test
        void skippedCategoryIsOmitted() {
            expense("50 Coffee");
            press("cat:none");
            press("txn:confirm");

            ArgumentCaptor<NewTransaction> txn = ArgumentCaptor.forClass(NewTransaction.class);
            verify(gateway).createTransaction(eq("tok"), txn.capture());
            assertThat(txn.getValue().getCategoryId()).isNull();
        }

        @Test
        void failedCommitKeepsTheCardForRetry() {
            doThrow(new BackendException("down")).doNothing().when(gateway).createTransaction(any(), any());
            expense("50 Coffee Food");

            press("txn:confirm");

            assertThat(transport.last().text()).startsWith("Failed to record the expense. Please try again.");
            assertThat(transport.last().payloads()).contains("txn:confirm");
            assertThat(live().getState()).isEqualTo(ConversationState.CONFIRM);

            press("txn:confirm");

            assertThat(transport.last().text()).startsWith("Expense Recorded");
            assertThat(session()).isEmpty();
            verify(gateway, times(2)).createTransaction(any(), any());
        }

        @Test
        void cancelButtonEndsWithoutBackendCall() {
            expense("50 Coffee Food");

            press("txn:cancel");

            assertThat(transport.last().text()).isEqualTo("Cancelled.");
            assertThat(session()).isEmpty();
            verify(gateway, never()).createTransaction(any(), any());
        }

        @Test
        void idleSessionExpiresBeforeConfirm() {
            expense("50 Coffee Food");
            clock.advance(Duration.ofSeconds(301));

            press("txn:confirm");

            assertThat(transport.last().text()).isEqualTo(EXPIRED);
            verify(gateway, never()).createTransaction(any(), any());
            verify(publisher).publishEvent(any(SessionExpiredEvent.class));
        }

        @Test
        void unknownButtonNamespaceIsTreatedAsExpired() {
            expense("50 Coffee Food");

            press("zzz:1");

            assertThat(transport.last().edit()).isTrue();
            assertThat(transport.last().text()).isEqualTo(FlowFamily.TRANSACTION.expiredMessage());
            assertThat(live().getState()).isEqualTo(ConversationState.CONFIRM);
        }

        @Test
        void buttonsOfAnotherStepAreIgnored() {
            expense("50 Coffee Food");
            int shown = transport.count();

            press("cat:c2");

            assertThat(transport.count()).isEqualTo(shown);
            assertThat(transport.acknowledged).hasSize(1);
            assertThat(live().getCategory().getId()).isEqualTo("c1");
        }
    }

    @Nested
    @DisplayName("side trips")
    class SideTrips {

        @Test
        void currencyCodeIsValidatedAndUpperCased() {
            expense("50 Coffee Food");
            press("txn:chg_ccy");
            assertThat(transport.last().payloads()).containsExactly("ccy:MYR", "ccy:other", "ccy:back");

            press("ccy:other");
            assertThat(live().getState()).isEqualTo(ConversationState.AWAITING_NEW_CURRENCY_CODE);

            engine.onText(text("jp"));
            assertThat(transport.last().text())
                    .isEqualTo("Please enter a valid 3-letter currency code (e.g. JPY, CAD, AUD):");
            assertThat(live().getState()).isEqualTo(ConversationState.AWAITING_NEW_CURRENCY_CODE);
            assertThat(live().getCurrency()).isEqualTo("MYR");

            engine.onText(text("jpy"));
            assertThat(live().getCurrency()).isEqualTo("JPY");
            assertThat(live().getState()).isEqualTo(ConversationState.CONFIRM);
            assertThat(transport.last().text()).startsWith("Expense: JPY 50.00").contains("Currency: JPY");
        }

        @Test
        void backReturnsToConfirm() {
            expense("50 Coffee Food");
            press("txn:chg_ccy");
            press("ccy:back");

            assertThat(live().getState()).isEqualTo(ConversationState.CONFIRM);
            assertThat(live().getCurrency()).isEqualTo("MYR");
        }

        @Test
        void pickingAnotherAccount() {
            expense("50 Coffee Food");
            press("txn:chg_acc");
            assertThat(transport.last().payloads()).containsExactly("acc:a1", "acc:a2", "acc:a3", "acc:new", "acc:back");

            press("acc:a3");

            assertThat(transport.last().text()).contains("Account: Visa");
            assertThat(live().getState()).isEqualTo(ConversationState.CONFIRM);
        }

        @Test
        void newCashAccountIsUsedForThisFlowOnly() {
            when(gateway.createCashAccount(eq("tok"), any())).thenReturn(
                    Account.builder().id("a9").name("Savings").type(AccountType.CASH).currency("MYR").build());
            expense("50 Coffee Food");
            press("txn:chg_acc");
            press("acc:new");
            assertThat(live().getState()).isEqualTo(ConversationState.AWAITING_NEW_ACCOUNT_NAME);

            engine.onText(text("Savings"));

            ArgumentCaptor<NewCashAccount> created = ArgumentCaptor.forClass(NewCashAccount.class);
            verify(gateway).createCashAccount(eq("tok"), created.capture());
            assertThat(created.getValue().getName()).isEqualTo("Savings");
            assertThat(created.getValue().getCurrency()).isEqualTo("MYR");
            assertThat(transport.last().text()).contains("Account: Savings");

            press("txn:chg_acc");
            assertThat(transport.last().payloads()).contains("acc:a9");
            press("acc:back");
            press("txn:confirm");

            expense("10 Tea Food");
            assertThat(live().getAccount().getId()).isEqualTo("a1");
        }

        @Test
        void newCategoryIsCreatedAtIconStep() {
            Category pizza = Category.builder().id("c9").name("Pizza").type(TransactionType.EXPENSE)
                    .parentId("c1").icon("🍕").build();
            when(gateway.createCategory(eq("tok"), any())).thenReturn(pizza);
            expense("50 Dinner");

            press("cat:new");
            assertThat(transport.last().text()).isEqualTo("Type a name for the new category:");

            engine.onText(text("   "));
            assertThat(transport.last().text()).isEqualTo("Please type a category name:");
            assertThat(live().getState()).isEqualTo(ConversationState.AWAITING_NEW_CATEGORY_NAME);

            engine.onText(text("Pizza"));
            assertThat(transport.last().text()).isEqualTo("Category: Pizza\n\nIs this a subcategory of an existing category?");
            assertThat(transport.last().payloads()).containsExactly("ncp:c1", "ncp:c2", "ncp:none");
            verify(gateway, never()).createCategory(any(), any());

            press("ncp:c1");
            assertThat(transport.last().payloads()).containsExactly("nci:skip");

            engine.onText(text("🍕"));

            ArgumentCaptor<NewCategory> created = ArgumentCaptor.forClass(NewCategory.class);
            verify(gateway).createCategory(eq("tok"), created.capture());
            assertThat(created.getValue().getName()).isEqualTo("Pizza");
            assertThat(created.getValue().getType()).isEqualTo(TransactionType.EXPENSE);
            assertThat(created.getValue().getIcon()).isEqualTo("🍕");
            assertThat(created.getValue().getParentId()).isEqualTo("c1");

            assertThat(live().getState()).isEqualTo(ConversationState.CONFIRM);
            assertThat(live().getNewCategory()).isNull();
            assertThat(transport.last().text()).contains("Category: 🍕 Pizza");

            press("txn:chg_cat");
            assertThat(transport.last().payloads()).contains("cat:c9");
        }

        @Test
        void failedCategoryCreationStaysAtIconStep() {
            Category pizza = Category.builder().id("c9").name("Pizza").type(TransactionType.EXPENSE).build();
            when(gateway.createCategory(eq("tok"), any()))
                    .thenThrow(new BackendException("down"))
                    .thenReturn(pizza);
            expense("50 Dinner");
            press("cat:new");
            engine.onText(text("Pizza"));
            press("ncp:none");

            engine.onText(text("🍕"));

            assertThat(live().getState()).isEqualTo(ConversationState.AWAITING_NEW_CATEGORY_ICON);
            assertThat(transport.last().payloads()).containsExactly("nci:skip");

            press("nci:skip");

            ArgumentCaptor<NewCategory> created = ArgumentCaptor.forClass(NewCategory.class);
            verify(gateway, times(2)).createCategory(eq("tok"), created.capture());
            assertThat(created.getAllValues().get(1).getIcon()).isEmpty();
            assertThat(created.getAllValues().get(1).getParentId()).isNull();
            assertThat(live().getState()).isEqualTo(ConversationState.CONFIRM);
        }

        @Test
        void iconKeepsFirstTwoCodePoints() {
            assertThat(TransactionFlow.firstCodePoints("☕️ coffee", 2)).isEqualTo("☕️");
            assertThat(TransactionFlow.firstCodePoints("🍕", 2)).isEqualTo("🍕");
            assertThat(TransactionFlow.firstCodePoints("", 2)).isEmpty();
        }
    }

    @Nested
    @DisplayName("cancel and free text")
    class CancelAndText {

        @Test
        void cancelIsIdempotent() {
            expense("50 Coffee");

            engine.cancel(command("cancel", ""));

            assertThat(transport.last().text()).isEqualTo("Cancelled.");
            assertThat(session()).isEmpty();

            int shown = transport.count();
            engine.cancel(command("cancel", ""));
            assertThat(transport.count()).isEqualTo(shown);
        }

        @Test
        void freeTextWithoutSessionIsIgnored() {
            engine.onText(text("hello"));

            assertThat(transport.count()).isZero();
        }

        @Test
        void linkAndTransactionSessionsLiveSideBySide() {
            when(gateway.resolve(USER)).thenReturn(Optional.empty(), Optional.of(alice));

            linkFlow.start(command("start", "abc123"));
            expense("");
            assertThat(store.findAll(new ChatUser(CHAT, USER))).hasSize(2);

            engine.onText(text("12"));
            assertThat(live().getAmount()).isEqualTo(1200L);

            engine.cancel(command("cancel", ""));
            assertThat(store.size()).isZero();
            assertThat(transport.messages).filteredOn(m -> m.text().equals("Cancelled.")).hasSize(1);
        }

        @Test
        void newEntryReplacesRunningTransaction() {
            expense("50 Coffee");
            expense("20 Bus Transport");

            assertThat(live().getAmount()).isEqualTo(2000L);
            assertThat(store.size()).isEqualTo(1);
        }
    }
}
