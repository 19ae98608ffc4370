package dev.univer.kuberan.conversation;

import dev.univer.kuberan.gateway.BackendException;
import dev.univer.kuberan.gateway.BackendGateway;
import dev.univer.kuberan.keyboard.CallbackData;
import dev.univer.kuberan.keyboard.CallbackData.Callback;
import dev.univer.kuberan.keyboard.ChoiceListBuilder;
import dev.univer.kuberan.model.*;
import dev.univer.kuberan.service.BotProperties;
import dev.univer.kuberan.util.ParseUtil;
import dev.univer.kuberan.util.ParseUtil.AmountMatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;

import static dev.univer.kuberan.conversation.ConversationState.*;
import static dev.univer.kuberan.conversation.TransactionMessages.*;
import static dev.univer.kuberan.keyboard.CallbackData.*;

/**
 * Expense and income entry: amount, category, confirm, with side trips to change the
 * account, the currency or to create a category or a cash account on the way.
 */
@Component
@Slf4j
public class TransactionFlow extends FlowSupport {

    private final BackendGateway gateway;
    private final BotProperties props;

    public TransactionFlow(SessionStore store, ChatTransport transport, BackendGateway gateway, BotProperties props) {
        super(store, transport);
        this.gateway = gateway;
        this.props = props;
    }

    void register(TransitionTable.Builder table) {
        table.on(AWAITING_AMOUNT, InputKind.TEXT, handler(this::onAmount))
             .on(AWAITING_CATEGORY, InputKind.BUTTON, handler(this::onCategory))
             .on(AWAITING_NEW_CATEGORY_NAME, InputKind.TEXT, handler(this::onNewCategoryName))
             .on(AWAITING_NEW_CATEGORY_PARENT, InputKind.BUTTON, handler(this::onNewCategoryParent))
             .on(AWAITING_NEW_CATEGORY_ICON, InputKind.TEXT, handler(this::onNewCategoryIcon))
             .on(AWAITING_NEW_CATEGORY_ICON, InputKind.BUTTON, handler(this::onNewCategoryIconSkip))
             .on(AWAITING_ACCOUNT, InputKind.BUTTON, handler(this::onAccount))
             .on(AWAITING_NEW_ACCOUNT_NAME, InputKind.TEXT, handler(this::onNewAccountName))
             .on(AWAITING_CURRENCY_CHOICE, InputKind.BUTTON, handler(this::onCurrency))
             .on(AWAITING_NEW_CURRENCY_CODE, InputKind.TEXT, handler(this::onCurrencyCode))
             .on(ConversationState.CONFIRM, InputKind.BUTTON, handler(this::onConfirm));
    }

    private static StateHandler handler(BiConsumer<TransactionSession, InboundEvent> h) {
        return (session, event) -> h.accept((TransactionSession) session, event);
    }

    // ===================== entry point =====================

    /** {@code /expense [amount [description]]} and {@code /income ...}. */
    public void start(InboundEvent event, TransactionType type) {
        LinkedUser user;
        try {
            user = gateway.resolve(event.userId()).orElse(null);
        } catch (BackendException e) {
            reply(event, LOAD_FAILED);
            return;
        }
        if (user == null) {
            reply(event, NOT_LINKED);
            return;
        }
        gateway.recordActivity(event.userId());

        List<Account> accounts;
        List<Category> categories;
        try {
            accounts = gateway.listAccounts(user.getAuthToken());
            if (defaultAccount(accounts) == null) {
                reply(event, NO_ACCOUNTS);
                return;
            }
            categories = gateway.listCategories(user.getAuthToken());
        } catch (BackendException e) {
            reply(event, LOAD_FAILED);
            return;
        }

        String currency = ParseUtil.normalizeCurrency(user.getDefaultCurrency()).orElse(props.getDefaultCurrency());
        TransactionSession session = new TransactionSession(SessionKey.of(event.chatUser(), FlowFamily.TRANSACTION),
                props.getTransactionTimeout(), type, user.getAuthToken(), currency,
                accounts, categories, defaultAccount(accounts));
        store.put(session);
        log.info("User {} started {} entry", event.userId(), type.wireValue());

        Optional<AmountMatch> quick = ParseUtil.parseAmountDescription(event.text());
        if (quick.isPresent()) {
            acceptAmount(session, event, quick.get());
        } else {
            session.setPromptMessageId(transport.send(event.chatId(), amountPrompt(type), null));
        }
    }

    /** First active eligible account in fetch order, else the first eligible one. */
    static Account defaultAccount(List<Account> accounts) {
        List<Account> eligible = ChoiceListBuilder.eligibleAccounts(accounts);
        return eligible.stream().filter(Account::isActive).findFirst()
                .orElse(eligible.isEmpty() ? null : eligible.get(0));
    }

    // ===================== amount & category =====================

    private void onAmount(TransactionSession s, InboundEvent e) {
        Optional<AmountMatch> match = ParseUtil.parseAmountDescription(e.text());
        if (match.isEmpty()) {
            reply(e, INVALID_AMOUNT);
            return;
        }
        acceptAmount(s, e, match.get());
    }

    private void acceptAmount(TransactionSession s, InboundEvent e, AmountMatch amount) {
        EntityMatcher.Match m = EntityMatcher.match(amount.description,
                ChoiceListBuilder.eligibleAccounts(s.getAccounts()), s.getCategories());
        s.setAmount(amount.minorUnits);
        s.setDescription(m.description());
        if (m.account() != null) s.setAccount(m.account());
        if (m.category() != null) s.setCategory(m.category());

        if (m.category() != null || s.getCategories().isEmpty()) {
            showConfirm(s, e);
        } else {
            showCategories(s, e, 0);
        }
    }

    private void onCategory(TransactionSession s, InboundEvent e) {
        Callback cb = CallbackData.parse(e.payload());
        if (cb.isPage()) {
            showCategories(s, e, cb.page());
        } else if (cb.is(NEW)) {
            s.setState(AWAITING_NEW_CATEGORY_NAME);
            prompt(s, e, NEW_CATEGORY_NAME, null);
        } else if (cb.is(NONE)) {
            s.setCategory(null);
            showConfirm(s, e);
        } else {
            Optional<Category> picked = s.getCategories().stream().filter(c -> cb.is(c.getId())).findFirst();
            if (picked.isEmpty()) {
                showCategories(s, e, 0);
                return;
            }
            s.setCategory(picked.get());
            showConfirm(s, e);
        }
    }

    private void showCategories(TransactionSession s, InboundEvent e, int page) {
        s.setState(AWAITING_CATEGORY);
        prompt(s, e, categoryPrompt(s), ChoiceListBuilder.categoryPage(s.getCategories(), page));
    }

    // ===================== new category =====================

    private void onNewCategoryName(TransactionSession s, InboundEvent e) {
        String name = e.textOrEmpty().trim();
        if (name.isEmpty()) {
            reply(e, BLANK_CATEGORY_NAME);
            return;
        }
        s.setNewCategory(new TransactionSession.NewCategoryDraft(name));
        s.setState(AWAITING_NEW_CATEGORY_PARENT);
        prompt(s, e, newCategoryParent(name), ChoiceListBuilder.parentCategories(s.getCategories(), s.getType()));
    }

    private void onNewCategoryParent(TransactionSession s, InboundEvent e) {
        Callback cb = CallbackData.parse(e.payload());
        String parentId = cb.is(NONE) ? null : s.getCategories().stream()
                .filter(c -> c.isTopLevel() && cb.is(c.getId()))
                .map(Category::getId)
                .findFirst().orElse(null);
        s.getNewCategory().setParentId(parentId);
        s.setState(AWAITING_NEW_CATEGORY_ICON);
        prompt(s, e, ICON_PROMPT, ChoiceListBuilder.iconSkip());
    }

    private void onNewCategoryIcon(TransactionSession s, InboundEvent e) {
        createCategory(s, e, firstCodePoints(e.textOrEmpty().trim(), 2).trim());
    }

    private void onNewCategoryIconSkip(TransactionSession s, InboundEvent e) {
        if (!CallbackData.parse(e.payload()).is(SKIP)) return;
        createCategory(s, e, "");
    }

    private void createCategory(TransactionSession s, InboundEvent e, String icon) {
        TransactionSession.NewCategoryDraft draft = s.getNewCategory();
        Category created;
        try {
            created = gateway.createCategory(s.getAuthToken(), NewCategory.builder()
                    .name(draft.getName())
                    .type(s.getType())
                    .icon(icon)
                    .parentId(draft.getParentId())
                    .build());
        } catch (BackendException ex) {
            log.warn("Category '{}' not created for user {}: {}", draft.getName(), e.userId(), ex.getMessage());
            prompt(s, e, CATEGORY_FAILED, ChoiceListBuilder.iconSkip());
            return;
        }
        s.getCategories().add(created);
        s.setCategory(created);
        s.setNewCategory(null);
        showConfirm(s, e);
    }

    static String firstCodePoints(String text, int count) {
        if (text.codePointCount(0, text.length()) <= count) return text;
        return text.substring(0, text.offsetByCodePoints(0, count));
    }

    // ===================== account & currency =====================

    private void onAccount(TransactionSession s, InboundEvent e) {
        Callback cb = CallbackData.parse(e.payload());
        if (cb.is(BACK)) {
            showConfirm(s, e);
        } else if (cb.is(NEW)) {
            s.setState(AWAITING_NEW_ACCOUNT_NAME);
            prompt(s, e, NEW_ACCOUNT_NAME, null);
        } else {
            Optional<Account> picked = ChoiceListBuilder.eligibleAccounts(s.getAccounts()).stream()
                    .filter(a -> cb.is(a.getId()))
                    .findFirst();
            if (picked.isEmpty()) {
                prompt(s, e, SELECT_ACCOUNT, ChoiceListBuilder.accounts(s.getAccounts()));
                return;
            }
            s.setAccount(picked.get());
            showConfirm(s, e);
        }
    }

    private void onNewAccountName(TransactionSession s, InboundEvent e) {
        String name = e.textOrEmpty().trim();
        if (name.isEmpty()) {
            reply(e, BLANK_ACCOUNT_NAME);
            return;
        }
        Account created;
        try {
            created = gateway.createCashAccount(s.getAuthToken(), NewCashAccount.builder()
                    .name(name)
                    .currency(s.getCurrency())
                    .build());
        } catch (BackendException ex) {
            log.warn("Account '{}' not created for user {}: {}", name, e.userId(), ex.getMessage());
            reply(e, ACCOUNT_FAILED);
            return;
        }
        if (created.getType() == null || created.getType() == AccountType.UNKNOWN) created.setType(AccountType.CASH);
        s.getAccounts().add(created);
        s.setAccount(created);
        showConfirm(s, e);
    }

    private void onCurrency(TransactionSession s, InboundEvent e) {
        Callback cb = CallbackData.parse(e.payload());
        if (cb.is(BACK)) {
            showConfirm(s, e);
        } else if (cb.is(OTHER)) {
            s.setState(AWAITING_NEW_CURRENCY_CODE);
            prompt(s, e, CURRENCY_CODE, null);
        } else {
            Optional<String> code = ParseUtil.normalizeCurrency(cb.value());
            if (code.isEmpty()) {
                prompt(s, e, SELECT_CURRENCY, ChoiceListBuilder.currencies(s.getDefaultCurrency()));
                return;
            }
            s.setCurrency(code.get());
            showConfirm(s, e);
        }
    }

    private void onCurrencyCode(TransactionSession s, InboundEvent e) {
        Optional<String> code = ParseUtil.normalizeCurrency(e.text());
        if (code.isEmpty()) {
            reply(e, INVALID_CURRENCY);
            return;
        }
        s.setCurrency(code.get());
        showConfirm(s, e);
    }

    // ===================== confirm =====================

    private void onConfirm(TransactionSession s, InboundEvent e) {
        Callback cb = CallbackData.parse(e.payload());
        switch (cb.value()) {
            case CallbackData.CONFIRM -> commit(s, e);
            case CallbackData.CANCEL -> finish(s, e, CANCELLED);
            case CHANGE_CATEGORY -> showCategories(s, e, 0);
            case CHANGE_ACCOUNT -> {
                s.setState(AWAITING_ACCOUNT);
                prompt(s, e, SELECT_ACCOUNT, ChoiceListBuilder.accounts(s.getAccounts()));
            }
            case CHANGE_CURRENCY -> {
                s.setState(AWAITING_CURRENCY_CHOICE);
                prompt(s, e, SELECT_CURRENCY, ChoiceListBuilder.currencies(s.getDefaultCurrency()));
            }
            default -> log.debug("Ignoring confirm payload {}", e.payload());
        }
    }

    private void commit(TransactionSession s, InboundEvent e) {
        NewTransaction txn = NewTransaction.builder()
                .type(s.getType())
                .accountId(s.getAccount().getId())
                .amount(s.getAmount())
                .description(s.effectiveDescription())
                .categoryId(s.getCategory() == null ? null : s.getCategory().getId())
                .build();
        try {
            gateway.createTransaction(s.getAuthToken(), txn);
        } catch (BackendException ex) {
            log.warn("{} of user {} not recorded: {}", s.getType().title(), e.userId(), ex.getMessage());
            prompt(s, e, commitFailed(s), ChoiceListBuilder.confirm());
            return;
        }
        log.info("Recorded {} {} for user {} on account {}", s.getType().wireValue(), s.getAmount(),
                e.userId(), s.getAccount().getId());
        finish(s, e, recorded(s));
    }

    private void showConfirm(TransactionSession s, InboundEvent e) {
        s.setState(ConversationState.CONFIRM);
        prompt(s, e, confirmCard(s), ChoiceListBuilder.confirm());
    }
}
