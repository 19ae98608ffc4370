package dev.univer.kuberan.keyboard;

/**
 * Button payloads, {@code <namespace>:<value>}. Telegram caps callback data at 64 bytes,
 * ids are UUIDs so every payload here stays well below that.
 */
public final class CallbackData {

    public static final String CATEGORY = "cat";
    public static final String ACCOUNT = "acc";
    public static final String CURRENCY = "ccy";
    public static final String LINK_CURRENCY = "cur";
    public static final String NEW_CATEGORY_PARENT = "ncp";
    public static final String NEW_CATEGORY_ICON = "nci";
    public static final String TRANSACTION = "txn";

    public static final String NEW = "new";
    public static final String NONE = "none";
    public static final String BACK = "back";
    public static final String OTHER = "other";
    public static final String SKIP = "skip";
    public static final String PAGE = "page";

    public static final String CONFIRM = "confirm";
    public static final String CANCEL = "cancel";
    public static final String CHANGE_CATEGORY = "chg_cat";
    public static final String CHANGE_ACCOUNT = "chg_acc";
    public static final String CHANGE_CURRENCY = "chg_ccy";

    private static final char SEPARATOR = ':';

    private CallbackData() {}

    public record Callback(String namespace, String value) {

        public boolean is(String v) {
            return value.equals(v);
        }

        public boolean isPage() {
            return value.startsWith(PAGE + SEPARATOR);
        }

        /** Page number of a {@code cat:page:<n>} payload, 0 when unreadable. */
        public int page() {
            try {
                return Math.max(0, Integer.parseInt(value.substring(PAGE.length() + 1)));
            } catch (RuntimeException e) {
                return 0;
            }
        }
    }

    public static String of(String namespace, String value) {
        return namespace + SEPARATOR + value;
    }

    public static String categoryPage(int page) {
        return of(CATEGORY, PAGE + SEPARATOR + page);
    }

    /** Null when the payload has no namespace or no value. */
    public static Callback parse(String payload) {
        if (payload == null) return null;
        int i = payload.indexOf(SEPARATOR);
        if (i <= 0 || i == payload.length() - 1) return null;
        return new Callback(payload.substring(0, i), payload.substring(i + 1));
    }
}
