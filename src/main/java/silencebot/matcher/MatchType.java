package silencebot.matcher;

import java.util.Optional;

/**
 * 标签匹配类型
 */
public enum MatchType {
    EQUAL("="),
    NOT_EQUAL("!="),
    REGEXP("=~"),
    NOT_REGEXP("!~");

    private final String symbol;

    MatchType(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isRegex() {
        return this == REGEXP || this == NOT_REGEXP;
    }

    /**
     * 是否为正向匹配(= 或 =~)
     */
    public boolean isEqual() {
        return this == EQUAL || this == REGEXP;
    }

    public static Optional<MatchType> fromSymbol(String symbol) {
        for (MatchType type : values()) {
            if (type.symbol.equals(symbol)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * 由 v1 API 的 isRegex/isEqual 组合还原匹配类型
     */
    public static MatchType of(boolean isRegex, boolean isEqual) {
        if (isRegex) {
            return isEqual ? REGEXP : NOT_REGEXP;
        }
        return isEqual ? EQUAL : NOT_EQUAL;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
