package silencebot.matcher;

import com.google.re2j.Pattern;
import com.google.re2j.PatternSyntaxException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * 单个标签匹配规则, 构造后不可变
 */
@Getter
@EqualsAndHashCode
public final class Matcher {
    private final MatchType type;
    private final String name;
    private final String value;

    // 仅正则类型存在, 与 value 同步
    @EqualsAndHashCode.Exclude
    @Getter(lombok.AccessLevel.NONE)
    private final Pattern pattern;

    private Matcher(MatchType type, String name, String value, Pattern pattern) {
        this.type = type;
        this.name = name;
        this.value = value;
        this.pattern = pattern;
    }

    /**
     * 创建匹配器, 正则类型会立即编译为全串匹配(RE2 语法, 匹配耗时与输入长度成线性)
     *
     * @throws MatcherPatternException 正则表达式无效
     */
    public static Matcher of(MatchType type, String name, String value) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");

        Pattern pattern = null;
        if (type.isRegex()) {
            try {
                pattern = Pattern.compile("^(?:" + value + ")$");
            } catch (PatternSyntaxException e) {
                throw new MatcherPatternException(value, e);
            }
        }
        return new Matcher(type, name, value, pattern);
    }

    /**
     * 判断给定标签值是否满足本规则
     */
    public boolean matches(String labelValue) {
        String s = labelValue == null ? "" : labelValue;
        return switch (type) {
            case EQUAL -> s.equals(value);
            case NOT_EQUAL -> !s.equals(value);
            case REGEXP -> pattern.matcher(s).matches();
            case NOT_REGEXP -> !pattern.matcher(s).matches();
        };
    }

    /**
     * 渲染为 name op "value" 形式, 可被解析器重新解析
     */
    public String render() {
        return name + type.symbol() + '"' + escape(value) + '"';
    }

    static String escape(String s) {
        StringBuilder out = new StringBuilder(s.length() + 2);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\':
                    out.append("\\\\");
                    break;
                case '\n':
                    out.append("\\n");
                    break;
                case '"':
                    out.append("\\\"");
                    break;
                default:
                    out.append(c);
            }
        }
        return out.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
