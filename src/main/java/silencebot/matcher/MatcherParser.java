package silencebot.matcher;

import com.google.common.base.CharMatcher;
import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 匹配器表达式解析器
 *
 * <p>单个匹配器由三部分组成: 标签名, 运算符(=, !=, =~, !~), 以及可用双引号包裹的值,
 * 各部分前后的空白会被忽略。值内支持 \" \n \\ 三种转义, 其他反斜杠按字面保留;
 * 未转义的双引号只能出现在值的首尾。
 *
 * <p>多个匹配器以引号外的逗号分隔, 整体可选地包裹在 { } 中, 例如:
 * <pre>
 *   {foo = "bar", dings != "bums", }
 *   foo=bar,dings!=bums
 *   {quote="She said: \"Hi, ladies!\""}
 *   statuscode=~"5.."
 * </pre>
 */
public final class MatcherParser {

    // =~ 必须排在 = 之前, 否则 ~ 会被并入值
    private static final Pattern MATCHER_PATTERN = Pattern.compile(
            "\\s*([a-zA-Z_:][a-zA-Z0-9_:]*)\\s*(=~|=|!=|!~)\\s*(.*?)\\s*",
            Pattern.DOTALL);

    private MatcherParser() {
    }

    /**
     * 解析单个匹配器
     *
     * @throws MatcherSyntaxException  格式错误或值中存在未转义的引号
     * @throws MatcherPatternException 正则表达式无效
     */
    public static Matcher parseOne(String text) {
        java.util.regex.Matcher m = MATCHER_PATTERN.matcher(text);
        if (!m.matches()) {
            throw new MatcherSyntaxException("匹配器格式错误", text);
        }

        String rawValue = StringUtils.removeStart(m.group(3), "\"");
        if (!StandardCharsets.UTF_8.newEncoder().canEncode(rawValue)) {
            throw new MatcherSyntaxException("匹配器的值不是合法的 UTF-8", rawValue);
        }

        MatchType type = MatchType.fromSymbol(m.group(2))
                .orElseThrow(() -> new MatcherSyntaxException("未知的匹配运算符", m.group(2)));
        return Matcher.of(type, m.group(1), unescape(rawValue));
    }

    /**
     * 解析逗号分隔的匹配器列表, 首个错误即中止
     */
    public static MatcherList parseAll(String text) {
        String s = StringUtils.removeStart(text, "{");
        s = StringUtils.removeEnd(s, "}");

        List<Matcher> matchers = new ArrayList<>();
        for (String token : tokenize(s)) {
            matchers.add(parseOne(token));
        }
        return MatcherList.of(matchers);
    }

    /**
     * 按引号外的逗号切分; 末尾的空白片段(尾随逗号)被丢弃, 中间的空片段保留。
     * 空白按 Unicode White_Space 判定, 控制字符不算空白
     */
    static List<String> tokenize(String s) {
        List<String> tokens = new ArrayList<>();
        StringBuilder token = new StringBuilder();
        boolean insideQuotes = false;
        boolean escaped = false;

        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case ',':
                    if (!insideQuotes) {
                        tokens.add(token.toString());
                        token.setLength(0);
                        continue;
                    }
                    break;
                case '"':
                    if (!escaped) {
                        insideQuotes = !insideQuotes;
                    } else {
                        escaped = false;
                    }
                    break;
                case '\\':
                    escaped = !escaped;
                    break;
                default:
                    escaped = false;
            }
            token.append(c);
        }

        String last = CharMatcher.whitespace().trimFrom(token);
        if (!last.isEmpty()) {
            tokens.add(last);
        }
        return tokens;
    }

    private static String unescape(String rawValue) {
        StringBuilder value = new StringBuilder(rawValue.length());
        boolean escaped = false;
        int last = rawValue.length() - 1;

        for (int i = 0; i < rawValue.length(); i++) {
            char c = rawValue.charAt(i);
            if (escaped) {
                escaped = false;
                switch (c) {
                    case 'n':
                        value.append('\n');
                        break;
                    case '"':
                    case '\\':
                        value.append(c);
                        break;
                    default:
                        // 无效转义, 反斜杠按字面保留
                        value.append('\\').append(c);
                }
                continue;
            }
            switch (c) {
                case '\\':
                    if (i < last) {
                        escaped = true;
                    } else {
                        value.append('\\');
                    }
                    break;
                case '"':
                    if (i < last) {
                        throw new MatcherSyntaxException("匹配器的值包含未转义的双引号", rawValue);
                    }
                    // 结尾引号
                    break;
                default:
                    value.append(c);
            }
        }
        return value.toString();
    }
}
