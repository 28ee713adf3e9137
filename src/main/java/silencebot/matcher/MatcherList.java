package silencebot.matcher;

import com.google.common.collect.ImmutableList;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 有序的匹配器列表, 所有匹配器都满足时才算匹配
 */
public final class MatcherList implements Iterable<Matcher> {

    private static final MatcherList EMPTY = new MatcherList(ImmutableList.of());

    private final ImmutableList<Matcher> matchers;

    private MatcherList(ImmutableList<Matcher> matchers) {
        this.matchers = matchers;
    }

    public static MatcherList of(List<Matcher> matchers) {
        return matchers.isEmpty() ? EMPTY : new MatcherList(ImmutableList.copyOf(matchers));
    }

    public static MatcherList of(Matcher... matchers) {
        return of(ImmutableList.copyOf(matchers));
    }

    public static MatcherList empty() {
        return EMPTY;
    }

    public List<Matcher> asList() {
        return matchers;
    }

    public int size() {
        return matchers.size();
    }

    public boolean isEmpty() {
        return matchers.isEmpty();
    }

    public Matcher get(int index) {
        return matchers.get(index);
    }

    /**
     * 标签集是否满足全部匹配器, 缺失的标签按空字符串处理; 空列表匹配任何标签集
     */
    public boolean matches(Map<String, String> labels) {
        for (Matcher m : matchers) {
            if (!m.matches(labels.getOrDefault(m.getName(), ""))) {
                return false;
            }
        }
        return true;
    }

    public String render() {
        return matchers.stream()
                .map(Matcher::render)
                .collect(Collectors.joining(",", "{", "}"));
    }

    @Override
    public Iterator<Matcher> iterator() {
        return matchers.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MatcherList)) {
            return false;
        }
        return matchers.equals(((MatcherList) o).matchers);
    }

    @Override
    public int hashCode() {
        return matchers.hashCode();
    }

    @Override
    public String toString() {
        return render();
    }
}
