package silencebot.alertmanager;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import silencebot.matcher.Matcher;

/**
 * 匹配器的 API 表示
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MatcherResource {
    private String name;
    private String value;
    @JsonProperty("isRegex")
    private boolean regex;
    // 缺省为 true, 与旧版 API 兼容
    @JsonProperty("isEqual")
    private boolean equal = true;

    public static MatcherResource from(Matcher matcher) {
        MatcherResource resource = new MatcherResource();
        resource.setName(matcher.getName());
        resource.setValue(matcher.getValue());
        resource.setRegex(matcher.getType().isRegex());
        resource.setEqual(matcher.getType().isEqual());
        return resource;
    }
}
