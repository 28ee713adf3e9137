package silencebot.alertmanager;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import silencebot.matcher.Matcher;
import silencebot.matcher.MatchType;
import silencebot.matcher.MatcherList;
import silencebot.silence.Silence;
import silencebot.silence.SilenceState;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 静默的 API 表示
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SilenceResource {
    private String id;
    private List<MatcherResource> matchers;
    private Instant startsAt;
    private Instant endsAt;
    private Instant updatedAt;
    private String createdBy;
    private String comment;
    private Status status;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Status {
        private SilenceState state;
    }

    public static SilenceResource from(Silence silence) {
        SilenceResource resource = new SilenceResource();
        resource.setId(silence.getId());
        resource.setMatchers(silence.getMatchers().asList().stream()
                .map(MatcherResource::from)
                .collect(Collectors.toList()));
        resource.setStartsAt(silence.getStartsAt());
        resource.setEndsAt(silence.getEndsAt());
        resource.setUpdatedAt(silence.getUpdatedAt());
        resource.setCreatedBy(silence.getCreatedBy());
        resource.setComment(silence.getComment());
        Status status = new Status();
        status.setState(silence.getState());
        resource.setStatus(status);
        return resource;
    }

    /**
     * 还原为静默实体, 状态按 now 重新计算
     *
     * @throws silencebot.matcher.MatcherPatternException 上游返回的正则无效
     */
    public Silence toSilence(Instant now) {
        List<Matcher> list = matchers == null ? List.of() : matchers.stream()
                .map(m -> Matcher.of(MatchType.of(m.isRegex(), m.isEqual()),
                        Objects.toString(m.getName(), ""), Objects.toString(m.getValue(), "")))
                .collect(Collectors.toList());
        return Silence.restore(id, MatcherList.of(list), startsAt, endsAt, updatedAt, createdBy, comment, now);
    }
}
