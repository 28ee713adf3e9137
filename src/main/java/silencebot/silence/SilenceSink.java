package silencebot.silence;

/**
 * 静默的提交与撤销
 */
public interface SilenceSink {
    /**
     * 提交静默
     *
     * @return 上游分配的静默ID
     * @throws UpstreamException 上游调用失败
     */
    String submit(Silence silence);

    /**
     * 撤销静默
     *
     * @throws UpstreamException 上游调用失败
     */
    void withdraw(String id);
}
