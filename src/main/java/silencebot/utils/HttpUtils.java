package silencebot.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

public class HttpUtils {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private static final OkHttpClient client = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .writeTimeout(10, TimeUnit.SECONDS)
            .readTimeout(30, TimeUnit.SECONDS)
            .build();

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private HttpUtils() {
    }

    public static <T> T get(String url, TypeReference<T> type) throws IOException {
        Request request = new Request.Builder()
                .url(url)
                .get()
                .build();
        String result = execute(request);
        return StringUtils.isBlank(result) ? null : objectMapper.readValue(result, type);
    }

    public static <T> T post(String url, Object payload, Class<T> clazz) throws IOException {
        RequestBody body = RequestBody.create(objectMapper.writeValueAsString(payload), JSON);
        Request request = new Request.Builder()
                .url(url)
                .post(body)
                .build();
        String result = execute(request);
        return StringUtils.isBlank(result) ? null : objectMapper.readValue(result, clazz);
    }

    public static void delete(String url) throws IOException {
        Request request = new Request.Builder()
                .url(url)
                .delete()
                .build();
        execute(request);
    }

    private static String execute(Request request) throws IOException {
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Unexpected code " + response);
            }
            ResponseBody body = response.body();
            return body == null ? "" : body.string();
        }
    }
}
