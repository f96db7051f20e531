package com.example.servicereconciler.driver;

import com.example.servicereconciler.domain.CheckOutcome;
import com.example.servicereconciler.domain.HealthCheckSpec.DeepCheck;
import com.example.servicereconciler.domain.HealthCheckSpec.ShallowCheck;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reachability and readiness checks against well-known addresses: HTTP GET, TCP connect,
 * and the JSON readiness-flag document used by deep checks.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EndpointChecker {

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public CheckOutcome shallow(ShallowCheck check) {
        return check.isHttp()
                ? http(check.url(), check.timeout())
                : tcp(check.host(), check.port(), check.timeout());
    }

    /** Passes on any 2xx response. */
    public CheckOutcome http(String url, Duration timeout) {
        long start = System.currentTimeMillis();
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = client(timeout).newCall(request).execute()) {
            long duration = System.currentTimeMillis() - start;
            String message = String.format("HTTP %d from %s (%dms)", response.code(), url, duration);
            return response.isSuccessful() ? CheckOutcome.pass(message) : CheckOutcome.fail(message);
        } catch (InterruptedIOException e) {
            return CheckOutcome.fail(String.format("%s timed out after %dms", url, timeout.toMillis()));
        } catch (IOException | IllegalArgumentException e) {
            return CheckOutcome.fail(url + " unreachable: " + e.getMessage());
        }
    }

    public CheckOutcome tcp(String host, int port, Duration timeout) {
        long start = System.currentTimeMillis();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) Math.max(1, timeout.toMillis()));
            long duration = System.currentTimeMillis() - start;
            return CheckOutcome.pass(String.format("TCP %s:%d connected (%dms)", host, port, duration));
        } catch (IOException e) {
            return CheckOutcome.fail(String.format("TCP %s:%d failed: %s", host, port, e.getMessage()));
        }
    }

    /**
     * Fetches the status document and requires every readiness flag to be {@code true}.
     * The detail names the flags that are not.
     */
    public CheckOutcome deep(DeepCheck check) {
        Request request = new Request.Builder().url(check.url()).get().build();
        JsonNode document;
        try (Response response = client(check.timeout()).newCall(request).execute()) {
            if (!response.isSuccessful()) {
                return CheckOutcome.fail(String.format("status document HTTP %d from %s", response.code(), check.url()));
            }
            ResponseBody body = response.body();
            document = objectMapper.readTree(body != null ? body.string() : "");
        } catch (InterruptedIOException e) {
            return CheckOutcome.fail(String.format("status document timed out after %dms", check.timeout().toMillis()));
        } catch (IOException | IllegalArgumentException e) {
            return CheckOutcome.fail("status document unavailable: " + e.getMessage());
        }

        JsonNode flags = navigate(document, check.flagsPath());
        if (flags == null || !flags.isObject()) {
            return CheckOutcome.fail("status document has no readiness flags at '" + check.flagsPath() + "'");
        }

        List<String> failing = new ArrayList<>();
        if (check.requiredFlags().isEmpty()) {
            Iterator<Map.Entry<String, JsonNode>> fields = flags.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isBoolean() && !field.getValue().asBoolean()) {
                    failing.add(field.getKey());
                }
            }
        } else {
            for (String flag : check.requiredFlags()) {
                JsonNode value = flags.get(flag);
                if (value == null || !value.isBoolean() || !value.asBoolean()) {
                    failing.add(flag);
                }
            }
        }

        if (!failing.isEmpty()) {
            return CheckOutcome.fail("readiness flags not set: " + String.join(", ", failing));
        }
        return CheckOutcome.pass("all readiness flags set");
    }

    private static JsonNode navigate(JsonNode root, String path) {
        if (root == null || path == null || path.isBlank()) {
            return root;
        }
        JsonNode node = root;
        for (String segment : path.split("\\.")) {
            node = node.get(segment);
            if (node == null || node.isNull()) {
                return null;
            }
        }
        return node;
    }

    private OkHttpClient client(Duration timeout) {
        return httpClient.newBuilder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .callTimeout(timeout)
                .build();
    }
}
