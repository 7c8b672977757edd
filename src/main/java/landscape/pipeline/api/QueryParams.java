package landscape.pipeline.api;

import io.netty.handler.codec.http.QueryStringDecoder;

import java.util.List;

/**
 * Typed access to query string parameters.
 */
public final class QueryParams {

    private QueryParams() {
    }

    public static int intParam(String uri, String name, int defaultValue) {
        List<String> values = new QueryStringDecoder(uri).parameters().get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(values.get(0).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer");
        }
    }
}
