package com.econlens.dataclient;

import com.econlens.core.catalog.CatalogDimensions;
import com.econlens.core.model.CatalogPage;
import com.econlens.core.model.CatalogQuery;
import com.econlens.core.model.DimensionOption;
import com.econlens.core.model.Observation;
import com.econlens.core.model.PeriodKey;
import com.econlens.core.model.Periodicity;
import com.econlens.core.model.SeriesInfo;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * HTTP client for the explorer backend's research endpoints.
 *
 * All calls are synchronous and throw {@link IOException} on transport errors and
 * non-2xx responses. Records the client cannot interpret are skipped, not fatal.
 */
public class ExplorerApiClient {
    private static final Logger log = LoggerFactory.getLogger(ExplorerApiClient.class);

    private static final String SEASONAL_DIMENSION = "seasonal";

    private final ExplorerClientConfig config;
    private final HttpUrl baseUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper jsonMapper;

    public ExplorerApiClient(ExplorerClientConfig config) {
        this.config = config;
        this.baseUrl = HttpUrl.parse(config.getBaseUrl());
        if (baseUrl == null) {
            throw new IllegalArgumentException("Invalid base URL: " + config.getBaseUrl());
        }
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(config.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
            .readTimeout(config.getReadTimeoutSeconds(), TimeUnit.SECONDS)
            .writeTimeout(config.getWriteTimeoutSeconds(), TimeUnit.SECONDS)
            .build();
        this.jsonMapper = new ObjectMapper();
    }

    public ExplorerClientConfig getConfig() {
        return config;
    }

    OkHttpClient getHttpClient() {
        return httpClient;
    }

    /**
     * Check if the backend answers at all.
     */
    public boolean isHealthy() {
        Request request = newRequest(baseUrl.newBuilder().addPathSegment("health").build());
        try (Response response = httpClient.newCall(request).execute()) {
            return response.isSuccessful();
        } catch (IOException e) {
            log.debug("Health check failed: {}", e.getMessage());
            return false;
        }
    }

    // ==================== Catalog ====================

    /**
     * One page of the series catalog of a survey.
     * Dimension filters are sent as {@code <dimension>_code} parameters.
     */
    public CatalogPage listSeries(String source, String survey, CatalogQuery query) throws IOException {
        HttpUrl.Builder url = surveyUrl(source, survey).addPathSegment("series")
            .addQueryParameter("limit", String.valueOf(query.limit()))
            .addQueryParameter("offset", String.valueOf(query.offset()))
            .addQueryParameter("active_only", String.valueOf(query.activeOnly()));
        if (query.hasKeyword()) {
            url.addQueryParameter("search", query.keyword());
        }
        query.dimensions().forEach((name, value) -> url.addQueryParameter(name + "_code", value));

        JsonNode root = getJson(url.build());
        List<SeriesInfo> items = new ArrayList<>();
        for (JsonNode node : root.path("series")) {
            SeriesInfo info = parseSeriesInfo(node);
            if (info != null) {
                items.add(info);
            }
        }
        int total = root.path("total").asInt(items.size());
        int offset = root.path("offset").asInt(query.offset());
        int limit = root.path("limit").asInt(query.limit());
        return CatalogPage.of(total, items, offset, limit);
    }

    /**
     * Filter dimensions of a survey. Every array in the response is one dimension,
     * named after the {@code <name>_code} field of its entries.
     */
    public CatalogDimensions getDimensions(String source, String survey) throws IOException {
        JsonNode root = getJson(surveyUrl(source, survey).addPathSegment("dimensions").build());
        Map<String, List<DimensionOption>> dimensions = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isArray()) continue;
            String dimension = null;
            List<DimensionOption> options = new ArrayList<>();
            int position = 0;
            for (JsonNode entry : field.getValue()) {
                position++;
                String codeField = codeField(entry);
                if (codeField == null) {
                    log.debug("Skipping {} entry without a code: {}", field.getKey(), entry);
                    continue;
                }
                String prefix = codeField.substring(0, codeField.length() - "_code".length());
                if (dimension == null) dimension = prefix;
                options.add(new DimensionOption(
                    entry.path(codeField).asText(),
                    entry.path(prefix + "_name").asText(entry.path(codeField).asText()),
                    entry.path("display_level").asInt(0),
                    entry.path("selectable").asBoolean(true),
                    entry.path("sort_sequence").asInt(position)));
            }
            if (dimension != null) {
                dimensions.put(dimension, options);
            }
        }
        return new CatalogDimensions(dimensions);
    }

    // ==================== Series data ====================

    /**
     * Observations of one series from {@code start}'s year on (all history when null).
     * Understands both the BLS shape ({@code series[0].data_points}) and the
     * BEA shape ({@code data[].time_period}).
     */
    public List<Observation> getSeriesData(String source, String survey, String seriesId, PeriodKey start)
            throws IOException {
        HttpUrl.Builder url = surveyUrl(source, survey)
            .addPathSegment("series").addPathSegment(seriesId).addPathSegment("data");
        if (start != null) {
            url.addQueryParameter("start_year", String.valueOf(start.year()));
        }

        JsonNode root = getJson(url.build());
        List<Observation> observations = new ArrayList<>();
        if (root.has("series")) {
            for (JsonNode series : root.path("series")) {
                for (JsonNode point : series.path("data_points")) {
                    addIfValid(observations, parseBlsPoint(point), point);
                }
            }
        } else {
            for (JsonNode point : root.path("data")) {
                addIfValid(observations, parseTimePeriodPoint(point), point);
            }
        }
        log.debug("Fetched {} observations for {}/{}/{}", observations.size(), source, survey, seriesId);
        return observations;
    }

    private static void addIfValid(List<Observation> target, Observation obs, JsonNode source) {
        if (obs != null) {
            target.add(obs);
        } else {
            log.debug("Skipping unreadable data point: {}", source);
        }
    }

    static Observation parseBlsPoint(JsonNode point) {
        int year = point.path("year").asInt(-1);
        if (year < 0 || !point.hasNonNull("period")) {
            return null;
        }
        try {
            PeriodKey key = PeriodKey.of(year, point.path("period").asText());
            return new Observation(key, textOrNull(point, "period_name"), numberOrNull(point.path("value")));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    static Observation parseTimePeriodPoint(JsonNode point) {
        String period = textOrNull(point, "time_period");
        if (period == null) {
            return null;
        }
        try {
            return new Observation(PeriodKey.parse(period), null, numberOrNull(point.path("value")));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    static SeriesInfo parseSeriesInfo(JsonNode node) {
        String id = textOrNull(node, "series_id");
        if (id == null) id = textOrNull(node, "series_code");
        if (id == null) {
            log.debug("Skipping catalog entry without an id: {}", node);
            return null;
        }
        String title = textOrNull(node, "series_title");
        if (title == null) title = textOrNull(node, "line_description");
        String unit = textOrNull(node, "unit");
        if (unit == null) unit = textOrNull(node, "units");

        Map<String, String> dimensions = new LinkedHashMap<>();
        Map<String, String> names = new LinkedHashMap<>();
        Iterator<String> fieldNames = node.fieldNames();
        while (fieldNames.hasNext()) {
            String field = fieldNames.next();
            if (!field.endsWith("_code") || field.equals("series_code") || field.equals("periodicity_code")) continue;
            String dimension = field.substring(0, field.length() - "_code".length());
            String code = textOrNull(node, field);
            if (code == null) continue;
            dimensions.put(dimension, code);
            String name = textOrNull(node, dimension + "_name");
            if (name != null) names.put(dimension, name);
        }

        boolean seasonallyAdjusted = "S".equalsIgnoreCase(dimensions.get(SEASONAL_DIMENSION));
        Periodicity periodicity = Periodicity.fromCode(textOrNull(node, "periodicity_code"));
        return new SeriesInfo(id, title != null ? title : id, unit, periodicity, seasonallyAdjusted,
            dimensions, names, intOrNull(node, "begin_year"), intOrNull(node, "end_year"),
            node.path("is_active").asBoolean(true));
    }

    // ==================== HTTP ====================

    private HttpUrl.Builder surveyUrl(String source, String survey) {
        return baseUrl.newBuilder()
            .addPathSegment("api")
            .addPathSegment("research")
            .addPathSegment(source)
            .addPathSegment(survey);
    }

    private Request newRequest(HttpUrl url) {
        Request.Builder builder = new Request.Builder().url(url).get()
            .header("Accept", "application/json");
        if (config.getApiToken() != null) {
            builder.header("Authorization", "Bearer " + config.getApiToken());
        }
        return builder.build();
    }

    private JsonNode getJson(HttpUrl url) throws IOException {
        try (Response response = httpClient.newCall(newRequest(url)).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new ExplorerApiException(response.code(), url.encodedPath(), text);
            }
            return jsonMapper.readTree(text);
        }
    }

    private static String codeField(JsonNode entry) {
        Iterator<String> names = entry.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (name.endsWith("_code")) return name;
        }
        return null;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static Integer intOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.canConvertToInt() ? value.asInt() : null;
    }

    /**
     * Numeric value, accepting numbers sent as strings; "-" and blanks are absent.
     */
    static Double numberOrNull(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) return null;
        if (value.isNumber()) {
            double d = value.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        String text = value.asText().trim().replace(",", "");
        if (text.isEmpty() || text.equals("-")) return null;
        try {
            double d = Double.parseDouble(text);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
